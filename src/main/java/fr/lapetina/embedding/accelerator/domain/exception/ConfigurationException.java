package fr.lapetina.embedding.accelerator.domain.exception;

import fr.lapetina.embedding.accelerator.domain.model.ErrorType;

/**
 * Exception for configuration errors. Raised at construction time, values are never clamped.
 */
public final class ConfigurationException extends AcceleratorException {

    public ConfigurationException(String message) {
        super(ErrorType.CONFIGURATION_INVALID, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorType.CONFIGURATION_INVALID, message, cause);
    }

    /**
     * Fails with a descriptive message unless {@code value > 0}.
     */
    public static int requirePositive(String name, int value) {
        if (value <= 0) {
            throw new ConfigurationException(name + " must be positive: " + value);
        }
        return value;
    }

    /**
     * Fails with a descriptive message unless {@code value > 0}.
     */
    public static double requirePositive(String name, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new ConfigurationException(name + " must be a positive finite number: " + value);
        }
        return value;
    }

    /**
     * Fails with a descriptive message unless {@code value > 0}.
     */
    public static long requirePositive(String name, long value) {
        if (value <= 0) {
            throw new ConfigurationException(name + " must be positive: " + value);
        }
        return value;
    }
}
