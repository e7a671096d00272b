package fr.lapetina.embedding.accelerator.domain.exception;

import fr.lapetina.embedding.accelerator.domain.model.ErrorType;

/**
 * Base class of all failures surfaced by the performance layer.
 *
 * Carries an {@link ErrorType} so callers can tell a backend outage from a
 * storage failure or a configuration mistake without inspecting messages.
 */
public abstract class AcceleratorException extends RuntimeException {

    private final ErrorType errorType;

    protected AcceleratorException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    protected AcceleratorException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * Whether retrying the same operation later may succeed.
     */
    public boolean isRetryable() {
        return errorType == ErrorType.BACKEND_UNAVAILABLE || errorType == ErrorType.STORAGE_UNAVAILABLE;
    }
}
