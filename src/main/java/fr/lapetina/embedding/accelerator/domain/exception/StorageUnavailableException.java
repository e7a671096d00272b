package fr.lapetina.embedding.accelerator.domain.exception;

import fr.lapetina.embedding.accelerator.domain.model.ErrorType;

/**
 * Thrown when a persistent cache store cannot be read or written.
 *
 * Cache tiers catch it themselves: a failed read counts as a miss and a failed
 * write is logged and skipped.
 */
public final class StorageUnavailableException extends AcceleratorException {

    public StorageUnavailableException(String message) {
        super(ErrorType.STORAGE_UNAVAILABLE, message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorType.STORAGE_UNAVAILABLE, message, cause);
    }
}
