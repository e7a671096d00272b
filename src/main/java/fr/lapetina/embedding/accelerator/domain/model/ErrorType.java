package fr.lapetina.embedding.accelerator.domain.model;

/**
 * Error taxonomy for the performance layer.
 * Lets calling layers decide whether to retry, degrade or abort.
 */
public enum ErrorType {
    /** Embedding backend failed or its circuit breaker is open */
    BACKEND_UNAVAILABLE,

    /** Persistent cache storage failed (disk I/O, corrupted blob) */
    STORAGE_UNAVAILABLE,

    /** Invalid configuration detected at construction time */
    CONFIGURATION_INVALID,

    /** A batch failed and the remaining batches were cancelled */
    BATCH_FAILED,

    /** Internal system error */
    INTERNAL_ERROR
}
