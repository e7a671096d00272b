package fr.lapetina.embedding.accelerator.domain.exception;

import fr.lapetina.embedding.accelerator.domain.model.ErrorType;

/**
 * Thrown by the batch processor when a batch fails.
 *
 * All batches still running are cancelled and no partial result is returned.
 * The original failure is kept as the cause.
 */
public final class BatchProcessingException extends AcceleratorException {

    private final int batchIndex;
    private final int totalBatches;

    public BatchProcessingException(int batchIndex, int totalBatches, String message, Throwable cause) {
        super(ErrorType.BATCH_FAILED,
                "Batch " + batchIndex + "/" + totalBatches + " failed: " + message, cause);
        this.batchIndex = batchIndex;
        this.totalBatches = totalBatches;
    }

    public int getBatchIndex() {
        return batchIndex;
    }

    public int getTotalBatches() {
        return totalBatches;
    }

    /**
     * Returns the typed cause when the batch function raised one of the layer's own errors.
     */
    public ErrorType getRootErrorType() {
        Throwable cause = getCause();
        while (cause != null) {
            if (cause instanceof AcceleratorException accelerator) {
                return accelerator.getErrorType();
            }
            cause = cause.getCause();
        }
        return ErrorType.INTERNAL_ERROR;
    }
}
