package fr.lapetina.embedding.accelerator.dispatch;

/**
 * Notified on the calling thread each time a batch completes.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(int completedBatches, int totalBatches);
}
