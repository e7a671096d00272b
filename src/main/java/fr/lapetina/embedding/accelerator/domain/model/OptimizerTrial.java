package fr.lapetina.embedding.accelerator.domain.model;

/**
 * One timed calibration probe of the backend at a candidate batch size.
 * Ephemeral: discarded once the optimizer has chosen a size.
 */
public record OptimizerTrial(
        int batchSize,
        double latencyMs,
        double throughputItemsPerSec,
        String strategy,
        boolean failed,
        String errorMessage
) {

    public static OptimizerTrial success(int batchSize, double latencyMs, String strategy) {
        double seconds = latencyMs / 1000.0;
        double throughput = seconds > 0 ? batchSize / seconds : Double.MAX_VALUE;
        return new OptimizerTrial(batchSize, latencyMs, throughput, strategy, false, null);
    }

    public static OptimizerTrial failure(int batchSize, String strategy, String errorMessage) {
        return new OptimizerTrial(batchSize, Double.POSITIVE_INFINITY, 0.0, strategy, true, errorMessage);
    }

    public boolean succeeded() {
        return !failed;
    }

    public boolean withinLatency(double targetLatencyMs) {
        return !failed && latencyMs <= targetLatencyMs;
    }
}
