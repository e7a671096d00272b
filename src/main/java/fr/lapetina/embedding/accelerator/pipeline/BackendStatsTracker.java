package fr.lapetina.embedding.accelerator.pipeline;

import fr.lapetina.embedding.accelerator.infrastructure.metrics.BackendMetrics;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;

/**
 * Running document counts and backend call latencies of one pipeline.
 * Latency percentiles are computed over the most recent calls only.
 */
final class BackendStatsTracker {

    static final int LATENCY_WINDOW = 1000;

    private final long startedNanos = System.nanoTime();
    private final ArrayDeque<Double> latencies = new ArrayDeque<>(LATENCY_WINDOW);
    private long docsProcessed;
    private long backendCalls;
    private long errors;

    synchronized void recordDocs(int count) {
        docsProcessed += count;
    }

    synchronized void recordCall(double latencyMs) {
        backendCalls++;
        if (latencies.size() >= LATENCY_WINDOW) {
            latencies.pollFirst();
        }
        latencies.addLast(latencyMs);
    }

    synchronized void recordError() {
        backendCalls++;
        errors++;
    }

    synchronized long errors() {
        return errors;
    }

    synchronized BackendMetrics snapshot() {
        double minutes = (System.nanoTime() - startedNanos) / 60_000_000_000.0;
        double docsPerMinute = minutes > 0 ? docsProcessed / minutes : 0.0;
        double[] sorted = latencies.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        double avg = Arrays.stream(sorted).average().orElse(0.0);
        double errorRate = backendCalls == 0 ? 0.0 : (double) errors / backendCalls;
        return new BackendMetrics(docsProcessed, docsPerMinute, avg,
                percentile(sorted, 0.95), percentile(sorted, 0.99), errors, errorRate, Instant.now());
    }

    private static double percentile(double[] sorted, double quantile) {
        if (sorted.length == 0) {
            return 0.0;
        }
        int rank = (int) Math.ceil(quantile * sorted.length);
        return sorted[Math.max(0, Math.min(sorted.length - 1, rank - 1))];
    }
}
