package fr.lapetina.embedding.accelerator.infrastructure.metrics;

import java.time.Instant;

/**
 * Throughput and latency of one embedding backend, as reported by its pipeline.
 */
public record BackendMetrics(
        long docsProcessed,
        double docsPerMinute,
        double avgLatencyMs,
        double p95LatencyMs,
        double p99LatencyMs,
        long errors,
        double errorRate,
        Instant updatedAt
) {
    public BackendMetrics {
        if (updatedAt == null) {
            updatedAt = Instant.now();
        }
    }
}
