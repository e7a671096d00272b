package fr.lapetina.embedding.accelerator.domain.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A single profiled call. Immutable once recorded.
 *
 * @param functionName    name supplied by the caller of the profiler
 * @param durationMs      wall-clock duration in milliseconds
 * @param heapUsedBytes   heap in use when the call finished, or -1 if not captured
 * @param acceleratorMetrics optional device metrics (utilization, device memory)
 * @param timestamp       completion time
 * @param success         false if the profiled call threw
 */
public record MetricSample(
        String functionName,
        double durationMs,
        long heapUsedBytes,
        Map<String, Double> acceleratorMetrics,
        Instant timestamp,
        boolean success
) {
    public MetricSample {
        Objects.requireNonNull(functionName, "Function name is required");
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        acceleratorMetrics = acceleratorMetrics != null ? Map.copyOf(acceleratorMetrics) : Map.of();
    }

    public static MetricSample of(String functionName, double durationMs) {
        return new MetricSample(functionName, durationMs, -1, null, null, true);
    }
}
