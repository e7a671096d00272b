package fr.lapetina.embedding.accelerator.infrastructure.metrics;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything the monitor observed on one collection tick.
 *
 * @param components values reported by registered sources, keyed {@code <source>.<key>}
 */
public record MonitorSnapshot(
        Instant timestamp,
        SystemMetrics system,
        Map<String, BackendMetrics> backends,
        Map<String, Double> components
) {
    public MonitorSnapshot {
        backends = Map.copyOf(backends);
        components = Map.copyOf(components);
    }

    /**
     * Flattens the snapshot into metric keys usable by alert rules.
     */
    public Map<String, Double> flatten() {
        Map<String, Double> flat = new LinkedHashMap<>();
        flat.put("cpu_percent", system.cpuPercent());
        flat.put("memory_percent", system.memoryPercent());
        flat.put("heap_used_bytes", (double) system.heapUsedBytes());
        flat.put("thread_count", (double) system.threadCount());
        backends.forEach((name, m) -> {
            flat.put(name + ".docs_processed", (double) m.docsProcessed());
            flat.put(name + ".docs_per_minute", m.docsPerMinute());
            flat.put(name + ".avg_latency_ms", m.avgLatencyMs());
            flat.put(name + ".p95_latency_ms", m.p95LatencyMs());
            flat.put(name + ".p99_latency_ms", m.p99LatencyMs());
            flat.put(name + ".errors", (double) m.errors());
            flat.put(name + ".error_rate", m.errorRate());
        });
        flat.putAll(components);
        return flat;
    }
}
