package fr.lapetina.embedding.accelerator.infrastructure.metrics;

import fr.lapetina.embedding.accelerator.domain.model.MetricSample;

import java.util.Arrays;
import java.util.List;

/**
 * Aggregate of the samples recorded under one profiler name.
 */
public record ProfileSummary(
        String name,
        int count,
        int failures,
        double totalMs,
        double avgMs,
        double minMs,
        double maxMs,
        double p95Ms,
        double stdDevMs
) {

    static ProfileSummary of(String name, List<MetricSample> samples) {
        double[] durations = samples.stream().mapToDouble(MetricSample::durationMs).sorted().toArray();
        int failures = (int) samples.stream().filter(s -> !s.success()).count();
        double total = Arrays.stream(durations).sum();
        double avg = total / durations.length;
        double variance = Arrays.stream(durations).map(d -> (d - avg) * (d - avg)).sum() / durations.length;
        return new ProfileSummary(
                name,
                durations.length,
                failures,
                total,
                avg,
                durations[0],
                durations[durations.length - 1],
                percentile(durations, 0.95),
                Math.sqrt(variance));
    }

    /**
     * Nearest-rank percentile over sorted values.
     */
    static double percentile(double[] sorted, double quantile) {
        int rank = (int) Math.ceil(quantile * sorted.length);
        return sorted[Math.max(0, Math.min(sorted.length - 1, rank - 1))];
    }
}
