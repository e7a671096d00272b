package fr.lapetina.embedding.accelerator.infrastructure.metrics;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Threshold check evaluated against every monitor snapshot.
 *
 * The metric is a flattened snapshot key such as {@code cpu_percent} or
 * {@code ollama.avg_latency_ms}. An alert fires once the metric breaches
 * the threshold on {@code consecutiveBreaches} snapshots in a row; the
 * streak then resets. Snapshots without the metric leave the streak untouched.
 */
public final class AlertRule {

    public enum Comparison {
        GT,
        GTE,
        LT,
        LTE;

        boolean breached(double value, double threshold) {
            return switch (this) {
                case GT -> value > threshold;
                case GTE -> value >= threshold;
                case LT -> value < threshold;
                case LTE -> value <= threshold;
            };
        }
    }

    private final String name;
    private final String metric;
    private final double threshold;
    private final Comparison comparison;
    private final int consecutiveBreaches;
    private final Consumer<Alert> callback;

    // touched only by the monitor's collection thread
    private int streak;

    public AlertRule(String name, String metric, double threshold, Comparison comparison,
                     int consecutiveBreaches, Consumer<Alert> callback) {
        this.name = Objects.requireNonNull(name, "Name is required");
        this.metric = Objects.requireNonNull(metric, "Metric is required");
        this.threshold = threshold;
        this.comparison = Objects.requireNonNull(comparison, "Comparison is required");
        if (consecutiveBreaches <= 0) {
            throw new IllegalArgumentException("Consecutive breaches must be positive: " + consecutiveBreaches);
        }
        this.consecutiveBreaches = consecutiveBreaches;
        this.callback = callback;
    }

    public AlertRule(String name, String metric, double threshold, Comparison comparison) {
        this(name, metric, threshold, comparison, 1, null);
    }

    /**
     * Feeds one observation and returns the alert if this one completes a breach streak.
     */
    synchronized Alert evaluate(Double value, Instant at) {
        if (value == null) {
            return null;
        }
        if (!comparison.breached(value, threshold)) {
            streak = 0;
            return null;
        }
        streak++;
        if (streak < consecutiveBreaches) {
            return null;
        }
        streak = 0;
        return new Alert(name, metric, value, threshold, comparison, at);
    }

    Consumer<Alert> getCallback() {
        return callback;
    }

    public String getName() {
        return name;
    }

    public String getMetric() {
        return metric;
    }

    public double getThreshold() {
        return threshold;
    }

    public Comparison getComparison() {
        return comparison;
    }

    public int getConsecutiveBreaches() {
        return consecutiveBreaches;
    }

    @Override
    public String toString() {
        return "AlertRule{" +
                "name='" + name + '\'' +
                ", metric='" + metric + '\'' +
                ", " + comparison + " " + threshold +
                ", consecutiveBreaches=" + consecutiveBreaches +
                '}';
    }
}
