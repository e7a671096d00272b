package fr.lapetina.embedding.accelerator.infrastructure.metrics;

import java.time.Instant;

/**
 * Raised when an {@link AlertRule} has been breached for its required number of snapshots.
 */
public record Alert(
        String ruleName,
        String metric,
        double observedValue,
        double threshold,
        AlertRule.Comparison comparison,
        Instant timestamp
) {
}
