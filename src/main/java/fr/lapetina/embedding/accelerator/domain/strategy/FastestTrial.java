package fr.lapetina.embedding.accelerator.domain.strategy;

import fr.lapetina.embedding.accelerator.domain.model.OptimizerTrial;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Shared fallback: the successful trial with the smallest latency, smallest size on ties.
 */
final class FastestTrial {

    private FastestTrial() {
        // Utility class
    }

    static Optional<OptimizerTrial> of(List<OptimizerTrial> trials) {
        return trials.stream()
                .filter(OptimizerTrial::succeeded)
                .min(Comparator.comparingDouble(OptimizerTrial::latencyMs)
                        .thenComparingInt(OptimizerTrial::batchSize));
    }
}
