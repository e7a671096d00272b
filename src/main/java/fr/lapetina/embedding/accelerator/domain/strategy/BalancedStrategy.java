package fr.lapetina.embedding.accelerator.domain.strategy;

import fr.lapetina.embedding.accelerator.domain.model.OptimizerTrial;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Highest throughput among the trials that meet the latency ceiling.
 *
 * Falls back to the fastest trial when none meets it.
 */
public final class BalancedStrategy implements OptimizationStrategy {

    public static final String NAME = "balanced";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Optional<OptimizerTrial> select(List<OptimizerTrial> trials, double targetLatencyMs) {
        Optional<OptimizerTrial> withinCeiling = trials.stream()
                .filter(trial -> trial.withinLatency(targetLatencyMs))
                .max(Comparator.comparingDouble(OptimizerTrial::throughputItemsPerSec)
                        .thenComparingInt(OptimizerTrial::batchSize));
        if (withinCeiling.isPresent()) {
            return withinCeiling;
        }
        return FastestTrial.of(trials);
    }
}
