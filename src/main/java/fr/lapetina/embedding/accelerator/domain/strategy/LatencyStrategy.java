package fr.lapetina.embedding.accelerator.domain.strategy;

import fr.lapetina.embedding.accelerator.domain.model.OptimizerTrial;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Largest batch size whose latency stays at or below the ceiling.
 *
 * Falls back to the fastest trial when no candidate meets the ceiling.
 */
public final class LatencyStrategy implements OptimizationStrategy {

    public static final String NAME = "latency";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Optional<OptimizerTrial> select(List<OptimizerTrial> trials, double targetLatencyMs) {
        Optional<OptimizerTrial> withinCeiling = trials.stream()
                .filter(trial -> trial.withinLatency(targetLatencyMs))
                .max(Comparator.comparingInt(OptimizerTrial::batchSize));
        if (withinCeiling.isPresent()) {
            return withinCeiling;
        }
        return FastestTrial.of(trials);
    }
}
