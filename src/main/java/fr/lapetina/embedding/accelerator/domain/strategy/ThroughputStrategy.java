package fr.lapetina.embedding.accelerator.domain.strategy;

import fr.lapetina.embedding.accelerator.domain.model.OptimizerTrial;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Batch size with the highest measured throughput.
 *
 * The latency ceiling is ignored for selection. The result is never smaller
 * than what {@link LatencyStrategy} picks from the same trials, so noisy
 * measurements cannot make the throughput objective choose smaller batches.
 */
public final class ThroughputStrategy implements OptimizationStrategy {

    public static final String NAME = "throughput";

    private final LatencyStrategy latencyFloor = new LatencyStrategy();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Optional<OptimizerTrial> select(List<OptimizerTrial> trials, double targetLatencyMs) {
        Optional<OptimizerTrial> best = trials.stream()
                .filter(OptimizerTrial::succeeded)
                .max(Comparator.comparingDouble(OptimizerTrial::throughputItemsPerSec)
                        .thenComparingInt(OptimizerTrial::batchSize));
        if (best.isEmpty()) {
            return best;
        }

        Optional<OptimizerTrial> floor = latencyFloor.select(trials, targetLatencyMs);
        if (floor.isPresent() && floor.get().batchSize() > best.get().batchSize()) {
            return floor;
        }
        return best;
    }
}
