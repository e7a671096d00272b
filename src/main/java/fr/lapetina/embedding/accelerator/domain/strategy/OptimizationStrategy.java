package fr.lapetina.embedding.accelerator.domain.strategy;

import fr.lapetina.embedding.accelerator.domain.model.OptimizerTrial;

import java.util.List;
import java.util.Optional;

/**
 * Objective used by the batch optimizer to pick a batch size from calibration trials.
 *
 * Each variant owns its selection rule so the optimizer never branches on the
 * strategy kind. Implementations must be stateless and thread-safe.
 */
public interface OptimizationStrategy {

    /**
     * Multiple of the latency ceiling past which larger candidates are no longer probed.
     */
    double PROBE_CUTOFF_FACTOR = 4.0;

    /**
     * Returns the name of this strategy for configuration and logs.
     */
    String getName();

    /**
     * Selects the winning trial.
     *
     * @param trials successful trials, ordered by increasing batch size
     * @param targetLatencyMs latency ceiling in milliseconds
     * @return the chosen trial, or empty if {@code trials} is empty
     */
    Optional<OptimizerTrial> select(List<OptimizerTrial> trials, double targetLatencyMs);

    /**
     * Whether the optimizer should stop trying larger batch sizes after this trial.
     * Latency is assumed to grow with batch size, so once it blows far past the
     * ceiling, larger candidates are not worth the calibration time.
     */
    default boolean shouldStopProbing(OptimizerTrial trial, double targetLatencyMs) {
        return trial.succeeded() && trial.latencyMs() > targetLatencyMs * PROBE_CUTOFF_FACTOR;
    }
}
