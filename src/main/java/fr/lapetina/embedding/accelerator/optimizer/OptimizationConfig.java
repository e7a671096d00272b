package fr.lapetina.embedding.accelerator.optimizer;

import fr.lapetina.embedding.accelerator.domain.exception.ConfigurationException;
import fr.lapetina.embedding.accelerator.domain.strategy.OptimizationStrategy;
import fr.lapetina.embedding.accelerator.domain.strategy.StrategyFactory;

import java.util.Objects;

/**
 * Parameters of one batch size calibration run. Validated on construction.
 *
 * @param strategy        selection objective
 * @param targetLatencyMs latency ceiling per batch, in milliseconds
 * @param minBatchSize    smallest candidate, at least 1
 * @param maxBatchSize    largest candidate, at most {@value #MAX_BATCH_SIZE}
 * @param testIterations  backend calls averaged per candidate
 */
public record OptimizationConfig(
        OptimizationStrategy strategy,
        double targetLatencyMs,
        int minBatchSize,
        int maxBatchSize,
        int testIterations
) {

    public static final int MAX_BATCH_SIZE = 1000;
    public static final double DEFAULT_TARGET_LATENCY_MS = 1000.0;

    public OptimizationConfig {
        if (strategy == null) {
            throw new ConfigurationException("optimizer.strategy is required");
        }
        ConfigurationException.requirePositive("optimizer.targetLatencyMs", targetLatencyMs);
        ConfigurationException.requirePositive("optimizer.minBatchSize", minBatchSize);
        ConfigurationException.requirePositive("optimizer.maxBatchSize", maxBatchSize);
        ConfigurationException.requirePositive("optimizer.testIterations", testIterations);
        if (maxBatchSize > MAX_BATCH_SIZE) {
            throw new ConfigurationException(
                    "optimizer.maxBatchSize must be at most " + MAX_BATCH_SIZE + ": " + maxBatchSize);
        }
        if (minBatchSize > maxBatchSize) {
            throw new ConfigurationException("optimizer.minBatchSize (" + minBatchSize
                    + ") must not exceed optimizer.maxBatchSize (" + maxBatchSize + ")");
        }
    }

    /**
     * Full candidate range, one iteration per candidate.
     */
    public static OptimizationConfig of(OptimizationStrategy strategy, double targetLatencyMs) {
        return new OptimizationConfig(strategy, targetLatencyMs, 1, MAX_BATCH_SIZE, 1);
    }

    /**
     * Resolves the strategy by name.
     *
     * @throws ConfigurationException on an unknown strategy name
     */
    public static OptimizationConfig of(String strategyName, double targetLatencyMs) {
        return of(StrategyFactory.require(strategyName), targetLatencyMs);
    }

    public OptimizationConfig withStrategy(OptimizationStrategy strategy) {
        return new OptimizationConfig(Objects.requireNonNull(strategy), targetLatencyMs,
                minBatchSize, maxBatchSize, testIterations);
    }

    public OptimizationConfig withRange(int minBatchSize, int maxBatchSize) {
        return new OptimizationConfig(strategy, targetLatencyMs, minBatchSize, maxBatchSize, testIterations);
    }

    public OptimizationConfig withTestIterations(int testIterations) {
        return new OptimizationConfig(strategy, targetLatencyMs, minBatchSize, maxBatchSize, testIterations);
    }
}
