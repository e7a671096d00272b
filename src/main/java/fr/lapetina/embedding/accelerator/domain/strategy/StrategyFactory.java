package fr.lapetina.embedding.accelerator.domain.strategy;

import fr.lapetina.embedding.accelerator.domain.exception.ConfigurationException;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Factory for creating optimization strategies by configuration name.
 */
public final class StrategyFactory {

    private static final Map<String, Supplier<OptimizationStrategy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        // Register built-in strategies
        register(ThroughputStrategy.NAME, ThroughputStrategy::new);
        register(LatencyStrategy.NAME, LatencyStrategy::new);
        register(BalancedStrategy.NAME, BalancedStrategy::new);
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Registers a custom strategy.
     *
     * @param name Strategy name (used in configuration)
     * @param supplier Factory for creating strategy instances
     */
    public static void register(String name, Supplier<OptimizationStrategy> supplier) {
        REGISTRY.put(name.toLowerCase(Locale.ROOT), supplier);
    }

    /**
     * Creates a strategy by name.
     *
     * @param name Strategy name from configuration, case-insensitive
     * @return Strategy instance, or empty if not found
     */
    public static Optional<OptimizationStrategy> create(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Supplier<OptimizationStrategy> supplier = REGISTRY.get(name.toLowerCase(Locale.ROOT));
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    /**
     * Creates a strategy by name, failing on unknown names.
     *
     * @throws ConfigurationException if no strategy is registered under the name
     */
    public static OptimizationStrategy require(String name) {
        return create(name).orElseThrow(() -> new ConfigurationException(
                "Unknown optimization strategy '" + name + "', expected one of " + REGISTRY.keySet()));
    }

    /**
     * Returns all registered strategy names.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
