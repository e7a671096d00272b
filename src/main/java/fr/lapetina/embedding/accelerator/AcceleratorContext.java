package fr.lapetina.embedding.accelerator;

import fr.lapetina.embedding.accelerator.cache.CacheHierarchy;
import fr.lapetina.embedding.accelerator.cache.CacheStats;
import fr.lapetina.embedding.accelerator.cache.CacheTier;
import fr.lapetina.embedding.accelerator.cache.FileSystemStore;
import fr.lapetina.embedding.accelerator.cache.MemoryCacheTier;
import fr.lapetina.embedding.accelerator.cache.PersistentCacheTier;
import fr.lapetina.embedding.accelerator.dispatch.TokenBucketRateLimiter;
import fr.lapetina.embedding.accelerator.domain.exception.ConfigurationException;
import fr.lapetina.embedding.accelerator.domain.port.EmbeddingBackend;
import fr.lapetina.embedding.accelerator.domain.port.PersistentStore;
import fr.lapetina.embedding.accelerator.domain.strategy.StrategyFactory;
import fr.lapetina.embedding.accelerator.infrastructure.config.AcceleratorConfig;
import fr.lapetina.embedding.accelerator.infrastructure.config.ConfigLoader;
import fr.lapetina.embedding.accelerator.infrastructure.metrics.AlertRule;
import fr.lapetina.embedding.accelerator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.embedding.accelerator.infrastructure.metrics.PerformanceMonitor;
import fr.lapetina.embedding.accelerator.infrastructure.metrics.Profiler;
import fr.lapetina.embedding.accelerator.memory.MemoryPool;
import fr.lapetina.embedding.accelerator.memory.PoolStats;
import fr.lapetina.embedding.accelerator.optimizer.DynamicBatchOptimizer;
import fr.lapetina.embedding.accelerator.optimizer.OptimizationConfig;
import fr.lapetina.embedding.accelerator.optimizer.OptimizationResultStore;
import fr.lapetina.embedding.accelerator.pipeline.BackendCircuitBreaker;
import fr.lapetina.embedding.accelerator.pipeline.EmbeddingPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Owns every component of the performance layer for one embedding backend,
 * wired from configuration. This is the primary entry point.
 *
 * <p>Usage:
 * <pre>{@code
 * try (AcceleratorContext context = AcceleratorContext.create("accelerator.yaml", backend).start()) {
 *     List<float[]> vectors = context.getPipeline().embedAll(texts);
 * }
 * }</pre>
 */
public class AcceleratorContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AcceleratorContext.class);

    private final ConfigLoader configLoader;
    private final AcceleratorConfig config;
    private final MetricsRegistry metricsRegistry;
    private final MemoryPool memoryPool;
    private final Profiler profiler;
    private final CacheHierarchy cache;
    private final TokenBucketRateLimiter rateLimiter;
    private final DynamicBatchOptimizer optimizer;
    private final PerformanceMonitor monitor;
    private final EmbeddingPipeline pipeline;

    protected AcceleratorContext(ConfigLoader configLoader, AcceleratorConfig config,
                                 EmbeddingBackend backend, PersistentStore storeOverride) {
        this.configLoader = configLoader;
        this.config = config.validate();
        log.info("Initializing AcceleratorContext: backend={}", backend.name());

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        MetricsRegistry meters = config.getMetrics().isEnabled() ? metricsRegistry : null;

        this.memoryPool = new MemoryPool(config.getPool().getMaxPoolSize(), meters);
        this.profiler = new Profiler(config.getMonitor().getProfilerMaxSamplesPerName(), meters);
        this.cache = createCache(storeOverride, meters);
        this.rateLimiter = createRateLimiter(meters);

        // Create optimizer
        AcceleratorConfig.OptimizerConfig optimizerConfig = config.getOptimizer();
        String resultFile = optimizerConfig.getResultFile();
        this.optimizer = new DynamicBatchOptimizer(
                resultFile == null || resultFile.isBlank() ? null : new OptimizationResultStore(Path.of(resultFile)));
        OptimizationConfig optimizationConfig = new OptimizationConfig(
                StrategyFactory.require(optimizerConfig.getStrategy()),
                optimizerConfig.getTargetLatencyMs(),
                optimizerConfig.getMinBatchSize(),
                optimizerConfig.getMaxBatchSize(),
                optimizerConfig.getTestIterations());

        this.monitor = PerformanceMonitor.builder()
                .collectionInterval(Duration.ofMillis(config.getMonitor().getCollectionIntervalMs()))
                .historySize(config.getMonitor().getHistorySize())
                .build();
        registerMonitorSources();
        registerAlerts();

        // Build pipeline
        this.pipeline = EmbeddingPipeline.builder()
                .backend(backend)
                .cache(cache)
                .rateLimiter(rateLimiter)
                .circuitBreaker(new BackendCircuitBreaker(
                        backend.name(),
                        config.getCircuitBreaker().getFailureThreshold(),
                        Duration.ofMillis(config.getCircuitBreaker().getRecoveryMs())))
                .profiler(profiler)
                .monitor(monitor)
                .metrics(meters)
                .memoryPool(memoryPool)
                .optimizer(optimizer, optimizationConfig)
                .batchSize(config.getBatch().getSize())
                .maxConcurrentBatches(config.getBatch().getMaxConcurrentBatches())
                .timeout(Duration.ofMillis(config.getBatch().getTimeoutMs()))
                .cacheTtl(config.getCache().getTtlSeconds() > 0
                        ? Duration.ofSeconds(config.getCache().getTtlSeconds()) : null)
                .build();

        // Register config change listener
        if (configLoader != null) {
            configLoader.addListener(this::onConfigChanged);
        }

        log.info("AcceleratorContext initialized: tiers={}, rateLimited={}, batchSize={}",
                cache.tierNames(), rateLimiter != null, pipeline.getBatchSize());
    }

    /**
     * Creates a context from the specified configuration file (file system first, then classpath).
     */
    public static AcceleratorContext create(String configPath, EmbeddingBackend backend) {
        ConfigLoader loader = new ConfigLoader(configPath);
        return new AcceleratorContext(loader, loader.load(), backend, null);
    }

    /**
     * Creates a context from an in-memory configuration, without hot reload.
     */
    public static AcceleratorContext create(AcceleratorConfig config, EmbeddingBackend backend) {
        return new AcceleratorContext(null, config, backend, null);
    }

    /**
     * Starts the monitor and configuration watching.
     */
    public AcceleratorContext start() {
        if (config.getMonitor().isEnabled()) {
            monitor.start();
        }
        if (configLoader != null) {
            configLoader.startWatching();
        }
        log.info("AcceleratorContext started");
        return this;
    }

    private CacheHierarchy createCache(PersistentStore storeOverride, MetricsRegistry meters) {
        AcceleratorConfig.CacheConfig cacheConfig = config.getCache();
        List<CacheTier> tiers = new ArrayList<>();
        tiers.add(new MemoryCacheTier(MemoryCacheTier.DEFAULT_NAME, cacheConfig.getMemoryMaxEntries(),
                cacheConfig.getMemoryMaxBytes(), meters));
        if (storeOverride != null || cacheConfig.isDiskEnabled()) {
            PersistentStore store = storeOverride != null ? storeOverride : openStore(cacheConfig.getDiskDirectory());
            tiers.add(new PersistentCacheTier(PersistentCacheTier.DEFAULT_NAME, store,
                    cacheConfig.getDiskMaxBytes(), meters));
        }
        return new CacheHierarchy(tiers, cacheConfig.isPrefetchEnabled());
    }

    private static PersistentStore openStore(String directory) {
        try {
            return new FileSystemStore(Path.of(directory));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot open cache directory: " + directory, e);
        }
    }

    private TokenBucketRateLimiter createRateLimiter(MetricsRegistry meters) {
        AcceleratorConfig.RateLimitConfig rateConfig = config.getRateLimit();
        if (!rateConfig.isEnabled()) {
            return null;
        }
        int burst = rateConfig.getBurstSize() > 0
                ? rateConfig.getBurstSize()
                : TokenBucketRateLimiter.defaultBurst(rateConfig.getRequestsPerSecond());
        return new TokenBucketRateLimiter(rateConfig.getRequestsPerSecond(), burst, meters);
    }

    private void registerMonitorSources() {
        monitor.registerSource("cache", () -> {
            Map<String, Double> values = new LinkedHashMap<>();
            for (Map.Entry<String, CacheStats> entry : cache.stats().entrySet()) {
                values.put(entry.getKey() + ".hit_rate", entry.getValue().hitRate());
                values.put(entry.getKey() + ".entries", (double) entry.getValue().entries());
                values.put(entry.getKey() + ".size_bytes", (double) entry.getValue().sizeBytes());
                values.put(entry.getKey() + ".expirations", (double) entry.getValue().expirations());
            }
            return values;
        });
        monitor.registerSource("pool", () -> {
            long outstanding = 0;
            long free = 0;
            for (PoolStats stats : memoryPool.stats().values()) {
                outstanding += stats.outstanding();
                free += stats.free();
            }
            return Map.of(
                    "outstanding", (double) outstanding,
                    "free", (double) free,
                    "allocations", (double) memoryPool.totalAllocations());
        });
        monitor.registerSource("profiler", () -> {
            Map<String, Double> values = new LinkedHashMap<>();
            for (String name : profiler.names()) {
                profiler.summarize(name).ifPresent(summary -> {
                    values.put(name + ".count", (double) summary.count());
                    values.put(name + ".avg_ms", summary.avgMs());
                    values.put(name + ".p95_ms", summary.p95Ms());
                });
            }
            return values;
        });
    }

    private void registerAlerts() {
        for (AcceleratorConfig.AlertConfig alert : config.getMonitor().getAlerts()) {
            monitor.addAlertRule(new AlertRule(
                    alert.getName(),
                    alert.getMetric(),
                    alert.getThreshold(),
                    AlertRule.Comparison.valueOf(alert.getComparison().toUpperCase(Locale.ROOT)),
                    alert.getConsecutiveBreaches(),
                    null));
        }
    }

    private void onConfigChanged(AcceleratorConfig oldConfig, AcceleratorConfig newConfig) {
        log.info("Configuration changed, applying updates...");

        int newBatchSize = newConfig.getBatch().getSize();
        if (newBatchSize != pipeline.getBatchSize()) {
            pipeline.setBatchSize(newBatchSize);
        }

        log.info("Configuration updates applied: batchSize={}", pipeline.getBatchSize());
    }

    public EmbeddingPipeline getPipeline() {
        return pipeline;
    }

    public CacheHierarchy getCache() {
        return cache;
    }

    public MemoryPool getMemoryPool() {
        return memoryPool;
    }

    public Profiler getProfiler() {
        return profiler;
    }

    public TokenBucketRateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public DynamicBatchOptimizer getOptimizer() {
        return optimizer;
    }

    public PerformanceMonitor getMonitor() {
        return monitor;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public AcceleratorConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    @Override
    public void close() {
        log.info("Shutting down AcceleratorContext...");

        if (configLoader != null) {
            try {
                configLoader.close();
            } catch (Exception e) {
                log.warn("Error closing config loader", e);
            }
        }

        try {
            monitor.close();
        } catch (Exception e) {
            log.warn("Error closing performance monitor", e);
        }

        try {
            pipeline.close();
        } catch (Exception e) {
            log.warn("Error closing pipeline", e);
        }

        try {
            cache.close();
        } catch (Exception e) {
            log.warn("Error closing cache hierarchy", e);
        }

        try {
            memoryPool.close();
        } catch (Exception e) {
            log.warn("Error closing memory pool", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("AcceleratorContext shut down");
    }
}
