package fr.lapetina.embedding.accelerator.infrastructure.config;

import fr.lapetina.embedding.accelerator.domain.exception.ConfigurationException;
import fr.lapetina.embedding.accelerator.domain.strategy.StrategyFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Root configuration object for the embedding accelerator.
 * Designed to be populated from YAML.
 */
public class AcceleratorConfig {

    private CacheConfig cache = new CacheConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private BatchConfig batch = new BatchConfig();
    private OptimizerConfig optimizer = new OptimizerConfig();
    private PoolConfig pool = new PoolConfig();
    private MonitorConfig monitor = new MonitorConfig();
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public RateLimitConfig getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

    public BatchConfig getBatch() { return batch; }
    public void setBatch(BatchConfig batch) { this.batch = batch; }

    public OptimizerConfig getOptimizer() { return optimizer; }
    public void setOptimizer(OptimizerConfig optimizer) { this.optimizer = optimizer; }

    public PoolConfig getPool() { return pool; }
    public void setPool(PoolConfig pool) { this.pool = pool; }

    public MonitorConfig getMonitor() { return monitor; }
    public void setMonitor(MonitorConfig monitor) { this.monitor = monitor; }

    public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Checks every section. Values are rejected, never clamped.
     *
     * @return this configuration
     * @throws ConfigurationException on the first invalid value
     */
    public AcceleratorConfig validate() {
        if (cache == null || rateLimit == null || batch == null || optimizer == null
                || pool == null || monitor == null || circuitBreaker == null || metrics == null) {
            throw new ConfigurationException("Configuration sections must not be null");
        }
        ConfigurationException.requirePositive("cache.memoryMaxEntries", cache.memoryMaxEntries);
        ConfigurationException.requirePositive("cache.memoryMaxBytes", cache.memoryMaxBytes);
        if (cache.ttlSeconds < 0) {
            throw new ConfigurationException("cache.ttlSeconds must not be negative: " + cache.ttlSeconds);
        }
        if (cache.diskEnabled) {
            ConfigurationException.requirePositive("cache.diskMaxBytes", cache.diskMaxBytes);
            if (cache.diskDirectory == null || cache.diskDirectory.isBlank()) {
                throw new ConfigurationException("cache.diskDirectory is required when the disk tier is enabled");
            }
        }

        ConfigurationException.requirePositive("rateLimit.requestsPerSecond", rateLimit.requestsPerSecond);
        if (rateLimit.burstSize < 0) {
            throw new ConfigurationException("rateLimit.burstSize must not be negative: " + rateLimit.burstSize);
        }

        ConfigurationException.requirePositive("batch.size", batch.size);
        ConfigurationException.requirePositive("batch.maxConcurrentBatches", batch.maxConcurrentBatches);
        ConfigurationException.requirePositive("batch.timeoutMs", batch.timeoutMs);

        StrategyFactory.require(optimizer.strategy);
        ConfigurationException.requirePositive("optimizer.targetLatencyMs", optimizer.targetLatencyMs);
        ConfigurationException.requirePositive("optimizer.testIterations", optimizer.testIterations);
        ConfigurationException.requirePositive("optimizer.minBatchSize", optimizer.minBatchSize);
        if (optimizer.maxBatchSize < optimizer.minBatchSize || optimizer.maxBatchSize > 1000) {
            throw new ConfigurationException("optimizer.maxBatchSize must be in [minBatchSize, 1000]: "
                    + optimizer.maxBatchSize);
        }

        if (pool.maxPoolSize < 0) {
            throw new ConfigurationException("pool.maxPoolSize must not be negative: " + pool.maxPoolSize);
        }

        ConfigurationException.requirePositive("monitor.collectionIntervalMs", monitor.collectionIntervalMs);
        ConfigurationException.requirePositive("monitor.historySize", monitor.historySize);
        ConfigurationException.requirePositive("monitor.profilerMaxSamplesPerName", monitor.profilerMaxSamplesPerName);
        for (AlertConfig alert : monitor.alerts) {
            alert.validate();
        }

        ConfigurationException.requirePositive("circuitBreaker.failureThreshold", circuitBreaker.failureThreshold);
        ConfigurationException.requirePositive("circuitBreaker.recoveryMs", circuitBreaker.recoveryMs);

        if (metrics.prefix == null || metrics.prefix.isBlank()) {
            throw new ConfigurationException("metrics.prefix must not be blank");
        }
        return this;
    }

    /**
     * Cache hierarchy configuration. A TTL of 0 keeps entries until they are evicted.
     */
    public static class CacheConfig {
        private int memoryMaxEntries = 10000;
        private long memoryMaxBytes = 512L * 1024 * 1024;
        private long ttlSeconds = 0;
        private boolean prefetchEnabled = true;
        private boolean diskEnabled = true;
        private String diskDirectory = "./cache/embeddings";
        private long diskMaxBytes = 1024L * 1024 * 1024;

        public int getMemoryMaxEntries() { return memoryMaxEntries; }
        public void setMemoryMaxEntries(int memoryMaxEntries) { this.memoryMaxEntries = memoryMaxEntries; }

        public long getMemoryMaxBytes() { return memoryMaxBytes; }
        public void setMemoryMaxBytes(long memoryMaxBytes) { this.memoryMaxBytes = memoryMaxBytes; }

        public long getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(long ttlSeconds) { this.ttlSeconds = ttlSeconds; }

        public boolean isPrefetchEnabled() { return prefetchEnabled; }
        public void setPrefetchEnabled(boolean prefetchEnabled) { this.prefetchEnabled = prefetchEnabled; }

        public boolean isDiskEnabled() { return diskEnabled; }
        public void setDiskEnabled(boolean diskEnabled) { this.diskEnabled = diskEnabled; }

        public String getDiskDirectory() { return diskDirectory; }
        public void setDiskDirectory(String diskDirectory) { this.diskDirectory = diskDirectory; }

        public long getDiskMaxBytes() { return diskMaxBytes; }
        public void setDiskMaxBytes(long diskMaxBytes) { this.diskMaxBytes = diskMaxBytes; }
    }

    /**
     * Token bucket configuration. A burst size of 0 means {@code max(1, floor(requestsPerSecond))}.
     */
    public static class RateLimitConfig {
        private boolean enabled = true;
        private double requestsPerSecond = 10.0;
        private int burstSize = 0;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public double getRequestsPerSecond() { return requestsPerSecond; }
        public void setRequestsPerSecond(double requestsPerSecond) { this.requestsPerSecond = requestsPerSecond; }

        public int getBurstSize() { return burstSize; }
        public void setBurstSize(int burstSize) { this.burstSize = burstSize; }
    }

    /**
     * Batch processor configuration.
     */
    public static class BatchConfig {
        private int size = 32;
        private int maxConcurrentBatches = 4;
        private long timeoutMs = 300000;

        public int getSize() { return size; }
        public void setSize(int size) { this.size = size; }

        public int getMaxConcurrentBatches() { return maxConcurrentBatches; }
        public void setMaxConcurrentBatches(int maxConcurrentBatches) { this.maxConcurrentBatches = maxConcurrentBatches; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    }

    /**
     * Batch size calibration configuration. An empty result file disables persistence.
     */
    public static class OptimizerConfig {
        private String strategy = "balanced";
        private double targetLatencyMs = 1000.0;
        private int minBatchSize = 1;
        private int maxBatchSize = 256;
        private int testIterations = 1;
        private String resultFile = "";

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public double getTargetLatencyMs() { return targetLatencyMs; }
        public void setTargetLatencyMs(double targetLatencyMs) { this.targetLatencyMs = targetLatencyMs; }

        public int getMinBatchSize() { return minBatchSize; }
        public void setMinBatchSize(int minBatchSize) { this.minBatchSize = minBatchSize; }

        public int getMaxBatchSize() { return maxBatchSize; }
        public void setMaxBatchSize(int maxBatchSize) { this.maxBatchSize = maxBatchSize; }

        public int getTestIterations() { return testIterations; }
        public void setTestIterations(int testIterations) { this.testIterations = testIterations; }

        public String getResultFile() { return resultFile; }
        public void setResultFile(String resultFile) { this.resultFile = resultFile; }
    }

    /**
     * Memory pool configuration.
     */
    public static class PoolConfig {
        private int maxPoolSize = 10;

        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
    }

    /**
     * Performance monitor and profiler configuration.
     */
    public static class MonitorConfig {
        private boolean enabled = true;
        private long collectionIntervalMs = 5000;
        private int historySize = 720;
        private int profilerMaxSamplesPerName = 1000;
        private List<AlertConfig> alerts = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getCollectionIntervalMs() { return collectionIntervalMs; }
        public void setCollectionIntervalMs(long collectionIntervalMs) { this.collectionIntervalMs = collectionIntervalMs; }

        public int getHistorySize() { return historySize; }
        public void setHistorySize(int historySize) { this.historySize = historySize; }

        public int getProfilerMaxSamplesPerName() { return profilerMaxSamplesPerName; }
        public void setProfilerMaxSamplesPerName(int max) { this.profilerMaxSamplesPerName = max; }

        public List<AlertConfig> getAlerts() { return alerts; }
        public void setAlerts(List<AlertConfig> alerts) { this.alerts = alerts != null ? alerts : new ArrayList<>(); }
    }

    /**
     * Threshold alert evaluated against monitor snapshots.
     */
    public static class AlertConfig {
        private String name;
        private String metric;
        private double threshold;
        private String comparison = "GT";
        private int consecutiveBreaches = 1;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getMetric() { return metric; }
        public void setMetric(String metric) { this.metric = metric; }

        public double getThreshold() { return threshold; }
        public void setThreshold(double threshold) { this.threshold = threshold; }

        public String getComparison() { return comparison; }
        public void setComparison(String comparison) { this.comparison = comparison; }

        public int getConsecutiveBreaches() { return consecutiveBreaches; }
        public void setConsecutiveBreaches(int consecutiveBreaches) { this.consecutiveBreaches = consecutiveBreaches; }

        void validate() {
            if (name == null || name.isBlank() || metric == null || metric.isBlank()) {
                throw new ConfigurationException("monitor.alerts entries need a name and a metric");
            }
            if (comparison == null || !List.of("GT", "GTE", "LT", "LTE").contains(comparison.toUpperCase(Locale.ROOT))) {
                throw new ConfigurationException("Alert '" + name + "' has an invalid comparison: " + comparison);
            }
            ConfigurationException.requirePositive("consecutiveBreaches of alert '" + name + "'", consecutiveBreaches);
        }
    }

    /**
     * Backend circuit breaker configuration.
     */
    public static class CircuitBreakerConfig {
        private int failureThreshold = 5;
        private long recoveryMs = 30000;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getRecoveryMs() { return recoveryMs; }
        public void setRecoveryMs(long recoveryMs) { this.recoveryMs = recoveryMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "embedding_accel";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
