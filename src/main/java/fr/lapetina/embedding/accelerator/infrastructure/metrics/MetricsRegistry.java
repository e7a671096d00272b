package fr.lapetina.embedding.accelerator.infrastructure.metrics;

import fr.lapetina.embedding.accelerator.domain.model.ErrorType;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Cache request counters per tier and result
 * - Rate limiter wait and batch latency timers
 * - Per-operation latency timers fed by the profiler
 * - Memory pool and in-flight batch gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String DEFAULT_PREFIX = "embedding_accel";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> cacheCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> operationTimers = new ConcurrentHashMap<>();
    private final Timer rateLimiterWait;
    private final Timer batchLatency;
    private final Counter itemsProcessed;

    private final AtomicInteger batchesInFlight = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_batches_inflight", batchesInFlight, AtomicInteger::get)
                .description("Number of batches currently executing")
                .register(registry);

        this.rateLimiterWait = Timer.builder(prefix + "_ratelimiter_wait")
                .description("Time callers spent waiting for a rate limiter token")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.batchLatency = Timer.builder(prefix + "_batch_latency")
                .description("Batch execution latency")
                .publishPercentileHistogram()
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);

        this.itemsProcessed = Counter.builder(prefix + "_items_processed_total")
                .description("Total number of items processed by the batch processor")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this(DEFAULT_PREFIX);
    }

    /**
     * Increments the cache request counter for a tier/result combination.
     *
     * @param tier   tier name (memory, disk, remote)
     * @param result hit, miss, write, eviction or expired
     */
    public void incrementCacheCount(String tier, String result) {
        String key = tier + ":" + result;
        cacheCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_cache_requests_total")
                        .description("Cache operations per tier and result")
                        .tag("tier", tier)
                        .tag("result", result)
                        .register(registry)
        ).increment();
    }

    /**
     * Records operation latency measured by the profiler.
     */
    public void recordOperationLatency(String operation, Duration latency) {
        operationTimers.computeIfAbsent(operation, k ->
                Timer.builder(prefix + "_operation_latency")
                        .description("Profiled operation latency")
                        .tag("operation", operation)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    /**
     * Records the time a caller waited for a rate limiter token.
     */
    public void recordRateLimiterWait(Duration wait) {
        rateLimiterWait.record(wait);
    }

    /**
     * Records a completed batch.
     */
    public void recordBatch(int items, Duration latency) {
        batchLatency.record(latency);
        itemsProcessed.increment(items);
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(String component, ErrorType errorType) {
        String key = component + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("component", component)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge backed by a live value, e.g. free buffers of a pool size class.
     */
    public void registerGauge(String name, String tagKey, String tagValue, Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_" + name, valueSupplier, s -> s.get().doubleValue())
                .tag(tagKey, tagValue)
                // suppliers are usually method references held nowhere else
                .strongReference(true)
                .register(registry);
    }

    public void batchStarted() {
        batchesInFlight.incrementAndGet();
    }

    public void batchFinished() {
        batchesInFlight.decrementAndGet();
    }

    public int getBatchesInFlight() {
        return batchesInFlight.get();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void close() {
        registry.close();
    }
}
