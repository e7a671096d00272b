package fr.lapetina.embedding.accelerator.pipeline;

import fr.lapetina.embedding.accelerator.cache.CacheHierarchy;
import fr.lapetina.embedding.accelerator.cache.ContentFingerprint;
import fr.lapetina.embedding.accelerator.dispatch.AsyncBatchProcessor;
import fr.lapetina.embedding.accelerator.dispatch.TokenBucketRateLimiter;
import fr.lapetina.embedding.accelerator.domain.exception.BackendUnavailableException;
import fr.lapetina.embedding.accelerator.domain.model.ErrorType;
import fr.lapetina.embedding.accelerator.domain.port.EmbeddingBackend;
import fr.lapetina.embedding.accelerator.infrastructure.metrics.BackendMetrics;
import fr.lapetina.embedding.accelerator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.embedding.accelerator.infrastructure.metrics.PerformanceMonitor;
import fr.lapetina.embedding.accelerator.infrastructure.metrics.Profiler;
import fr.lapetina.embedding.accelerator.memory.MemoryPool;
import fr.lapetina.embedding.accelerator.memory.PooledBuffer;
import fr.lapetina.embedding.accelerator.optimizer.DynamicBatchOptimizer;
import fr.lapetina.embedding.accelerator.optimizer.OptimizationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cached, rate-limited, batched embedding generation for one backend.
 *
 * Each batch looks up every text in the cache hierarchy, sends the misses to
 * the backend in a single rate-limited call guarded by the circuit breaker,
 * writes the new vectors back and returns vectors in input order. Identical
 * texts within a batch reach the backend once.
 */
public final class EmbeddingPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingPipeline.class);

    public static final String MDC_PIPELINE = "pipeline";
    public static final String BACKEND_OPERATION = "generate_embeddings";

    private final EmbeddingBackend backend;
    private final CacheHierarchy cache;
    private final TokenBucketRateLimiter rateLimiter;
    private final BackendCircuitBreaker circuitBreaker;
    private final Profiler profiler;
    private final PerformanceMonitor monitor;
    private final MetricsRegistry metrics;
    private final MemoryPool memoryPool;
    private final DynamicBatchOptimizer optimizer;
    private final OptimizationConfig optimizationConfig;
    private final Duration cacheTtl;
    private final AsyncBatchProcessor<String, float[]> processor;
    private final BackendStatsTracker stats = new BackendStatsTracker();

    private EmbeddingPipeline(Builder builder) {
        this.backend = Objects.requireNonNull(builder.backend, "Backend is required");
        this.cache = Objects.requireNonNull(builder.cache, "Cache hierarchy is required");
        this.rateLimiter = builder.rateLimiter;
        this.circuitBreaker = builder.circuitBreaker != null
                ? builder.circuitBreaker
                : new BackendCircuitBreaker(backend.name());
        this.profiler = builder.profiler != null ? builder.profiler : new Profiler();
        this.monitor = builder.monitor;
        this.metrics = builder.metrics;
        this.memoryPool = builder.memoryPool;
        this.optimizer = builder.optimizer;
        this.optimizationConfig = builder.optimizationConfig;
        this.cacheTtl = builder.cacheTtl;
        this.processor = AsyncBatchProcessor.<String, float[]>builder(this::embedBatch)
                .name("pipeline-" + backend.name())
                .batchSize(builder.batchSize)
                .maxConcurrentBatches(builder.maxConcurrentBatches)
                .timeout(builder.timeout)
                .metrics(metrics)
                .build();

        log.info("EmbeddingPipeline initialized: backend={}, dimension={}, batchSize={}, rateLimited={}, tiers={}",
                backend.name(), backend.dimension(), builder.batchSize, rateLimiter != null, cache.tierNames());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns one vector per text, in input order.
     *
     * @throws fr.lapetina.embedding.accelerator.domain.exception.BatchProcessingException
     *         if a batch fails; its cause is typically a {@link BackendUnavailableException}
     */
    public List<float[]> embedAll(List<String> texts) {
        Objects.requireNonNull(texts, "Texts are required");
        for (String text : texts) {
            Objects.requireNonNull(text, "Texts must not contain null");
        }
        return processor.processAll(texts);
    }

    public float[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    /**
     * Embeds the texts into a pooled {@code [texts.size(), dimension]} row-major matrix.
     * The caller owns the buffer and must close it.
     */
    public PooledBuffer embedAllPooled(List<String> texts) {
        if (memoryPool == null) {
            throw new IllegalStateException("No memory pool configured for pipeline " + backend.name());
        }
        if (texts.isEmpty()) {
            throw new IllegalArgumentException("Texts must not be empty");
        }
        List<float[]> vectors = embedAll(texts);
        int dimension = vectors.get(0).length;
        PooledBuffer buffer = memoryPool.acquireArray(vectors.size(), dimension);
        try {
            float[] matrix = buffer.floats();
            for (int i = 0; i < vectors.size(); i++) {
                float[] row = vectors.get(i);
                if (row.length != dimension) {
                    throw new IllegalStateException("Inconsistent vector length at " + i + ": " + row.length);
                }
                System.arraycopy(row, 0, matrix, i * dimension, dimension);
            }
            return buffer;
        } catch (RuntimeException e) {
            buffer.close();
            throw e;
        }
    }

    /**
     * Embeds the documents and reports throughput statistics for the run.
     */
    public PipelineResult processDocuments(List<String> documents) {
        long start = System.nanoTime();
        long errorsBefore = stats.errors();
        List<float[]> embeddings = embedAll(documents);
        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
        double throughput = seconds > 0 ? documents.size() / seconds : 0.0;
        int dimension = embeddings.isEmpty() ? 0 : embeddings.get(0).length;
        log.info("Pipeline completed: backend={}, documents={}, durationSeconds={}, docsPerSec={}",
                backend.name(), documents.size(), String.format("%.2f", seconds), String.format("%.1f", throughput));
        return new PipelineResult(embeddings, documents.size(), dimension, seconds, throughput,
                stats.errors() - errorsBefore);
    }

    List<float[]> embedBatch(List<String> batch) throws Exception {
        MDC.put(MDC_PIPELINE, backend.name());
        try {
            float[][] results = new float[batch.size()][];
            // fingerprint -> normalized text, first occurrence wins
            Map<String, String> misses = new LinkedHashMap<>();
            String[] keys = new String[batch.size()];
            for (int i = 0; i < batch.size(); i++) {
                keys[i] = ContentFingerprint.of(backend.name(), batch.get(i));
                float[] cached = cache.get(keys[i]).orElse(null);
                if (cached != null) {
                    results[i] = cached;
                } else {
                    misses.putIfAbsent(keys[i], ContentFingerprint.normalize(batch.get(i)));
                }
            }

            if (!misses.isEmpty()) {
                Map<String, float[]> generated = generate(misses);
                for (int i = 0; i < batch.size(); i++) {
                    if (results[i] == null) {
                        results[i] = generated.get(keys[i]);
                    }
                }
            }

            stats.recordDocs(batch.size());
            publishMetrics();
            log.debug("Batch embedded: size={}, cacheHits={}, generated={}",
                    batch.size(), batch.size() - countMissPositions(keys, misses), misses.size());
            return List.of(results);
        } finally {
            MDC.remove(MDC_PIPELINE);
        }
    }

    private Map<String, float[]> generate(Map<String, String> misses) throws InterruptedException {
        List<String> keys = new ArrayList<>(misses.keySet());
        List<String> texts = new ArrayList<>(misses.values());

        if (rateLimiter != null) {
            rateLimiter.acquire();
        }

        long start = System.nanoTime();
        List<float[]> vectors;
        try {
            vectors = circuitBreaker.execute(() -> profiler.time(BACKEND_OPERATION, () -> {
                List<float[]> out = backend.generateEmbeddings(texts);
                if (out == null || out.size() != texts.size()) {
                    throw new BackendUnavailableException(backend.name(), "Expected " + texts.size()
                            + " vectors, got " + (out == null ? "null" : out.size()));
                }
                return out;
            }));
        } catch (BackendUnavailableException e) {
            stats.recordError();
            if (metrics != null) {
                metrics.incrementErrorCount("backend_" + backend.name(), ErrorType.BACKEND_UNAVAILABLE);
            }
            publishMetrics();
            log.warn("Backend call failed: backend={}, texts={}, error={}", backend.name(), texts.size(), e.getMessage());
            throw e;
        }
        stats.recordCall((System.nanoTime() - start) / 1_000_000.0);

        Map<String, float[]> generated = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            generated.put(keys.get(i), vectors.get(i));
            cache.set(keys.get(i), vectors.get(i), cacheTtl);
        }
        return generated;
    }

    private static int countMissPositions(String[] keys, Map<String, String> misses) {
        int count = 0;
        for (String key : keys) {
            if (misses.containsKey(key)) {
                count++;
            }
        }
        return count;
    }

    private void publishMetrics() {
        if (monitor != null) {
            monitor.updateBackendMetrics(backend.name(), stats.snapshot());
        }
    }

    /**
     * Calibrates the batch size against the backend and applies it to later calls.
     *
     * @return the batch size now in effect
     */
    public int tune(List<String> sampleTexts) {
        if (optimizer == null || optimizationConfig == null) {
            throw new IllegalStateException("No optimizer configured for pipeline " + backend.name());
        }
        int chosen = optimizer.calculateOptimalBatchSize(backend, optimizationConfig, sampleTexts);
        processor.setBatchSize(chosen);
        log.info("Pipeline tuned: backend={}, strategy={}, batchSize={}",
                backend.name(), optimizationConfig.strategy().getName(), chosen);
        return chosen;
    }

    public void setBatchSize(int batchSize) {
        processor.setBatchSize(batchSize);
    }

    public int getBatchSize() {
        return processor.getBatchSize();
    }

    public BackendMetrics getBackendMetrics() {
        return stats.snapshot();
    }

    public BackendCircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public EmbeddingBackend getBackend() {
        return backend;
    }

    public long getTotalProcessed() {
        return processor.getTotalProcessed();
    }

    @Override
    public void close() {
        processor.close();
        log.info("EmbeddingPipeline closed: backend={}", backend.name());
    }

    public static final class Builder {
        private EmbeddingBackend backend;
        private CacheHierarchy cache;
        private TokenBucketRateLimiter rateLimiter;
        private BackendCircuitBreaker circuitBreaker;
        private Profiler profiler;
        private PerformanceMonitor monitor;
        private MetricsRegistry metrics;
        private MemoryPool memoryPool;
        private DynamicBatchOptimizer optimizer;
        private OptimizationConfig optimizationConfig;
        private int batchSize = 32;
        private int maxConcurrentBatches = 4;
        private Duration timeout = Duration.ofMinutes(5);
        private Duration cacheTtl;

        private Builder() {
        }

        public Builder backend(EmbeddingBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder cache(CacheHierarchy cache) {
            this.cache = cache;
            return this;
        }

        public Builder rateLimiter(TokenBucketRateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder circuitBreaker(BackendCircuitBreaker circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        public Builder profiler(Profiler profiler) {
            this.profiler = profiler;
            return this;
        }

        public Builder monitor(PerformanceMonitor monitor) {
            this.monitor = monitor;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder memoryPool(MemoryPool memoryPool) {
            this.memoryPool = memoryPool;
            return this;
        }

        public Builder optimizer(DynamicBatchOptimizer optimizer, OptimizationConfig optimizationConfig) {
            this.optimizer = optimizer;
            this.optimizationConfig = optimizationConfig;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder maxConcurrentBatches(int maxConcurrentBatches) {
            this.maxConcurrentBatches = maxConcurrentBatches;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Lifetime of generated vectors in the cache; null keeps them until evicted.
         */
        public Builder cacheTtl(Duration cacheTtl) {
            if (cacheTtl != null && (cacheTtl.isNegative() || cacheTtl.isZero())) {
                throw new IllegalArgumentException("Cache TTL must be positive: " + cacheTtl);
            }
            this.cacheTtl = cacheTtl;
            return this;
        }

        public EmbeddingPipeline build() {
            return new EmbeddingPipeline(this);
        }
    }
}
