package fr.lapetina.embedding.accelerator.infrastructure.metrics;

import fr.lapetina.embedding.accelerator.domain.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit timing of named operations.
 *
 * <pre>{@code
 * try (Profiler.Scope scope = profiler.start("generate_embeddings")) {
 *     vectors = backend.generateEmbeddings(texts);
 * }
 * }</pre>
 *
 * Samples are kept in a bounded ring per name, oldest dropped first, and
 * mirrored to the {@code _operation_latency} timer when a registry is set.
 */
public final class Profiler {

    private static final Logger log = LoggerFactory.getLogger(Profiler.class);

    public static final int DEFAULT_MAX_SAMPLES_PER_NAME = 1000;

    private final int maxSamplesPerName;
    private final MetricsRegistry metrics;
    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
    private final Map<String, ArrayDeque<MetricSample>> samples = new ConcurrentHashMap<>();

    public Profiler(int maxSamplesPerName, MetricsRegistry metrics) {
        if (maxSamplesPerName <= 0) {
            throw new IllegalArgumentException("Max samples per name must be positive: " + maxSamplesPerName);
        }
        this.maxSamplesPerName = maxSamplesPerName;
        this.metrics = metrics;
    }

    public Profiler() {
        this(DEFAULT_MAX_SAMPLES_PER_NAME, null);
    }

    /**
     * Starts timing; the sample is recorded when the scope closes.
     */
    public Scope start(String name) {
        return new Scope(name, System.nanoTime());
    }

    /**
     * Times a call, recording a failed sample if it throws.
     */
    public <V> V time(String name, Callable<V> callable) throws Exception {
        try (Scope scope = start(name)) {
            try {
                return callable.call();
            } catch (Exception | Error e) {
                scope.markFailed();
                throw e;
            }
        }
    }

    /**
     * Times a runnable, recording a failed sample if it throws.
     */
    public void run(String name, Runnable runnable) {
        try (Scope scope = start(name)) {
            try {
                runnable.run();
            } catch (RuntimeException | Error e) {
                scope.markFailed();
                throw e;
            }
        }
    }

    /**
     * Adds an externally measured sample.
     */
    public void record(MetricSample sample) {
        ArrayDeque<MetricSample> ring = samples.computeIfAbsent(sample.functionName(), k -> new ArrayDeque<>());
        synchronized (ring) {
            if (ring.size() >= maxSamplesPerName) {
                ring.pollFirst();
            }
            ring.addLast(sample);
        }
        if (metrics != null) {
            metrics.recordOperationLatency(sample.functionName(),
                    Duration.ofNanos((long) (sample.durationMs() * 1_000_000)));
        }
        if (log.isTraceEnabled()) {
            log.trace("Profiled: name={}, durationMs={}, success={}",
                    sample.functionName(), sample.durationMs(), sample.success());
        }
    }

    /**
     * Returns the samples recorded under a name, oldest first.
     */
    public List<MetricSample> getMetrics(String name) {
        ArrayDeque<MetricSample> ring = samples.get(name);
        if (ring == null) {
            return List.of();
        }
        synchronized (ring) {
            return List.copyOf(ring);
        }
    }

    /**
     * Returns every sample whose name contains the filter, ordered by timestamp.
     */
    public List<MetricSample> getMetricsMatching(String nameFilter) {
        List<MetricSample> matching = new ArrayList<>();
        for (String name : names()) {
            if (name.contains(nameFilter)) {
                matching.addAll(getMetrics(name));
            }
        }
        matching.sort(Comparator.comparing(MetricSample::timestamp));
        return matching;
    }

    public Optional<ProfileSummary> summarize(String name) {
        List<MetricSample> recorded = getMetrics(name);
        if (recorded.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ProfileSummary.of(name, recorded));
    }

    /**
     * Runs a callable {@code iterations} times under a fresh name and summarizes the runs.
     */
    public ProfileSummary benchmark(String name, int iterations, Callable<?> callable) throws Exception {
        if (iterations <= 0) {
            throw new IllegalArgumentException("Iterations must be positive: " + iterations);
        }
        String benchmarkName = "benchmark_" + name;
        samples.remove(benchmarkName);
        for (int i = 0; i < iterations; i++) {
            time(benchmarkName, callable);
        }
        return summarize(benchmarkName).orElseThrow();
    }

    public Set<String> names() {
        return new TreeSet<>(samples.keySet());
    }

    public void clear() {
        samples.clear();
        log.debug("Profiler samples cleared");
    }

    public int getMaxSamplesPerName() {
        return maxSamplesPerName;
    }

    /**
     * An in-progress measurement. Closing it records the sample exactly once.
     */
    public final class Scope implements AutoCloseable {
        private final String name;
        private final long startNanos;
        private boolean failed;
        private boolean closed;

        private Scope(String name, long startNanos) {
            this.name = name;
            this.startNanos = startNanos;
        }

        public void markFailed() {
            this.failed = true;
        }

        public String getName() {
            return name;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            double durationMs = (System.nanoTime() - startNanos) / 1_000_000.0;
            long heapUsed = memoryBean.getHeapMemoryUsage().getUsed();
            record(new MetricSample(name, durationMs, heapUsed, null, Instant.now(), !failed));
        }
    }
}
