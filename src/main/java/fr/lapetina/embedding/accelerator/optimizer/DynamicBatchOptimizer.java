package fr.lapetina.embedding.accelerator.optimizer;

import fr.lapetina.embedding.accelerator.domain.model.OptimizerTrial;
import fr.lapetina.embedding.accelerator.domain.port.EmbeddingBackend;
import fr.lapetina.embedding.accelerator.domain.strategy.OptimizationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.LongSupplier;

/**
 * Picks a batch size by timing the backend at a series of candidate sizes.
 *
 * Candidates are the powers of two between the configured bounds, plus the
 * bounds themselves, capped at the number of sample texts when samples are
 * given. Each candidate is run {@code testIterations} times and averaged. A
 * failing candidate is discarded and probing continues; probing stops once
 * latency runs far past the ceiling or the JVM runs out of memory. The
 * configured {@link OptimizationStrategy} then selects among the successful
 * trials. When every trial fails the result is 1.
 *
 * A stored result is reused only when it was measured with the same latency
 * target and candidate range and its batch size lies within that range.
 */
public final class DynamicBatchOptimizer {

    private static final Logger log = LoggerFactory.getLogger(DynamicBatchOptimizer.class);

    static final int FALLBACK_BATCH_SIZE = 1;

    private static final String[] SYNTHETIC_TEMPLATES = {
            "This is a short test sentence.",
            "This is a medium length test sentence that contains a bit more content for testing purposes.",
            "This is a longer test sentence that contains significantly more content and is designed to "
                    + "test how the system handles various text lengths during batch processing optimization.",
            "Brief text.",
            "Moderately sized text content that should provide a good balance for testing."
    };

    private final OptimizationResultStore resultStore;
    private final LongSupplier nanoClock;
    private volatile List<OptimizerTrial> lastTrials = List.of();

    public DynamicBatchOptimizer(OptimizationResultStore resultStore, LongSupplier nanoClock) {
        this.resultStore = resultStore;
        this.nanoClock = Objects.requireNonNull(nanoClock, "Clock is required");
    }

    public DynamicBatchOptimizer(OptimizationResultStore resultStore) {
        this(resultStore, System::nanoTime);
    }

    public DynamicBatchOptimizer() {
        this(null, System::nanoTime);
    }

    /**
     * Calibrates the backend and returns the batch size chosen by the configured strategy.
     *
     * @param sampleTexts representative inputs; synthetic texts are used when empty
     * @return a batch size in {@code [1, 1000]}; never throws on backend failures
     */
    public int calculateOptimalBatchSize(EmbeddingBackend backend, OptimizationConfig config,
                                         List<String> sampleTexts) {
        Objects.requireNonNull(backend, "Backend is required");
        Objects.requireNonNull(config, "Config is required");
        String strategyName = config.strategy().getName();

        if (resultStore != null) {
            Optional<OptimizationResultStore.StoredResult> cached = resultStore.find(backend.name(), strategyName)
                    .filter(stored -> isReusable(stored, config));
            if (cached.isPresent()) {
                log.info("Using cached batch size: backend={}, strategy={}, batchSize={}",
                        backend.name(), strategyName, cached.get().optimalBatchSize());
                return cached.get().optimalBatchSize();
            }
        }

        List<String> samples = sampleTexts == null ? List.of() : sampleTexts;
        List<Integer> candidates = candidateSizes(config, samples.size());
        List<String> pool = samples.isEmpty() ? syntheticTexts(candidates.get(candidates.size() - 1)) : samples;

        log.info("Calibrating batch size: backend={}, strategy={}, targetLatencyMs={}, candidates={}",
                backend.name(), strategyName, config.targetLatencyMs(), candidates);

        List<OptimizerTrial> trials = new ArrayList<>(candidates.size());
        for (int size : candidates) {
            TrialOutcome outcome = runTrial(backend, size, pool.subList(0, size), config);
            trials.add(outcome.trial());
            if (outcome.stop() || config.strategy().shouldStopProbing(outcome.trial(), config.targetLatencyMs())) {
                log.debug("Stopped probing: batchSize={}, latencyMs={}", size, outcome.trial().latencyMs());
                break;
            }
        }
        lastTrials = List.copyOf(trials);

        List<OptimizerTrial> successful = trials.stream().filter(OptimizerTrial::succeeded).toList();
        int chosen = config.strategy().select(successful, config.targetLatencyMs())
                .map(OptimizerTrial::batchSize)
                .orElse(FALLBACK_BATCH_SIZE);

        if (successful.isEmpty()) {
            log.warn("All calibration trials failed, using fallback: backend={}, batchSize={}",
                    backend.name(), chosen);
        } else {
            log.info("Optimal batch size determined: backend={}, strategy={}, batchSize={}, trials={}",
                    backend.name(), strategyName, chosen, trials.size());
            if (resultStore != null) {
                resultStore.save(toStoredResult(backend.name(), strategyName, chosen, config, trials));
            }
        }
        return chosen;
    }

    private static boolean isReusable(OptimizationResultStore.StoredResult stored, OptimizationConfig config) {
        int size = stored.optimalBatchSize();
        if (size < 1 || size > config.maxBatchSize()) {
            log.warn("Stored batch size out of range, recalibrating: backend={}, strategy={}, batchSize={}, maxBatchSize={}",
                    stored.backendName(), stored.strategy(), size, config.maxBatchSize());
            return false;
        }
        if (Double.compare(stored.targetLatencyMs(), config.targetLatencyMs()) != 0
                || stored.minBatchSize() != config.minBatchSize()
                || stored.maxBatchSize() != config.maxBatchSize()) {
            log.info("Stored batch size measured under other settings, recalibrating: backend={}, strategy={}, "
                            + "storedTargetLatencyMs={}, storedRange=[{}, {}]",
                    stored.backendName(), stored.strategy(), stored.targetLatencyMs(),
                    stored.minBatchSize(), stored.maxBatchSize());
            return false;
        }
        return true;
    }

    private record TrialOutcome(OptimizerTrial trial, boolean stop) {
    }

    private TrialOutcome runTrial(EmbeddingBackend backend, int size, List<String> texts,
                                  OptimizationConfig config) {
        String strategyName = config.strategy().getName();
        long totalNanos = 0;
        try {
            for (int i = 0; i < config.testIterations(); i++) {
                long start = nanoClock.getAsLong();
                List<float[]> vectors = backend.generateEmbeddings(texts);
                totalNanos += nanoClock.getAsLong() - start;
                if (vectors == null || vectors.size() != size) {
                    String message = "Expected " + size + " vectors, got "
                            + (vectors == null ? "null" : vectors.size());
                    log.debug("Trial rejected: batchSize={}, reason={}", size, message);
                    return new TrialOutcome(OptimizerTrial.failure(size, strategyName, message), false);
                }
            }
        } catch (OutOfMemoryError e) {
            log.warn("Out of memory during calibration, stopping: batchSize={}", size);
            return new TrialOutcome(OptimizerTrial.failure(size, strategyName, "Out of memory"), true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new TrialOutcome(OptimizerTrial.failure(size, strategyName, "Interrupted"), true);
        } catch (Exception e) {
            log.debug("Trial failed: batchSize={}, error={}", size, e.getMessage());
            return new TrialOutcome(OptimizerTrial.failure(size, strategyName, String.valueOf(e.getMessage())), false);
        }
        double latencyMs = totalNanos / 1_000_000.0 / config.testIterations();
        OptimizerTrial trial = OptimizerTrial.success(size, latencyMs, strategyName);
        log.debug("Trial completed: batchSize={}, latencyMs={}, throughput={}",
                size, String.format("%.2f", latencyMs), String.format("%.1f", trial.throughputItemsPerSec()));
        return new TrialOutcome(trial, false);
    }

    /**
     * Returns the sorted candidate sizes for a run.
     */
    static List<Integer> candidateSizes(OptimizationConfig config, int sampleSize) {
        int max = sampleSize > 0 ? Math.min(config.maxBatchSize(), sampleSize) : config.maxBatchSize();
        int min = Math.min(config.minBatchSize(), max);
        TreeSet<Integer> sizes = new TreeSet<>();
        sizes.add(min);
        sizes.add(max);
        for (int power = 1; power <= max; power *= 2) {
            if (power >= min) {
                sizes.add(power);
            }
        }
        return new ArrayList<>(sizes);
    }

    static List<String> syntheticTexts(int count) {
        List<String> texts = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            texts.add(SYNTHETIC_TEMPLATES[i % SYNTHETIC_TEMPLATES.length] + " Document " + i + ".");
        }
        return texts;
    }

    private static OptimizationResultStore.StoredResult toStoredResult(String backendName, String strategy,
                                                                       int chosen, OptimizationConfig config,
                                                                       List<OptimizerTrial> trials) {
        List<OptimizationResultStore.TrialRecord> records = trials.stream()
                .map(t -> new OptimizationResultStore.TrialRecord(t.batchSize(),
                        t.failed() ? -1 : t.latencyMs(), t.throughputItemsPerSec(), t.failed(), t.errorMessage()))
                .toList();
        return new OptimizationResultStore.StoredResult(backendName, strategy, chosen,
                config.targetLatencyMs(), config.minBatchSize(), config.maxBatchSize(), records, Instant.now());
    }

    /**
     * Returns the trials of the most recent calibration run, in probing order.
     */
    public List<OptimizerTrial> lastTrials() {
        return lastTrials;
    }

    /**
     * Forgets all persisted results so the next call probes again.
     */
    public void clearCache() {
        if (resultStore != null) {
            resultStore.clear();
            log.info("Optimization result cache cleared");
        }
    }
}
