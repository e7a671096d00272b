package fr.lapetina.embedding.accelerator.dispatch;

import fr.lapetina.embedding.accelerator.domain.exception.BatchProcessingException;
import fr.lapetina.embedding.accelerator.domain.exception.ConfigurationException;
import fr.lapetina.embedding.accelerator.domain.model.BatchJob;
import fr.lapetina.embedding.accelerator.domain.model.ErrorType;
import fr.lapetina.embedding.accelerator.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Splits a list into contiguous batches and runs them concurrently.
 *
 * At most {@code maxConcurrentBatches} batches are in flight: a fixed worker
 * pool of that size executes them and a semaphore of the same size gates
 * submission. Results are written back by position, so the output always
 * matches the input order.
 *
 * Failure policy is fail-fast: the first failing batch cancels every batch
 * that has not finished and {@link #processAll} throws a
 * {@link BatchProcessingException} carrying the original cause. Exceeding
 * the timeout does the same.
 *
 * @param <T> input item type
 * @param <R> result type
 */
public final class AsyncBatchProcessor<T, R> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AsyncBatchProcessor.class);

    public static final String MDC_BATCH_INDEX = "batchIndex";

    private final String name;
    private final BatchFunction<T, R> batchFunction;
    private final int maxConcurrentBatches;
    private final Duration timeout;
    private final MetricsRegistry metrics;
    private final ExecutorService executor;
    private final Semaphore slots;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong totalProcessed = new AtomicLong();
    private final AtomicLong totalErrors = new AtomicLong();

    private volatile int batchSize;
    private volatile ProgressListener progressListener;

    private AsyncBatchProcessor(Builder<T, R> builder) {
        this.name = builder.name;
        this.batchFunction = Objects.requireNonNull(builder.batchFunction, "Batch function is required");
        this.batchSize = ConfigurationException.requirePositive("batch.size", builder.batchSize);
        this.maxConcurrentBatches = ConfigurationException.requirePositive(
                "batch.maxConcurrentBatches", builder.maxConcurrentBatches);
        ConfigurationException.requirePositive("batch.timeoutMs", builder.timeout.toMillis());
        this.timeout = builder.timeout;
        this.metrics = builder.metrics;
        this.progressListener = builder.progressListener;
        this.slots = new Semaphore(maxConcurrentBatches, true);
        this.executor = Executors.newFixedThreadPool(maxConcurrentBatches, workerThreadFactory(name));

        log.info("AsyncBatchProcessor initialized: name={}, batchSize={}, maxConcurrentBatches={}, timeoutMs={}",
                name, batchSize, maxConcurrentBatches, timeout.toMillis());
    }

    public static <T, R> Builder<T, R> builder(BatchFunction<T, R> batchFunction) {
        return new Builder<T, R>().batchFunction(batchFunction);
    }

    private static ThreadFactory workerThreadFactory(String name) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Processes all items and returns one result per item, in input order.
     *
     * @throws BatchProcessingException if any batch fails, the timeout expires,
     *                                  or the calling thread is interrupted
     */
    public List<R> processAll(List<T> items) {
        Objects.requireNonNull(items, "Items are required");
        if (closed.get()) {
            throw new IllegalStateException("AsyncBatchProcessor " + name + " is closed");
        }
        if (items.isEmpty()) {
            return List.of();
        }

        List<BatchJob<T>> jobs = BatchJob.partition(items, batchSize);
        int total = jobs.size();
        Object[] results = new Object[items.size()];
        ExecutorCompletionService<BatchJob<T>> completion = new ExecutorCompletionService<>(executor);
        List<SubmittedBatch> submittedBatches = new ArrayList<>(total);
        long deadline = System.nanoTime() + timeout.toNanos();

        log.debug("Processing items: name={}, items={}, batches={}, batchSize={}",
                name, items.size(), total, jobs.get(0).targetSize());

        int submitted = 0;
        int completed = 0;
        try {
            while (completed < total) {
                if (submitted < total && submitted == completed) {
                    // nothing of ours in flight: wait for a slot
                    if (!slots.tryAcquire(remaining(deadline), TimeUnit.NANOSECONDS)) {
                        throw timedOut(total, completed, submittedBatches);
                    }
                    submittedBatches.add(submit(completion, jobs.get(submitted++), results, total));
                }
                while (submitted < total && slots.tryAcquire()) {
                    submittedBatches.add(submit(completion, jobs.get(submitted++), results, total));
                }

                Future<BatchJob<T>> done = completion.poll(remaining(deadline), TimeUnit.NANOSECONDS);
                if (done == null) {
                    throw timedOut(total, completed, submittedBatches);
                }
                BatchJob<T> job;
                try {
                    job = done.get();
                } catch (ExecutionException e) {
                    int failedIndex = indexOf(submittedBatches, done);
                    cancelAll(submittedBatches);
                    totalErrors.incrementAndGet();
                    Throwable cause = e.getCause();
                    log.error("Batch failed, cancelling remaining: name={}, batchIndex={}, totalBatches={}, error={}",
                            name, failedIndex, total, cause.getMessage());
                    if (metrics != null) {
                        metrics.incrementErrorCount("batch_processor", ErrorType.BATCH_FAILED);
                    }
                    throw new BatchProcessingException(failedIndex, total, String.valueOf(cause.getMessage()), cause);
                }
                completed++;
                totalProcessed.addAndGet(job.size());
                ProgressListener listener = progressListener;
                if (listener != null) {
                    listener.onProgress(completed, total);
                }
            }
        } catch (InterruptedException e) {
            cancelAll(submittedBatches);
            Thread.currentThread().interrupt();
            throw new BatchProcessingException(completed, total, "Interrupted while waiting for batches", e);
        }

        return toList(results);
    }

    @SuppressWarnings("unchecked")
    private List<R> toList(Object[] results) {
        List<R> ordered = new ArrayList<>(results.length);
        for (Object result : results) {
            ordered.add((R) result);
        }
        return ordered;
    }

    private SubmittedBatch submit(ExecutorCompletionService<BatchJob<T>> completion,
                                  BatchJob<T> job, Object[] results, int total) {
        BatchTask task = new BatchTask(job, results, total);
        Future<BatchJob<T>> future = completion.submit(task);
        return new SubmittedBatch(job.batchIndex(), task.started, future);
    }

    private BatchProcessingException timedOut(int total, int completed, List<SubmittedBatch> submittedBatches) {
        cancelAll(submittedBatches);
        totalErrors.incrementAndGet();
        log.error("Batch processing timed out: name={}, completed={}/{}, timeoutMs={}",
                name, completed, total, timeout.toMillis());
        if (metrics != null) {
            metrics.incrementErrorCount("batch_processor", ErrorType.BATCH_FAILED);
        }
        return new BatchProcessingException(completed, total,
                "Timed out after " + timeout.toMillis() + "ms", null);
    }

    private void cancelAll(List<SubmittedBatch> submittedBatches) {
        for (SubmittedBatch batch : submittedBatches) {
            if (!batch.future().isDone()) {
                batch.future().cancel(true);
                // a task cancelled before it started never releases its own slot
                if (batch.started().compareAndSet(false, true)) {
                    slots.release();
                }
            }
        }
    }

    private int indexOf(List<SubmittedBatch> submittedBatches, Future<?> future) {
        for (SubmittedBatch batch : submittedBatches) {
            if (batch.future() == future) {
                return batch.batchIndex();
            }
        }
        return -1;
    }

    private static long remaining(long deadline) {
        return Math.max(0, deadline - System.nanoTime());
    }

    private record SubmittedBatch(int batchIndex, AtomicBoolean started, Future<?> future) {
    }

    /**
     * Runs one batch and owns one semaphore slot until it finishes.
     */
    private final class BatchTask implements Callable<BatchJob<T>> {
        private final BatchJob<T> job;
        private final Object[] results;
        private final int totalBatches;
        private final AtomicBoolean started = new AtomicBoolean(false);

        BatchTask(BatchJob<T> job, Object[] results, int totalBatches) {
            this.job = job;
            this.results = results;
            this.totalBatches = totalBatches;
        }

        @Override
        public BatchJob<T> call() throws Exception {
            if (!started.compareAndSet(false, true)) {
                throw new CancellationException("Batch cancelled before start");
            }
            MDC.put(MDC_BATCH_INDEX, String.valueOf(job.batchIndex()));
            long start = System.nanoTime();
            if (metrics != null) {
                metrics.batchStarted();
            }
            try {
                List<R> out = batchFunction.apply(job.items());
                if (out == null || out.size() != job.size()) {
                    throw new IllegalStateException("Batch function returned "
                            + (out == null ? "null" : out.size() + " results")
                            + " for " + job.size() + " items");
                }
                for (int j = 0; j < out.size(); j++) {
                    results[job.offset() + j] = out.get(j);
                }
                Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                if (metrics != null) {
                    metrics.recordBatch(job.size(), elapsed);
                }
                log.debug("Batch completed: batchIndex={}, totalBatches={}, size={}, latencyMs={}",
                        job.batchIndex(), totalBatches, job.size(), elapsed.toMillis());
                return job;
            } finally {
                if (metrics != null) {
                    metrics.batchFinished();
                }
                MDC.remove(MDC_BATCH_INDEX);
                slots.release();
            }
        }
    }

    /**
     * Changes the batch size used by subsequent {@link #processAll} calls.
     */
    public void setBatchSize(int batchSize) {
        int previous = this.batchSize;
        this.batchSize = ConfigurationException.requirePositive("batch.size", batchSize);
        if (previous != batchSize) {
            log.info("Batch size changed: name={}, from={}, to={}", name, previous, batchSize);
        }
    }

    public void setProgressListener(ProgressListener progressListener) {
        this.progressListener = progressListener;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getMaxConcurrentBatches() {
        return maxConcurrentBatches;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public long getTotalProcessed() {
        return totalProcessed.get();
    }

    public long getTotalErrors() {
        return totalErrors.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("AsyncBatchProcessor closed: name={}, totalProcessed={}, totalErrors={}",
                name, totalProcessed.get(), totalErrors.get());
    }

    public static final class Builder<T, R> {
        private String name = "batch";
        private BatchFunction<T, R> batchFunction;
        private int batchSize = 32;
        private int maxConcurrentBatches = 4;
        private Duration timeout = Duration.ofSeconds(300);
        private MetricsRegistry metrics;
        private ProgressListener progressListener;

        private Builder() {
        }

        public Builder<T, R> name(String name) {
            this.name = name;
            return this;
        }

        public Builder<T, R> batchFunction(BatchFunction<T, R> batchFunction) {
            this.batchFunction = batchFunction;
            return this;
        }

        public Builder<T, R> batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder<T, R> maxConcurrentBatches(int maxConcurrentBatches) {
            this.maxConcurrentBatches = maxConcurrentBatches;
            return this;
        }

        public Builder<T, R> timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "Timeout is required");
            return this;
        }

        public Builder<T, R> metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder<T, R> progressListener(ProgressListener progressListener) {
            this.progressListener = progressListener;
            return this;
        }

        public AsyncBatchProcessor<T, R> build() {
            return new AsyncBatchProcessor<>(this);
        }
    }
}
