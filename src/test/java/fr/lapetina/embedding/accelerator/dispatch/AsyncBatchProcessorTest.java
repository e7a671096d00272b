package fr.lapetina.embedding.accelerator.dispatch;

import fr.lapetina.embedding.accelerator.domain.exception.BatchProcessingException;
import fr.lapetina.embedding.accelerator.domain.exception.ConfigurationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AsyncBatchProcessorTest {

    private final List<AsyncBatchProcessor<?, ?>> processors = new ArrayList<>();

    @AfterEach
    void tearDown() {
        processors.forEach(AsyncBatchProcessor::close);
    }

    private <T, R> AsyncBatchProcessor<T, R> track(AsyncBatchProcessor<T, R> processor) {
        processors.add(processor);
        return processor;
    }

    private static List<Integer> range(int n) {
        return IntStream.range(0, n).boxed().collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("should double every item in input order")
        void shouldDoubleInOrder() {
            AsyncBatchProcessor<Integer, Integer> processor = track(AsyncBatchProcessor
                    .<Integer, Integer>builder(batch -> batch.stream().map(x -> x * 2).collect(Collectors.toList()))
                    .batchSize(10)
                    .maxConcurrentBatches(4)
                    .build());

            List<Integer> result = processor.processAll(range(10));

            assertThat(result).containsExactly(0, 2, 4, 6, 8, 10, 12, 14, 16, 18);
        }

        @Test
        @DisplayName("should keep order when later batches finish first")
        void shouldKeepOrderAcrossOutOfOrderCompletion() {
            AsyncBatchProcessor<Integer, Integer> processor = track(AsyncBatchProcessor
                    .<Integer, Integer>builder(batch -> {
                        // first batches sleep longest
                        Thread.sleep(Math.max(0, 50 - batch.get(0)));
                        return new ArrayList<>(batch);
                    })
                    .batchSize(5)
                    .maxConcurrentBatches(4)
                    .build());

            List<Integer> result = processor.processAll(range(47));

            assertThat(result).isEqualTo(range(47));
            assertThat(processor.getTotalProcessed()).isEqualTo(47);
        }

        @Test
        @DisplayName("should return empty list for empty input")
        void shouldHandleEmptyInput() {
            AsyncBatchProcessor<Integer, Integer> processor = track(AsyncBatchProcessor
                    .<Integer, Integer>builder(batch -> batch)
                    .build());

            assertThat(processor.processAll(List.of())).isEmpty();
        }

        @Test
        @DisplayName("should use the new batch size after it changes")
        void shouldApplyNewBatchSize() {
            List<Integer> sizes = new CopyOnWriteArrayList<>();
            AsyncBatchProcessor<Integer, Integer> processor = track(AsyncBatchProcessor
                    .<Integer, Integer>builder(batch -> {
                        sizes.add(batch.size());
                        return batch;
                    })
                    .batchSize(10)
                    .build());

            processor.setBatchSize(3);
            processor.processAll(range(7));

            assertThat(sizes).containsExactlyInAnyOrder(3, 3, 1);
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("should never run more than maxConcurrentBatches at once")
        void shouldBoundConcurrency() {
            AtomicInteger active = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            AsyncBatchProcessor<Integer, Integer> processor = track(AsyncBatchProcessor
                    .<Integer, Integer>builder(batch -> {
                        int now = active.incrementAndGet();
                        peak.accumulateAndGet(now, Math::max);
                        Thread.sleep(20);
                        active.decrementAndGet();
                        return batch;
                    })
                    .batchSize(1)
                    .maxConcurrentBatches(3)
                    .build());

            processor.processAll(range(20));

            assertThat(peak.get()).isLessThanOrEqualTo(3).isGreaterThan(1);
        }

        @Test
        @DisplayName("should report progress once per completed batch")
        void shouldReportProgress() {
            List<Integer> progress = Collections.synchronizedList(new ArrayList<>());
            AsyncBatchProcessor<Integer, Integer> processor = track(AsyncBatchProcessor
                    .<Integer, Integer>builder(batch -> batch)
                    .batchSize(2)
                    .progressListener((completed, total) -> {
                        assertThat(total).isEqualTo(3);
                        progress.add(completed);
                    })
                    .build());

            processor.processAll(range(5));

            assertThat(progress).containsExactly(1, 2, 3);
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("should fail fast with the original cause")
        void shouldFailFast() {
            AsyncBatchProcessor<Integer, Integer> processor = track(AsyncBatchProcessor
                    .<Integer, Integer>builder(batch -> {
                        if (batch.contains(7)) {
                            throw new IllegalStateException("boom");
                        }
                        return batch;
                    })
                    .batchSize(5)
                    .maxConcurrentBatches(2)
                    .build());

            assertThatThrownBy(() -> processor.processAll(range(20)))
                    .isInstanceOf(BatchProcessingException.class)
                    .hasRootCauseInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("boom")
                    .satisfies(e -> assertThat(((BatchProcessingException) e).getBatchIndex()).isEqualTo(1));
            assertThat(processor.getTotalErrors()).isEqualTo(1);
        }

        @Test
        @DisplayName("should remain usable after a failed call")
        void shouldRecoverAfterFailure() {
            AtomicInteger calls = new AtomicInteger();
            AsyncBatchProcessor<Integer, Integer> processor = track(AsyncBatchProcessor
                    .<Integer, Integer>builder(batch -> {
                        if (calls.incrementAndGet() == 1) {
                            throw new IllegalStateException("first call fails");
                        }
                        return batch;
                    })
                    .batchSize(10)
                    .maxConcurrentBatches(1)
                    .build());

            assertThatThrownBy(() -> processor.processAll(range(3))).isInstanceOf(BatchProcessingException.class);

            assertThat(processor.processAll(range(3))).containsExactly(0, 1, 2);
        }

        @Test
        @DisplayName("should reject a wrong number of results")
        void shouldRejectWrongResultCount() {
            AsyncBatchProcessor<Integer, Integer> processor = track(AsyncBatchProcessor
                    .<Integer, Integer>builder(batch -> List.of(1))
                    .batchSize(4)
                    .build());

            assertThatThrownBy(() -> processor.processAll(range(4)))
                    .isInstanceOf(BatchProcessingException.class)
                    .hasRootCauseInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should time out slow batches")
        void shouldTimeOut() {
            AsyncBatchProcessor<Integer, Integer> processor = track(AsyncBatchProcessor
                    .<Integer, Integer>builder(batch -> {
                        Thread.sleep(5_000);
                        return batch;
                    })
                    .batchSize(1)
                    .maxConcurrentBatches(2)
                    .timeout(Duration.ofMillis(200))
                    .build());

            long start = System.nanoTime();
            assertThatThrownBy(() -> processor.processAll(range(4)))
                    .isInstanceOf(BatchProcessingException.class)
                    .hasMessageContaining("Timed out");
            assertThat((System.nanoTime() - start) / 1_000_000).isLessThan(2_000);
        }

        @Test
        @DisplayName("should reject invalid construction parameters")
        void shouldRejectInvalidParameters() {
            assertThatThrownBy(() -> AsyncBatchProcessor.<Integer, Integer>builder(b -> b).batchSize(0).build())
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> AsyncBatchProcessor.<Integer, Integer>builder(b -> b).maxConcurrentBatches(0).build())
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should refuse work after close")
        void shouldRefuseAfterClose() {
            AsyncBatchProcessor<Integer, Integer> processor = AsyncBatchProcessor
                    .<Integer, Integer>builder(b -> b)
                    .build();
            processor.close();

            assertThatThrownBy(() -> processor.processAll(range(1)))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
