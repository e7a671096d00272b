package fr.lapetina.embedding.accelerator.infrastructure.metrics;

import fr.lapetina.embedding.accelerator.domain.model.MetricSample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ProfilerTest {

    private Profiler profiler;

    @BeforeEach
    void setUp() {
        profiler = new Profiler(3, null);
    }

    @Test
    @DisplayName("should record a sample when a scope closes")
    void shouldRecordOnScopeClose() throws InterruptedException {
        try (Profiler.Scope scope = profiler.start("load")) {
            assertThat(scope.getName()).isEqualTo("load");
            Thread.sleep(10);
        }

        List<MetricSample> samples = profiler.getMetrics("load");
        assertThat(samples).hasSize(1);
        assertThat(samples.get(0).durationMs()).isGreaterThanOrEqualTo(9.0);
        assertThat(samples.get(0).success()).isTrue();
        assertThat(samples.get(0).heapUsedBytes()).isPositive();
    }

    @Test
    @DisplayName("should return the value and record failures of timed calls")
    void shouldTimeCallables() throws Exception {
        assertThat(profiler.time("call", () -> 42)).isEqualTo(42);
        assertThatThrownBy(() -> profiler.time("call", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(profiler.getMetrics("call")).extracting(MetricSample::success).containsExactly(true, false);
        assertThat(profiler.summarize("call")).hasValueSatisfying(s -> assertThat(s.failures()).isEqualTo(1));
    }

    @Test
    @DisplayName("should keep only the most recent samples per name")
    void shouldBoundSamplesPerName() {
        for (int i = 1; i <= 5; i++) {
            profiler.record(MetricSample.of("op", i));
        }

        assertThat(profiler.getMetrics("op")).extracting(MetricSample::durationMs).containsExactly(3.0, 4.0, 5.0);
    }

    @Test
    @DisplayName("should summarize recorded durations")
    void shouldSummarize() {
        Profiler large = new Profiler();
        for (int i = 1; i <= 20; i++) {
            large.record(MetricSample.of("op", i));
        }

        ProfileSummary summary = large.summarize("op").orElseThrow();

        assertThat(summary.count()).isEqualTo(20);
        assertThat(summary.avgMs()).isEqualTo(10.5);
        assertThat(summary.minMs()).isEqualTo(1.0);
        assertThat(summary.maxMs()).isEqualTo(20.0);
        assertThat(summary.p95Ms()).isEqualTo(19.0);
        assertThat(summary.stdDevMs()).isCloseTo(5.766, within(0.001));
        assertThat(large.summarize("unknown")).isEmpty();
    }

    @Test
    @DisplayName("should filter samples by name fragment")
    void shouldFilterByName() {
        profiler.record(MetricSample.of("cache_get", 1));
        profiler.record(MetricSample.of("cache_set", 2));
        profiler.record(MetricSample.of("generate", 3));

        assertThat(profiler.getMetricsMatching("cache")).hasSize(2);
        assertThat(profiler.names()).containsExactly("cache_get", "cache_set", "generate");
    }

    @Test
    @DisplayName("should benchmark a callable under its own name")
    void shouldBenchmark() throws Exception {
        ProfileSummary summary = profiler.benchmark("noop", 3, () -> null);

        assertThat(summary.name()).isEqualTo("benchmark_noop");
        assertThat(summary.count()).isEqualTo(3);
        assertThat(profiler.names()).contains("benchmark_noop");
    }

    @Test
    @DisplayName("should feed the operation latency timer")
    void shouldFeedMetricsRegistry() {
        MetricsRegistry registry = new MetricsRegistry("test");
        Profiler withMetrics = new Profiler(10, registry);

        withMetrics.run("embed", () -> { });

        assertThat(registry.scrape()).contains("test_operation_latency").contains("operation=\"embed\"");
        registry.close();
    }
}
