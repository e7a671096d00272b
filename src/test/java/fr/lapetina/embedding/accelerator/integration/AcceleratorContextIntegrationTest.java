package fr.lapetina.embedding.accelerator.integration;

import fr.lapetina.embedding.accelerator.AcceleratorContext;
import fr.lapetina.embedding.accelerator.cache.MemoryCacheTier;
import fr.lapetina.embedding.accelerator.domain.exception.BatchProcessingException;
import fr.lapetina.embedding.accelerator.domain.model.ErrorType;
import fr.lapetina.embedding.accelerator.infrastructure.config.AcceleratorConfig;
import fr.lapetina.embedding.accelerator.infrastructure.config.ConfigLoader;
import fr.lapetina.embedding.accelerator.infrastructure.metrics.MonitorSnapshot;
import fr.lapetina.embedding.accelerator.pipeline.EmbeddingPipeline;
import fr.lapetina.embedding.accelerator.pipeline.PipelineResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for a fully wired context.
 * Configuration is externalized to test-config.yaml.
 */
class AcceleratorContextIntegrationTest {

    private TestAcceleratorContext context;

    @BeforeEach
    void setUp() {
        context = TestAcceleratorContext.create();
    }

    @AfterEach
    void tearDown() {
        if (context != null) {
            context.close();
        }
    }

    private static List<String> documents(int count) {
        List<String> documents = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            documents.add("integration document " + i);
        }
        return documents;
    }

    @Test
    @DisplayName("should apply test configuration to the wired components")
    void shouldApplyConfiguration() {
        assertThat(context.getPipeline().getBatchSize()).isEqualTo(8);
        assertThat(context.getRateLimiter()).isNull();
        assertThat(context.getCache().tierNames()).containsExactly("memory");
        assertThat(context.getCache().isPrefetchEnabled()).isTrue();
        assertThat(context.getCache().getTiers().get(0))
                .isInstanceOfSatisfying(MemoryCacheTier.class, tier -> {
                    assertThat(tier.getMaxEntries()).isEqualTo(100);
                    assertThat(tier.getMaxBytes()).isEqualTo(1_048_576L);
                });
        assertThat(context.getMemoryPool().getMaxPoolSize()).isEqualTo(4);
        assertThat(context.getMonitor().isRunning()).isFalse();
        assertThat(context.getPipeline().getCircuitBreaker().getBackendName()).isEqualTo("stub");
    }

    @Test
    @DisplayName("should embed documents through the pipeline")
    void shouldEmbedDocuments() {
        PipelineResult result = context.getPipeline().processDocuments(documents(20));

        assertThat(result.numDocuments()).isEqualTo(20);
        assertThat(result.dimension()).isEqualTo(2);
        assertThat(result.embeddings()).allSatisfy(vector -> assertThat(vector).hasSize(2));
        // 20 documents in batches of 8
        assertThat(context.getStubBackend().getCalls()).isEqualTo(3);
    }

    @Test
    @DisplayName("should serve a second pass from the cache")
    void shouldServeSecondPassFromCache() {
        context.getPipeline().embedAll(documents(10));
        int calls = context.getStubBackend().getCalls();

        context.getPipeline().embedAll(documents(10));

        assertThat(context.getStubBackend().getCalls()).isEqualTo(calls);
        assertThat(context.getCache().stats().get("memory").hitRate()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("should expose component values in monitor snapshots")
    void shouldExposeComponentsToMonitor() {
        context.getPipeline().embedAll(documents(4));

        MonitorSnapshot snapshot = context.getMonitor().collectNow();

        assertThat(snapshot.components())
                .containsEntry("cache.memory.entries", 4.0)
                .containsEntry("profiler." + EmbeddingPipeline.BACKEND_OPERATION + ".count", 1.0)
                .containsKey("pool.allocations");
        assertThat(snapshot.backends()).containsKey("stub");
    }

    @Test
    @DisplayName("should raise the configured alert on sustained breaches")
    void shouldRaiseConfiguredAlert() {
        context.getPipeline().embedAll(documents(2));

        // average latency of the stub stays far below the threshold
        context.getMonitor().collectNow();
        context.getMonitor().collectNow();

        assertThat(context.getMonitor().getAlerts()).isEmpty();
    }

    @Test
    @DisplayName("should report backend errors as typed batch failures")
    void shouldReportBackendErrors() {
        context.getStubBackend().setException(new IllegalStateException("connection reset"));

        assertThatThrownBy(() -> context.getPipeline().embedAll(documents(3)))
                .isInstanceOf(BatchProcessingException.class)
                .satisfies(e -> assertThat(((BatchProcessingException) e).getRootErrorType())
                        .isEqualTo(ErrorType.BACKEND_UNAVAILABLE));
        assertThat(context.getPipeline().getBackendMetrics().errors()).isEqualTo(1);
    }

    @Test
    @DisplayName("should publish metrics under the configured prefix")
    void shouldPublishMetrics() {
        context.getPipeline().embedAll(documents(3));

        String scrape = context.getMetricsRegistry().scrape();

        assertThat(scrape).contains("test_accel_cache_requests_total");
        assertThat(context.getMetricsRegistry().getPrefix()).isEqualTo("test_accel");
    }

    @Test
    @DisplayName("should tune the batch size within the configured range")
    void shouldTuneBatchSize() {
        int chosen = context.getPipeline().tune(documents(16));

        assertThat(chosen).isBetween(1, 16);
        assertThat(context.getPipeline().getBatchSize()).isEqualTo(chosen);
    }

    @Test
    @DisplayName("should apply reloaded batch size to the pipeline")
    void shouldApplyReloadedConfiguration() {
        context.getPipeline().setBatchSize(3);

        context.getConfigLoader().reload();

        assertThat(context.getPipeline().getBatchSize()).isEqualTo(8);
    }

    @Test
    @DisplayName("should keep vectors on disk across contexts")
    void shouldPersistAcrossContexts(@TempDir Path cacheDir) {
        AcceleratorConfig config = ConfigLoader.createDefault();
        config.getCache().setDiskEnabled(true);
        config.getCache().setDiskDirectory(cacheDir.toString());
        config.getMetrics().setEnabled(false);
        TestAcceleratorContext.StubEmbeddingBackend backend = new TestAcceleratorContext.StubEmbeddingBackend();

        try (AcceleratorContext first = AcceleratorContext.create(config, backend)) {
            assertThat(first.getCache().tierNames()).containsExactly("memory", "disk");
            first.getPipeline().embedAll(documents(5));
        }
        try (AcceleratorContext second = AcceleratorContext.create(config, backend)) {
            second.getPipeline().embedAll(documents(5));

            assertThat(second.getCache().stats().get("disk").hits()).isEqualTo(5);
        }
        assertThat(backend.getCalls()).isEqualTo(1);
    }
}
