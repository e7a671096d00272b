package fr.lapetina.embedding.accelerator.optimizer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * JSON file of previously chosen batch sizes, keyed by backend and strategy.
 *
 * A missing or unreadable file starts an empty store; a failed save is logged
 * and the in-memory result is kept.
 */
public final class OptimizationResultStore {

    private static final Logger log = LoggerFactory.getLogger(OptimizationResultStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, StoredResult> results;

    /**
     * A persisted calibration outcome, with the settings it was measured under.
     */
    public record StoredResult(
            String backendName,
            String strategy,
            int optimalBatchSize,
            double targetLatencyMs,
            int minBatchSize,
            int maxBatchSize,
            List<TrialRecord> trials,
            Instant measuredAt
    ) {
    }

    public record TrialRecord(int batchSize, double latencyMs, double throughputItemsPerSec,
                              boolean failed, String errorMessage) {
    }

    public OptimizationResultStore(Path file) {
        this.file = file;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.results = load();
    }

    private Map<String, StoredResult> load() {
        Map<String, StoredResult> loaded = new TreeMap<>();
        if (!Files.exists(file)) {
            return loaded;
        }
        try {
            loaded.putAll(objectMapper.readValue(file.toFile(), new TypeReference<Map<String, StoredResult>>() {
            }));
            log.info("Loaded optimization results: file={}, entries={}", file, loaded.size());
        } catch (IOException e) {
            log.warn("Could not load optimization results, starting empty: file={}, error={}",
                    file, e.getMessage());
        }
        return loaded;
    }

    public synchronized Optional<StoredResult> find(String backendName, String strategy) {
        return Optional.ofNullable(results.get(key(backendName, strategy)));
    }

    public synchronized void save(StoredResult result) {
        results.put(key(result.backendName(), result.strategy()), result);
        persist();
    }

    public synchronized void clear() {
        results.clear();
        persist();
    }

    public synchronized int size() {
        return results.size();
    }

    public Path getFile() {
        return file;
    }

    private void persist() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(file.toFile(), results);
        } catch (IOException e) {
            log.warn("Could not save optimization results: file={}, error={}", file, e.getMessage());
        }
    }

    static String key(String backendName, String strategy) {
        return backendName + "|" + strategy;
    }
}
