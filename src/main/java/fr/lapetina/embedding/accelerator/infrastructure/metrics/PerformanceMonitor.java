package fr.lapetina.embedding.accelerator.infrastructure.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Background collector of system, backend and component metrics.
 *
 * A single daemon thread takes a {@link MonitorSnapshot} every
 * {@code collectionInterval}, keeps the last {@code historySize} of them and
 * evaluates the alert rules against each one. {@link #stop()} returns only
 * once the collection thread has terminated. A stopped monitor cannot be
 * restarted.
 */
public final class PerformanceMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PerformanceMonitor.class);

    public enum State {
        NEW,
        RUNNING,
        STOPPED
    }

    private final Duration collectionInterval;
    private final int historySize;
    private final Supplier<SystemMetrics> systemSampler;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final ObjectMapper objectMapper;
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);

    private final Map<String, BackendMetrics> backends = new ConcurrentHashMap<>();
    private final Map<String, Supplier<Map<String, Double>>> sources = new ConcurrentHashMap<>();
    private final List<AlertRule> rules = new CopyOnWriteArrayList<>();

    // guarded by this
    private final ArrayDeque<MonitorSnapshot> history;
    private final ArrayDeque<Alert> alerts;

    private PerformanceMonitor(Builder builder) {
        if (builder.collectionInterval.isNegative() || builder.collectionInterval.isZero()) {
            throw new IllegalArgumentException("Collection interval must be positive: " + builder.collectionInterval);
        }
        if (builder.historySize <= 0) {
            throw new IllegalArgumentException("History size must be positive: " + builder.historySize);
        }
        this.collectionInterval = builder.collectionInterval;
        this.historySize = builder.historySize;
        this.systemSampler = builder.systemSampler;
        this.clock = builder.clock;
        this.history = new ArrayDeque<>(historySize);
        this.alerts = new ArrayDeque<>(historySize);
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "performance-monitor");
            t.setDaemon(true);
            return t;
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts periodic collection. Calling it on a running monitor has no effect.
     *
     * @throws IllegalStateException if the monitor has been stopped
     */
    public void start() {
        if (state.compareAndSet(State.NEW, State.RUNNING)) {
            scheduler.scheduleAtFixedRate(this::collectSafely, 0, collectionInterval.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Performance monitor started: interval={}, historySize={}", collectionInterval, historySize);
            return;
        }
        if (state.get() == State.STOPPED) {
            throw new IllegalStateException("Performance monitor has been stopped and cannot be restarted");
        }
    }

    /**
     * Stops collection and waits for the collection thread to finish.
     */
    public void stop() {
        State previous = state.getAndSet(State.STOPPED);
        if (previous == State.STOPPED) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Performance monitor thread did not terminate");
                }
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Performance monitor stopped: snapshots={}", historySnapshotCount());
    }

    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    public State getState() {
        return state.get();
    }

    private void collectSafely() {
        try {
            collectNow();
        } catch (RuntimeException e) {
            // keep the schedule alive
            log.error("Metrics collection failed: error={}", e.getMessage(), e);
        }
    }

    /**
     * Takes a snapshot immediately, records it and evaluates alert rules.
     */
    public MonitorSnapshot collectNow() {
        Instant now = clock.instant();
        Map<String, Double> components = new LinkedHashMap<>();
        sources.forEach((sourceName, source) -> {
            try {
                source.get().forEach((key, value) -> components.put(sourceName + "." + key, value));
            } catch (RuntimeException e) {
                log.warn("Metric source failed: source={}, error={}", sourceName, e.getMessage());
            }
        });
        MonitorSnapshot snapshot = new MonitorSnapshot(now, systemSampler.get(), new LinkedHashMap<>(backends),
                components);
        synchronized (this) {
            if (history.size() >= historySize) {
                history.pollFirst();
            }
            history.addLast(snapshot);
        }
        evaluateRules(snapshot);
        log.debug("Snapshot collected: cpuPercent={}, memoryPercent={}, backends={}",
                String.format("%.1f", snapshot.system().cpuPercent()),
                String.format("%.1f", snapshot.system().memoryPercent()),
                snapshot.backends().size());
        return snapshot;
    }

    private void evaluateRules(MonitorSnapshot snapshot) {
        if (rules.isEmpty()) {
            return;
        }
        Map<String, Double> flat = snapshot.flatten();
        for (AlertRule rule : rules) {
            Alert alert = rule.evaluate(flat.get(rule.getMetric()), snapshot.timestamp());
            if (alert == null) {
                continue;
            }
            synchronized (this) {
                if (alerts.size() >= historySize) {
                    alerts.pollFirst();
                }
                alerts.addLast(alert);
            }
            log.warn("Alert raised: rule={}, metric={}, value={}, threshold={}, comparison={}",
                    alert.ruleName(), alert.metric(), alert.observedValue(), alert.threshold(), alert.comparison());
            if (rule.getCallback() != null) {
                try {
                    rule.getCallback().accept(alert);
                } catch (RuntimeException e) {
                    log.warn("Alert callback failed: rule={}, error={}", rule.getName(), e.getMessage());
                }
            }
        }
    }

    /**
     * Records the latest metrics of a backend; picked up by the next snapshot.
     */
    public void updateBackendMetrics(String backendName, BackendMetrics metrics) {
        backends.put(Objects.requireNonNull(backendName), Objects.requireNonNull(metrics));
    }

    /**
     * Registers a component whose values are copied into every snapshot as {@code <name>.<key>}.
     */
    public void registerSource(String name, Supplier<Map<String, Double>> source) {
        sources.put(Objects.requireNonNull(name), Objects.requireNonNull(source));
    }

    public void addAlertRule(AlertRule rule) {
        rules.add(Objects.requireNonNull(rule));
        log.info("Alert rule added: {}", rule);
    }

    public synchronized List<MonitorSnapshot> getHistory() {
        return List.copyOf(history);
    }

    public synchronized Optional<MonitorSnapshot> getLatestSnapshot() {
        return Optional.ofNullable(history.peekLast());
    }

    public synchronized List<Alert> getAlerts() {
        return List.copyOf(alerts);
    }

    private synchronized int historySnapshotCount() {
        return history.size();
    }

    /**
     * Summarizes the snapshots taken within the window ending now.
     *
     * @return a map with {@code system}, {@code backends}, {@code components} and {@code alerts} sections
     */
    public Map<String, Object> getSummary(Duration window) {
        Instant since = clock.instant().minus(window);
        List<MonitorSnapshot> recent;
        List<Alert> recentAlerts;
        synchronized (this) {
            recent = history.stream().filter(s -> !s.timestamp().isBefore(since)).toList();
            recentAlerts = alerts.stream().filter(a -> !a.timestamp().isBefore(since)).toList();
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("window_seconds", window.toSeconds());
        summary.put("system", systemSection(recent));
        summary.put("backends", backendSection(recent));
        Map<String, Double> components = new TreeMap<>();
        if (!recent.isEmpty()) {
            components.putAll(recent.get(recent.size() - 1).components());
        }
        summary.put("components", components);

        List<Map<String, Object>> alertList = new ArrayList<>();
        for (Alert alert : recentAlerts) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("rule", alert.ruleName());
            entry.put("metric", alert.metric());
            entry.put("value", alert.observedValue());
            entry.put("threshold", alert.threshold());
            entry.put("timestamp", alert.timestamp().toString());
            alertList.add(entry);
        }
        summary.put("alerts", alertList);
        return summary;
    }

    private static Map<String, Object> systemSection(List<MonitorSnapshot> recent) {
        Map<String, Object> system = new LinkedHashMap<>();
        system.put("samples", recent.size());
        if (recent.isEmpty()) {
            return system;
        }
        double cpuSum = 0;
        double cpuMax = 0;
        double memSum = 0;
        double memMax = 0;
        for (MonitorSnapshot s : recent) {
            cpuSum += s.system().cpuPercent();
            cpuMax = Math.max(cpuMax, s.system().cpuPercent());
            memSum += s.system().memoryPercent();
            memMax = Math.max(memMax, s.system().memoryPercent());
        }
        MonitorSnapshot last = recent.get(recent.size() - 1);
        system.put("cpu_percent_avg", cpuSum / recent.size());
        system.put("cpu_percent_max", cpuMax);
        system.put("memory_percent_avg", memSum / recent.size());
        system.put("memory_percent_max", memMax);
        system.put("heap_used_bytes", last.system().heapUsedBytes());
        system.put("thread_count", last.system().threadCount());
        return system;
    }

    private static Map<String, Object> backendSection(List<MonitorSnapshot> recent) {
        Map<String, List<BackendMetrics>> perBackend = new LinkedHashMap<>();
        for (MonitorSnapshot s : recent) {
            s.backends().forEach((name, m) -> perBackend.computeIfAbsent(name, k -> new ArrayList<>()).add(m));
        }
        Map<String, Object> section = new LinkedHashMap<>();
        perBackend.forEach((name, series) -> {
            BackendMetrics latest = series.get(series.size() - 1);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("docs_processed", latest.docsProcessed());
            entry.put("docs_per_minute", latest.docsPerMinute());
            entry.put("avg_latency_ms", latest.avgLatencyMs());
            entry.put("avg_latency_ms_window",
                    series.stream().mapToDouble(BackendMetrics::avgLatencyMs).average().orElse(0.0));
            entry.put("p95_latency_ms", latest.p95LatencyMs());
            entry.put("p99_latency_ms", latest.p99LatencyMs());
            entry.put("errors", latest.errors());
            entry.put("error_rate", latest.errorRate());
            section.put(name, entry);
        });
        return section;
    }

    /**
     * Renders {@link #getSummary(Duration)} as JSON.
     */
    public String getSummaryJson(Duration window) {
        try {
            return objectMapper.writeValueAsString(getSummary(window));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render monitor summary", e);
        }
    }

    public Duration getCollectionInterval() {
        return collectionInterval;
    }

    @Override
    public void close() {
        stop();
    }

    public static final class Builder {
        private Duration collectionInterval = Duration.ofSeconds(5);
        private int historySize = 720;
        private Supplier<SystemMetrics> systemSampler = SystemMetrics::capture;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder collectionInterval(Duration collectionInterval) {
            this.collectionInterval = Objects.requireNonNull(collectionInterval);
            return this;
        }

        public Builder historySize(int historySize) {
            this.historySize = historySize;
            return this;
        }

        public Builder systemSampler(Supplier<SystemMetrics> systemSampler) {
            this.systemSampler = Objects.requireNonNull(systemSampler);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public PerformanceMonitor build() {
            return new PerformanceMonitor(this);
        }
    }
}
