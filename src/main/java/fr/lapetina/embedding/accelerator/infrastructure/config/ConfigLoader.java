package fr.lapetina.embedding.accelerator.infrastructure.config;

import fr.lapetina.embedding.accelerator.domain.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads {@link AcceleratorConfig} from YAML and reloads it when the file changes.
 *
 * The path is tried on the file system first, then as a classpath resource.
 * Every loaded configuration is validated before it replaces the current one
 * and listeners see it. Watching polls the file's modification time; a
 * classpath configuration is never watched.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "accelerator.yaml";
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

    private final Path configPath;
    private final Yaml yaml;
    private final AtomicReference<AcceleratorConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();

    private ScheduledExecutorService watcher;
    private volatile long loadedModifiedTime = -1;

    public ConfigLoader(String configPath) {
        this.configPath = Path.of(Objects.requireNonNull(configPath, "Config path is required"));
        this.yaml = new Yaml(new Constructor(AcceleratorConfig.class, new LoaderOptions()));
    }

    public ConfigLoader() {
        this(DEFAULT_RESOURCE);
    }

    /**
     * Loads, validates and publishes the configuration.
     *
     * @throws ConfigurationException if the source is missing, malformed or invalid
     */
    public AcceleratorConfig load() {
        return publish(Files.isRegularFile(configPath) ? readFile() : readClasspath());
    }

    /**
     * Loads, validates and publishes a configuration read from the stream.
     */
    public AcceleratorConfig loadFromStream(InputStream inputStream) {
        return publish(parse(inputStream, "stream"));
    }

    private AcceleratorConfig publish(AcceleratorConfig config) {
        config.validate();
        AcceleratorConfig previous = currentConfig.getAndSet(config);
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(previous, config);
            } catch (RuntimeException e) {
                log.error("Config listener failed: listener={}", listener, e);
            }
        }
        return config;
    }

    private AcceleratorConfig readFile() {
        try {
            long modified = Files.getLastModifiedTime(configPath).toMillis();
            AcceleratorConfig config;
            try (InputStream in = Files.newInputStream(configPath)) {
                config = parse(in, configPath.toString());
            }
            loadedModifiedTime = modified;
            log.info("Configuration read from file: path={}", configPath);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file: " + configPath, e);
        }
    }

    private AcceleratorConfig readClasspath() {
        String resource = configPath.toString().replace('\\', '/');
        if (resource.startsWith("/")) {
            resource = resource.substring(1);
        }
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Configuration file not found: " + configPath);
            }
            log.info("Configuration read from classpath: resource={}", resource);
            return parse(in, resource);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration resource: " + resource, e);
        }
    }

    private AcceleratorConfig parse(InputStream in, String source) {
        try {
            AcceleratorConfig config = yaml.load(in);
            // an empty document means all defaults
            return config != null ? config : new AcceleratorConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    public AcceleratorConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Reloads the configuration. An unreadable or invalid file keeps the current configuration.
     */
    public AcceleratorConfig reload() {
        try {
            return load();
        } catch (RuntimeException e) {
            log.error("Configuration reload rejected, keeping current: error={}", e.getMessage());
            return currentConfig.get();
        }
    }

    public void startWatching() {
        startWatching(DEFAULT_POLL_INTERVAL);
    }

    /**
     * Reloads whenever the file's modification time differs from the one last loaded.
     */
    public synchronized void startWatching(Duration pollInterval) {
        if (watcher != null) {
            return;
        }
        if (!Files.isRegularFile(configPath)) {
            log.warn("Configuration is not a file, hot reload disabled: path={}", configPath);
            return;
        }
        long intervalMs = Math.max(1, pollInterval.toMillis());
        watcher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "accelerator-config-watcher");
            t.setDaemon(true);
            return t;
        });
        watcher.scheduleWithFixedDelay(this::reloadIfModified, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Configuration hot reload enabled: path={}, pollMs={}", configPath, intervalMs);
    }

    private void reloadIfModified() {
        long modified;
        try {
            modified = Files.getLastModifiedTime(configPath).toMillis();
        } catch (IOException e) {
            log.warn("Cannot stat configuration file: path={}, error={}", configPath, e.getMessage());
            return;
        }
        if (modified == loadedModifiedTime) {
            return;
        }
        log.info("Configuration file modified, reloading: path={}", configPath);
        // a rejected file is not retried until it changes again
        loadedModifiedTime = modified;
        reload();
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener is required"));
    }

    @Override
    public synchronized void close() {
        if (watcher == null) {
            return;
        }
        watcher.shutdownNow();
        try {
            if (!watcher.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Configuration watcher did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        watcher = null;
    }

    /**
     * Creates a default, validated configuration.
     */
    public static AcceleratorConfig createDefault() {
        return new AcceleratorConfig().validate();
    }
}
