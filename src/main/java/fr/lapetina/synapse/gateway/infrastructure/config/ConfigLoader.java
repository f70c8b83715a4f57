package fr.lapetina.synapse.gateway.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Configuration loader with hot-reload support.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Validation of backend and route references
 * - File watching for automatic reload
 * - Listener notification on changes
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String CONFIG_ENV = "SYNAPSE_GATEWAY_CONFIG";
    public static final String DEFAULT_CONFIG = "gateway.yaml";

    private final AtomicReference<GatewayConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(GatewayConfig.class, new LoaderOptions()));
    }

    /**
     * Picks the configuration location: first CLI argument, then the
     * {@value #CONFIG_ENV} environment variable, then {@value #DEFAULT_CONFIG}.
     */
    public static String resolveConfigPath(String[] args, Map<String, String> env) {
        if (args != null && args.length > 0 && args[0] != null && !args[0].isBlank()) {
            return args[0];
        }
        String fromEnv = env.get(CONFIG_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv;
        }
        return DEFAULT_CONFIG;
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public GatewayConfig load() {
        GatewayConfig config = validate(loadFromPath());
        GatewayConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private GatewayConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: resource={}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private GatewayConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: path={}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private GatewayConfig parse(InputStream is, String origin) {
        try {
            GatewayConfig config = yaml.load(is);
            return config != null ? config : new GatewayConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + origin + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public GatewayConfig loadFromStream(InputStream inputStream) {
        GatewayConfig config = validate(parse(inputStream, "stream"));
        GatewayConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    /**
     * Checks that backends are named with a url and that every route points to a known backend.
     */
    static GatewayConfig validate(GatewayConfig config) {
        Set<String> names = new HashSet<>();
        for (GatewayConfig.BackendConfig backend : config.getBackends()) {
            if (backend.getName() == null || backend.getName().isBlank()) {
                throw new ConfigurationException("Backend without a name");
            }
            if (backend.getUrl() == null || backend.getUrl().isBlank()) {
                throw new ConfigurationException("Backend '" + backend.getName() + "' has no url");
            }
            if (!names.add(backend.getName())) {
                throw new ConfigurationException("Duplicate backend name: " + backend.getName());
            }
        }
        for (GatewayConfig.RouteConfig route : config.getRoutes()) {
            if (route.getPrefix() == null || !route.getPrefix().startsWith("/")) {
                throw new ConfigurationException("Route prefix must start with '/': " + route.getPrefix());
            }
            if (!names.contains(route.getBackend())) {
                throw new ConfigurationException("Route " + route.getPrefix()
                        + " references unknown backend: " + route.getBackend());
            }
        }
        return config;
    }

    /**
     * Returns the current configuration.
     */
    public GatewayConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: path={}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent == null) {
                parent = Paths.get(".");
            }
            // Saves done by rename arrive as ENTRY_CREATE
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled: path={}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher: path={}", configPath, e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            boolean touched = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() != StandardWatchEventKinds.OVERFLOW
                        && configPath.getFileName().equals(event.context())) {
                    touched = true;
                }
            }
            key.reset();

            // One reload per batch of events; the timestamp filters out no-op touches
            if (touched && Files.exists(configPath)
                    && Files.getLastModifiedTime(configPath).toMillis() != lastModified) {
                log.info("Configuration file changed, reloading: path={}", configPath);
                reload();
            }
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload. A broken file keeps the current configuration.
     */
    public GatewayConfig reload() {
        try {
            return load();
        } catch (Exception e) {
            log.error("Failed to reload configuration, keeping current: error={}", e.getMessage());
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(GatewayConfig oldConfig, GatewayConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
