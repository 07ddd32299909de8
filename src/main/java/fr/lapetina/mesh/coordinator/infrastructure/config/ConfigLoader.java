package fr.lapetina.mesh.coordinator.infrastructure.config;

import fr.lapetina.mesh.coordinator.domain.model.NodeRole;
import fr.lapetina.mesh.coordinator.domain.model.RouteTier;
import fr.lapetina.mesh.coordinator.domain.model.RoutingPolicyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
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
 * - Loading from classpath or file system
 * - Validation of thresholds, identity and route templates
 * - File watching for automatic reload
 * - Listener notification on changes
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<CoordinatorConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(CoordinatorConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public CoordinatorConfig load() {
        CoordinatorConfig config = validate(loadFromPath());
        CoordinatorConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private CoordinatorConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return orDefault(yaml.load(is));
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private CoordinatorConfig loadFromFile(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            log.info("Loading configuration from file: {}", path);
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return orDefault(yaml.load(is));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public CoordinatorConfig loadFromStream(InputStream inputStream) {
        CoordinatorConfig config = validate(orDefault(yaml.load(inputStream)));
        CoordinatorConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private static CoordinatorConfig orDefault(CoordinatorConfig loaded) {
        return loaded != null ? loaded : createDefault();
    }

    /**
     * Rejects configurations the coordinator cannot run with.
     */
    public static CoordinatorConfig validate(CoordinatorConfig config) {
        CoordinatorConfig.HealthConfig health = config.getHealth();
        if (health.getMissThresholdDegraded() < 1) {
            throw new ConfigurationException("health.missThresholdDegraded must be at least 1");
        }
        if (health.getMissThresholdOffline() <= health.getMissThresholdDegraded()) {
            throw new ConfigurationException("health.missThresholdOffline must be greater than missThresholdDegraded: "
                    + health.getMissThresholdOffline() + " <= " + health.getMissThresholdDegraded());
        }
        if (config.getIdentity() == null || isBlank(config.getIdentity().getNodeId())) {
            throw new ConfigurationException("identity.nodeId is required");
        }
        if (health.getHeartbeatTimeoutMs() <= 0) {
            throw new ConfigurationException("health.heartbeatTimeoutMs must be positive");
        }
        CoordinatorConfig.IdentityConfig identity = config.getIdentity();
        if (!isBlank(identity.getCentralUrl()) && isBlank(identity.getAdvertisedUrl())) {
            throw new ConfigurationException("identity.advertisedUrl is required with identity.centralUrl");
        }
        Set<String> nodeIds = new HashSet<>();
        for (CoordinatorConfig.NodeConfig node : config.getNodes()) {
            if (isBlank(node.getId()) || isBlank(node.getUrl())) {
                throw new ConfigurationException("Every node needs an id and a url");
            }
            requireEnum(NodeRole.class, node.getRole(), "role of node " + node.getId());
            if (!nodeIds.add(node.getId())) {
                throw new ConfigurationException("Duplicate node id in configuration: " + node.getId());
            }
        }
        for (CoordinatorConfig.RouteConfig route : config.getRoutes()) {
            if (isBlank(route.getService())) {
                throw new ConfigurationException("Every route needs a service name");
            }
            try {
                RoutingPolicyType.fromTag(route.getPolicy());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown routing policy '" + route.getPolicy()
                        + "' for service " + route.getService(), e);
            }
            for (CoordinatorConfig.CandidateConfig candidate : route.getCandidates()) {
                if (isBlank(candidate.getNodeId())) {
                    throw new ConfigurationException("Route candidate without nodeId: service=" + route.getService());
                }
                requireEnum(RouteTier.class, candidate.getTier(), "tier of " + candidate.getNodeId());
            }
        }
        if (config.getScheduler().getQueueCapacity() < 1) {
            throw new ConfigurationException("scheduler.queueCapacity must be positive");
        }
        int ringSize = config.getScheduler().getRingBufferSize();
        if (ringSize < 1 || Integer.bitCount(ringSize) != 1) {
            throw new ConfigurationException("scheduler.ringBufferSize must be a power of 2: " + ringSize);
        }
        return config;
    }

    private static <E extends Enum<E>> void requireEnum(Class<E> type, String value, String what) {
        try {
            Enum.valueOf(type, value == null ? "" : value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid " + what + ": " + value, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Returns the current configuration.
     */
    public CoordinatorConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent == null) {
                parent = Paths.get(".");
            }
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed.equals(configPath.getFileName())) {
                    // Debounce on modification time
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Configuration file changed, reloading: path={}", configPath);
                        reload();
                    }
                }
            }

            key.reset();
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload. An invalid file keeps the current configuration.
     */
    public CoordinatorConfig reload() {
        try {
            return load();
        } catch (Exception e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(CoordinatorConfig oldConfig, CoordinatorConfig newConfig) {
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
     * Creates a default configuration.
     */
    public static CoordinatorConfig createDefault() {
        return new CoordinatorConfig();
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
