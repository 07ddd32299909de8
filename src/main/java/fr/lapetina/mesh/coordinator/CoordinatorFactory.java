package fr.lapetina.mesh.coordinator;

import fr.lapetina.mesh.coordinator.domain.merge.MergeFunctionTable;
import fr.lapetina.mesh.coordinator.domain.model.Node;
import fr.lapetina.mesh.coordinator.domain.model.NodeMetrics;
import fr.lapetina.mesh.coordinator.domain.model.NodeRole;
import fr.lapetina.mesh.coordinator.domain.model.NodeStatus;
import fr.lapetina.mesh.coordinator.infrastructure.config.ConfigLoader;
import fr.lapetina.mesh.coordinator.infrastructure.config.CoordinatorConfig;
import fr.lapetina.mesh.coordinator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mesh.coordinator.infrastructure.registry.CentralRegistrar;
import fr.lapetina.mesh.coordinator.infrastructure.registry.HealthMonitor;
import fr.lapetina.mesh.coordinator.infrastructure.registry.WorkerRegistry;
import fr.lapetina.mesh.coordinator.infrastructure.store.CanonicalStore;
import fr.lapetina.mesh.coordinator.infrastructure.store.FileCanonicalStore;
import fr.lapetina.mesh.coordinator.infrastructure.store.FileOfflineLogStore;
import fr.lapetina.mesh.coordinator.infrastructure.store.InMemoryCanonicalStore;
import fr.lapetina.mesh.coordinator.infrastructure.store.OfflineLogStore;
import fr.lapetina.mesh.coordinator.infrastructure.transport.HttpTransport;
import fr.lapetina.mesh.coordinator.infrastructure.transport.Transport;
import fr.lapetina.mesh.coordinator.offline.DrainStatus;
import fr.lapetina.mesh.coordinator.offline.OfflineQueueManager;
import fr.lapetina.mesh.coordinator.routing.ConnectionRouter;
import fr.lapetina.mesh.coordinator.scheduler.TaskDistributor;
import fr.lapetina.mesh.coordinator.sync.SyncEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Creates and wires every coordinator component from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (CoordinatorFactory factory = CoordinatorFactory.create("config.yaml").start()) {
 *     String taskId = factory.getTaskDistributor().submit(submission);
 *     // ...
 * }
 * }</pre>
 */
public class CoordinatorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorFactory.class);

    private final ConfigLoader configLoader;
    private final CoordinatorConfig config;
    private final Clock clock;
    private final MetricsRegistry metricsRegistry;
    private final WorkerRegistry registry;
    private final Transport transport;
    private final HealthMonitor healthMonitor;
    private final CentralRegistrar centralRegistrar;
    private final TaskDistributor taskDistributor;
    private final ConnectionRouter router;
    private final MergeFunctionTable mergeTable;
    private final CanonicalStore canonicalStore;
    private final SyncEngine syncEngine;
    private final OfflineLogStore offlineLogStore;
    private final OfflineQueueManager offlineQueue;

    protected CoordinatorFactory(String configPath, Transport transportOverride, Clock clock) {
        log.info("Initializing CoordinatorFactory from config: {}", configPath);

        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();
        this.clock = clock;

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        CoordinatorConfig.HealthConfig health = config.getHealth();
        this.registry = new WorkerRegistry(
                clock,
                health.getMissThresholdDegraded(),
                health.getMissThresholdOffline(),
                health.getHealthyThreshold()
        );
        registerSeedNodes(config);

        // Tests inject a stub transport
        this.transport = transportOverride != null ? transportOverride : createTransport();

        this.healthMonitor = new HealthMonitor(
                registry,
                transport,
                Duration.ofMillis(health.getProbeIntervalMs()),
                Duration.ofMillis(health.getProbeTimeoutMs()),
                Duration.ofMillis(health.getNodeTtlMs()),
                Duration.ofMillis(health.getHeartbeatTimeoutMs()),
                Duration.ofMillis(health.getEventRetentionMs()),
                Duration.ofMillis(health.getMetricRetentionMs())
        );

        this.centralRegistrar = createCentralRegistrar(config.getIdentity());

        this.taskDistributor = TaskDistributor.builder()
                .fromConfig(config)
                .registry(registry)
                .transport(transport)
                .metricsRegistry(metricsRegistry)
                .clock(clock)
                .build();

        this.router = ConnectionRouter.builder()
                .fromConfig(config)
                .registry(registry)
                .transport(transport)
                .metricsRegistry(metricsRegistry)
                .clock(clock)
                .build();

        this.mergeTable = new MergeFunctionTable(config.getSync().getFieldTypes());
        this.canonicalStore = createCanonicalStore(config.getSync().getStorePath());
        this.syncEngine = SyncEngine.builder()
                .fromConfig(config)
                .store(canonicalStore)
                .mergeTable(mergeTable)
                .metricsRegistry(metricsRegistry)
                .clock(clock)
                .build();

        this.offlineLogStore = new FileOfflineLogStore(Path.of(config.getOffline().getLogPath()), clock);
        this.offlineQueue = OfflineQueueManager.builder()
                .fromConfig(config)
                .logStore(offlineLogStore)
                .syncEngine(syncEngine)
                .registry(registry)
                .catchUpHandler(taskDistributor::submitCatchUp)
                .metricsRegistry(metricsRegistry)
                .clock(clock)
                .build();

        configLoader.addListener(router);
        configLoader.addListener(this::onConfigChanged);

        log.info("CoordinatorFactory initialized: nodeId={}, nodes={}, routes={}",
                config.getIdentity().getNodeId(), registry.size(), router.getRoutes().size());
    }

    public static CoordinatorFactory create(String configPath) {
        return new CoordinatorFactory(configPath, null, Clock.systemUTC());
    }

    public static CoordinatorFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the background loops: assignment, health probing, offline
     * recovery and drain, configuration watching.
     */
    public CoordinatorFactory start() {
        taskDistributor.start();
        healthMonitor.start();
        if (centralRegistrar != null) {
            centralRegistrar.start();
        }
        offlineQueue.start();
        configLoader.startWatching();
        log.info("Coordinator started");
        return this;
    }

    /**
     * Overall status with per-node health, queue depths and sync state.
     */
    public Map<String, Object> healthSnapshot() {
        List<Node> nodes = registry.getAllNodes();
        metricsRegistry.setOnlineNodes(registry.getNodesByStatus(NodeStatus.ONLINE).size());

        List<Map<String, Object>> nodeViews = new ArrayList<>();
        for (Node node : nodes) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("id", node.getId());
            view.put("role", node.getRole().name());
            view.put("status", node.getStatus().name());
            view.put("activeTasks", node.getActiveTasks());
            view.put("maxConcurrency", node.getMaxConcurrency());
            view.put("consecutiveMisses", node.getConsecutiveMisses());
            view.put("lastHeartbeat", node.getLastHeartbeat());
            view.put("health", registry.health(node.getId()));
            nodeViews.add(view);
        }

        DrainStatus drain = offlineQueue.drainStatus();
        Map<String, Object> scheduler = new LinkedHashMap<>();
        scheduler.put("queued", taskDistributor.queueSize());
        scheduler.put("ringBufferRemaining", taskDistributor.getRemainingDispatchCapacity());
        scheduler.put("deadLetters", taskDistributor.deadLetters().size());

        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("status", overallStatus(nodes, drain));
        snapshot.put("nodeId", config.getIdentity().getNodeId());
        snapshot.put("timestamp", clock.instant());
        snapshot.put("nodes", nodeViews);
        snapshot.put("scheduler", scheduler);
        snapshot.put("offline", drain);
        snapshot.put("circuitBreakers", router.getBreakerSnapshots());
        return snapshot;
    }

    private String overallStatus(List<Node> nodes, DrainStatus drain) {
        long online = nodes.stream().filter(n -> n.getStatus() == NodeStatus.ONLINE).count();
        if (online == 0) {
            return "DOWN";
        }
        if (drain.halted() || online < nodes.size()) {
            return "DEGRADED";
        }
        return "UP";
    }

    public CoordinatorConfig getConfig() {
        return configLoader.getCurrentConfig() != null ? configLoader.getCurrentConfig() : config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public WorkerRegistry getRegistry() {
        return registry;
    }

    public HealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    /**
     * Present when {@code identity.centralUrl} is configured.
     */
    public Optional<CentralRegistrar> getCentralRegistrar() {
        return Optional.ofNullable(centralRegistrar);
    }

    public Transport getTransport() {
        return transport;
    }

    public TaskDistributor getTaskDistributor() {
        return taskDistributor;
    }

    public ConnectionRouter getRouter() {
        return router;
    }

    public MergeFunctionTable getMergeTable() {
        return mergeTable;
    }

    public CanonicalStore getCanonicalStore() {
        return canonicalStore;
    }

    public SyncEngine getSyncEngine() {
        return syncEngine;
    }

    public OfflineQueueManager getOfflineQueue() {
        return offlineQueue;
    }

    private Transport createTransport() {
        return new HttpTransport(
                config.getIdentity().getNodeId(),
                config.getIdentity().getAuthToken(),
                Duration.ofMillis(config.getHealth().getProbeTimeoutMs())
        );
    }

    private CentralRegistrar createCentralRegistrar(CoordinatorConfig.IdentityConfig identity) {
        if (identity.getCentralUrl() == null || identity.getCentralUrl().isBlank()) {
            return null;
        }
        CentralRegistrar.Registration registration = new CentralRegistrar.Registration(
                identity.getNodeId(),
                identity.getAdvertisedUrl(),
                NodeRole.valueOf(identity.getRole().trim().toUpperCase(Locale.ROOT)),
                identity.getCapabilities() != null ? Set.copyOf(identity.getCapabilities()) : Set.of(),
                identity.getMaxConcurrency(),
                1
        );
        return new CentralRegistrar(
                transport,
                identity.getCentralUrl(),
                registration,
                this::localMetrics,
                Duration.ofMillis(identity.getCentralHeartbeatIntervalMs()),
                Duration.ofMillis(config.getHealth().getProbeTimeoutMs())
        );
    }

    /**
     * Load of this process as reported to the central registry. Active tasks
     * are the tasks this coordinator has in flight on its nodes.
     */
    private NodeMetrics localMetrics() {
        Runtime runtime = Runtime.getRuntime();
        double memoryPercent = 100.0 * (runtime.totalMemory() - runtime.freeMemory()) / runtime.maxMemory();
        double loadAverage = ManagementFactory.getOperatingSystemMXBean().getSystemLoadAverage();
        // Negative when the platform does not report it
        double cpuPercent = loadAverage < 0 ? 0.0 : Math.min(100.0, 100.0 * loadAverage / runtime.availableProcessors());
        int activeTasks = registry.getAllNodes().stream().mapToInt(Node::getActiveTasks).sum();
        return new NodeMetrics(cpuPercent, memoryPercent, activeTasks);
    }

    private static CanonicalStore createCanonicalStore(String storePath) {
        if (storePath == null || storePath.isBlank()) {
            log.warn("No sync.storePath configured, canonical state is kept in memory only");
            return new InMemoryCanonicalStore();
        }
        return new FileCanonicalStore(Path.of(storePath));
    }

    private void registerSeedNodes(CoordinatorConfig source) {
        for (CoordinatorConfig.NodeConfig nodeConfig : source.getNodes()) {
            if (registry.getNode(nodeConfig.getId()).isPresent()) {
                continue;
            }
            Node node = Node.builder()
                    .id(nodeConfig.getId())
                    .address(nodeConfig.getUrl())
                    .role(NodeRole.valueOf(nodeConfig.getRole().trim().toUpperCase(Locale.ROOT)))
                    .capabilities(nodeConfig.getCapabilities())
                    .maxConcurrency(nodeConfig.getMaxConcurrency())
                    .cost(nodeConfig.getCost())
                    .registeredAt(clock.instant())
                    .build();
            registerNode(node);
        }
    }

    /**
     * Registers a node added at runtime and exposes its gauges.
     */
    public Node registerNode(Node node) {
        registry.register(node);
        metricsRegistry.registerNode(node.getId(), node::getActiveTasks, () -> switch (node.getStatus()) {
            case ONLINE -> 2;
            case DEGRADED -> 1;
            case OFFLINE -> 0;
        });
        return node;
    }

    private void onConfigChanged(CoordinatorConfig oldConfig, CoordinatorConfig newConfig) {
        if (oldConfig == null) {
            return;
        }
        log.info("Configuration changed, applying updates...");
        mergeTable.replaceTypes(newConfig.getSync().getFieldTypes());
        registry.setHealthyThreshold(newConfig.getHealth().getHealthyThreshold());
        registerSeedNodes(newConfig);
        log.info("Configuration updates applied: routes={}, fieldTypes={}",
                router.getRoutes().size(), newConfig.getSync().getFieldTypes().size());
    }

    @Override
    public void close() {
        log.info("Shutting down CoordinatorFactory...");

        if (centralRegistrar != null) {
            try {
                centralRegistrar.close();
            } catch (Exception e) {
                log.warn("Error closing central registrar", e);
            }
        }

        try {
            offlineQueue.close();
        } catch (Exception e) {
            log.warn("Error closing offline queue", e);
        }

        try {
            canonicalStore.close();
        } catch (Exception e) {
            log.warn("Error closing canonical store", e);
        }

        try {
            healthMonitor.close();
        } catch (Exception e) {
            log.warn("Error closing health monitor", e);
        }

        try {
            taskDistributor.close();
        } catch (Exception e) {
            log.warn("Error closing task distributor", e);
        }

        try {
            transport.close();
        } catch (Exception e) {
            log.warn("Error closing transport", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("CoordinatorFactory shut down");
    }
}
