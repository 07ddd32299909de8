package fr.lapetina.mesh.coordinator.infrastructure.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Root configuration object for the coordinator.
 * Designed to be populated from YAML.
 */
public class CoordinatorConfig {

    private ServerConfig server = new ServerConfig();
    private IdentityConfig identity = new IdentityConfig();
    private List<NodeConfig> nodes = new ArrayList<>();
    private List<RouteConfig> routes = new ArrayList<>();
    private RouterConfig router = new RouterConfig();
    private HealthConfig health = new HealthConfig();
    private SchedulerConfig scheduler = new SchedulerConfig();
    private RetryConfig retry = new RetryConfig();
    private OfflineConfig offline = new OfflineConfig();
    private SyncConfig sync = new SyncConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public IdentityConfig getIdentity() { return identity; }
    public void setIdentity(IdentityConfig identity) { this.identity = identity; }

    public List<NodeConfig> getNodes() { return nodes; }
    public void setNodes(List<NodeConfig> nodes) { this.nodes = nodes; }

    public List<RouteConfig> getRoutes() { return routes; }
    public void setRoutes(List<RouteConfig> routes) { this.routes = routes; }

    public RouterConfig getRouter() { return router; }
    public void setRouter(RouterConfig router) { this.router = router; }

    public HealthConfig getHealth() { return health; }
    public void setHealth(HealthConfig health) { this.health = health; }

    public SchedulerConfig getScheduler() { return scheduler; }
    public void setScheduler(SchedulerConfig scheduler) { this.scheduler = scheduler; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public OfflineConfig getOffline() { return offline; }
    public void setOffline(OfflineConfig offline) { this.offline = offline; }

    public SyncConfig getSync() { return sync; }
    public void setSync(SyncConfig sync) { this.sync = sync; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int workerThreads = 16;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    /**
     * Identity of the local node. The auth token is sent with every transport call.
     * With a central URL set, the node registers itself there under its
     * advertised URL and keeps sending heartbeats.
     */
    public static class IdentityConfig {
        private String nodeId = "coordinator";
        private String role = "CLOUD";
        private String authToken;
        private String centralUrl;
        private String advertisedUrl;
        private List<String> capabilities = new ArrayList<>();
        private int maxConcurrency = 4;
        private long centralHeartbeatIntervalMs = 60000;

        public String getNodeId() { return nodeId; }
        public void setNodeId(String nodeId) { this.nodeId = nodeId; }

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }

        public String getAuthToken() { return authToken; }
        public void setAuthToken(String authToken) { this.authToken = authToken; }

        public String getCentralUrl() { return centralUrl; }
        public void setCentralUrl(String centralUrl) { this.centralUrl = centralUrl; }

        public String getAdvertisedUrl() { return advertisedUrl; }
        public void setAdvertisedUrl(String advertisedUrl) { this.advertisedUrl = advertisedUrl; }

        public List<String> getCapabilities() { return capabilities; }
        public void setCapabilities(List<String> capabilities) { this.capabilities = capabilities; }

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

        public long getCentralHeartbeatIntervalMs() { return centralHeartbeatIntervalMs; }
        public void setCentralHeartbeatIntervalMs(long ms) { this.centralHeartbeatIntervalMs = ms; }
    }

    /**
     * Seed node configuration.
     */
    public static class NodeConfig {
        private String id;
        private String url;
        private String role = "EDGE";
        private Set<String> capabilities = new HashSet<>();
        private int maxConcurrency = 4;
        private int cost = 1;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }

        public Set<String> getCapabilities() { return capabilities; }
        public void setCapabilities(Set<String> capabilities) { this.capabilities = capabilities; }

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

        public int getCost() { return cost; }
        public void setCost(int cost) { this.cost = cost; }
    }

    /**
     * Route template for one service.
     */
    public static class RouteConfig {
        private String service;
        private String policy = "local-first";
        private List<CandidateConfig> candidates = new ArrayList<>();

        public String getService() { return service; }
        public void setService(String service) { this.service = service; }

        public String getPolicy() { return policy; }
        public void setPolicy(String policy) { this.policy = policy; }

        public List<CandidateConfig> getCandidates() { return candidates; }
        public void setCandidates(List<CandidateConfig> candidates) { this.candidates = candidates; }
    }

    public static class CandidateConfig {
        private String nodeId;
        private String tier = "CLOUD";
        private int cost = 1;

        public String getNodeId() { return nodeId; }
        public void setNodeId(String nodeId) { this.nodeId = nodeId; }

        public String getTier() { return tier; }
        public void setTier(String tier) { this.tier = tier; }

        public int getCost() { return cost; }
        public void setCost(int cost) { this.cost = cost; }
    }

    /**
     * Failover window for routed calls. Each attempt gets at most
     * attemptTimeoutMs, all attempts together at most requestWindowMs.
     */
    public static class RouterConfig {
        private long requestWindowMs = 10000;
        private long attemptTimeoutMs = 3000;

        public long getRequestWindowMs() { return requestWindowMs; }
        public void setRequestWindowMs(long requestWindowMs) { this.requestWindowMs = requestWindowMs; }

        public long getAttemptTimeoutMs() { return attemptTimeoutMs; }
        public void setAttemptTimeoutMs(long attemptTimeoutMs) { this.attemptTimeoutMs = attemptTimeoutMs; }
    }

    /**
     * Health monitoring and circuit breaker configuration.
     */
    public static class HealthConfig {
        private long probeIntervalMs = 10000;
        private long probeTimeoutMs = 3000;
        private int missThresholdDegraded = 3;
        private int missThresholdOffline = 5;
        private long nodeTtlMs = 600000;
        private double healthyThreshold = 0.8;
        private int circuitBreakerFailureThreshold = 5;
        private long circuitBreakerRecoveryMs = 30000;
        private int circuitBreakerHalfOpenSuccesses = 2;
        private long eventRetentionMs = 86400000;
        private long heartbeatTimeoutMs = 300000;
        private long metricRetentionMs = 604800000;

        public long getProbeIntervalMs() { return probeIntervalMs; }
        public void setProbeIntervalMs(long probeIntervalMs) { this.probeIntervalMs = probeIntervalMs; }

        public long getProbeTimeoutMs() { return probeTimeoutMs; }
        public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }

        public int getMissThresholdDegraded() { return missThresholdDegraded; }
        public void setMissThresholdDegraded(int missThresholdDegraded) { this.missThresholdDegraded = missThresholdDegraded; }

        public int getMissThresholdOffline() { return missThresholdOffline; }
        public void setMissThresholdOffline(int missThresholdOffline) { this.missThresholdOffline = missThresholdOffline; }

        public long getNodeTtlMs() { return nodeTtlMs; }
        public void setNodeTtlMs(long nodeTtlMs) { this.nodeTtlMs = nodeTtlMs; }

        public double getHealthyThreshold() { return healthyThreshold; }
        public void setHealthyThreshold(double healthyThreshold) { this.healthyThreshold = healthyThreshold; }

        public int getCircuitBreakerFailureThreshold() { return circuitBreakerFailureThreshold; }
        public void setCircuitBreakerFailureThreshold(int threshold) { this.circuitBreakerFailureThreshold = threshold; }

        public long getCircuitBreakerRecoveryMs() { return circuitBreakerRecoveryMs; }
        public void setCircuitBreakerRecoveryMs(long ms) { this.circuitBreakerRecoveryMs = ms; }

        public int getCircuitBreakerHalfOpenSuccesses() { return circuitBreakerHalfOpenSuccesses; }
        public void setCircuitBreakerHalfOpenSuccesses(int successes) { this.circuitBreakerHalfOpenSuccesses = successes; }

        public long getEventRetentionMs() { return eventRetentionMs; }
        public void setEventRetentionMs(long eventRetentionMs) { this.eventRetentionMs = eventRetentionMs; }

        public long getHeartbeatTimeoutMs() { return heartbeatTimeoutMs; }
        public void setHeartbeatTimeoutMs(long heartbeatTimeoutMs) { this.heartbeatTimeoutMs = heartbeatTimeoutMs; }

        public long getMetricRetentionMs() { return metricRetentionMs; }
        public void setMetricRetentionMs(long metricRetentionMs) { this.metricRetentionMs = metricRetentionMs; }
    }

    /**
     * Task queue, assign loop and LMAX Disruptor configuration.
     */
    public static class SchedulerConfig {
        private int queueCapacity = 10000;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private long assignIntervalMs = 50;
        private long dispatchTimeoutMs = 30000;
        private long maxWaitMs = 60000;
        private int escalationStep = 1;
        private String catchUpCapability = "sync";

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public long getAssignIntervalMs() { return assignIntervalMs; }
        public void setAssignIntervalMs(long assignIntervalMs) { this.assignIntervalMs = assignIntervalMs; }

        public long getDispatchTimeoutMs() { return dispatchTimeoutMs; }
        public void setDispatchTimeoutMs(long dispatchTimeoutMs) { this.dispatchTimeoutMs = dispatchTimeoutMs; }

        public long getMaxWaitMs() { return maxWaitMs; }
        public void setMaxWaitMs(long maxWaitMs) { this.maxWaitMs = maxWaitMs; }

        public int getEscalationStep() { return escalationStep; }
        public void setEscalationStep(int escalationStep) { this.escalationStep = escalationStep; }

        public String getCatchUpCapability() { return catchUpCapability; }
        public void setCatchUpCapability(String catchUpCapability) { this.catchUpCapability = catchUpCapability; }
    }

    /**
     * Retry configuration.
     */
    public static class RetryConfig {
        private int maxRetries = 3;
        private long initialBackoffMs = 100;
        private long maxBackoffMs = 5000;
        private double backoffMultiplier = 2.0;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    }

    /**
     * Offline log and drain configuration.
     */
    public static class OfflineConfig {
        private String logPath = "data/offline-log.jsonl";
        private int maxPendingOperations = 10000;
        private Set<String> authoritativeNodes = new HashSet<>();
        private long syncIntervalMs = 30000;
        private long replayTimeoutMs = 5000;
        private int drainQueueCapacity = 64;

        public String getLogPath() { return logPath; }
        public void setLogPath(String logPath) { this.logPath = logPath; }

        public int getMaxPendingOperations() { return maxPendingOperations; }
        public void setMaxPendingOperations(int maxPendingOperations) { this.maxPendingOperations = maxPendingOperations; }

        public Set<String> getAuthoritativeNodes() { return authoritativeNodes; }
        public void setAuthoritativeNodes(Set<String> authoritativeNodes) { this.authoritativeNodes = authoritativeNodes; }

        public long getSyncIntervalMs() { return syncIntervalMs; }
        public void setSyncIntervalMs(long syncIntervalMs) { this.syncIntervalMs = syncIntervalMs; }

        public long getReplayTimeoutMs() { return replayTimeoutMs; }
        public void setReplayTimeoutMs(long replayTimeoutMs) { this.replayTimeoutMs = replayTimeoutMs; }

        public int getDrainQueueCapacity() { return drainQueueCapacity; }
        public void setDrainQueueCapacity(int drainQueueCapacity) { this.drainQueueCapacity = drainQueueCapacity; }
    }

    /**
     * Conflict resolution configuration.
     * Field types are keyed by {@code entityType.field} or bare {@code field}.
     */
    public static class SyncConfig {
        private Map<String, String> fieldTypes = new HashMap<>();
        private String resolverNodeId;
        private String storePath;

        public Map<String, String> getFieldTypes() { return fieldTypes; }
        public void setFieldTypes(Map<String, String> fieldTypes) { this.fieldTypes = fieldTypes; }

        public String getResolverNodeId() { return resolverNodeId; }
        public void setResolverNodeId(String resolverNodeId) { this.resolverNodeId = resolverNodeId; }

        public String getStorePath() { return storePath; }
        public void setStorePath(String storePath) { this.storePath = storePath; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "mesh";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
