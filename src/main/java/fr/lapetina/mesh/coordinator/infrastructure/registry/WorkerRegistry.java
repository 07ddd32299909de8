package fr.lapetina.mesh.coordinator.infrastructure.registry;

import fr.lapetina.mesh.coordinator.domain.model.HealthRecord;
import fr.lapetina.mesh.coordinator.domain.model.Node;
import fr.lapetina.mesh.coordinator.domain.model.NodeEvent;
import fr.lapetina.mesh.coordinator.domain.model.NodeMetricSample;
import fr.lapetina.mesh.coordinator.domain.model.NodeMetrics;
import fr.lapetina.mesh.coordinator.domain.model.NodeStatus;
import fr.lapetina.mesh.coordinator.domain.routing.HealthView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Registry of execution nodes and their health.
 *
 * Thread-safe. There is no registry-wide lock: the node map is concurrent and
 * every status transition runs under the lock of the node it affects.
 * Listeners are notified after the node lock has been released.
 */
public final class WorkerRegistry implements HealthView {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    /** Per node; the oldest samples are dropped beyond it. */
    static final int MAX_METRIC_SAMPLES = 1_000;

    private final Map<String, Node> nodes = new ConcurrentHashMap<>();
    private final Map<String, HealthRecord> healthRecords = new ConcurrentHashMap<>();
    private final Map<String, Deque<NodeEvent>> events = new ConcurrentHashMap<>();
    private final Map<String, Deque<NodeMetricSample>> metricHistory = new ConcurrentHashMap<>();
    private final List<Consumer<RegistryEvent>> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;
    private final int missThresholdDegraded;
    private final int missThresholdOffline;
    private volatile double healthyThreshold;

    public WorkerRegistry(Clock clock, int missThresholdDegraded, int missThresholdOffline, double healthyThreshold) {
        if (missThresholdOffline <= missThresholdDegraded) {
            throw new IllegalArgumentException("Offline threshold must be greater than degraded threshold");
        }
        this.clock = clock;
        this.missThresholdDegraded = missThresholdDegraded;
        this.missThresholdOffline = missThresholdOffline;
        this.healthyThreshold = healthyThreshold;
    }

    public WorkerRegistry() {
        this(Clock.systemUTC(), 3, 5, 0.8);
    }

    /**
     * Registers a new node with status ONLINE.
     *
     * @throws DuplicateNodeException if the id is already registered
     */
    public Node register(Node node) {
        Node previous = nodes.putIfAbsent(node.getId(), node);
        if (previous != null) {
            throw new DuplicateNodeException(node.getId());
        }
        healthRecords.put(node.getId(), HealthRecord.initial(node.getId()));
        log.info("Node registered: nodeId={}, role={}, address={}, capabilities={}, maxConcurrency={}",
                node.getId(), node.getRole(), node.getAddress(), node.getCapabilities(), node.getMaxConcurrency());
        recordEvent(node.getId(), NodeEvent.Type.REGISTERED, "Registered as " + node.getRole());
        notifyListeners(new RegistryEvent(NodeEvent.Type.REGISTERED, node, null, NodeStatus.ONLINE));
        return node;
    }

    /**
     * Removes a node by ID.
     */
    public Optional<Node> deregister(String nodeId) {
        return remove(nodeId, NodeEvent.Type.DEREGISTERED, "Deregistered");
    }

    private Optional<Node> remove(String nodeId, NodeEvent.Type type, String message) {
        Node removed = nodes.remove(nodeId);
        if (removed == null) {
            return Optional.empty();
        }
        healthRecords.remove(nodeId);
        metricHistory.remove(nodeId);
        log.info("Node removed: nodeId={}, reason={}", nodeId, type);
        recordEvent(nodeId, type, message);
        notifyListeners(new RegistryEvent(type, removed, removed.getStatus(), null));
        return Optional.of(removed);
    }

    /**
     * Records a heartbeat: resets the miss counter, stores the reported
     * metrics in the node and its metric history, and restores ONLINE.
     */
    public Node heartbeat(String nodeId, NodeMetrics metrics) {
        Node node = require(nodeId);
        Instant now = clock.instant();
        publish(node, node.recordSuccess(metrics, now));
        if (metrics != null) {
            Deque<NodeMetricSample> history = metricHistory.computeIfAbsent(nodeId, id -> new ConcurrentLinkedDeque<>());
            history.addLast(new NodeMetricSample(nodeId, metrics, now));
            while (history.size() > MAX_METRIC_SAMPLES) {
                history.pollFirst();
            }
        }
        return node;
    }

    /**
     * Records a missed heartbeat or failed probe.
     */
    public Node recordMiss(String nodeId) {
        Node node = require(nodeId);
        Node.StatusChange change = node.recordMiss(missThresholdDegraded, missThresholdOffline, clock.instant());
        if (change == null) {
            log.debug("Miss recorded: nodeId={}, consecutiveMisses={}, status={}",
                    nodeId, node.getConsecutiveMisses(), node.getStatus());
        }
        publish(node, change);
        return node;
    }

    /**
     * Successful probe: updates the health record and counts as a heartbeat.
     */
    public void recordProbeSuccess(String nodeId, long latencyMs, NodeMetrics metrics) {
        Instant now = clock.instant();
        healthRecords.computeIfPresent(nodeId, (id, record) -> record.withSuccess(latencyMs, now));
        heartbeat(nodeId, metrics);
    }

    /**
     * Failed or timed out probe: updates the health record and counts a miss.
     */
    public void recordProbeFailure(String nodeId) {
        Instant now = clock.instant();
        healthRecords.computeIfPresent(nodeId, (id, record) -> record.withFailure(now));
        recordMiss(nodeId);
    }

    /**
     * Outcome of a routed call, folded into the node's health record.
     */
    public void recordCallOutcome(String nodeId, boolean success, long latencyMs) {
        Instant now = clock.instant();
        healthRecords.computeIfPresent(nodeId, (id, record) ->
                success ? record.withSuccess(latencyMs, now) : record.withFailure(now));
    }

    /**
     * Explicit disconnect signal. Moves the node straight to OFFLINE.
     */
    public Node hardDisconnect(String nodeId) {
        Node node = require(nodeId);
        Node.StatusChange change = node.hardDisconnect(clock.instant());
        if (change != null) {
            log.warn("Node hard-disconnected: nodeId={}, previousStatus={}", nodeId, change.from());
        }
        publish(node, change);
        return node;
    }

    /**
     * ONLINE -> DEGRADED after a failed routed call. No-op for other states.
     */
    public void markDegraded(String nodeId) {
        Node node = nodes.get(nodeId);
        if (node != null) {
            publish(node, node.markDegraded(clock.instant()));
        }
    }

    /**
     * Deregisters every node that has been OFFLINE for longer than the TTL.
     *
     * @return ids of expired nodes
     */
    public List<String> expireOffline(Duration ttl) {
        Instant cutoff = clock.instant().minus(ttl);
        List<String> expired = new ArrayList<>();
        for (Node node : nodes.values()) {
            Instant offlineSince = node.getOfflineSince();
            if (node.getStatus() == NodeStatus.OFFLINE && offlineSince != null && offlineSince.isBefore(cutoff)) {
                remove(node.getId(), NodeEvent.Type.EXPIRED, "Offline since " + offlineSince + ", TTL " + ttl)
                        .ifPresent(removed -> expired.add(removed.getId()));
            }
        }
        if (!expired.isEmpty()) {
            log.info("Expired offline nodes: count={}, nodeIds={}", expired.size(), expired);
        }
        return expired;
    }

    /**
     * Steps every node whose last heartbeat, or registration when it never
     * sent one, is older than the timeout one status down. A node silent for
     * two sweeps past the timeout is OFFLINE; DEGRADED is never skipped.
     *
     * @return ids of the nodes stepped down
     */
    public List<String> markStale(Duration heartbeatTimeout) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(heartbeatTimeout);
        List<String> stale = new ArrayList<>();
        for (Node node : nodes.values()) {
            Node.StatusChange change = node.expireHeartbeat(cutoff, now);
            if (change != null) {
                log.warn("Node heartbeat stale: nodeId={}, lastHeartbeat={}, timeout={}, status={}",
                        node.getId(), node.getLastHeartbeat(), heartbeatTimeout, change.to());
                publish(node, change);
                stale.add(node.getId());
            }
        }
        return stale;
    }

    /**
     * Drops node events older than the retention period.
     *
     * @return number of events removed
     */
    public int pruneEvents(Duration retention) {
        int removed = pruneOlderThan(events, NodeEvent::at, clock.instant().minus(retention));
        if (removed > 0) {
            log.debug("Pruned node events: removed={}", removed);
        }
        return removed;
    }

    /**
     * Drops reported metric samples older than the retention period.
     *
     * @return number of samples removed
     */
    public int pruneMetrics(Duration retention) {
        int removed = pruneOlderThan(metricHistory, NodeMetricSample::recordedAt, clock.instant().minus(retention));
        if (removed > 0) {
            log.info("Pruned node metric samples: removed={}, retention={}", removed, retention);
        }
        return removed;
    }

    private static <T> int pruneOlderThan(Map<String, Deque<T>> byNode, Function<T, Instant> at, Instant cutoff) {
        int removed = 0;
        for (Iterator<Map.Entry<String, Deque<T>>> it = byNode.entrySet().iterator(); it.hasNext(); ) {
            Deque<T> deque = it.next().getValue();
            while (true) {
                T oldest = deque.peekFirst();
                if (oldest == null || !at.apply(oldest).isBefore(cutoff)) {
                    break;
                }
                if (deque.pollFirst() != null) {
                    removed++;
                }
            }
            if (deque.isEmpty()) {
                it.remove();
            }
        }
        return removed;
    }

    /**
     * Metric samples the node reported, oldest first.
     */
    public List<NodeMetricSample> getMetricHistory(String nodeId) {
        Deque<NodeMetricSample> deque = metricHistory.get(nodeId);
        return deque == null ? List.of() : List.copyOf(deque);
    }

    public List<NodeEvent> getEvents(String nodeId) {
        Deque<NodeEvent> deque = events.get(nodeId);
        return deque == null ? List.of() : List.copyOf(deque);
    }

    public Optional<Node> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public List<Node> getAllNodes() {
        return new ArrayList<>(nodes.values());
    }

    public List<Node> getNodesByStatus(NodeStatus status) {
        return nodes.values().stream()
                .filter(node -> node.getStatus() == status)
                .toList();
    }

    /**
     * Nodes that may take a task with the given capabilities, least loaded
     * first, then fewest active tasks.
     */
    public List<Node> getEligibleNodes(Collection<String> requiredCapabilities) {
        return nodes.values().stream()
                .filter(node -> node.isEligible(requiredCapabilities))
                .sorted(Comparator.comparingDouble(Node::getLoadRatio)
                        .thenComparingInt(Node::getActiveTasks)
                        .thenComparing(Node::getId))
                .toList();
    }

    /**
     * True if any registered node, whatever its status or load, has the capabilities.
     */
    public boolean hasCapableNode(Collection<String> requiredCapabilities) {
        return nodes.values().stream().anyMatch(node -> node.hasCapabilities(requiredCapabilities));
    }

    public Map<String, HealthRecord> getHealthRecords() {
        return Map.copyOf(healthRecords);
    }

    public void setHealthyThreshold(double healthyThreshold) {
        this.healthyThreshold = healthyThreshold;
    }

    @Override
    public Optional<NodeStatus> status(String nodeId) {
        return getNode(nodeId).map(Node::getStatus);
    }

    @Override
    public HealthRecord health(String nodeId) {
        HealthRecord record = healthRecords.get(nodeId);
        return record != null ? record : HealthRecord.initial(nodeId);
    }

    @Override
    public boolean isHealthy(String nodeId) {
        Node node = nodes.get(nodeId);
        return node != null
                && node.getStatus() == NodeStatus.ONLINE
                && health(nodeId).successRate() >= healthyThreshold;
    }

    public Instant now() {
        return clock.instant();
    }

    public void addListener(Consumer<RegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RegistryEvent> listener) {
        listeners.remove(listener);
    }

    public int size() {
        return nodes.size();
    }

    private Node require(String nodeId) {
        Node node = nodes.get(nodeId);
        if (node == null) {
            throw new UnknownNodeException(nodeId);
        }
        return node;
    }

    private void publish(Node node, Node.StatusChange change) {
        if (change == null) {
            return;
        }
        NodeEvent.Type type = change.isReconnect() ? NodeEvent.Type.RECONNECTED : NodeEvent.Type.STATUS_CHANGED;
        log.info("Node status changed: nodeId={}, {} -> {}, consecutiveMisses={}",
                change.nodeId(), change.from(), change.to(), node.getConsecutiveMisses());
        recordEvent(node.getId(), type, change.from() + " -> " + change.to());
        notifyListeners(new RegistryEvent(type, node, change.from(), change.to()));
    }

    private void recordEvent(String nodeId, NodeEvent.Type type, String message) {
        events.computeIfAbsent(nodeId, id -> new ConcurrentLinkedDeque<>())
                .addLast(new NodeEvent(nodeId, type, message, clock.instant()));
    }

    private void notifyListeners(RegistryEvent event) {
        for (Consumer<RegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying registry listener: type={}, nodeId={}", event.type(), event.node().getId(), e);
            }
        }
    }

    /**
     * Event for registry changes. {@code from} is null on registration and
     * {@code to} is null on removal.
     */
    public record RegistryEvent(NodeEvent.Type type, Node node, NodeStatus from, NodeStatus to) {

        public boolean isReconnect() {
            return type == NodeEvent.Type.RECONNECTED;
        }

        public boolean wentOffline() {
            return to == NodeStatus.OFFLINE && from != NodeStatus.OFFLINE;
        }
    }
}
