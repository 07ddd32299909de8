package fr.lapetina.mesh.coordinator.domain.model;

import java.net.URI;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Represents a participating node (cloud server, edge device or client).
 *
 * Thread-safe for concurrent access. Every status transition and every
 * capacity reservation runs under the node's own lock, so two transitions on
 * the same node never interleave while different nodes never contend.
 */
public final class Node {
    private final String id;
    private final NodeRole role;
    private final URI address;
    private final Set<String> capabilities;
    private final int maxConcurrency;
    private final int cost;

    // Mutable state - guarded by lock for transitions, atomics for cheap reads
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicReference<NodeStatus> status;
    private final AtomicInteger activeTasks;
    private final AtomicInteger consecutiveMisses;
    private volatile NodeMetrics metrics;
    private volatile Instant lastHeartbeat;
    private volatile Instant offlineSince;

    private Node(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Node ID is required");
        this.role = Objects.requireNonNull(builder.role, "Node role is required");
        this.address = Objects.requireNonNull(builder.address, "Address is required");
        Set<String> capabilitiesCopy = ConcurrentHashMap.newKeySet();
        capabilitiesCopy.addAll(builder.capabilities);
        this.capabilities = Collections.unmodifiableSet(capabilitiesCopy);
        if (builder.maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        this.maxConcurrency = builder.maxConcurrency;
        this.cost = builder.cost;
        this.status = new AtomicReference<>(NodeStatus.ONLINE);
        this.activeTasks = new AtomicInteger(0);
        this.consecutiveMisses = new AtomicInteger(0);
        this.metrics = NodeMetrics.empty();
        this.lastHeartbeat = builder.registeredAt;
    }

    public String getId() {
        return id;
    }

    public NodeRole getRole() {
        return role;
    }

    public URI getAddress() {
        return address;
    }

    public Set<String> getCapabilities() {
        return capabilities;
    }

    public boolean hasCapabilities(Collection<String> required) {
        return capabilities.containsAll(required);
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public int getCost() {
        return cost;
    }

    public NodeStatus getStatus() {
        return status.get();
    }

    public int getActiveTasks() {
        return activeTasks.get();
    }

    public int getConsecutiveMisses() {
        return consecutiveMisses.get();
    }

    public NodeMetrics getMetrics() {
        return metrics;
    }

    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }

    public Instant getOfflineSince() {
        return offlineSince;
    }

    /**
     * Load ratio used to prefer the least-loaded node.
     */
    public double getLoadRatio() {
        return (double) activeTasks.get() / maxConcurrency;
    }

    /**
     * Records a successful heartbeat or probe: resets the miss counter and
     * restores ONLINE from any status.
     *
     * @return the status transition, or null if the status did not change
     */
    public StatusChange recordSuccess(NodeMetrics reported, Instant now) {
        lock.lock();
        try {
            consecutiveMisses.set(0);
            lastHeartbeat = now;
            if (reported != null) {
                metrics = reported;
            }
            return transition(NodeStatus.ONLINE, now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a missed heartbeat or failed probe. At most one step is taken
     * per miss, so DEGRADED is never skipped.
     *
     * @return the status transition, or null if the status did not change
     */
    public StatusChange recordMiss(int degradedThreshold, int offlineThreshold, Instant now) {
        lock.lock();
        try {
            int misses = consecutiveMisses.incrementAndGet();
            NodeStatus current = status.get();
            if (current == NodeStatus.ONLINE && misses >= degradedThreshold) {
                return transition(NodeStatus.DEGRADED, now);
            }
            if (current == NodeStatus.DEGRADED && misses >= offlineThreshold) {
                return transition(NodeStatus.OFFLINE, now);
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves an ONLINE node to DEGRADED after a failed routed call.
     */
    public StatusChange markDegraded(Instant now) {
        lock.lock();
        try {
            if (status.get() != NodeStatus.ONLINE) {
                return null;
            }
            return transition(NodeStatus.DEGRADED, now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Steps the node one status down, ONLINE to DEGRADED or DEGRADED to
     * OFFLINE, when its last heartbeat is older than {@code cutoff}. A node
     * that never sent one is judged by its registration time.
     *
     * @return the status transition, or null if the node is fresh or already OFFLINE
     */
    public StatusChange expireHeartbeat(Instant cutoff, Instant now) {
        lock.lock();
        try {
            NodeStatus current = status.get();
            if (current == NodeStatus.OFFLINE || lastHeartbeat == null || !lastHeartbeat.isBefore(cutoff)) {
                return null;
            }
            return transition(current == NodeStatus.ONLINE ? NodeStatus.DEGRADED : NodeStatus.OFFLINE, now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Explicit hard-disconnect signal: the only path that may skip DEGRADED.
     */
    public StatusChange hardDisconnect(Instant now) {
        lock.lock();
        try {
            return transition(NodeStatus.OFFLINE, now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Attempts to reserve an execution slot. Re-validates status, capabilities
     * and capacity against the latest state before committing.
     *
     * @return true if slot reserved, false if the node is not eligible
     */
    public boolean tryReserve(Collection<String> requiredCapabilities) {
        lock.lock();
        try {
            if (status.get() != NodeStatus.ONLINE || !hasCapabilities(requiredCapabilities)) {
                return false;
            }
            int current = activeTasks.get();
            if (current >= maxConcurrency) {
                return false;
            }
            activeTasks.set(current + 1);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases a slot after task completion.
     */
    public void release() {
        activeTasks.updateAndGet(current -> Math.max(0, current - 1));
    }

    /**
     * Checks if the node may receive new work.
     */
    public boolean isEligible(Collection<String> requiredCapabilities) {
        return status.get() == NodeStatus.ONLINE
                && activeTasks.get() < maxConcurrency
                && hasCapabilities(requiredCapabilities);
    }

    private StatusChange transition(NodeStatus target, Instant now) {
        NodeStatus previous = status.getAndSet(target);
        if (previous == target) {
            return null;
        }
        if (target == NodeStatus.OFFLINE) {
            offlineSince = now;
        } else {
            offlineSince = null;
        }
        return new StatusChange(id, previous, target, now);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node that = (Node) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Node{" +
                "id='" + id + '\'' +
                ", role=" + role +
                ", address=" + address +
                ", status=" + status.get() +
                ", active=" + activeTasks.get() +
                "/" + maxConcurrency +
                '}';
    }

    /**
     * A single status transition produced by one of the mutators.
     */
    public record StatusChange(String nodeId, NodeStatus from, NodeStatus to, Instant at) {

        public boolean isReconnect() {
            return from == NodeStatus.OFFLINE && to == NodeStatus.ONLINE;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private NodeRole role = NodeRole.EDGE;
        private URI address;
        private final Set<String> capabilities = ConcurrentHashMap.newKeySet();
        private int maxConcurrency = 4;
        private int cost = 1;
        private Instant registeredAt = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder role(NodeRole role) {
            this.role = role;
            return this;
        }

        public Builder address(String url) {
            this.address = URI.create(url);
            return this;
        }

        public Builder address(URI url) {
            this.address = url;
            return this;
        }

        public Builder addCapability(String capability) {
            this.capabilities.add(capability);
            return this;
        }

        public Builder capabilities(Collection<String> capabilities) {
            this.capabilities.addAll(capabilities);
            return this;
        }

        public Builder maxConcurrency(int max) {
            this.maxConcurrency = max;
            return this;
        }

        public Builder cost(int cost) {
            this.cost = cost;
            return this;
        }

        public Builder registeredAt(Instant registeredAt) {
            this.registeredAt = registeredAt;
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }
}
