package fr.lapetina.mesh.coordinator.offline;

import fr.lapetina.mesh.coordinator.domain.model.ErrorType;
import fr.lapetina.mesh.coordinator.domain.model.NodeStatus;
import fr.lapetina.mesh.coordinator.domain.model.OfflineOperation;
import fr.lapetina.mesh.coordinator.domain.model.OfflineWrite;
import fr.lapetina.mesh.coordinator.domain.model.OperationState;
import fr.lapetina.mesh.coordinator.domain.model.PendingReview;
import fr.lapetina.mesh.coordinator.infrastructure.config.CoordinatorConfig;
import fr.lapetina.mesh.coordinator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mesh.coordinator.infrastructure.registry.WorkerRegistry;
import fr.lapetina.mesh.coordinator.infrastructure.store.OfflineLogStore;
import fr.lapetina.mesh.coordinator.infrastructure.store.StoreCorruptionException;
import fr.lapetina.mesh.coordinator.scheduler.exception.BackpressureException;
import fr.lapetina.mesh.coordinator.sync.ApplyResult;
import fr.lapetina.mesh.coordinator.sync.SyncEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Durable queue of writes captured while disconnected, drained into the
 * {@link SyncEngine} once an authoritative node is reachable.
 *
 * <p>Every accepted write is sequenced per origin and appended to the
 * {@link OfflineLogStore} before {@link #enqueue} returns. State changes are
 * appended as markers, so a restart resumes exactly where the previous
 * process stopped: {@link #start()} replays unsettled entries in their
 * original order before new writes are accepted.
 *
 * <p>Draining runs on a dedicated thread woken by a bounded signal queue:
 * a reconnect of an authoritative node, a new write while one is online,
 * an operator request, or the periodic sync interval.
 */
public final class OfflineQueueManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OfflineQueueManager.class);

    private final OfflineLogStore logStore;
    private final SyncEngine syncEngine;
    private final WorkerRegistry registry;
    private final CatchUpHandler catchUpHandler;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final String localNodeId;
    private final Set<String> authoritativeNodes;
    private final int maxPending;
    private final Duration syncInterval;

    private final ReentrantLock logLock = new ReentrantLock();
    private final Map<String, OfflineOperation> pending = new LinkedHashMap<>();
    private final Map<String, Long> lastSequenceByOrigin = new HashMap<>();
    private final AtomicLong lamport = new AtomicLong();

    private final ReentrantLock drainLock = new ReentrantLock();
    private final BlockingQueue<DrainSignal> signals;
    private final AtomicLong applied = new AtomicLong();
    private final AtomicLong conflicted = new AtomicLong();
    private final AtomicReference<Instant> lastDrainAt = new AtomicReference<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean recovered = new AtomicBoolean(false);
    private final AtomicBoolean logCorrupt = new AtomicBoolean(false);
    private final Consumer<WorkerRegistry.RegistryEvent> registryListener = this::onRegistryEvent;
    private volatile Thread drainThread;

    private OfflineQueueManager(Builder builder) {
        this.logStore = builder.logStore;
        this.syncEngine = builder.syncEngine;
        this.registry = builder.registry;
        this.catchUpHandler = builder.catchUpHandler;
        this.metricsRegistry = builder.metricsRegistry;
        this.clock = builder.clock;
        this.localNodeId = builder.localNodeId;
        this.authoritativeNodes = Set.copyOf(builder.authoritativeNodes);
        this.maxPending = builder.maxPending;
        this.syncInterval = builder.syncInterval;
        this.signals = new ArrayBlockingQueue<>(builder.drainQueueCapacity);

        syncEngine.addReviewListener(this::onReviewChanged);

        log.info("OfflineQueueManager created: localNodeId={}, authoritativeNodes={}, maxPending={}, syncIntervalMs={}",
                localNodeId, authoritativeNodes, maxPending, syncInterval.toMillis());
    }

    /**
     * Recovers the log and starts the drain thread.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            recover();
            registry.addListener(registryListener);
            Thread thread = new Thread(this::drainLoop, "offline-drain");
            thread.setDaemon(true);
            drainThread = thread;
            thread.start();
            log.info("OfflineQueueManager started: pending={}", pendingCount());
        }
    }

    /**
     * Rebuilds the in-memory queue from the durable log and reopens the
     * reviews of conflicted operations nobody has settled yet. Can be called
     * again once an operator has repaired a corrupt log.
     *
     * @return true if the log was read successfully
     */
    public boolean recover() {
        List<OfflineOperation> operations;
        try {
            operations = logStore.recover();
        } catch (StoreCorruptionException e) {
            recovered.set(false);
            logCorrupt.set(true);
            log.error("Offline log corrupt, syncing halted: location={}", e.getLocation(), e);
            syncEngine.halt(e.getMessage());
            return false;
        }

        logLock.lock();
        try {
            pending.clear();
            lastSequenceByOrigin.clear();
            long settledApplied = 0;
            long settledConflicted = 0;
            for (OfflineOperation operation : operations) {
                lastSequenceByOrigin.merge(operation.originNode(), operation.sequence(), Math::max);
                lamport.accumulateAndGet(operation.lamport(), Math::max);
                switch (operation.state()) {
                    case APPLIED -> settledApplied++;
                    case CONFLICTED -> {
                        // No RESOLVED marker yet: the operator still owes a decision
                        settledConflicted++;
                        syncEngine.restoreReview(operation);
                    }
                    case RESOLVED -> settledConflicted++;
                    default -> pending.put(operation.id(), operation.withState(OperationState.QUEUED));
                }
            }
            applied.set(settledApplied);
            conflicted.set(settledConflicted);
            metricsRegistry.setOfflinePending(pending.size());
        } finally {
            logLock.unlock();
        }

        recovered.set(true);
        if (logCorrupt.getAndSet(false)) {
            syncEngine.resume();
        }
        log.info("Offline queue recovered: operations={}, pending={}, origins={}",
                operations.size(), pendingCount(), lastSequenceByOrigin.size());
        signal(DrainSignal.RECOVERY);
        return true;
    }

    /**
     * Sequences and durably logs one write.
     *
     * @return the operation id
     * @throws BackpressureException    if the pending log is full
     * @throws IllegalArgumentException if an explicit sequence skips ahead or a field cannot be merged
     * @throws IllegalStateException    if the log has not been recovered
     */
    public String enqueue(OfflineWrite write) {
        if (!recovered.get()) {
            throw new IllegalStateException("Offline log not recovered"
                    + (syncEngine.isHalted() ? ": " + syncEngine.getHaltReason() : ""));
        }

        String origin = write.originNode() != null ? write.originNode() : localNodeId;
        syncEngine.validateDelta(write.entityType(), write.delta());
        OfflineOperation operation;

        logLock.lock();
        try {
            long last = lastSequenceByOrigin.getOrDefault(origin, 0L);
            long sequence;
            if (write.sequence() != null) {
                sequence = write.sequence();
                if (sequence <= last) {
                    log.debug("Duplicate offline write ignored: origin={}, sequence={}, last={}", origin, sequence, last);
                    return OfflineOperation.idFor(origin, sequence);
                }
                if (sequence != last + 1) {
                    throw new IllegalArgumentException("Sequence gap for origin " + origin
                            + ": expected " + (last + 1) + " but got " + sequence);
                }
            } else {
                sequence = last + 1;
            }

            if (pending.size() >= maxPending) {
                metricsRegistry.incrementErrorCount("offline", ErrorType.CAPACITY_EXHAUSTED);
                throw new BackpressureException(
                        BackpressureException.BackpressureReason.OFFLINE_LOG_FULL,
                        "pending=" + pending.size()
                );
            }

            long timestamp = stamp(write.lamport());

            operation = new OfflineOperation(
                    OfflineOperation.idFor(origin, sequence),
                    origin,
                    sequence,
                    write.entityId(),
                    write.entityType(),
                    write.kind(),
                    write.delta(),
                    write.baseVector(),
                    timestamp,
                    clock.instant(),
                    OperationState.QUEUED
            );
            logStore.append(operation);
            lastSequenceByOrigin.put(origin, sequence);
            pending.put(operation.id(), operation);
            metricsRegistry.setOfflinePending(pending.size());
        } finally {
            logLock.unlock();
        }

        log.debug("Offline write queued: operationId={}, entityId={}, kind={}, lamport={}",
                operation.id(), operation.entityId(), operation.kind(), operation.lamport());
        if (isAuthoritativeOnline()) {
            signal(DrainSignal.ENQUEUED);
        }
        return operation.id();
    }

    /**
     * Requests a drain from the background thread.
     */
    public void requestDrain() {
        signal(DrainSignal.MANUAL);
    }

    /**
     * Replays every pending operation in append order on the calling thread.
     *
     * @return number of operations settled
     */
    public int drainOnce() {
        if (!recovered.get() || syncEngine.isHalted()) {
            return 0;
        }
        drainLock.lock();
        try {
            List<OfflineOperation> batch;
            logLock.lock();
            try {
                batch = new ArrayList<>(pending.values());
            } finally {
                logLock.unlock();
            }
            if (batch.isEmpty()) {
                lastDrainAt.set(clock.instant());
                return 0;
            }

            Map<String, Long> drainedUpTo = new TreeMap<>();
            Map<String, Set<String>> touched = new HashMap<>();
            int settled = 0;
            for (OfflineOperation operation : batch) {
                if (!replay(operation)) {
                    break;
                }
                settled++;
                drainedUpTo.merge(operation.originNode(), operation.sequence(), Math::max);
                touched.computeIfAbsent(operation.originNode(), o -> new TreeSet<>()).add(operation.entityId());
            }
            lastDrainAt.set(clock.instant());
            log.info("Offline drain finished: settled={}, remaining={}", settled, pendingCount());

            drainedUpTo.forEach((origin, sequence) -> requestCatchUp(origin, sequence, touched.get(origin)));
            return settled;
        } finally {
            drainLock.unlock();
        }
    }

    public DrainStatus drainStatus() {
        Map<String, Long> sequences;
        int pendingNow;
        logLock.lock();
        try {
            sequences = new TreeMap<>(lastSequenceByOrigin);
            pendingNow = pending.size();
        } finally {
            logLock.unlock();
        }
        return new DrainStatus(
                pendingNow,
                applied.get(),
                conflicted.get(),
                syncEngine.pendingReviews().size(),
                lastDrainAt.get(),
                drainLock.isLocked(),
                syncEngine.isHalted(),
                syncEngine.getHaltReason(),
                sequences
        );
    }

    /**
     * True if at least one authoritative node is reachable, or none is configured.
     */
    public boolean isAuthoritativeOnline() {
        if (authoritativeNodes.isEmpty()) {
            return true;
        }
        return authoritativeNodes.stream()
                .map(registry::status)
                .anyMatch(status -> status.isPresent() && status.get() != NodeStatus.OFFLINE);
    }

    public int pendingCount() {
        logLock.lock();
        try {
            return pending.size();
        } finally {
            logLock.unlock();
        }
    }

    public long lastSequence(String origin) {
        logLock.lock();
        try {
            return lastSequenceByOrigin.getOrDefault(origin, 0L);
        } finally {
            logLock.unlock();
        }
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            registry.removeListener(registryListener);
            Thread thread = drainThread;
            if (thread != null) {
                thread.interrupt();
                try {
                    thread.join(TimeUnit.SECONDS.toMillis(5));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            logStore.close();
            log.info("OfflineQueueManager stopped: pending={}", pendingCount());
        }
    }

    /**
     * @return false if draining must stop at this operation
     */
    private boolean replay(OfflineOperation operation) {
        ApplyResult result;
        try {
            logStore.appendState(operation.id(), OperationState.REPLAYING);
            result = syncEngine.apply(operation.withState(OperationState.REPLAYING));
            logStore.appendState(operation.id(), result.operationState());
        } catch (StoreCorruptionException e) {
            syncEngine.halt(e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Offline replay failed, drain stopped: operationId={}, entityId={}",
                    operation.id(), operation.entityId(), e);
            return false;
        }

        if (result.outcome() == ApplyResult.Outcome.CONFLICTED) {
            conflicted.incrementAndGet();
        } else {
            applied.incrementAndGet();
        }

        logLock.lock();
        try {
            pending.remove(operation.id());
            metricsRegistry.setOfflinePending(pending.size());
        } finally {
            logLock.unlock();
        }
        return true;
    }

    private void requestCatchUp(String origin, long sequence, Set<String> entityIds) {
        if (catchUpHandler == null || origin.equals(localNodeId)) {
            return;
        }
        catchUpHandler.submitCatchUp(origin, sequence, entityIds)
                .ifPresent(taskId -> log.debug("Catch-up submitted: origin={}, lastSequence={}, taskId={}",
                        origin, sequence, taskId));
    }

    /**
     * Lamport clock update for one accepted write. A forwarded timestamp is
     * kept as the write's own and pulls the local clock up to it, so the
     * next local write is stamped after it; a local write ticks the clock.
     */
    private long stamp(long forwarded) {
        if (forwarded > 0) {
            lamport.accumulateAndGet(forwarded, Math::max);
            return forwarded;
        }
        return lamport.incrementAndGet();
    }

    private void drainLoop() {
        while (running.get()) {
            try {
                DrainSignal signal = signals.poll(syncInterval.toMillis(), TimeUnit.MILLISECONDS);
                if (signal == DrainSignal.MANUAL || isAuthoritativeOnline()) {
                    log.debug("Drain triggered: signal={}", signal != null ? signal : "INTERVAL");
                    drainOnce();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Drain loop error", e);
            }
        }
    }

    private void signal(DrainSignal signal) {
        if (!signals.offer(signal)) {
            // A full queue already guarantees a pending drain
            log.debug("Drain signal dropped: signal={}", signal);
        }
    }

    private void onRegistryEvent(WorkerRegistry.RegistryEvent event) {
        if (event.isReconnect() && authoritativeNodes.contains(event.node().getId())) {
            log.info("Authoritative node reconnected, draining: nodeId={}", event.node().getId());
            signal(DrainSignal.RECONNECTED);
        }
    }

    private void onReviewChanged(PendingReview review) {
        if (review.isOpen()) {
            return;
        }
        OfflineOperation operation = review.operation();
        if (operation.sequence() > lastSequence(operation.originNode())) {
            return;
        }
        logStore.appendState(operation.id(), OperationState.RESOLVED);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for OfflineQueueManager.
     */
    public static final class Builder {
        private OfflineLogStore logStore;
        private SyncEngine syncEngine;
        private WorkerRegistry registry;
        private CatchUpHandler catchUpHandler;
        private MetricsRegistry metricsRegistry;
        private Clock clock = Clock.systemUTC();
        private String localNodeId;
        private Set<String> authoritativeNodes = Set.of();
        private int maxPending = 10000;
        private Duration syncInterval = Duration.ofSeconds(30);
        private int drainQueueCapacity = 64;

        public Builder logStore(OfflineLogStore logStore) {
            this.logStore = logStore;
            return this;
        }

        public Builder syncEngine(SyncEngine syncEngine) {
            this.syncEngine = syncEngine;
            return this;
        }

        public Builder registry(WorkerRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder catchUpHandler(CatchUpHandler handler) {
            this.catchUpHandler = handler;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder localNodeId(String nodeId) {
            this.localNodeId = nodeId;
            return this;
        }

        public Builder authoritativeNodes(Set<String> nodeIds) {
            this.authoritativeNodes = nodeIds;
            return this;
        }

        public Builder maxPending(int maxPending) {
            this.maxPending = maxPending;
            return this;
        }

        public Builder syncInterval(Duration interval) {
            this.syncInterval = interval;
            return this;
        }

        public Builder drainQueueCapacity(int capacity) {
            this.drainQueueCapacity = capacity;
            return this;
        }

        public Builder fromConfig(CoordinatorConfig config) {
            this.localNodeId = config.getIdentity().getNodeId();
            this.authoritativeNodes = config.getOffline().getAuthoritativeNodes();
            this.maxPending = config.getOffline().getMaxPendingOperations();
            this.syncInterval = Duration.ofMillis(config.getOffline().getSyncIntervalMs());
            this.drainQueueCapacity = config.getOffline().getDrainQueueCapacity();
            return this;
        }

        public OfflineQueueManager build() {
            if (logStore == null) {
                throw new IllegalStateException("OfflineLogStore is required");
            }
            if (syncEngine == null) {
                throw new IllegalStateException("SyncEngine is required");
            }
            if (registry == null) {
                throw new IllegalStateException("WorkerRegistry is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            if (localNodeId == null || localNodeId.isBlank()) {
                throw new IllegalStateException("Local node ID is required");
            }
            return new OfflineQueueManager(this);
        }
    }
}
