package fr.lapetina.mesh.coordinator.sync;

import fr.lapetina.mesh.coordinator.domain.merge.MergeFunctionTable;
import fr.lapetina.mesh.coordinator.domain.model.CanonicalEntity;
import fr.lapetina.mesh.coordinator.domain.model.ConflictResolution;
import fr.lapetina.mesh.coordinator.domain.model.ErrorType;
import fr.lapetina.mesh.coordinator.domain.model.OfflineOperation;
import fr.lapetina.mesh.coordinator.domain.model.OperationState;
import fr.lapetina.mesh.coordinator.domain.model.PendingReview;
import fr.lapetina.mesh.coordinator.domain.model.ReviewDecision;
import fr.lapetina.mesh.coordinator.infrastructure.config.CoordinatorConfig;
import fr.lapetina.mesh.coordinator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mesh.coordinator.infrastructure.store.CanonicalStore;
import fr.lapetina.mesh.coordinator.infrastructure.store.StoreCorruptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Applies offline operations to canonical state.
 *
 * <p>Each call locks one entity, reads it, lets the {@link ConflictResolver}
 * compute the successor and stores it with the revision that was read.
 * Operations whose sequence is already recorded for their origin are skipped,
 * so replaying a log any number of times yields the same state.
 *
 * <p>Storage corruption halts the engine: every later call fails with
 * {@link IllegalStateException} until {@link #resume()} is called.
 */
public final class SyncEngine {

    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    private final CanonicalStore store;
    private final ConflictResolver resolver;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final Duration replayTimeout;
    private final int resolutionHistory;

    private final Map<String, PendingReview> reviews = new ConcurrentHashMap<>();
    private final Deque<ConflictResolution> recentResolutions = new ArrayDeque<>();
    private final List<Consumer<PendingReview>> reviewListeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<String> haltReason = new AtomicReference<>();

    private SyncEngine(Builder builder) {
        this.store = builder.store;
        this.resolver = new ConflictResolver(builder.mergeTable, builder.resolverNodeId);
        this.metricsRegistry = builder.metricsRegistry;
        this.clock = builder.clock;
        this.replayTimeout = builder.replayTimeout;
        this.resolutionHistory = builder.resolutionHistory;

        log.info("SyncEngine created: resolverNodeId={}, replayTimeoutMs={}",
                builder.resolverNodeId, replayTimeout.toMillis());
    }

    /**
     * Applies one operation.
     *
     * @throws IllegalStateException     if the engine is halted
     * @throws StoreCorruptionException  if the canonical store rejects the write; the engine halts
     */
    public ApplyResult apply(OfflineOperation operation) {
        ensureRunning();

        Optional<CanonicalStore.EntityLock> acquired = store.lock(operation.entityId(), replayTimeout);
        if (acquired.isEmpty()) {
            log.warn("Replay deadline expired: operationId={}, entityId={}, timeoutMs={}",
                    operation.id(), operation.entityId(), replayTimeout.toMillis());
            metricsRegistry.incrementErrorCount("sync", ErrorType.DEADLINE_EXCEEDED);
            CanonicalEntity snapshot = current(operation);
            return ApplyResult.conflicted(operation, snapshot,
                    openReview(operation, PendingReview.Reason.REPLAY_TIMEOUT, snapshot));
        }

        try (CanonicalStore.EntityLock ignored = acquired.get()) {
            CanonicalEntity current = current(operation);
            if (operation.sequence() <= current.appliedSequence(operation.originNode())) {
                log.debug("Operation already applied: operationId={}, entityId={}",
                        operation.id(), operation.entityId());
                return ApplyResult.skipped(operation, current);
            }

            ConflictResolver.Decision decision = resolver.resolve(current, operation, clock.instant());
            if (decision.isEscalated()) {
                // Record the sequence so a replay does not open the review twice
                CanonicalEntity seen = resolver.markSeen(current, operation);
                write(seen, current.revision());
                return ApplyResult.conflicted(operation, seen,
                        openReview(operation, decision.escalation(), current));
            }

            write(decision.entity(), current.revision());
            record(decision.resolution());
            log.debug("Operation applied: operationId={}, entityId={}, strategy={}, vector={}",
                    operation.id(), operation.entityId(), decision.resolution().strategy(),
                    decision.entity().vector());
            return ApplyResult.applied(operation, decision.entity(), decision.resolution());
        }
    }

    /**
     * Settles a pending review with an operator decision.
     *
     * @return the settled review, or empty if no review has this id
     * @throws IllegalStateException       if the review was already settled or the engine is halted
     * @throws ConflictUnresolvedException if the entity could not be locked in time
     */
    public Optional<PendingReview> resolveReview(String reviewId, ReviewDecision decision) {
        ensureRunning();
        PendingReview review = reviews.get(reviewId);
        if (review == null) {
            return Optional.empty();
        }
        if (!review.isOpen()) {
            throw new IllegalStateException("Review already resolved: " + reviewId);
        }

        OfflineOperation operation = review.operation();
        CanonicalStore.EntityLock lock = store.lock(operation.entityId(), replayTimeout)
                .orElseThrow(() -> new ConflictUnresolvedException(reviewId,
                        "Entity " + operation.entityId() + " is locked, try again later"));

        try (lock) {
            CanonicalEntity current = current(operation);
            ConflictResolver.Decision outcome;
            if (decision == ReviewDecision.KEEP_CANONICAL) {
                outcome = resolver.keepCanonical(current, operation, clock.instant());
            } else if (review.reason() == PendingReview.Reason.REPLAY_TIMEOUT) {
                outcome = resolver.resolve(current, operation, clock.instant());
                if (outcome.isEscalated()) {
                    outcome = resolver.applyIncoming(current, operation, clock.instant());
                }
            } else {
                outcome = resolver.applyIncoming(current, operation, clock.instant());
            }
            write(outcome.entity(), current.revision());
            record(outcome.resolution());
        }

        PendingReview settled = review.resolve(decision, clock.instant());
        reviews.put(reviewId, settled);
        log.info("Review resolved: reviewId={}, entityId={}, decision={}",
                reviewId, operation.entityId(), decision);
        reviewListeners.forEach(listener -> notifyListener(listener, settled));
        return Optional.of(settled);
    }

    /**
     * Reopens the review of an operation the offline log still records as
     * conflicted, after a restart. An escalated operation has its sequence
     * recorded on the entity; one that timed out before locking does not.
     *
     * @return the open review, existing or restored
     */
    public PendingReview restoreReview(OfflineOperation operation) {
        PendingReview existing = reviews.get(operation.id());
        if (existing != null && existing.isOpen()) {
            return existing;
        }
        CanonicalEntity snapshot = current(operation);
        PendingReview.Reason reason = operation.sequence() <= snapshot.appliedSequence(operation.originNode())
                ? PendingReview.Reason.DELETE_UPDATE_CONFLICT
                : PendingReview.Reason.REPLAY_TIMEOUT;
        PendingReview review = PendingReview.open(operation.withState(OperationState.CONFLICTED),
                reason, snapshot, clock.instant());
        reviews.put(review.id(), review);
        log.info("Review restored: operationId={}, entityId={}, reason={}",
                operation.id(), operation.entityId(), reason);
        return review;
    }

    /**
     * Checks that every field of a write can be merged under its declared type.
     *
     * @throws IllegalArgumentException naming the offending field
     */
    public void validateDelta(String entityType, Map<String, Object> delta) {
        resolver.getMergeTable().validate(entityType, delta);
    }

    public List<PendingReview> pendingReviews() {
        return reviews.values().stream()
                .filter(PendingReview::isOpen)
                .sorted(Comparator.comparing(PendingReview::createdAt).thenComparing(PendingReview::id))
                .toList();
    }

    public Optional<PendingReview> getReview(String reviewId) {
        return Optional.ofNullable(reviews.get(reviewId));
    }

    public Optional<CanonicalEntity> getEntity(String entityId) {
        return store.get(entityId);
    }

    /**
     * Most recent resolutions, newest first.
     */
    public List<ConflictResolution> recentResolutions() {
        synchronized (recentResolutions) {
            return new ArrayList<>(recentResolutions);
        }
    }

    /**
     * Notified when a review is opened and again when it is settled.
     */
    public void addReviewListener(Consumer<PendingReview> listener) {
        reviewListeners.add(listener);
    }

    public void halt(String reason) {
        if (haltReason.compareAndSet(null, reason)) {
            log.error("SyncEngine halted: reason={}", reason);
            metricsRegistry.incrementErrorCount("sync", ErrorType.STORE_CORRUPTION);
        }
    }

    public boolean isHalted() {
        return haltReason.get() != null;
    }

    public String getHaltReason() {
        return haltReason.get();
    }

    /**
     * Clears the halt after an operator repaired the store.
     */
    public void resume() {
        String previous = haltReason.getAndSet(null);
        if (previous != null) {
            log.info("SyncEngine resumed: previousReason={}", previous);
        }
    }

    public ConflictResolver getResolver() {
        return resolver;
    }

    private void ensureRunning() {
        String reason = haltReason.get();
        if (reason != null) {
            throw new IllegalStateException("Sync halted: " + reason);
        }
    }

    private CanonicalEntity current(OfflineOperation operation) {
        return store.get(operation.entityId())
                .orElseGet(() -> CanonicalEntity.empty(operation.entityId(), operation.entityType()));
    }

    private void write(CanonicalEntity entity, long expectedRevision) {
        try {
            store.put(entity, expectedRevision);
        } catch (StoreCorruptionException e) {
            halt(e.getMessage());
            throw e;
        }
    }

    private PendingReview openReview(OfflineOperation operation, PendingReview.Reason reason,
                                     CanonicalEntity snapshot) {
        PendingReview existing = reviews.get(operation.id());
        if (existing != null && existing.isOpen()) {
            return existing;
        }
        PendingReview review = PendingReview.open(operation, reason, snapshot, clock.instant());
        reviews.put(review.id(), review);
        metricsRegistry.incrementErrorCount("sync", ErrorType.CONFLICT_UNRESOLVED);
        log.warn("Operation escalated to review: operationId={}, entityId={}, reason={}",
                operation.id(), operation.entityId(), reason);
        reviewListeners.forEach(listener -> notifyListener(listener, review));
        return review;
    }

    private void record(ConflictResolution resolution) {
        metricsRegistry.incrementResolution(resolution.strategy());
        synchronized (recentResolutions) {
            recentResolutions.addFirst(resolution);
            while (recentResolutions.size() > resolutionHistory) {
                recentResolutions.removeLast();
            }
        }
    }

    private void notifyListener(Consumer<PendingReview> listener, PendingReview review) {
        try {
            listener.accept(review);
        } catch (RuntimeException e) {
            log.error("Review listener failed: reviewId={}", review.id(), e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for SyncEngine.
     */
    public static final class Builder {
        private CanonicalStore store;
        private MergeFunctionTable mergeTable = new MergeFunctionTable();
        private String resolverNodeId;
        private MetricsRegistry metricsRegistry;
        private Clock clock = Clock.systemUTC();
        private Duration replayTimeout = Duration.ofSeconds(5);
        private int resolutionHistory = 100;

        public Builder store(CanonicalStore store) {
            this.store = store;
            return this;
        }

        public Builder mergeTable(MergeFunctionTable mergeTable) {
            this.mergeTable = mergeTable;
            return this;
        }

        public Builder resolverNodeId(String nodeId) {
            this.resolverNodeId = nodeId;
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

        public Builder replayTimeout(Duration timeout) {
            this.replayTimeout = timeout;
            return this;
        }

        public Builder resolutionHistory(int size) {
            this.resolutionHistory = size;
            return this;
        }

        public Builder fromConfig(CoordinatorConfig config) {
            String configured = config.getSync().getResolverNodeId();
            this.resolverNodeId = configured != null ? configured : config.getIdentity().getNodeId();
            this.replayTimeout = Duration.ofMillis(config.getOffline().getReplayTimeoutMs());
            return this;
        }

        public SyncEngine build() {
            if (store == null) {
                throw new IllegalStateException("CanonicalStore is required");
            }
            if (resolverNodeId == null || resolverNodeId.isBlank()) {
                throw new IllegalStateException("Resolver node ID is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new SyncEngine(this);
        }
    }
}
