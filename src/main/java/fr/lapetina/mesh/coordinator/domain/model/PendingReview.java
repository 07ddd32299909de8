package fr.lapetina.mesh.coordinator.domain.model;

import java.time.Instant;

/**
 * An operation the resolver refused to merge automatically.
 */
public record PendingReview(
        String id,
        OfflineOperation operation,
        Reason reason,
        CanonicalEntity canonicalSnapshot,
        Instant createdAt,
        ReviewDecision decision,
        Instant resolvedAt
) {

    public enum Reason {
        /** A delete raced an update of the same entity. */
        DELETE_UPDATE_CONFLICT,
        /** The entity could not be locked before the replay deadline. */
        REPLAY_TIMEOUT
    }

    public static PendingReview open(OfflineOperation operation, Reason reason, CanonicalEntity snapshot, Instant now) {
        return new PendingReview(operation.id(), operation, reason, snapshot, now, null, null);
    }

    public boolean isOpen() {
        return decision == null;
    }

    public PendingReview resolve(ReviewDecision resolution, Instant now) {
        return new PendingReview(id, operation.withState(OperationState.RESOLVED), reason,
                canonicalSnapshot, createdAt, resolution, now);
    }
}
