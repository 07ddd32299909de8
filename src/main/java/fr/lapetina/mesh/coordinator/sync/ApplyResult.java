package fr.lapetina.mesh.coordinator.sync;

import fr.lapetina.mesh.coordinator.domain.model.CanonicalEntity;
import fr.lapetina.mesh.coordinator.domain.model.ConflictResolution;
import fr.lapetina.mesh.coordinator.domain.model.OfflineOperation;
import fr.lapetina.mesh.coordinator.domain.model.OperationState;
import fr.lapetina.mesh.coordinator.domain.model.PendingReview;

/**
 * Result of applying one operation to canonical state.
 *
 * @param entity     canonical entity after the call
 * @param resolution how the write was merged, null unless APPLIED
 * @param review     the opened review, null unless CONFLICTED
 */
public record ApplyResult(
        Outcome outcome,
        OfflineOperation operation,
        CanonicalEntity entity,
        ConflictResolution resolution,
        PendingReview review
) {

    public enum Outcome {
        /** Written, possibly after a field merge */
        APPLIED,
        /** Already reflected in canonical state */
        SKIPPED,
        /** Escalated to pending review */
        CONFLICTED
    }

    static ApplyResult applied(OfflineOperation operation, CanonicalEntity entity, ConflictResolution resolution) {
        return new ApplyResult(Outcome.APPLIED, operation, entity, resolution, null);
    }

    static ApplyResult skipped(OfflineOperation operation, CanonicalEntity entity) {
        return new ApplyResult(Outcome.SKIPPED, operation, entity, null, null);
    }

    static ApplyResult conflicted(OfflineOperation operation, CanonicalEntity entity, PendingReview review) {
        return new ApplyResult(Outcome.CONFLICTED, operation, entity, null, review);
    }

    /**
     * State the operation should be logged with.
     */
    public OperationState operationState() {
        return outcome == Outcome.CONFLICTED ? OperationState.CONFLICTED : OperationState.APPLIED;
    }
}
