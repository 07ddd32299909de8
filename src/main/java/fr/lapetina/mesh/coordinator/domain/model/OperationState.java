package fr.lapetina.mesh.coordinator.domain.model;

/**
 * Lifecycle of an offline operation.
 *
 * <pre>
 * CAPTURED -> QUEUED -> REPLAYING -> APPLIED
 *                                 -> CONFLICTED -> RESOLVED
 * </pre>
 */
public enum OperationState {
    CAPTURED,
    QUEUED,
    REPLAYING,
    APPLIED,
    CONFLICTED,
    RESOLVED;

    /**
     * True once the operation no longer needs to be replayed.
     */
    public boolean isSettled() {
        return this == APPLIED || this == CONFLICTED || this == RESOLVED;
    }
}
