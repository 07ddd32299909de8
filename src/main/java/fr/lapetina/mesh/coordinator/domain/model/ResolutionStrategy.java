package fr.lapetina.mesh.coordinator.domain.model;

public enum ResolutionStrategy {
    /** The operation saw every canonical change; applied as is. */
    FAST_FORWARD,
    /** Concurrent changes reconciled field by field. */
    FIELD_MERGE,
    /** Could not be merged automatically; waiting for an operator. */
    PENDING_REVIEW,
    /** Settled by an operator decision. */
    MANUAL
}
