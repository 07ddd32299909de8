package fr.lapetina.mesh.coordinator.domain.model;

/**
 * Operator decision for a pending review.
 */
public enum ReviewDecision {
    /** Apply the held operation over the canonical state. */
    APPLY_INCOMING,
    /** Discard the held operation and keep the canonical state. */
    KEEP_CANONICAL
}
