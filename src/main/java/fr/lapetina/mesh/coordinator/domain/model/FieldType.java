package fr.lapetina.mesh.coordinator.domain.model;

/**
 * Merge semantics of an entity field.
 */
public enum FieldType {
    /** Single value, concurrent writes settled by last-writer-wins. */
    SCALAR,
    /** Grow-only set, merged by union. */
    SET,
    /** Monotonic counter, merged by maximum. */
    COUNTER
}
