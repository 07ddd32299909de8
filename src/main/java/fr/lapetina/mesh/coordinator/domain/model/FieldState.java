package fr.lapetina.mesh.coordinator.domain.model;

/**
 * Current value of one field together with its merge type and the write that set it.
 */
public record FieldState(Object value, FieldType type, WriteStamp stamp) {
}
