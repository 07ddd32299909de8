package fr.lapetina.mesh.coordinator.domain.model;

public enum OperationKind {
    CREATE,
    UPDATE,
    DELETE
}
