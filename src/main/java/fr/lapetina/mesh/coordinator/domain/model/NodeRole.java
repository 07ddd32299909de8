package fr.lapetina.mesh.coordinator.domain.model;

/**
 * Deployment tier of a node.
 */
public enum NodeRole {
    CLOUD,
    EDGE,
    CLIENT
}
