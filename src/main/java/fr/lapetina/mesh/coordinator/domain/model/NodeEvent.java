package fr.lapetina.mesh.coordinator.domain.model;

import java.time.Instant;

/**
 * Lifecycle entry kept by the registry for each node.
 */
public record NodeEvent(String nodeId, Type type, String message, Instant at) {

    public enum Type {
        REGISTERED,
        STATUS_CHANGED,
        RECONNECTED,
        DEREGISTERED,
        EXPIRED
    }
}
