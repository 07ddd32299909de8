package fr.lapetina.mesh.coordinator.domain.model;

/**
 * Liveness status of a node.
 *
 * ONLINE: Node answers heartbeats and probes
 * DEGRADED: Node missed enough probes to be suspect, or a routed call failed
 * OFFLINE: Node missed the offline threshold or was hard-disconnected
 */
public enum NodeStatus {
    ONLINE,
    DEGRADED,
    OFFLINE
}
