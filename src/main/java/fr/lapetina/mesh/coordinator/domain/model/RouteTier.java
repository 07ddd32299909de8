package fr.lapetina.mesh.coordinator.domain.model;

/**
 * Network tier of a route candidate, ordered from closest to farthest.
 */
public enum RouteTier {
    LOCAL,
    EDGE,
    CLOUD;

    public boolean isLocal() {
        return this == LOCAL || this == EDGE;
    }
}
