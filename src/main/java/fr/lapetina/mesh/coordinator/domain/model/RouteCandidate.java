package fr.lapetina.mesh.coordinator.domain.model;

import java.util.Objects;

/**
 * One entry of a route template.
 */
public record RouteCandidate(String nodeId, RouteTier tier, int cost) {

    public RouteCandidate {
        Objects.requireNonNull(nodeId, "Node ID is required");
        tier = tier != null ? tier : RouteTier.CLOUD;
    }
}
