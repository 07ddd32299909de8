package fr.lapetina.mesh.coordinator.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Route template for a service: the fallback chain in declared order and the
 * policy used to reorder it at resolution time.
 */
public record Route(String service, List<RouteCandidate> candidates, RoutingPolicyType policy) {

    public Route {
        Objects.requireNonNull(service, "Service name is required");
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        policy = policy != null ? policy : RoutingPolicyType.LOCAL_FIRST;
    }
}
