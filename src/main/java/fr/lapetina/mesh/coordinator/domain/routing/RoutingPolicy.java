package fr.lapetina.mesh.coordinator.domain.routing;

import fr.lapetina.mesh.coordinator.domain.model.RouteCandidate;

import java.util.List;

/**
 * Orders the candidates of a route template.
 *
 * Implementations must be stateless and thread-safe; they are shared across
 * all routing calls. The input list has already been filtered to reachable
 * candidates and is in template order.
 */
public interface RoutingPolicy {

    /**
     * Returns the name of this policy for configuration and metrics.
     */
    String getName();

    /**
     * Returns the candidates in the order they should be attempted.
     *
     * @param candidates reachable candidates in template order
     * @param health     current node health
     * @return a new list, never the input list
     */
    List<RouteCandidate> order(List<RouteCandidate> candidates, HealthView health);
}
