package fr.lapetina.mesh.coordinator.domain.routing;

import fr.lapetina.mesh.coordinator.domain.model.RouteCandidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Cheapest candidate first. Ties keep template order.
 */
public final class CostOptimizedPolicy implements RoutingPolicy {

    @Override
    public String getName() {
        return "cost-optimized";
    }

    @Override
    public List<RouteCandidate> order(List<RouteCandidate> candidates, HealthView health) {
        List<RouteCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingInt(RouteCandidate::cost));
        return ordered;
    }
}
