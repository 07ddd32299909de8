package fr.lapetina.mesh.coordinator.domain.routing;

import fr.lapetina.mesh.coordinator.domain.model.RouteCandidate;

import java.util.ArrayList;
import java.util.List;

/**
 * Healthy local and edge candidates first, then the rest of the template
 * chain in declared order.
 */
public final class LocalFirstPolicy implements RoutingPolicy {

    @Override
    public String getName() {
        return "local-first";
    }

    @Override
    public List<RouteCandidate> order(List<RouteCandidate> candidates, HealthView health) {
        List<RouteCandidate> preferred = new ArrayList<>();
        List<RouteCandidate> fallback = new ArrayList<>();
        for (RouteCandidate candidate : candidates) {
            if (candidate.tier().isLocal() && health.isHealthy(candidate.nodeId())) {
                preferred.add(candidate);
            } else {
                fallback.add(candidate);
            }
        }
        preferred.addAll(fallback);
        return preferred;
    }
}
