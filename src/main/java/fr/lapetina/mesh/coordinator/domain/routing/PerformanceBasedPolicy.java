package fr.lapetina.mesh.coordinator.domain.routing;

import fr.lapetina.mesh.coordinator.domain.model.RouteCandidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Lowest observed latency first, then highest success rate.
 *
 * Candidates without samples go last. The sort is stable, so ties keep
 * template order.
 */
public final class PerformanceBasedPolicy implements RoutingPolicy {

    @Override
    public String getName() {
        return "performance-based";
    }

    @Override
    public List<RouteCandidate> order(List<RouteCandidate> candidates, HealthView health) {
        Comparator<RouteCandidate> bySampled = Comparator.comparing(
                candidate -> !health.health(candidate.nodeId()).hasSamples());
        Comparator<RouteCandidate> byLatency = Comparator.comparingDouble(
                candidate -> health.health(candidate.nodeId()).latencyMs());
        Comparator<RouteCandidate> bySuccess = Comparator.comparingDouble(
                (RouteCandidate candidate) -> health.health(candidate.nodeId()).successRate()).reversed();

        List<RouteCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(bySampled.thenComparing(byLatency).thenComparing(bySuccess));
        return ordered;
    }
}
