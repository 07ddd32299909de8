package fr.lapetina.mesh.coordinator.routing;

import java.util.List;

/**
 * Every candidate of a route was skipped or failed within the request window.
 */
public final class RouteExhaustedException extends RuntimeException {

    private final String service;
    private final List<String> attempts;

    public RouteExhaustedException(String service, List<String> attempts) {
        super("No candidate could serve " + service + ": " + attempts);
        this.service = service;
        this.attempts = List.copyOf(attempts);
    }

    public String getService() {
        return service;
    }

    /**
     * One entry per candidate, {@code nodeId: reason}, in attempt order.
     */
    public List<String> getAttempts() {
        return attempts;
    }
}
