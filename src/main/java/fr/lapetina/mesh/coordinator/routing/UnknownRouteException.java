package fr.lapetina.mesh.coordinator.routing;

/**
 * No route template is configured for the service.
 */
public final class UnknownRouteException extends RuntimeException {

    private final String service;

    public UnknownRouteException(String service) {
        super("No route configured for service: " + service);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
