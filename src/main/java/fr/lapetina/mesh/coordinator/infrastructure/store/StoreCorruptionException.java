package fr.lapetina.mesh.coordinator.infrastructure.store;

/**
 * Durable state cannot be trusted: an unreadable entry, a sequence gap or a
 * marker for an unknown operation. Synchronization halts until an operator
 * repairs the store.
 */
public class StoreCorruptionException extends RuntimeException {

    private final String location;

    public StoreCorruptionException(String location, String message) {
        super(message + " (" + location + ")");
        this.location = location;
    }

    public StoreCorruptionException(String location, String message, Throwable cause) {
        super(message + " (" + location + ")", cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
