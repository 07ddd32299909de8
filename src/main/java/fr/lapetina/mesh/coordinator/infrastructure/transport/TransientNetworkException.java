package fr.lapetina.mesh.coordinator.infrastructure.transport;

/**
 * A node could not be reached, or did not answer before the deadline.
 * The operation may succeed if retried.
 */
public class TransientNetworkException extends RuntimeException {

    private final String nodeId;
    private final boolean timeout;

    public TransientNetworkException(String nodeId, String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
        this.timeout = timeout;
    }

    public TransientNetworkException(String nodeId, String message) {
        this(nodeId, message, false, null);
    }

    public String getNodeId() {
        return nodeId;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
