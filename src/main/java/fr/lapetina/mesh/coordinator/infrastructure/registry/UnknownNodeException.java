package fr.lapetina.mesh.coordinator.infrastructure.registry;

/**
 * Thrown when an operation names a node the registry does not know.
 */
public class UnknownNodeException extends RuntimeException {

    private final String nodeId;

    public UnknownNodeException(String nodeId) {
        super("Unknown node: " + nodeId);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
