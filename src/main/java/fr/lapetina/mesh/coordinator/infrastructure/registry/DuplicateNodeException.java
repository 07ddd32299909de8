package fr.lapetina.mesh.coordinator.infrastructure.registry;

/**
 * Thrown when a node registers with an id that is already taken.
 */
public class DuplicateNodeException extends RuntimeException {

    private final String nodeId;

    public DuplicateNodeException(String nodeId) {
        super("Node already registered: " + nodeId);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
