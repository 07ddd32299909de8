package fr.lapetina.mesh.coordinator.domain.routing;

import fr.lapetina.mesh.coordinator.domain.model.HealthRecord;
import fr.lapetina.mesh.coordinator.domain.model.NodeStatus;

import java.util.Optional;

/**
 * Read-only view of node health used by routing policies.
 */
public interface HealthView {

    /**
     * Current status, or empty for unknown nodes.
     */
    Optional<NodeStatus> status(String nodeId);

    /**
     * Latest health record. Never null; unknown nodes get an empty record.
     */
    HealthRecord health(String nodeId);

    /**
     * True if the node is ONLINE and its success rate is above the healthy threshold.
     */
    boolean isHealthy(String nodeId);
}
