package fr.lapetina.mesh.coordinator.offline;

import java.util.Collection;
import java.util.Optional;

/**
 * Receives a catch-up request once the writes of one origin have been drained,
 * so the origin can pull the canonical state of the entities it touched.
 */
@FunctionalInterface
public interface CatchUpHandler {

    /**
     * @return id of the submitted catch-up task, or empty if it could not be submitted
     */
    Optional<String> submitCatchUp(String originNode, long lastSequence, Collection<String> entityIds);
}
