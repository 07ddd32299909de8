package fr.lapetina.mesh.coordinator.infrastructure.store;

import fr.lapetina.mesh.coordinator.domain.model.OfflineOperation;
import fr.lapetina.mesh.coordinator.domain.model.OperationState;

import java.util.List;

/**
 * Append-only durable log of offline operations.
 *
 * Operations are never rewritten; a state change is appended as a marker
 * that refers to the operation id. Appends are atomic: after a crash an
 * entry is either fully present or absent.
 */
public interface OfflineLogStore extends AutoCloseable {

    void append(OfflineOperation operation);

    void appendState(String operationId, OperationState state);

    /**
     * Reads the whole log and folds markers into their operations.
     *
     * @return every logged operation with its latest state, in append order
     * @throws StoreCorruptionException if an entry is unreadable or a per-origin sequence has a gap
     */
    List<OfflineOperation> recover();

    @Override
    void close();
}
