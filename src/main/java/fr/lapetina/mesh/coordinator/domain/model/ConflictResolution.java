package fr.lapetina.mesh.coordinator.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Record of how an operation was reconciled with canonical state.
 *
 * @param mergedOperationIds the incoming operation followed by the concurrent writes it was merged with
 * @param fieldStrategies    merge type applied to each touched field
 */
public record ConflictResolution(
        String entityId,
        List<String> mergedOperationIds,
        ResolutionStrategy strategy,
        Map<String, FieldType> fieldStrategies,
        VersionVector resultVector,
        String resolvedBy,
        Instant resolvedAt
) {

    public ConflictResolution {
        mergedOperationIds = List.copyOf(mergedOperationIds);
        fieldStrategies = Map.copyOf(fieldStrategies);
    }
}
