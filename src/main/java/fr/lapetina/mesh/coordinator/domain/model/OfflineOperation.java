package fr.lapetina.mesh.coordinator.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A sequenced write from the durable offline log.
 */
public record OfflineOperation(
        String id,
        String originNode,
        long sequence,
        String entityId,
        String entityType,
        OperationKind kind,
        Map<String, Object> delta,
        VersionVector baseVector,
        long lamport,
        Instant capturedAt,
        OperationState state
) {

    public OfflineOperation {
        Objects.requireNonNull(id, "Operation ID is required");
        Objects.requireNonNull(originNode, "Origin node is required");
        Objects.requireNonNull(entityId, "Entity ID is required");
        Objects.requireNonNull(kind, "Operation kind is required");
        if (sequence < 1 || lamport < 0) {
            throw new IllegalArgumentException("Invalid sequence " + sequence + " or timestamp " + lamport + " for " + id);
        }
        delta = delta != null ? Collections.unmodifiableMap(new LinkedHashMap<>(delta)) : Map.of();
        baseVector = baseVector != null ? baseVector : VersionVector.empty();
        state = state != null ? state : OperationState.CAPTURED;
    }

    /**
     * Operation id derived from origin and sequence, stable across restarts.
     */
    public static String idFor(String originNode, long sequence) {
        return originNode + ":" + sequence;
    }

    public OfflineOperation withState(OperationState newState) {
        return new OfflineOperation(id, originNode, sequence, entityId, entityType, kind,
                delta, baseVector, lamport, capturedAt, newState);
    }
}
