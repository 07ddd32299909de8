package fr.lapetina.mesh.coordinator.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A write captured while disconnected, before it is sequenced.
 *
 * @param originNode  node that produced the write, defaults to the local node
 * @param sequence    explicit per-origin sequence for forwarded writes, or null to assign the next one
 * @param baseVector  version vector observed when the write was made
 * @param lamport     logical timestamp, or 0 to let the queue assign one
 */
public record OfflineWrite(
        String originNode,
        String entityId,
        String entityType,
        OperationKind kind,
        Map<String, Object> delta,
        Long sequence,
        VersionVector baseVector,
        long lamport
) {

    public OfflineWrite {
        Objects.requireNonNull(entityId, "Entity ID is required");
        Objects.requireNonNull(kind, "Operation kind is required");
        if (lamport < 0) {
            throw new IllegalArgumentException("Logical timestamp must not be negative: " + lamport);
        }
        if (sequence != null && sequence < 1) {
            throw new IllegalArgumentException("Sequence must be positive: " + sequence);
        }
        entityType = entityType != null ? entityType : "entity";
        delta = delta != null ? Collections.unmodifiableMap(new LinkedHashMap<>(delta)) : Map.of();
        baseVector = baseVector != null ? baseVector : VersionVector.empty();
    }

    public static OfflineWrite create(String entityId, String entityType, Map<String, Object> fields) {
        return new OfflineWrite(null, entityId, entityType, OperationKind.CREATE, fields, null, null, 0);
    }

    public static OfflineWrite update(String entityId, String entityType, Map<String, Object> delta, VersionVector base) {
        return new OfflineWrite(null, entityId, entityType, OperationKind.UPDATE, delta, null, base, 0);
    }

    public static OfflineWrite delete(String entityId, String entityType, VersionVector base) {
        return new OfflineWrite(null, entityId, entityType, OperationKind.DELETE, Map.of(), null, base, 0);
    }

    public OfflineWrite fromOrigin(String origin, long seq) {
        return new OfflineWrite(origin, entityId, entityType, kind, delta, seq, baseVector, lamport);
    }

    public OfflineWrite withLamport(long timestamp) {
        return new OfflineWrite(originNode, entityId, entityType, kind, delta, sequence, baseVector, timestamp);
    }
}
