package fr.lapetina.mesh.coordinator.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import fr.lapetina.mesh.coordinator.domain.model.OfflineWrite;
import fr.lapetina.mesh.coordinator.domain.model.OperationKind;
import fr.lapetina.mesh.coordinator.domain.model.VersionVector;

import java.util.Locale;
import java.util.Map;

/**
 * Body of {@code POST /offline/operations}. Forwarded writes carry their
 * origin node and sequence; local writes leave both empty.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OfflineWriteRequest {

    private String originNode;
    private Long sequence;
    private String entityId;
    private String entityType;
    private String kind;
    private Map<String, Object> delta;
    private Map<String, Long> baseVector;
    private long lamport;

    public String getOriginNode() { return originNode; }
    public void setOriginNode(String originNode) { this.originNode = originNode; }

    public Long getSequence() { return sequence; }
    public void setSequence(Long sequence) { this.sequence = sequence; }

    public String getEntityId() { return entityId; }
    public void setEntityId(String entityId) { this.entityId = entityId; }

    public String getEntityType() { return entityType; }
    public void setEntityType(String entityType) { this.entityType = entityType; }

    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }

    public Map<String, Object> getDelta() { return delta; }
    public void setDelta(Map<String, Object> delta) { this.delta = delta; }

    public Map<String, Long> getBaseVector() { return baseVector; }
    public void setBaseVector(Map<String, Long> baseVector) { this.baseVector = baseVector; }

    public long getLamport() { return lamport; }
    public void setLamport(long lamport) { this.lamport = lamport; }

    /**
     * @throws IllegalArgumentException if a required field is missing or invalid
     */
    public OfflineWrite toWrite() {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("Missing 'entityId' field");
        }
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Missing 'kind' field");
        }
        if ((originNode == null) != (sequence == null)) {
            throw new IllegalArgumentException("'originNode' and 'sequence' must be given together");
        }
        if (sequence != null && sequence < 1) {
            throw new IllegalArgumentException("'sequence' must be positive");
        }
        return new OfflineWrite(
                originNode,
                entityId,
                entityType,
                OperationKind.valueOf(kind.trim().toUpperCase(Locale.ROOT)),
                delta,
                sequence,
                VersionVector.of(baseVector),
                lamport
        );
    }
}
