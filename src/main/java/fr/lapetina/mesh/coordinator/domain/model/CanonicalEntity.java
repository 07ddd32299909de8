package fr.lapetina.mesh.coordinator.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Authoritative state of a synchronized entity. Immutable; the canonical
 * store swaps whole instances under the entity lock.
 *
 * @param appliedSequences highest applied sequence per origin, used to skip replays
 * @param deletedBy        write that tombstoned the entity, null when live
 * @param revision         incremented on every stored change
 */
public record CanonicalEntity(
        String id,
        String type,
        Map<String, FieldState> fields,
        VersionVector vector,
        Map<String, Long> appliedSequences,
        boolean tombstone,
        WriteStamp deletedBy,
        long revision
) {

    public CanonicalEntity {
        Objects.requireNonNull(id, "Entity ID is required");
        fields = Collections.unmodifiableMap(new TreeMap<>(fields != null ? fields : Map.of()));
        vector = vector != null ? vector : VersionVector.empty();
        appliedSequences = Map.copyOf(appliedSequences != null ? appliedSequences : Map.of());
    }

    public static CanonicalEntity empty(String id, String type) {
        return new CanonicalEntity(id, type, Map.of(), VersionVector.empty(), Map.of(), false, null, 0);
    }

    public boolean exists() {
        return revision > 0 && !tombstone;
    }

    public long appliedSequence(String origin) {
        return appliedSequences.getOrDefault(origin, 0L);
    }

    /**
     * Plain field values, in field-name order.
     */
    public Map<String, Object> values() {
        Map<String, Object> values = new LinkedHashMap<>();
        fields.forEach((name, state) -> values.put(name, state.value()));
        return values;
    }
}
