package fr.lapetina.mesh.coordinator.sync;

import fr.lapetina.mesh.coordinator.domain.merge.MergeFunctionTable;
import fr.lapetina.mesh.coordinator.domain.model.CanonicalEntity;
import fr.lapetina.mesh.coordinator.domain.model.ConflictResolution;
import fr.lapetina.mesh.coordinator.domain.model.FieldState;
import fr.lapetina.mesh.coordinator.domain.model.FieldType;
import fr.lapetina.mesh.coordinator.domain.model.OfflineOperation;
import fr.lapetina.mesh.coordinator.domain.model.OperationKind;
import fr.lapetina.mesh.coordinator.domain.model.PendingReview;
import fr.lapetina.mesh.coordinator.domain.model.ResolutionStrategy;
import fr.lapetina.mesh.coordinator.domain.model.VersionVector;
import fr.lapetina.mesh.coordinator.domain.model.WriteStamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Computes the successor of a canonical entity for one operation.
 *
 * <p>Pure and stateless apart from the merge table: the same entity and
 * operation always produce the same result. Locking and storage are the
 * caller's job.
 *
 * <p>The causal past of an operation is its base vector plus every earlier
 * write of its own origin. When the canonical vector is covered by that past
 * the operation fast-forwards. Otherwise each touched field is merged through
 * the {@link MergeFunctionTable}; a field whose current writer is in the
 * operation's past is simply overwritten. A delete racing an update, in either
 * order, has no safe merge and is escalated.
 *
 * <p>Automatic merges yield the pointwise maximum of the merged vectors; the
 * resolver node's counter advances only for operator decisions.
 */
public final class ConflictResolver {

    private final MergeFunctionTable mergeTable;
    private final String resolverNodeId;

    public ConflictResolver(MergeFunctionTable mergeTable, String resolverNodeId) {
        this.mergeTable = mergeTable;
        this.resolverNodeId = resolverNodeId;
    }

    public MergeFunctionTable getMergeTable() {
        return mergeTable;
    }

    public String getResolverNodeId() {
        return resolverNodeId;
    }

    /**
     * Writes the operation has seen: its base vector plus the preceding
     * writes of its own origin.
     */
    public static VersionVector causalPast(OfflineOperation operation) {
        return operation.baseVector().advance(operation.originNode(), operation.sequence() - 1);
    }

    /**
     * Reconciles an operation with the current entity.
     *
     * @param current canonical entity, {@link CanonicalEntity#empty} if it never existed
     */
    public Decision resolve(CanonicalEntity current, OfflineOperation operation, Instant now) {
        VersionVector past = causalPast(operation);
        boolean concurrent = !current.vector().isCoveredBy(past);
        WriteStamp stamp = WriteStamp.of(operation);

        if (operation.kind() == OperationKind.DELETE) {
            if (!concurrentWriters(current, past).isEmpty()) {
                return Decision.escalate(PendingReview.Reason.DELETE_UPDATE_CONFLICT);
            }
            WriteStamp deletedBy = current.tombstone() ? WriteStamp.max(current.deletedBy(), stamp) : stamp;
            VersionVector vector = resultVector(current, operation, past);
            CanonicalEntity next = new CanonicalEntity(current.id(), typeOf(current, operation), Map.of(), vector,
                    recordApplied(current, operation), true, deletedBy, current.revision() + 1);
            return Decision.merged(next, resolution(current, operation, past, concurrent, Map.of(), vector, now));
        }

        if (current.tombstone() && !current.deletedBy().isCoveredBy(past)) {
            return Decision.escalate(PendingReview.Reason.DELETE_UPDATE_CONFLICT);
        }

        // A write made after seeing the delete starts the entity over
        Map<String, FieldState> fields = current.tombstone() ? new TreeMap<>() : new TreeMap<>(current.fields());
        Map<String, FieldType> fieldStrategies = new HashMap<>();
        operation.delta().forEach((field, value) -> {
            FieldType type = mergeTable.typeOf(typeOf(current, operation), field);
            FieldState existing = fields.get(field);
            boolean sawExisting = existing == null || existing.stamp().isCoveredBy(past);
            FieldState incoming = new FieldState(value, type, stamp);
            fields.put(field, mergeTable.functionFor(type).merge(existing, incoming, sawExisting));
            fieldStrategies.put(field, type);
        });

        VersionVector vector = resultVector(current, operation, past);
        CanonicalEntity next = new CanonicalEntity(current.id(), typeOf(current, operation), fields, vector,
                recordApplied(current, operation), false, null, current.revision() + 1);
        return Decision.merged(next, resolution(current, operation, past, concurrent, fieldStrategies, vector, now));
    }

    /**
     * Operator kept the canonical state: the operation is recorded as seen
     * and its data discarded.
     */
    public Decision keepCanonical(CanonicalEntity current, OfflineOperation operation, Instant now) {
        VersionVector past = causalPast(operation);
        VersionVector vector = manualVector(current, operation, past);
        CanonicalEntity next = new CanonicalEntity(current.id(), typeOf(current, operation), current.fields(), vector,
                recordApplied(current, operation), current.tombstone(), current.deletedBy(), current.revision() + 1);
        return Decision.merged(next, manualResolution(current, operation, Map.of(), vector, now));
    }

    /**
     * Operator chose the incoming operation: a delete tombstones the entity,
     * a create or update revives it and writes its fields over the current ones.
     */
    public Decision applyIncoming(CanonicalEntity current, OfflineOperation operation, Instant now) {
        VersionVector past = causalPast(operation);
        VersionVector vector = manualVector(current, operation, past);
        WriteStamp stamp = WriteStamp.of(operation);

        if (operation.kind() == OperationKind.DELETE) {
            CanonicalEntity next = new CanonicalEntity(current.id(), typeOf(current, operation), Map.of(), vector,
                    recordApplied(current, operation), true, stamp, current.revision() + 1);
            return Decision.merged(next, manualResolution(current, operation, Map.of(), vector, now));
        }

        Map<String, FieldState> fields = current.tombstone() ? new TreeMap<>() : new TreeMap<>(current.fields());
        Map<String, FieldType> fieldStrategies = new HashMap<>();
        operation.delta().forEach((field, value) -> {
            FieldType type = mergeTable.typeOf(typeOf(current, operation), field);
            fields.put(field, mergeTable.functionFor(type)
                    .merge(fields.get(field), new FieldState(value, type, stamp), true));
            fieldStrategies.put(field, type);
        });
        CanonicalEntity next = new CanonicalEntity(current.id(), typeOf(current, operation), fields, vector,
                recordApplied(current, operation), false, null, current.revision() + 1);
        return Decision.merged(next, manualResolution(current, operation, fieldStrategies, vector, now));
    }

    /**
     * Records the operation's sequence without changing data, so a replay of
     * an escalated operation does not open a second review.
     */
    public CanonicalEntity markSeen(CanonicalEntity current, OfflineOperation operation) {
        return new CanonicalEntity(current.id(), typeOf(current, operation), current.fields(), current.vector(),
                recordApplied(current, operation), current.tombstone(), current.deletedBy(), current.revision() + 1);
    }

    /**
     * Pointwise maximum of the inputs. The resolver's own counter is only
     * carried here, so the result of a set of merges is the same whatever
     * order they were applied in.
     */
    private static VersionVector resultVector(CanonicalEntity current, OfflineOperation operation,
                                              VersionVector past) {
        return current.vector().merge(past).advance(operation.originNode(), operation.sequence());
    }

    /**
     * A manual decision is a write of the resolver itself and advances its counter.
     */
    private VersionVector manualVector(CanonicalEntity current, OfflineOperation operation, VersionVector past) {
        return resultVector(current, operation, past).increment(resolverNodeId);
    }

    private ConflictResolution resolution(CanonicalEntity current, OfflineOperation operation, VersionVector past,
                                          boolean concurrent, Map<String, FieldType> fieldStrategies,
                                          VersionVector vector, Instant now) {
        List<String> merged = new ArrayList<>();
        merged.add(operation.id());
        if (concurrent) {
            merged.addAll(concurrentWriters(current, past));
        }
        return new ConflictResolution(
                current.id(),
                merged,
                concurrent ? ResolutionStrategy.FIELD_MERGE : ResolutionStrategy.FAST_FORWARD,
                fieldStrategies,
                vector,
                resolverNodeId,
                now
        );
    }

    private ConflictResolution manualResolution(CanonicalEntity current, OfflineOperation operation,
                                                Map<String, FieldType> fieldStrategies,
                                                VersionVector vector, Instant now) {
        return new ConflictResolution(current.id(), List.of(operation.id()), ResolutionStrategy.MANUAL,
                fieldStrategies, vector, resolverNodeId, now);
    }

    /**
     * Ids of the writes behind current field values that the operation did not see.
     */
    private static List<String> concurrentWriters(CanonicalEntity current, VersionVector past) {
        TreeSet<String> ids = new TreeSet<>();
        current.fields().values().forEach(state -> {
            if (state.stamp() != null && !state.stamp().isCoveredBy(past)) {
                ids.add(state.stamp().operationId());
            }
        });
        return new ArrayList<>(ids);
    }

    private static Map<String, Long> recordApplied(CanonicalEntity current, OfflineOperation operation) {
        Map<String, Long> applied = new HashMap<>(current.appliedSequences());
        applied.merge(operation.originNode(), operation.sequence(), Math::max);
        return applied;
    }

    private static String typeOf(CanonicalEntity current, OfflineOperation operation) {
        return current.type() != null ? current.type() : operation.entityType();
    }

    /**
     * Outcome of reconciling one operation. Either {@code entity} and
     * {@code resolution} are set, or {@code escalation} is.
     */
    public record Decision(CanonicalEntity entity, ConflictResolution resolution, PendingReview.Reason escalation) {

        static Decision merged(CanonicalEntity entity, ConflictResolution resolution) {
            return new Decision(entity, resolution, null);
        }

        static Decision escalate(PendingReview.Reason reason) {
            return new Decision(null, null, reason);
        }

        public boolean isEscalated() {
            return escalation != null;
        }
    }
}
