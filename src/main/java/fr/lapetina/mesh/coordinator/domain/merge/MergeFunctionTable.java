package fr.lapetina.mesh.coordinator.domain.merge;

import fr.lapetina.mesh.coordinator.domain.model.FieldState;
import fr.lapetina.mesh.coordinator.domain.model.FieldType;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps entity fields to their merge type and merge function.
 *
 * Field types are declared as {@code "entityType.field"} or, for every
 * entity type, as a bare {@code "field"}. Undeclared fields are SCALAR.
 */
public final class MergeFunctionTable {

    private final Map<String, FieldType> fieldTypes = new ConcurrentHashMap<>();
    private final Map<FieldType, FieldMergeFunction> functions = new EnumMap<>(FieldType.class);

    public MergeFunctionTable(Map<String, String> declaredTypes) {
        functions.put(FieldType.SCALAR, new LastWriterWinsMerge());
        functions.put(FieldType.SET, new SetUnionMerge());
        functions.put(FieldType.COUNTER, new MaxCounterMerge());
        replaceTypes(declaredTypes);
    }

    public MergeFunctionTable() {
        this(Map.of());
    }

    /**
     * Replaces the declared field types. Used on configuration reload.
     */
    public void replaceTypes(Map<String, String> declaredTypes) {
        Map<String, FieldType> parsed = new ConcurrentHashMap<>();
        if (declaredTypes != null) {
            declaredTypes.forEach((field, type) ->
                    parsed.put(field, FieldType.valueOf(type.trim().toUpperCase(Locale.ROOT))));
        }
        fieldTypes.clear();
        fieldTypes.putAll(parsed);
    }

    public void declare(String field, FieldType type) {
        fieldTypes.put(field, type);
    }

    public FieldType typeOf(String entityType, String field) {
        FieldType specific = fieldTypes.get(entityType + "." + field);
        if (specific != null) {
            return specific;
        }
        return fieldTypes.getOrDefault(field, FieldType.SCALAR);
    }

    public FieldMergeFunction functionFor(FieldType type) {
        return functions.get(type);
    }

    /**
     * Checks every field of a delta against the merge function of its type.
     *
     * @throws IllegalArgumentException naming the first field that cannot be merged
     */
    public void validate(String entityType, Map<String, Object> delta) {
        delta.forEach((field, value) -> {
            try {
                functionFor(typeOf(entityType, field)).validate(value);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Field '" + field + "': " + e.getMessage(), e);
            }
        });
    }

    /**
     * Merges an incoming field write into the current state using the field's declared type.
     */
    public FieldState merge(String entityType, String field, FieldState current, FieldState incoming,
                            boolean incomingSawCurrent) {
        return functionFor(typeOf(entityType, field)).merge(current, incoming, incomingSawCurrent);
    }
}
