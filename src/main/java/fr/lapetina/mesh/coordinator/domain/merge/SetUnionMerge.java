package fr.lapetina.mesh.coordinator.domain.merge;

import fr.lapetina.mesh.coordinator.domain.model.FieldState;
import fr.lapetina.mesh.coordinator.domain.model.FieldType;
import fr.lapetina.mesh.coordinator.domain.model.WriteStamp;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Grow-only set fields, merged by union on every write.
 *
 * Values are kept as a list sorted by string form so the stored value does not
 * depend on arrival order.
 */
public final class SetUnionMerge implements FieldMergeFunction {

    private static final Comparator<Object> ELEMENT_ORDER =
            Comparator.comparing((Object element) -> String.valueOf(element))
                    .thenComparing(element -> element == null ? "" : element.getClass().getName());

    @Override
    public FieldType getType() {
        return FieldType.SET;
    }

    @Override
    public FieldState merge(FieldState current, FieldState incoming, boolean incomingSawCurrent) {
        Set<Object> union = new LinkedHashSet<>();
        if (current != null) {
            union.addAll(elements(current.value()));
        }
        union.addAll(elements(incoming.value()));
        List<Object> sorted = new ArrayList<>(union);
        sorted.sort(ELEMENT_ORDER);
        WriteStamp stamp = current != null ? WriteStamp.max(current.stamp(), incoming.stamp()) : incoming.stamp();
        return new FieldState(List.copyOf(sorted), FieldType.SET, stamp);
    }

    static Collection<?> elements(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream().filter(Objects::nonNull).toList();
        }
        return List.of(value);
    }
}
