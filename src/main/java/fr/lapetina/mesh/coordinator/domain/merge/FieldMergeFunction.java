package fr.lapetina.mesh.coordinator.domain.merge;

import fr.lapetina.mesh.coordinator.domain.model.FieldState;
import fr.lapetina.mesh.coordinator.domain.model.FieldType;

/**
 * Combines the canonical state of one field with an incoming write.
 *
 * Implementations must be deterministic and, for writes that did not see each
 * other, commutative: merging A then B yields the same state as B then A.
 */
public interface FieldMergeFunction {

    FieldType getType();

    /**
     * @param current          canonical field state, or null if never written
     * @param incoming         state carried by the incoming write
     * @param incomingSawCurrent true if the current value is in the causal past of the incoming write
     * @return the new canonical field state
     */
    FieldState merge(FieldState current, FieldState incoming, boolean incomingSawCurrent);

    /**
     * Checks a written value before it is accepted for later merging.
     *
     * @throws IllegalArgumentException if this function cannot merge the value
     */
    default void validate(Object value) {
    }
}
