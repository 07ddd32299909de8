package fr.lapetina.mesh.coordinator.domain.merge;

import fr.lapetina.mesh.coordinator.domain.model.FieldState;
import fr.lapetina.mesh.coordinator.domain.model.FieldType;

/**
 * Scalar fields. A causally newer write replaces the value; concurrent writes
 * keep the one with the greater (logical timestamp, node id) stamp.
 */
public final class LastWriterWinsMerge implements FieldMergeFunction {

    @Override
    public FieldType getType() {
        return FieldType.SCALAR;
    }

    @Override
    public FieldState merge(FieldState current, FieldState incoming, boolean incomingSawCurrent) {
        if (current == null || incomingSawCurrent) {
            return new FieldState(incoming.value(), FieldType.SCALAR, incoming.stamp());
        }
        return incoming.stamp().compareTo(current.stamp()) > 0
                ? new FieldState(incoming.value(), FieldType.SCALAR, incoming.stamp())
                : current;
    }
}
