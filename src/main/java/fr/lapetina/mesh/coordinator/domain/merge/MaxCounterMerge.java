package fr.lapetina.mesh.coordinator.domain.merge;

import fr.lapetina.mesh.coordinator.domain.model.FieldState;
import fr.lapetina.mesh.coordinator.domain.model.FieldType;
import fr.lapetina.mesh.coordinator.domain.model.WriteStamp;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Counter fields, merged by maximum on every write.
 *
 * Integral values are stored as {@code Long}, others as {@code Double}.
 */
public final class MaxCounterMerge implements FieldMergeFunction {

    @Override
    public FieldType getType() {
        return FieldType.COUNTER;
    }

    @Override
    public FieldState merge(FieldState current, FieldState incoming, boolean incomingSawCurrent) {
        Number value = normalize(incoming.value());
        WriteStamp stamp = incoming.stamp();
        if (current != null) {
            value = max(normalize(current.value()), value);
            stamp = WriteStamp.max(current.stamp(), incoming.stamp());
        }
        return new FieldState(value, FieldType.COUNTER, stamp);
    }

    @Override
    public void validate(Object value) {
        normalize(value);
    }

    /**
     * @throws IllegalArgumentException if the value is not a number, not finite, or an integer outside the long range
     */
    static Number normalize(Object value) {
        if (value == null) {
            return 0L;
        }
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Counter value must be numeric: " + value);
        }
        Number number = (Number) value;
        if (number instanceof BigInteger) {
            return exactLong(new BigDecimal((BigInteger) number));
        }
        if (number instanceof BigDecimal) {
            BigDecimal decimal = (BigDecimal) number;
            if (decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0) {
                return exactLong(decimal);
            }
            return finite(decimal.doubleValue(), decimal);
        }
        if (number instanceof Double || number instanceof Float) {
            double d = finite(number.doubleValue(), number);
            if (d == Math.rint(d) && Math.abs(d) < Long.MAX_VALUE) {
                return (long) d;
            }
            return d;
        }
        return number.longValue();
    }

    private static long exactLong(BigDecimal value) {
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Counter value out of range: " + value, e);
        }
    }

    private static double finite(double value, Number original) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Counter value must be finite: " + original);
        }
        return value;
    }

    private static Number max(Number a, Number b) {
        if (a instanceof Long && b instanceof Long) {
            return Math.max(a.longValue(), b.longValue());
        }
        return a.doubleValue() >= b.doubleValue() ? a : b;
    }
}
