package io.surfworks.snakeweaver.value;

import java.util.Objects;

/**
 * Result of the {@code range} builtin. Each bound is a Long or an integer Tracer.
 */
public record RangeValue(Object start, Object stop, Object step) {

    public RangeValue {
        checkBound(start, "start");
        checkBound(stop, "stop");
        checkBound(step, "step");
        if (step instanceof Long s && s == 0L) {
            throw new IllegalArgumentException("range() arg 3 must not be zero");
        }
    }

    private static void checkBound(Object bound, String name) {
        Objects.requireNonNull(bound, name);
        if (bound instanceof Long) {
            return;
        }
        if (bound instanceof Tracer t && t.aval().kind() == ValueKind.NUMERIC_SCALAR
                && t.aval().elementType() == ElementType.INT64) {
            return;
        }
        throw new IllegalArgumentException("range() " + name + " must be an integer, got " + Values.typeName(bound));
    }

    public boolean isStatic() {
        return !(start instanceof Tracer) && !(stop instanceof Tracer) && !(step instanceof Tracer);
    }

    /**
     * Number of elements, computed from the concrete bounds.
     */
    public long length() {
        long lo = (Long) Values.concrete(start);
        long hi = (Long) Values.concrete(stop);
        long st = (Long) Values.concrete(step);
        if (st > 0) {
            return lo >= hi ? 0 : (hi - lo + st - 1) / st;
        }
        return lo <= hi ? 0 : (lo - hi - st - 1) / -st;
    }

    /**
     * Element at position k, from the concrete bounds.
     */
    public long get(long k) {
        return (Long) Values.concrete(start) + k * (Long) Values.concrete(step);
    }

    @Override
    public String toString() {
        if (step instanceof Long s && s == 1L) {
            return "range(" + start + ", " + stop + ")";
        }
        return "range(" + start + ", " + stop + ", " + step + ")";
    }
}
