package io.surfworks.snakeweaver.value;

import java.util.Objects;

/**
 * Result of the {@code enumerate} builtin: pairs of (offset + position, element).
 */
public record EnumerateValue(Object iterable, long start) {

    public EnumerateValue {
        Objects.requireNonNull(iterable, "iterable");
    }

    @Override
    public String toString() {
        return "enumerate(" + Values.repr(iterable) + ", " + start + ")";
    }
}
