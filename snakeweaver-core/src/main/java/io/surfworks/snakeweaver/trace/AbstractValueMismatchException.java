package io.surfworks.snakeweaver.trace;

import io.surfworks.snakeweaver.value.AbstractValue;

/**
 * Thrown when a primitive's results do not have the abstract values it was bound with.
 */
public class AbstractValueMismatchException extends RuntimeException {

    private final int position;
    private final AbstractValue expected;
    private final AbstractValue actual;

    public AbstractValueMismatchException(String primitive, int position, AbstractValue expected, AbstractValue actual) {
        super(String.format("Result %d of %s has abstract value %s, expected %s",
                position, primitive, actual.describe(), expected.describe()));
        this.position = position;
        this.expected = expected;
        this.actual = actual;
    }

    public int getPosition() {
        return position;
    }

    public AbstractValue getExpected() {
        return expected;
    }

    public AbstractValue getActual() {
        return actual;
    }
}
