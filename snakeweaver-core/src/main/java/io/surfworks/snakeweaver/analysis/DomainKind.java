package io.surfworks.snakeweaver.analysis;

/**
 * Classification of a for-loop's iteration source.
 */
public enum DomainKind {
    STATIC_RANGE(true),
    DYNAMIC_RANGE(true),
    HOMOGENEOUS_SEQUENCE(true),
    HETEROGENEOUS_SEQUENCE(false),
    OPAQUE_ITERABLE(false);

    private final boolean convertible;

    DomainKind(boolean convertible) {
        this.convertible = convertible;
    }

    /**
     * True if the loop can become a counted loop primitive.
     */
    public boolean isConvertible() {
        return convertible;
    }
}
