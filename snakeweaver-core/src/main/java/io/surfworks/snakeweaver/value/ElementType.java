package io.surfworks.snakeweaver.value;

/**
 * Element types of the tracing engine's value model.
 *
 * Declaration order is the promotion order: combining two types yields the later one.
 */
public enum ElementType {
    BOOL("bool"),
    INT64("int64"),
    FLOAT64("float64");

    private final String typeName;

    ElementType(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    public static ElementType promote(ElementType a, ElementType b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    /**
     * Promotion for arithmetic, where booleans behave as integers.
     */
    public static ElementType promoteArithmetic(ElementType a, ElementType b) {
        ElementType promoted = promote(a, b);
        return promoted == BOOL ? INT64 : promoted;
    }

    @Override
    public String toString() {
        return typeName;
    }
}
