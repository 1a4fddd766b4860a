package io.surfworks.snakeweaver.value;

/**
 * Semantic type classes of values crossing a converted block.
 */
public enum ValueKind {
    NUMERIC_SCALAR,
    BOOLEAN,
    ARRAY,
    UNREPRESENTABLE;

    public boolean isRepresentable() {
        return this != UNREPRESENTABLE;
    }
}
