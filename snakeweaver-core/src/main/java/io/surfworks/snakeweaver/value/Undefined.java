package io.surfworks.snakeweaver.value;

/**
 * Placeholder for a carried variable that has no binding when a block is entered.
 */
public enum Undefined {
    INSTANCE;

    @Override
    public String toString() {
        return "<undefined>";
    }
}
