package io.surfworks.snakeweaver.analysis;

/**
 * Kinds of control-flow blocks that are converted to primitives.
 */
public enum BlockKind {
    CONDITIONAL("if statement"),
    COUNTED_LOOP("for loop"),
    CONDITIONAL_LOOP("while loop");

    private final String displayName;

    BlockKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Name used in user-facing diagnostics.
     */
    public String displayName() {
        return displayName;
    }
}
