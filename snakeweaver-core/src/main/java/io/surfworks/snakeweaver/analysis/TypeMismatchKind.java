package io.surfworks.snakeweaver.analysis;

/**
 * Distinguishes the ways a carried variable's type can be rejected.
 */
public enum TypeMismatchKind {
    /** The value on entry is not a number, boolean or array. */
    UNREPRESENTABLE_INITIAL,
    /** The value on entry differs from a value produced inside the block. */
    WRONG_TYPE,
    /** Two branches of a conditional produce different types. */
    BRANCH_MISMATCH
}
