package io.surfworks.snakeweaver.analysis;

/**
 * Classification of a conditional's predicate expression at conversion time.
 */
public enum PredicateKind {
    /** A boolean literal; only the taken branch is emitted. */
    STATIC_CONSTANT,
    /** Known only when the callable runs. */
    RUNTIME
}
