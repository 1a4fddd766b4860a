package io.surfworks.snakeweaver.analysis;

/**
 * Classification of an evaluated predicate.
 */
public enum PredicateValueKind {
    /** An eager value; the host branches on it. */
    STATIC,
    /** A traced value; the selection primitive is needed. */
    DYNAMIC
}
