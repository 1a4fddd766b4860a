package io.surfworks.snakeweaver.analysis;

/**
 * A rejected carried variable, before it is turned into an exception.
 */
public record TypeMismatch(String variable, TypeMismatchKind kind, String message) {}
