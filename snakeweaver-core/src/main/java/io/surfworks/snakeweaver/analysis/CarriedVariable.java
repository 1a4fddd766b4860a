package io.surfworks.snakeweaver.analysis;

/**
 * A variable threaded into and out of a converted block.
 *
 * @param name                name of the variable
 * @param declaredBeforeBlock true if every path to the block assigns it
 * @param liveOnEntry         true if its value on entry can be observed, either
 *                            inside the block or after it on a path that skips
 *                            the assignments
 */
public record CarriedVariable(String name, boolean declaredBeforeBlock, boolean liveOnEntry) {}
