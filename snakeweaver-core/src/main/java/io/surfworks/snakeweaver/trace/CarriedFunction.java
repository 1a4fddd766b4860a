package io.surfworks.snakeweaver.trace;

import java.util.List;

/**
 * Maps the values of the carried variables on entry to their values on exit.
 */
@FunctionalInterface
public interface CarriedFunction {
    List<Object> apply(List<Object> carried);
}
