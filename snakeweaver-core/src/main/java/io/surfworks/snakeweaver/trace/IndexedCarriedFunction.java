package io.surfworks.snakeweaver.trace;

import java.util.List;

/**
 * Loop body of a counted loop: (iteration position, carried values) to carried values.
 */
@FunctionalInterface
public interface IndexedCarriedFunction {
    List<Object> apply(Object index, List<Object> carried);
}
