package io.surfworks.snakeweaver.trace;

import java.util.List;

/**
 * Loop condition evaluated on the carried values before every iteration.
 */
@FunctionalInterface
public interface CarriedPredicate {
    Object test(List<Object> carried);
}
