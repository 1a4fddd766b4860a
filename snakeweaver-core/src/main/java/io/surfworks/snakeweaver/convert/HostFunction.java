package io.surfworks.snakeweaver.convert;

import java.util.List;

/**
 * A function outside the converted program, callable by name.
 *
 * <p>Arguments may be traced values while a session is tracing.
 */
@FunctionalInterface
public interface HostFunction {

    Object call(List<Object> args);
}
