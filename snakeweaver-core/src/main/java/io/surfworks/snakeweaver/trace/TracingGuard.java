package io.surfworks.snakeweaver.trace;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Process-wide guard allowing at most one active tracing session.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (TracingSession session = TracingGuard.enter()) {
 *     Tracer x = session.graph().input(3L);
 *     ...
 * }
 * // TracingGuard.isActive() is false again, even if the block threw
 * }</pre>
 */
public final class TracingGuard {

    private static final Logger LOGGER = Logger.getLogger(TracingGuard.class.getName());

    private static final AtomicBoolean ACTIVE = new AtomicBoolean(false);

    private TracingGuard() {}

    /**
     * Opens a new session with an empty trace graph.
     *
     * @throws SessionReentryException if a session is already active
     */
    public static TracingSession enter() {
        if (!ACTIVE.compareAndSet(false, true)) {
            throw new SessionReentryException();
        }
        LOGGER.fine("Tracing session entered");
        return new TracingSession();
    }

    public static boolean isActive() {
        return ACTIVE.get();
    }

    static void release() {
        ACTIVE.set(false);
        LOGGER.fine("Tracing session exited");
    }
}
