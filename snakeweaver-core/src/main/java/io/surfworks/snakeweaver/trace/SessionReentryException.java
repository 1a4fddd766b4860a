package io.surfworks.snakeweaver.trace;

/**
 * Thrown when a tracing session is entered while another one is active.
 *
 * <p>Nesting sessions is a programming error. It is never caught internally.
 */
public class SessionReentryException extends IllegalStateException {

    public SessionReentryException() {
        super("Cannot nest tracing sessions: a tracing session is already active");
    }
}
