package io.surfworks.snakeweaver.convert;

/**
 * States a supervised block passes through.
 *
 * <pre>
 * NOT_ATTEMPTED -> TRACING -> COMMITTED
 *                          -> FAILED_PRE_BIND  -> FALLBACK_EXECUTED
 *                          -> FAILED_POST_BIND -> FALLBACK_EXECUTED
 * NOT_ATTEMPTED -> FALLBACK_EXECUTED (unconvertible iteration domain)
 * </pre>
 */
public enum SupervisorState {
    NOT_ATTEMPTED,
    TRACING,
    COMMITTED,
    FAILED_PRE_BIND,
    FAILED_POST_BIND,
    FALLBACK_EXECUTED;

    public boolean isTerminal() {
        return this == COMMITTED || this == FALLBACK_EXECUTED;
    }
}
