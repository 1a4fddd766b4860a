package io.surfworks.snakeweaver.trace;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Tests for {@link TracingGuard}. */
@DisplayName("TracingGuard")
class TracingGuardTest {

    @AfterEach
    void cleanup() {
        assertFalse(TracingGuard.isActive(), "a test left a tracing session open");
    }

    @Test
    @DisplayName("entering marks the guard active until close")
    void enterAndClose() {
        try (TracingSession session = TracingGuard.enter()) {
            assertTrue(TracingGuard.isActive());
            assertFalse(session.isClosed());
        }
        assertFalse(TracingGuard.isActive());
    }

    @Test
    @DisplayName("a second session cannot be entered while one is active")
    void nestedEnterFails() {
        try (TracingSession ignored = TracingGuard.enter()) {
            SessionReentryException e = assertThrows(SessionReentryException.class, TracingGuard::enter);
            assertTrue(e.getMessage().contains("already active"));
            assertTrue(TracingGuard.isActive(), "the failed entry must not release the outer session");
        }
    }

    @Test
    @DisplayName("the guard is released when the body throws")
    void releasedOnException() {
        assertThrows(IllegalStateException.class, () -> {
            try (TracingSession ignored = TracingGuard.enter()) {
                throw new IllegalStateException("boom");
            }
        });
        assertFalse(TracingGuard.isActive());
    }

    @Test
    @DisplayName("closing twice releases once")
    void closeIsIdempotent() {
        TracingSession first = TracingGuard.enter();
        first.close();
        try (TracingSession second = TracingGuard.enter()) {
            first.close();
            assertTrue(TracingGuard.isActive(), "closing a stale session must not release the current one");
            assertFalse(second.isClosed());
        }
    }

    @Test
    @DisplayName("concrete scopes nest")
    void concreteScopes() {
        try (TracingSession session = TracingGuard.enter()) {
            assertFalse(session.isConcrete());
            try (TracingSession.ConcreteScope outer = session.concreteScope()) {
                try (TracingSession.ConcreteScope inner = session.concreteScope()) {
                    assertTrue(session.isConcrete());
                }
                assertTrue(session.isConcrete());
            }
            assertFalse(session.isConcrete());
        }
    }
}
