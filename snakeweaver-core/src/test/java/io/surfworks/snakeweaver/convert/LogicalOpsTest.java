package io.surfworks.snakeweaver.convert;

import io.surfworks.snakeweaver.trace.RecordingTracingEngine;
import io.surfworks.snakeweaver.trace.TraceOps;
import io.surfworks.snakeweaver.value.NdArray;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests for {@link LogicalOps}. */
@DisplayName("LogicalOps")
class LogicalOpsTest {

    private final LogicalOps logical = new LogicalOps(new RecordingTracingEngine(), TraceOps.eager());

    static Stream<Object> hostObjects() {
        return Stream.of("text", new ArrayList<>(List.of(1L, "a")), Map.of("key", 1L), NdArray.ofLongs(7));
    }

    @ParameterizedTest
    @MethodSource("hostObjects")
    @DisplayName("a true left operand of and returns the right operand itself")
    void andReturnsRight(Object value) {
        assertSame(value, logical.and(true, () -> value));
    }

    @ParameterizedTest
    @MethodSource("hostObjects")
    @DisplayName("a false left operand of or returns the right operand itself")
    void orReturnsRight(Object value) {
        assertSame(value, logical.or(false, () -> value));
    }

    @ParameterizedTest
    @MethodSource("hostObjects")
    @DisplayName("not of a host object is a Boolean")
    void notIsBoolean(Object value) {
        assertEquals(Boolean.FALSE, logical.not(value));
    }

    @Test
    @DisplayName("a short-circuited right operand is never evaluated")
    void shortCircuit() {
        assertEquals(0L, logical.and(0L, () -> {
            throw new AssertionError("right operand evaluated");
        }));
        assertEquals("x", logical.or("x", () -> {
            throw new AssertionError("right operand evaluated");
        }));
    }

    @Test
    @DisplayName("not of an eager array follows host truth rules")
    void notOfArray() {
        assertEquals(Boolean.TRUE, logical.not(NdArray.ofLongs(0)));
        assertEquals(Boolean.TRUE, logical.not(new ArrayList<>()));
        assertThrows(IllegalArgumentException.class, () -> logical.not(NdArray.ofLongs(0, 1)));
    }
}
