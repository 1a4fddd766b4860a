package io.surfworks.snakeweaver.trace;

import io.surfworks.snakeweaver.ConversionException;
import io.surfworks.snakeweaver.ast.AgAst.BinaryOperator;
import io.surfworks.snakeweaver.trace.PrimitiveResult.Committed;
import io.surfworks.snakeweaver.trace.PrimitiveResult.PostBindFailure;
import io.surfworks.snakeweaver.trace.PrimitiveResult.PreBindFailure;
import io.surfworks.snakeweaver.value.NdArray;
import io.surfworks.snakeweaver.value.Tracer;
import io.surfworks.snakeweaver.value.Undefined;
import io.surfworks.snakeweaver.value.Values;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Tests for {@link RecordingTracingEngine}. */
@DisplayName("RecordingTracingEngine")
class RecordingTracingEngineTest {

    private final RecordingTracingEngine engine = new RecordingTracingEngine();

    @AfterEach
    void cleanup() {
        assertFalse(TracingGuard.isActive());
    }

    private static List<Object> operands(Object... values) {
        List<Object> list = new ArrayList<>();
        for (Object value : values) {
            list.add(value);
        }
        return list;
    }

    @Nested
    @DisplayName("select")
    class Select {

        @Test
        @DisplayName("commits the branch chosen by the predicate's concrete value")
        void commits() {
            try (TracingSession session = TracingGuard.enter()) {
                TraceOps ops = new TraceOps(session);
                Tracer predicate = session.graph().input(false);
                Tracer x = session.graph().input(5L);
                PrimitiveResult result = engine.select(session, predicate,
                        params -> List.of(ops.binary(BinaryOperator.ADD, params.get(0), 1L)),
                        params -> List.of(ops.binary(BinaryOperator.SUB, params.get(0), 1L)),
                        operands(x));

                Committed committed = assertInstanceOf(Committed.class, result);
                assertEquals(4L, Values.concrete(committed.results().get(0)));
                assertEquals(1, session.graph().count("cond"));
                assertEquals(2, committed.node().regions().size());
            }
        }

        @Test
        @DisplayName("branches producing different shapes fail after binding")
        void shapeMismatchIsPostBind() {
            try (TracingSession session = TracingGuard.enter()) {
                TraceOps ops = new TraceOps(session);
                Tracer predicate = session.graph().input(true);
                Tracer arr = session.graph().input(NdArray.ofLongs(1, 2));
                PrimitiveResult result = engine.select(session, predicate,
                        params -> List.of(ops.kron(params.get(0), params.get(0))),
                        params -> params,
                        operands(arr));

                PostBindFailure failure = assertInstanceOf(PostBindFailure.class, result);
                assertInstanceOf(AbstractValueMismatchException.class, failure.cause());
                assertTrue(session.graph().contains("cond"));

                engine.retract(session, failure.node());
                assertFalse(session.graph().contains("cond"));
            }
        }

        @Test
        @DisplayName("undefined operands are allowed and left out of the node")
        void undefinedOperands() {
            try (TracingSession session = TracingGuard.enter()) {
                Tracer predicate = session.graph().input(true);
                PrimitiveResult result = engine.select(session, predicate,
                        params -> List.of(1L), params -> List.of(2L), operands(Undefined.INSTANCE));

                Committed committed = assertInstanceOf(Committed.class, result);
                assertEquals(1L, Values.concrete(committed.results().get(0)));
                assertEquals(List.of(predicate), committed.node().operands());
            }
        }
    }

    @Nested
    @DisplayName("forLoop")
    class ForLoop {

        @Test
        @DisplayName("traces the body once and computes the remaining iterations concretely")
        void sumOverBounds() {
            try (TracingSession session = TracingGuard.enter()) {
                TraceOps ops = new TraceOps(session);
                List<Integer> calls = new ArrayList<>();
                PrimitiveResult result = engine.forLoop(session, new LoopSource.Bounds(0L, 4L, 1L),
                        (index, params) -> {
                            calls.add(calls.size());
                            return List.of(ops.binary(BinaryOperator.ADD, params.get(0), index));
                        },
                        operands(0L));

                Committed committed = assertInstanceOf(Committed.class, result);
                assertEquals(6L, Values.concrete(committed.results().get(0)));
                assertEquals(4, calls.size());
                assertEquals(1, session.graph().count("for_loop"));
                assertEquals(1, session.graph().count("add"), "only the traced iteration records nodes");
            }
        }

        @Test
        @DisplayName("zero iterations bind without calling the body")
        void emptyDomain() {
            try (TracingSession session = TracingGuard.enter()) {
                PrimitiveResult result = engine.forLoop(session, new LoopSource.Bounds(3L, 3L, 1L),
                        (index, params) -> {
                            throw new AssertionError("body must not run");
                        },
                        operands(7L));

                Committed committed = assertInstanceOf(Committed.class, result);
                assertEquals(7L, Values.concrete(committed.results().get(0)));
            }
        }

        @Test
        @DisplayName("a body failure while tracing leaves the graph untouched")
        void preBindFailure() {
            try (TracingSession session = TracingGuard.enter()) {
                PrimitiveResult result = engine.forLoop(session, new LoopSource.Bounds(0L, 2L, 1L),
                        (index, params) -> {
                            throw new IllegalArgumentException("cannot trace");
                        },
                        operands(0L));

                PreBindFailure failure = assertInstanceOf(PreBindFailure.class, result);
                assertEquals("cannot trace", failure.cause().getMessage());
                assertTrue(session.graph().nodes().isEmpty());
            }
        }

        @Test
        @DisplayName("an undefined carried value is rejected before tracing")
        void undefinedOperand() {
            try (TracingSession session = TracingGuard.enter()) {
                PrimitiveResult result = engine.forLoop(session, new LoopSource.Bounds(0L, 2L, 1L),
                        (index, params) -> params, operands(Undefined.INSTANCE));
                assertInstanceOf(PreBindFailure.class, result);
            }
        }

        @Test
        @DisplayName("conversion errors from the body propagate")
        void conversionErrorsPropagate() {
            try (TracingSession session = TracingGuard.enter()) {
                assertThrows(ConversionException.class, () -> engine.forLoop(session,
                        new LoopSource.Bounds(0L, 2L, 1L),
                        (index, params) -> {
                            throw new ConversionException("fatal");
                        },
                        operands(0L)));
                assertTrue(session.graph().nodes().isEmpty());
            }
        }

        @Test
        @DisplayName("iterating the rows of an array")
        void sequenceSource() {
            try (TracingSession session = TracingGuard.enter()) {
                TraceOps ops = new TraceOps(session);
                NdArray values = NdArray.ofLongs(2, 3, 4);
                PrimitiveResult result = engine.forLoop(session, new LoopSource.Sequence(values),
                        (index, params) -> List.of(ops.binary(BinaryOperator.ADD, params.get(0),
                                ops.index(values, index))),
                        operands(0L));

                Committed committed = assertInstanceOf(Committed.class, result);
                assertEquals(9L, Values.concrete(committed.results().get(0)));
                assertTrue(session.graph().contains("dynamic_index"));
            }
        }
    }

    @Nested
    @DisplayName("whileLoop")
    class WhileLoop {

        @Test
        @DisplayName("a carried value that changes shape fails after binding")
        void shapeChangeIsPostBind() {
            try (TracingSession session = TracingGuard.enter()) {
                TraceOps ops = new TraceOps(session);
                Tracer arr = session.graph().input(NdArray.ofLongs(1, 2));
                PrimitiveResult result = engine.whileLoop(session,
                        params -> ops.compare(io.surfworks.snakeweaver.ast.AgAst.CompareOperator.LT,
                                ops.len(params.get(0)), 16L),
                        params -> List.of(ops.kron(params.get(0), params.get(0))),
                        operands(arr));

                PostBindFailure failure = assertInstanceOf(PostBindFailure.class, result);
                assertEquals("while_loop", failure.node().primitive());
            }
        }

        @Test
        @DisplayName("the iteration bound turns a runaway loop into a failure")
        void iterationBound() {
            RecordingTracingEngine bounded = new RecordingTracingEngine(10);
            try (TracingSession session = TracingGuard.enter()) {
                PrimitiveResult result = bounded.whileLoop(session, params -> true, params -> params, operands(1L));

                PostBindFailure failure = assertInstanceOf(PostBindFailure.class, result);
                assertTrue(failure.cause().getMessage().contains("exceeded 10 iterations"));
            }
        }

        @Test
        @DisplayName("counts down to zero")
        void countdown() {
            try (TracingSession session = TracingGuard.enter()) {
                TraceOps ops = new TraceOps(session);
                Tracer n = session.graph().input(3L);
                PrimitiveResult result = engine.whileLoop(session,
                        params -> ops.compare(io.surfworks.snakeweaver.ast.AgAst.CompareOperator.GT, params.get(0), 0L),
                        params -> List.of(ops.binary(BinaryOperator.SUB, params.get(0), 1L)),
                        operands(n));

                Committed committed = assertInstanceOf(Committed.class, result);
                assertEquals(0L, Values.concrete(committed.results().get(0)));
                assertEquals(2, committed.node().regions().size());
            }
        }

        @Test
        @DisplayName("rejects a non-positive iteration bound")
        void invalidBound() {
            assertThrows(IllegalArgumentException.class, () -> new RecordingTracingEngine(0));
        }
    }

    @Test
    @DisplayName("logical primitives record nodes with concrete results")
    void logicalPrimitives() {
        try (TracingSession session = TracingGuard.enter()) {
            Tracer a = session.graph().input(true);
            Tracer b = session.graph().input(false);
            assertEquals(false, engine.logicalAnd(session, a, b).concrete());
            assertEquals(true, engine.logicalOr(session, a, b).concrete());
            assertEquals(false, engine.logicalNot(session, a).concrete());
            assertEquals(3, session.graph().nodes().size());
        }
    }
}
