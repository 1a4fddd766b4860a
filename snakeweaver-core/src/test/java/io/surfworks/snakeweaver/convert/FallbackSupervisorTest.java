package io.surfworks.snakeweaver.convert;

import io.surfworks.snakeweaver.analysis.AnalysisException;
import io.surfworks.snakeweaver.analysis.BlockKind;
import io.surfworks.snakeweaver.analysis.CarriedTypeMismatchException;
import io.surfworks.snakeweaver.analysis.TypeMismatch;
import io.surfworks.snakeweaver.analysis.TypeMismatchKind;
import io.surfworks.snakeweaver.ast.AgAst.SourceLocation;
import io.surfworks.snakeweaver.trace.LoopSource;
import io.surfworks.snakeweaver.trace.PrimitiveResult;
import io.surfworks.snakeweaver.trace.PrimitiveResult.PreBindFailure;
import io.surfworks.snakeweaver.trace.RecordingTracingEngine;
import io.surfworks.snakeweaver.trace.TraceOps;
import io.surfworks.snakeweaver.trace.TracingGuard;
import io.surfworks.snakeweaver.trace.TracingSession;
import io.surfworks.snakeweaver.value.NdArray;
import io.surfworks.snakeweaver.value.Tracer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Tests for {@link FallbackSupervisor}. */
@DisplayName("FallbackSupervisor")
class FallbackSupervisorTest {

    private static final SourceLocation LOCATION = new SourceLocation("loops.py", 7, "f", "for i in range(3):");

    private final RecordingTracingEngine engine = new RecordingTracingEngine();
    private final CollectingDiagnosticSink sink = new CollectingDiagnosticSink();

    private FallbackSupervisor supervisor(ConversionConfig config) {
        return new FallbackSupervisor(engine, config, sink);
    }

    private FallbackSupervisor lenient() {
        return supervisor(ConversionConfig.builder().build());
    }

    private static List<Object> operands(Object... values) {
        return new ArrayList<>(List.of(values));
    }

    private static Supplier<List<Object>> failingFallback() {
        return () -> {
            throw new AssertionError("fallback must not run");
        };
    }

    @Test
    @DisplayName("a committed primitive does not fall back")
    void committed() {
        try (TracingSession session = TracingGuard.enter()) {
            FallbackSupervisor supervisor = lenient();
            BlockOutcome outcome = supervisor.supervise(session, BlockKind.COUNTED_LOOP, LOCATION, List.of("acc"),
                    () -> engine.forLoop(session, new LoopSource.Bounds(0L, 2L, 1L), (i, p) -> p, operands(1L)),
                    failingFallback());

            assertEquals(List.of(SupervisorState.NOT_ATTEMPTED, SupervisorState.TRACING, SupervisorState.COMMITTED),
                    outcome.trail());
            assertFalse(outcome.isFallback());
            assertNull(outcome.failure());
            assertTrue(sink.warnings().isEmpty());
            assertEquals(List.of(outcome), supervisor.history());
        }
    }

    @Test
    @DisplayName("a pre-bind failure warns and runs the fallback")
    void preBind() {
        try (TracingSession session = TracingGuard.enter()) {
            IllegalArgumentException cause = new IllegalArgumentException("nope");
            BlockOutcome outcome = lenient().supervise(session, BlockKind.COUNTED_LOOP, LOCATION, List.of("acc"),
                    () -> new PreBindFailure(cause), () -> List.of(42L));

            assertEquals(List.of(SupervisorState.NOT_ATTEMPTED, SupervisorState.TRACING,
                    SupervisorState.FAILED_PRE_BIND, SupervisorState.FALLBACK_EXECUTED), outcome.trail());
            assertEquals(List.of(42L), outcome.values());
            assertSame(cause, outcome.failure());

            ConversionWarning warning = sink.warnings().get(0);
            assertEquals(ConversionWarning.Kind.TRACING_FALLBACK, warning.kind());
            assertEquals("IllegalArgumentException", warning.exceptionType());
            assertTrue(warning.message().contains("IllegalArgumentException: nope"), warning.message());
            assertTrue(warning.message().contains("File \"loops.py\", line 7, in f"), warning.message());
        }
    }

    @Test
    @DisplayName("a post-bind failure is retracted before the fallback")
    void postBind() {
        try (TracingSession session = TracingGuard.enter()) {
            TraceOps ops = new TraceOps(session);
            Tracer arr = session.graph().input(NdArray.ofLongs(1, 2));
            List<Boolean> graphHadLoop = new ArrayList<>();

            BlockOutcome outcome = lenient().supervise(session, BlockKind.CONDITIONAL_LOOP, LOCATION, List.of("arr"),
                    () -> engine.whileLoop(session, params -> true,
                            params -> List.of(ops.kron(params.get(0), params.get(0))), operands(arr)),
                    () -> {
                        graphHadLoop.add(session.graph().contains("while_loop"));
                        return List.of(arr);
                    });

            assertTrue(outcome.trail().contains(SupervisorState.FAILED_POST_BIND));
            assertEquals(List.of(false), graphHadLoop);
            assertEquals("AbstractValueMismatchException", sink.warnings().get(0).exceptionType());
        }
    }

    @Test
    @DisplayName("strict conversion rethrows the cause without a warning")
    void strict() {
        try (TracingSession session = TracingGuard.enter()) {
            FallbackSupervisor supervisor = supervisor(ConversionConfig.builder().strictConversion(true).build());
            IllegalStateException cause = new IllegalStateException("broken");
            Supplier<PrimitiveResult> primitive = () -> new PreBindFailure(cause);

            IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> supervisor.supervise(
                    session, BlockKind.CONDITIONAL, LOCATION, List.of(), primitive, failingFallback()));

            assertSame(cause, thrown);
            assertTrue(sink.warnings().isEmpty());
            assertEquals(SupervisorState.FAILED_PRE_BIND, supervisor.history().get(0).state());
        }
    }

    @Test
    @DisplayName("ignored fallbacks emit nothing")
    void ignored() {
        try (TracingSession session = TracingGuard.enter()) {
            FallbackSupervisor supervisor = supervisor(ConversionConfig.builder().ignoreFallbacks(true).build());
            BlockOutcome outcome = supervisor.supervise(session, BlockKind.CONDITIONAL, LOCATION, List.of(),
                    () -> new PreBindFailure(new IllegalArgumentException("x")), List::of);

            assertTrue(outcome.isFallback());
            assertTrue(sink.warnings().isEmpty());
        }
    }

    @Test
    @DisplayName("a block without an eager counterpart turns a carried type mismatch into an analysis error")
    void withoutFallbackMismatch() {
        try (TracingSession session = TracingGuard.enter()) {
            FallbackSupervisor supervisor = lenient();
            CarriedTypeMismatchException cause = new CarriedTypeMismatchException(new TypeMismatch("r",
                    TypeMismatchKind.BRANCH_MISMATCH, "Branches produce int64[] and float64[] for 'r'"));

            AnalysisException e = assertThrows(AnalysisException.class, () -> supervisor.superviseWithoutFallback(
                    session, BlockKind.CONDITIONAL, LOCATION, () -> new PreBindFailure(cause)));

            assertEquals(List.of("r"), e.getVariables());
            assertEquals(TypeMismatchKind.BRANCH_MISMATCH, e.getMismatchKind());
            assertTrue(e.getMessage().contains("File \"loops.py\", line 7, in f"), e.getMessage());
            assertTrue(sink.warnings().isEmpty());
            assertEquals(List.of(SupervisorState.NOT_ATTEMPTED, SupervisorState.TRACING,
                    SupervisorState.FAILED_PRE_BIND), supervisor.history().get(0).trail());
        }
    }

    @Test
    @DisplayName("a block without an eager counterpart rethrows other causes unchanged")
    void withoutFallbackRethrows() {
        try (TracingSession session = TracingGuard.enter()) {
            HostRaisedException cause = new HostRaisedException("ValueError", "bad");

            HostRaisedException thrown = assertThrows(HostRaisedException.class, () -> lenient()
                    .superviseWithoutFallback(session, BlockKind.CONDITIONAL, LOCATION, () -> new PreBindFailure(cause)));

            assertSame(cause, thrown);
            assertTrue(sink.warnings().isEmpty());
        }
    }

    @Test
    @DisplayName("a domain fallback never attempts the primitive")
    void domainFallback() {
        BlockOutcome outcome = lenient().domainFallback(BlockKind.COUNTED_LOOP, LOCATION, List.of("n"),
                "Could not convert the iteration target.", () -> List.of(3L));

        assertEquals(List.of(SupervisorState.NOT_ATTEMPTED, SupervisorState.FALLBACK_EXECUTED), outcome.trail());
        ConversionWarning warning = sink.warnings().get(0);
        assertEquals(ConversionWarning.Kind.DOMAIN_FALLBACK, warning.kind());
        assertNull(warning.exceptionType());
        assertTrue(warning.message().startsWith("Could not convert the iteration target.\n  File \"loops.py\""));
    }

    @Test
    @DisplayName("exceptions raised by the program are named by their program type")
    void hostRaisedType() {
        assertEquals("ValueError", FallbackSupervisor.exceptionType(new HostRaisedException("ValueError", "bad")));
        assertTrue(FallbackSupervisor.tracingFailureMessage(BlockKind.CONDITIONAL, LOCATION,
                new HostRaisedException("ValueError", "bad")).contains("ValueError: bad"));
    }
}
