package io.surfworks.snakeweaver.convert;

import io.surfworks.snakeweaver.analysis.AnalysisException;
import io.surfworks.snakeweaver.analysis.BlockKind;
import io.surfworks.snakeweaver.analysis.CarriedTypeMismatchException;
import io.surfworks.snakeweaver.ast.AgAst.SourceLocation;
import io.surfworks.snakeweaver.trace.PrimitiveResult;
import io.surfworks.snakeweaver.trace.PrimitiveResult.Committed;
import io.surfworks.snakeweaver.trace.PrimitiveResult.PostBindFailure;
import io.surfworks.snakeweaver.trace.PrimitiveResult.PreBindFailure;
import io.surfworks.snakeweaver.trace.TracingEngine;
import io.surfworks.snakeweaver.trace.TracingSession;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Runs a block through its primitive and falls back to host execution on failure.
 *
 * <p>A post-bind failure is retracted from the graph before anything else
 * happens. Under strict conversion the failure's cause is rethrown unchanged.
 * Otherwise a {@link ConversionWarning} is emitted, unless fallbacks are
 * ignored, and the block re-executes eagerly from its pre-block state.
 *
 * <p>One supervisor serves one trace. Its history lists every block it ran.
 */
public final class FallbackSupervisor {

    private static final Logger LOGGER = Logger.getLogger(FallbackSupervisor.class.getName());

    private final TracingEngine engine;
    private final ConversionConfig config;
    private final DiagnosticSink sink;
    private final List<BlockOutcome> history = new ArrayList<>();

    public FallbackSupervisor(TracingEngine engine, ConversionConfig config, DiagnosticSink sink) {
        this.engine = engine;
        this.config = config;
        this.sink = sink;
    }

    /**
     * @param primitive invokes the engine primitive; called once
     * @param fallback  executes the block eagerly and returns its carried values
     */
    public BlockOutcome supervise(TracingSession session, BlockKind kind, SourceLocation location,
                                  List<String> variables, Supplier<PrimitiveResult> primitive,
                                  Supplier<List<Object>> fallback) {
        List<SupervisorState> trail = new ArrayList<>();
        PrimitiveResult result = attempt(session, trail, primitive);
        if (result instanceof Committed committed) {
            return remember(new BlockOutcome(kind, location, trail, committed.results(), null));
        }
        RuntimeException cause = causeOf(result);

        if (config.isStrictConversion()) {
            remember(new BlockOutcome(kind, location, trail, List.of(), cause));
            throw cause;
        }
        emit(new ConversionWarning(kind, ConversionWarning.Kind.TRACING_FALLBACK,
                tracingFailureMessage(kind, location, cause), variables, location, exceptionType(cause)));
        List<Object> values = fallback.get();
        trail.add(SupervisorState.FALLBACK_EXECUTED);
        return remember(new BlockOutcome(kind, location, trail, values, cause));
    }

    /**
     * Runs a block whose primitive has no eager counterpart, such as a conditional on a traced predicate.
     *
     * <p>A failure is never recovered from and emits no fallback warning. A carried type mismatch becomes an
     * {@link AnalysisException} naming the variable; any other cause is rethrown unchanged.
     */
    public BlockOutcome superviseWithoutFallback(TracingSession session, BlockKind kind, SourceLocation location,
                                                 Supplier<PrimitiveResult> primitive) {
        List<SupervisorState> trail = new ArrayList<>();
        PrimitiveResult result = attempt(session, trail, primitive);
        if (result instanceof Committed committed) {
            return remember(new BlockOutcome(kind, location, trail, committed.results(), null));
        }
        RuntimeException cause = causeOf(result);
        remember(new BlockOutcome(kind, location, trail, List.of(), cause));
        if (cause instanceof CarriedTypeMismatchException mismatch) {
            throw new AnalysisException(List.of(mismatch.getMessage() + "\n" + location.toTraceback()),
                    List.of(mismatch.getVariable()), mismatch.getMismatchKind());
        }
        throw cause;
    }

    /**
     * Runs a block eagerly without attempting its primitive.
     *
     * @param reason user-facing explanation, without location
     */
    public BlockOutcome domainFallback(BlockKind kind, SourceLocation location, List<String> variables,
                                       String reason, Supplier<List<Object>> fallback) {
        emit(new ConversionWarning(kind, ConversionWarning.Kind.DOMAIN_FALLBACK,
                reason + "\n" + location.toTraceback(), variables, location, null));
        List<Object> values = fallback.get();
        return remember(new BlockOutcome(kind, location,
                List.of(SupervisorState.NOT_ATTEMPTED, SupervisorState.FALLBACK_EXECUTED), values, null));
    }

    private PrimitiveResult attempt(TracingSession session, List<SupervisorState> trail,
                                    Supplier<PrimitiveResult> primitive) {
        trail.add(SupervisorState.NOT_ATTEMPTED);
        trail.add(SupervisorState.TRACING);
        PrimitiveResult result = primitive.get();
        if (result instanceof Committed) {
            trail.add(SupervisorState.COMMITTED);
        } else if (result instanceof PreBindFailure) {
            trail.add(SupervisorState.FAILED_PRE_BIND);
        } else {
            trail.add(SupervisorState.FAILED_POST_BIND);
            engine.retract(session, ((PostBindFailure) result).node());
        }
        return result;
    }

    private static RuntimeException causeOf(PrimitiveResult result) {
        if (result instanceof PreBindFailure preBind) {
            return preBind.cause();
        }
        return ((PostBindFailure) result).cause();
    }

    public List<BlockOutcome> history() {
        return Collections.unmodifiableList(history);
    }

    private BlockOutcome remember(BlockOutcome outcome) {
        history.add(outcome);
        LOGGER.fine(() -> outcome.kind().displayName() + " at line " + outcome.location().line()
                + ": " + outcome.trail());
        return outcome;
    }

    private void emit(ConversionWarning warning) {
        if (config.isIgnoreFallbacks()) {
            LOGGER.fine(() -> "Fallback warning suppressed: " + warning.message());
            return;
        }
        LOGGER.warning(warning.message());
        sink.warn(warning);
    }

    static String tracingFailureMessage(BlockKind kind, SourceLocation location, RuntimeException cause) {
        StringBuilder sb = new StringBuilder();
        sb.append("Tracing of a converted ").append(kind.displayName()).append(" failed with an exception:\n");
        sb.append("  ").append(exceptionType(cause)).append(": ").append(cause.getMessage()).append('\n');
        sb.append(location.toTraceback()).append('\n');
        if (kind == BlockKind.COUNTED_LOOP) {
            sb.append("If the loop should be converted, make sure its index is not used where tracing cannot "
                    + "follow it, for instance to index a host list. Wrap such lists with array(...).\n");
        }
        sb.append("If this fallback is expected, set ignoreFallbacks to silence the warning.");
        return sb.toString();
    }

    static String exceptionType(RuntimeException cause) {
        if (cause instanceof HostRaisedException raised) {
            return raised.getExceptionType();
        }
        return cause.getClass().getSimpleName();
    }
}
