package io.surfworks.snakeweaver.convert;

import io.surfworks.snakeweaver.ast.AgAst.FunctionDef;
import io.surfworks.snakeweaver.trace.TraceOps;
import io.surfworks.snakeweaver.trace.TracingGuard;
import io.surfworks.snakeweaver.trace.TracingSession;
import io.surfworks.snakeweaver.value.Values;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * A function whose control flow runs through the tracing engine's primitives.
 *
 * <p>Obtained from {@link AutoGraph#convert}. Holding one is the conversion
 * marker: {@link #original()} returns the unconverted function.
 */
public final class ConvertedCallable {

    private static final Logger LOGGER = Logger.getLogger(ConvertedCallable.class.getName());

    private final AutoGraph autograph;
    private final FunctionDef function;
    private final CallableHandle handle;
    private final String convertedSource;

    ConvertedCallable(AutoGraph autograph, FunctionDef function, CallableHandle handle, String convertedSource) {
        this.autograph = autograph;
        this.function = function;
        this.handle = handle;
        this.convertedSource = convertedSource;
    }

    public FunctionDef original() {
        return function;
    }

    public CallableHandle handle() {
        return handle;
    }

    public String name() {
        return function.name();
    }

    public String convertedSource() {
        return convertedSource;
    }

    public TraceResult trace(Object... args) {
        return traceArguments(Arrays.asList(args));
    }

    /**
     * Runs the callable inside a new tracing session.
     *
     * <p>Numbers, booleans and arrays become graph inputs. Other arguments are passed eagerly.
     *
     * @throws io.surfworks.snakeweaver.trace.SessionReentryException if a session is already active
     */
    public TraceResult traceArguments(List<?> args) {
        try (TracingSession session = TracingGuard.enter()) {
            List<Object> inputs = new ArrayList<>(args.size());
            for (Object arg : args) {
                Object value = Values.normalize(arg);
                inputs.add(Values.isRepresentable(value) ? session.graph().input(value) : value);
            }
            CollectingDiagnosticSink collected = new CollectingDiagnosticSink();
            DiagnosticSink sink = warning -> {
                collected.warn(warning);
                autograph.sink().warn(warning);
            };
            FallbackSupervisor supervisor = new FallbackSupervisor(autograph.engine(), autograph.config(), sink);
            ControlFlowTransformer transformer = new ControlFlowTransformer(
                    autograph.engine(), autograph.config(), supervisor, autograph.plans());
            Interpreter interpreter = new Interpreter(autograph.program(), autograph.hostFunctions(),
                    new TraceOps(session), autograph.engine(), transformer);

            LOGGER.fine(() -> "Tracing " + handle + " with " + inputs.size() + " arguments");
            Object output = interpreter.call(function, inputs);
            LOGGER.fine(() -> "Traced " + handle + ": " + session.graph().nodes().size() + " top-level nodes, "
                    + collected.warnings().size() + " warnings");
            return new TraceResult(session.graph(), output, collected.warnings(), supervisor.history());
        }
    }

    /**
     * Traces the callable and returns its concrete output.
     */
    public Object call(Object... args) {
        return trace(args).concreteOutput();
    }

    /**
     * Runs the unconverted function with host semantics and no tracing.
     */
    public Object callEager(Object... args) {
        Interpreter interpreter = new Interpreter(autograph.program(), autograph.hostFunctions(),
                TraceOps.eager(), autograph.engine(), null);
        return interpreter.call(function, Arrays.asList(args));
    }

    @Override
    public String toString() {
        return "ConvertedCallable[" + handle + "]";
    }
}
