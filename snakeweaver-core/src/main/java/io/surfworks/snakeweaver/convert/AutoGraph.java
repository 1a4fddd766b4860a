package io.surfworks.snakeweaver.convert;

import io.surfworks.snakeweaver.analysis.AnalysisException;
import io.surfworks.snakeweaver.analysis.CarriedVariableAnalyzer;
import io.surfworks.snakeweaver.analysis.FunctionAnalysis;
import io.surfworks.snakeweaver.ast.AgAst.*;
import io.surfworks.snakeweaver.convert.ControlFlowTransformer.BlockPlan;
import io.surfworks.snakeweaver.trace.RecordingTracingEngine;
import io.surfworks.snakeweaver.trace.TracingEngine;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Entry point: converts functions of a program and keeps their conversion state.
 *
 * <p>Example usage:
 * <pre>{@code
 * AutoGraph autograph = AutoGraph.create(program, new RecordingTracingEngine(),
 *         ConversionConfig.defaults(), ConversionRegistry.global());
 * ConvertedCallable f = autograph.convert("f");
 * TraceResult result = f.trace(3L);
 * }</pre>
 *
 * <p>Conversion analyzes the function, plans its blocks, and converts every
 * function of the program it calls. It is memoized per function: converting
 * the same function again returns the same callable without re-running the
 * analysis. A function the registry already holds as converted is bound from
 * its record, so instances sharing a registry analyze it once. An {@link AnalysisException} aborts the conversion and is recorded
 * as the function's failure in the registry.
 */
public final class AutoGraph {

    private static final Logger LOGGER = Logger.getLogger(AutoGraph.class.getName());

    private final Program program;
    private final TracingEngine engine;
    private final ConversionConfig config;
    private final ConversionRegistry registry;
    private final DiagnosticSink sink;
    private final Map<String, HostFunction> hostFunctions;
    private final Map<CallableHandle, ConvertedCallable> converted = new HashMap<>();
    private final Map<Stmt, BlockPlan> plans = new IdentityHashMap<>();

    private AutoGraph(Builder builder) {
        this.program = Objects.requireNonNull(builder.program, "program");
        this.engine = builder.engine != null ? builder.engine : new RecordingTracingEngine();
        this.config = builder.config != null ? builder.config : ConversionConfig.defaults();
        this.registry = builder.registry != null ? builder.registry : ConversionRegistry.global();
        this.sink = builder.sink != null ? builder.sink : DiagnosticSink.none();
        this.hostFunctions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.hostFunctions));
    }

    public static AutoGraph create(Program program, TracingEngine engine, ConversionConfig config,
                                   ConversionRegistry registry) {
        return builder(program).engine(engine).config(config).registry(registry).build();
    }

    public static Builder builder(Program program) {
        return new Builder(program);
    }

    /**
     * @throws IllegalArgumentException if the program has no function of that name
     * @throws AnalysisException         if the function or one it calls cannot be converted
     */
    public ConvertedCallable convert(String functionName) {
        FunctionDef function = program.function(functionName).orElseThrow(() ->
                new IllegalArgumentException("No function named '" + functionName + "' in the program"));
        return convert(function);
    }

    public synchronized ConvertedCallable convert(FunctionDef function) {
        CallableHandle handle = registry.register(function);
        ConvertedCallable existing = converted.get(handle);
        if (existing != null) {
            return existing;
        }
        if (registry.isConverted(handle)) {
            return reuse(function, handle);
        }

        registry.recordAttempt(handle);
        Map<Stmt, BlockPlan> functionPlans = Map.of();
        try {
            FunctionAnalysis analysis = new CarriedVariableAnalyzer().analyze(function);
            analysis.check();
            functionPlans = ControlFlowTransformer.plan(function, analysis);
            String source = ConvertedSourcePrinter.print(function, functionPlans);
            ConvertedCallable callable = new ConvertedCallable(this, function, handle, source);
            // Registered before the callees so that recursion terminates.
            converted.put(handle, callable);
            plans.putAll(functionPlans);
            for (String callee : callees(function)) {
                Optional<FunctionDef> target = program.function(callee);
                if (target.isPresent()) {
                    convert(target.get());
                }
            }
            registry.markConverted(handle, source, functionPlans);
            LOGGER.fine(() -> "Converted '" + function.name() + "' with " + analysis.blocks().size() + " blocks");
            return callable;
        } catch (AnalysisException e) {
            converted.remove(handle);
            functionPlans.keySet().forEach(plans::remove);
            registry.markFailed(handle, e.getMessage());
            throw e;
        }
    }

    /**
     * Binds a conversion another instance already recorded in the registry, without analyzing again.
     */
    private ConvertedCallable reuse(FunctionDef function, CallableHandle handle) {
        ConversionRecord record = registry.record(handle).orElseThrow();
        ConvertedCallable callable = new ConvertedCallable(this, function, handle, record.convertedSource());
        converted.put(handle, callable);
        plans.putAll(record.plans());
        for (String callee : callees(function)) {
            program.function(callee).ifPresent(this::convert);
        }
        LOGGER.fine(() -> "Reused the registered conversion of '" + function.name() + "'");
        return callable;
    }

    /**
     * @throws NotConvertedException     if conversion was never attempted
     * @throws ConversionFailedException if conversion failed
     */
    public String getConvertedSource(ConvertedCallable callable) {
        return registry.getConvertedSource(callable.handle());
    }

    public String getConvertedSource(CallableHandle handle) {
        return registry.getConvertedSource(handle);
    }

    public String getConvertedSource(FunctionDef function) {
        CallableHandle handle = registry.handleOf(function)
                .orElseThrow(() -> new NotConvertedException(function.name(), null));
        return registry.getConvertedSource(handle);
    }

    public boolean isConverted(CallableHandle handle) {
        return registry.isConverted(handle);
    }

    public boolean isConverted(FunctionDef function) {
        return registry.handleOf(function).map(registry::isConverted).orElse(false);
    }

    public ConversionRegistry registry() {
        return registry;
    }

    public ConversionConfig config() {
        return config;
    }

    TracingEngine engine() {
        return engine;
    }

    DiagnosticSink sink() {
        return sink;
    }

    Program program() {
        return program;
    }

    Map<String, HostFunction> hostFunctions() {
        return hostFunctions;
    }

    Map<Stmt, BlockPlan> plans() {
        return plans;
    }

    // ==================== Callees ====================

    /**
     * Names of all functions called by the function, in order of first call.
     */
    static Set<String> callees(FunctionDef function) {
        Set<String> names = new LinkedHashSet<>();
        collectCalls(function.body(), names);
        return names;
    }

    private static void collectCalls(List<Stmt> body, Set<String> out) {
        for (Stmt stmt : body) {
            if (stmt instanceof Assign a) {
                collectCalls(a.value(), out);
            } else if (stmt instanceof AugAssign a) {
                collectCalls(a.value(), out);
            } else if (stmt instanceof ExprStmt e) {
                collectCalls(e.value(), out);
            } else if (stmt instanceof Return r && r.value() != null) {
                collectCalls(r.value(), out);
            } else if (stmt instanceof Raise r && r.message() != null) {
                collectCalls(r.message(), out);
            } else if (stmt instanceof If i) {
                for (Branch branch : i.branches()) {
                    if (branch.test() != null) {
                        collectCalls(branch.test(), out);
                    }
                    collectCalls(branch.body(), out);
                }
            } else if (stmt instanceof For f) {
                collectCalls(f.iter(), out);
                collectCalls(f.body(), out);
            } else if (stmt instanceof While w) {
                collectCalls(w.test(), out);
                collectCalls(w.body(), out);
            }
        }
    }

    private static void collectCalls(Expr expr, Set<String> out) {
        if (expr instanceof Call c) {
            out.add(c.function());
            c.args().forEach(arg -> collectCalls(arg, out));
        } else if (expr instanceof ListExpr l) {
            l.elements().forEach(e -> collectCalls(e, out));
        } else if (expr instanceof TupleExpr t) {
            t.elements().forEach(e -> collectCalls(e, out));
        } else if (expr instanceof BinOp b) {
            collectCalls(b.left(), out);
            collectCalls(b.right(), out);
        } else if (expr instanceof Compare c) {
            collectCalls(c.left(), out);
            collectCalls(c.right(), out);
        } else if (expr instanceof BoolOp b) {
            collectCalls(b.left(), out);
            collectCalls(b.right(), out);
        } else if (expr instanceof Not n) {
            collectCalls(n.operand(), out);
        } else if (expr instanceof Neg n) {
            collectCalls(n.operand(), out);
        } else if (expr instanceof Index i) {
            collectCalls(i.target(), out);
            collectCalls(i.index(), out);
        }
    }

    public static final class Builder {

        private final Program program;
        private TracingEngine engine;
        private ConversionConfig config;
        private ConversionRegistry registry;
        private DiagnosticSink sink;
        private final Map<String, HostFunction> hostFunctions = new LinkedHashMap<>();

        private Builder(Program program) {
            this.program = program;
        }

        public Builder engine(TracingEngine engine) {
            this.engine = engine;
            return this;
        }

        public Builder config(ConversionConfig config) {
            this.config = config;
            return this;
        }

        public Builder registry(ConversionRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder sink(DiagnosticSink sink) {
            this.sink = sink;
            return this;
        }

        /**
         * Makes a function outside the program callable by name.
         */
        public Builder hostFunction(String name, HostFunction function) {
            hostFunctions.put(name, function);
            return this;
        }

        public AutoGraph build() {
            return new AutoGraph(this);
        }
    }
}
