package io.surfworks.snakeweaver.convert;

import io.surfworks.snakeweaver.analysis.AnalysisException;
import io.surfworks.snakeweaver.analysis.BlockAnalysis;
import io.surfworks.snakeweaver.analysis.BlockKind;
import io.surfworks.snakeweaver.analysis.CarriedVariable;
import io.surfworks.snakeweaver.analysis.DomainClassifier;
import io.surfworks.snakeweaver.analysis.FunctionAnalysis;
import io.surfworks.snakeweaver.analysis.IterationDomain;
import io.surfworks.snakeweaver.analysis.PredicateKind;
import io.surfworks.snakeweaver.analysis.PredicateValueKind;
import io.surfworks.snakeweaver.analysis.TypeConsistencyChecker;
import io.surfworks.snakeweaver.analysis.TypeMismatch;
import io.surfworks.snakeweaver.ast.AgAst.BinaryOperator;
import io.surfworks.snakeweaver.ast.AgAst.Branch;
import io.surfworks.snakeweaver.ast.AgAst.For;
import io.surfworks.snakeweaver.ast.AgAst.FunctionDef;
import io.surfworks.snakeweaver.ast.AgAst.If;
import io.surfworks.snakeweaver.ast.AgAst.SourceLocation;
import io.surfworks.snakeweaver.ast.AgAst.Stmt;
import io.surfworks.snakeweaver.ast.AgAst.While;
import io.surfworks.snakeweaver.trace.CarriedFunction;
import io.surfworks.snakeweaver.trace.CarriedPredicate;
import io.surfworks.snakeweaver.trace.IndexedCarriedFunction;
import io.surfworks.snakeweaver.trace.LoopSource;
import io.surfworks.snakeweaver.trace.PrimitiveResult;
import io.surfworks.snakeweaver.trace.PrimitiveResult.PreBindFailure;
import io.surfworks.snakeweaver.trace.TraceOps;
import io.surfworks.snakeweaver.trace.TracingEngine;
import io.surfworks.snakeweaver.trace.TracingSession;
import io.surfworks.snakeweaver.value.EnumerateValue;
import io.surfworks.snakeweaver.value.RangeValue;
import io.surfworks.snakeweaver.value.Tracer;
import io.surfworks.snakeweaver.value.Undefined;
import io.surfworks.snakeweaver.value.Values;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Turns if, for and while statements into calls to the tracing engine's structured primitives.
 *
 * <p>At conversion time {@link #plan} derives one {@link BlockPlan} per block from
 * the function's analysis. At run time the interpreter hands each planned block
 * to {@link #dispatch} while a session is tracing:
 * <ul>
 *   <li>an eager predicate takes the host branch; a traced one goes through {@code select};</li>
 *   <li>a convertible iteration domain goes through {@code forLoop}, any other
 *       falls back to a host loop, or fails under strict conversion;</li>
 *   <li>a while loop always goes through {@code whileLoop}.</li>
 * </ul>
 * Every primitive call is supervised by the {@link FallbackSupervisor}.
 */
public final class ControlFlowTransformer {

    private static final Logger LOGGER = Logger.getLogger(ControlFlowTransformer.class.getName());

    // ==================== Plans ====================

    /**
     * Conversion-time description of one block.
     */
    public sealed interface BlockPlan permits SelectionPlan, CountedLoopPlan, ConditionalLoopPlan {

        Stmt block();

        BlockAnalysis analysis();

        /**
         * Carried variable names, in first-assignment order.
         */
        default List<String> carried() {
            return analysis().carriedNames();
        }

        default BlockKind kind() {
            return analysis().kind();
        }

        default SourceLocation location() {
            return block().location();
        }
    }

    /**
     * @param predicateKind classification of the first branch's test
     */
    public record SelectionPlan(If block, BlockAnalysis analysis, PredicateKind predicateKind) implements BlockPlan {}

    public record CountedLoopPlan(For block, BlockAnalysis analysis) implements BlockPlan {}

    public record ConditionalLoopPlan(While block, BlockAnalysis analysis) implements BlockPlan {}

    /**
     * One plan per block of the function, keyed by statement identity.
     */
    public static Map<Stmt, BlockPlan> plan(FunctionDef function, FunctionAnalysis analysis) {
        if (analysis.function() != function) {
            throw new IllegalArgumentException("Analysis of '" + analysis.function().name()
                    + "' does not belong to '" + function.name() + "'");
        }
        Map<Stmt, BlockPlan> plans = new IdentityHashMap<>();
        for (BlockAnalysis block : analysis.blocks()) {
            Stmt stmt = block.block();
            BlockPlan plan;
            if (stmt instanceof If i) {
                plan = new SelectionPlan(i, block, DomainClassifier.classifyPredicate(i.branches().get(0).test()));
            } else if (stmt instanceof For f) {
                plan = new CountedLoopPlan(f, block);
            } else {
                plan = new ConditionalLoopPlan((While) stmt, block);
            }
            plans.put(stmt, plan);
        }
        return plans;
    }

    // ==================== Runtime ====================

    private final TracingEngine engine;
    private final ConversionConfig config;
    private final FallbackSupervisor supervisor;
    private final TypeConsistencyChecker checker;
    private final Map<Stmt, BlockPlan> plans;

    /**
     * @param plans plans of every converted function reachable from the traced callable
     */
    ControlFlowTransformer(TracingEngine engine, ConversionConfig config, FallbackSupervisor supervisor,
                           Map<Stmt, BlockPlan> plans) {
        this.engine = engine;
        this.config = config;
        this.supervisor = supervisor;
        this.checker = new TypeConsistencyChecker(config.isStrictConversion());
        this.plans = plans;
    }

    FallbackSupervisor supervisor() {
        return supervisor;
    }

    Interpreter.Completion dispatch(Stmt stmt, Frame frame, Interpreter in) {
        BlockPlan plan = plans.get(stmt);
        if (plan instanceof SelectionPlan selection) {
            return select(selection, 0, frame, in);
        } else if (plan instanceof CountedLoopPlan loop) {
            return forLoop(loop, frame, in);
        } else if (plan instanceof ConditionalLoopPlan loop) {
            return whileLoop(loop, frame, in);
        }
        LOGGER.fine(() -> "No plan for statement at line " + stmt.location().line() + ", running on host");
        if (stmt instanceof If i) {
            return in.hostIf(i, 0, null, frame);
        } else if (stmt instanceof For f) {
            return in.hostFor(f, in.eval(f.iter(), frame), frame);
        }
        return in.hostWhile((While) stmt, frame);
    }

    // ==================== Selection ====================

    /**
     * Dispatches the if-chain from branch {@code b}. The false side of a selection handles the remaining branches.
     */
    private Interpreter.Completion select(SelectionPlan plan, int b, Frame frame, Interpreter in) {
        If stmt = plan.block();
        List<Branch> branches = stmt.branches();
        Branch branch = branches.get(b);
        if (branch.isElse()) {
            return in.execBody(branch.body(), frame);
        }
        Object predicate = in.eval(branch.test(), frame);
        if (DomainClassifier.classifyPredicateValue(predicate) == PredicateValueKind.STATIC) {
            if (Values.truthy(predicate)) {
                return in.execBody(branch.body(), frame);
            }
            return b + 1 < branches.size() ? select(plan, b + 1, frame, in) : null;
        }

        rejectReturn(plan);
        List<String> carried = plan.carried();
        List<Object> operands = frame.values(carried);
        RuntimeException invalid = checkInitial(plan, operands);
        BranchCheck check = new BranchCheck(carried);

        CarriedFunction onTrue = params -> {
            Frame scope = scope(frame, carried, params);
            in.execBody(branch.body(), scope);
            return check.accept(scope.values(carried));
        };
        CarriedFunction onFalse = params -> {
            if (b + 1 == branches.size()) {
                return check.accept(params);
            }
            Frame scope = scope(frame, carried, params);
            select(plan, b + 1, scope, in);
            return check.accept(scope.values(carried));
        };

        TracingSession session = in.ops().session();
        // A traced predicate cannot drive host branching, so there is nothing to fall back to.
        BlockOutcome outcome = supervisor.superviseWithoutFallback(session, BlockKind.CONDITIONAL, stmt.location(),
                primitive(invalid, () -> engine.select(session, (Tracer) predicate, onTrue, onFalse, operands)));
        frame.assignAll(carried, outcome.values());
        return null;
    }

    /**
     * Checks that all branches of one selection produce the same types.
     */
    private final class BranchCheck {

        private final List<String> names;
        private List<Object> first;

        BranchCheck(List<String> names) {
            this.names = names;
        }

        List<Object> accept(List<Object> values) {
            if (first == null) {
                first = values;
            } else {
                for (int i = 0; i < names.size(); i++) {
                    checker.checkBranches(names.get(i), first.get(i), values.get(i));
                }
            }
            return values;
        }
    }

    // ==================== Counted loop ====================

    private Interpreter.Completion forLoop(CountedLoopPlan plan, Frame frame, Interpreter in) {
        For stmt = plan.block();
        List<String> carried = plan.carried();
        Object iterable = in.eval(stmt.iter(), frame);
        IterationDomain domain = DomainClassifier.classify(iterable, stmt.target());
        LOGGER.fine(() -> "for loop at line " + stmt.location().line() + ": " + domain);

        if (!domain.isConvertible()) {
            String reason = "Could not convert the iteration target " + Values.repr(Values.concretize(iterable))
                    + " to an array. Elements must be numbers or booleans of one type and uniform shape.";
            if (config.isStrictConversion()) {
                throw new AnalysisException(reason + "\n" + stmt.location().toTraceback());
            }
            Interpreter.Completion[] completion = new Interpreter.Completion[1];
            supervisor.domainFallback(BlockKind.COUNTED_LOOP, stmt.location(), carried,
                    reason + " The loop runs as host control flow.", () -> {
                        completion[0] = in.hostFor(stmt, iterable, frame);
                        return frame.values(carried);
                    });
            return completion[0];
        }

        rejectReturn(plan);
        TraceOps ops = in.ops();
        LoopSource source = loopSource(iterable, ops);
        List<Object> operands = frame.values(carried);
        RuntimeException invalid = checkInitial(plan, operands);

        IndexedCarriedFunction body = (index, params) -> {
            Frame scope = scope(frame, carried, params);
            Object element = element(source, index, ops);
            Object target = domain.enumerated()
                    ? List.of(position(index, domain.offset(), ops), element)
                    : element;
            in.assignTarget(stmt.target(), target, scope);
            in.execBody(stmt.body(), scope);
            List<Object> produced = scope.values(carried);
            checkProduced(plan, operands, produced);
            return produced;
        };

        TracingSession session = ops.session();
        BlockOutcome outcome = supervisor.supervise(session, BlockKind.COUNTED_LOOP, stmt.location(), carried,
                primitive(invalid, () -> engine.forLoop(session, source, body, operands)),
                () -> {
                    in.hostFor(stmt, iterable, frame);
                    return frame.values(carried);
                });
        frame.assignAll(carried, outcome.values());
        return null;
    }

    private static LoopSource loopSource(Object iterable, TraceOps ops) {
        Object inner = iterable instanceof EnumerateValue enumerate ? enumerate.iterable() : iterable;
        if (inner instanceof RangeValue range) {
            return new LoopSource.Bounds(range.start(), range.stop(), range.step());
        }
        return new LoopSource.Sequence(ops.array(inner));
    }

    private static Object element(LoopSource source, Object index, TraceOps ops) {
        if (source instanceof LoopSource.Bounds bounds) {
            if (bounds.isUnitFromZero()) {
                return index;
            }
            return ops.binary(BinaryOperator.ADD, bounds.start(),
                    ops.binary(BinaryOperator.MUL, index, bounds.step()));
        }
        return ops.index(((LoopSource.Sequence) source).array(), index);
    }

    private static Object position(Object index, long offset, TraceOps ops) {
        return offset == 0 ? index : ops.binary(BinaryOperator.ADD, index, offset);
    }

    // ==================== Conditional loop ====================

    private Interpreter.Completion whileLoop(ConditionalLoopPlan plan, Frame frame, Interpreter in) {
        While stmt = plan.block();
        rejectReturn(plan);
        List<String> carried = plan.carried();
        List<Object> operands = frame.values(carried);
        RuntimeException invalid = checkInitial(plan, operands);

        CarriedPredicate predicate = params -> in.eval(stmt.test(), scope(frame, carried, params));
        CarriedFunction body = params -> {
            Frame scope = scope(frame, carried, params);
            in.execBody(stmt.body(), scope);
            List<Object> produced = scope.values(carried);
            checkProduced(plan, operands, produced);
            return produced;
        };

        TracingSession session = in.ops().session();
        BlockOutcome outcome = supervisor.supervise(session, BlockKind.CONDITIONAL_LOOP, stmt.location(), carried,
                primitive(invalid, () -> engine.whileLoop(session, predicate, body, operands)),
                () -> {
                    in.hostWhile(stmt, frame);
                    return frame.values(carried);
                });
        frame.assignAll(carried, outcome.values());
        return null;
    }

    // ==================== Helpers ====================

    private static Frame scope(Frame frame, List<String> carried, List<Object> params) {
        Frame scope = frame.child();
        scope.assignAll(carried, params);
        return scope;
    }

    private static Supplier<PrimitiveResult> primitive(RuntimeException invalid, Supplier<PrimitiveResult> call) {
        if (invalid != null) {
            return () -> new PreBindFailure(invalid);
        }
        return call;
    }

    /**
     * A primitive body cannot leave the function.
     */
    private static void rejectReturn(BlockPlan plan) {
        if (plan.analysis().containsReturn()) {
            throw new AnalysisException("Return statements are not supported inside a converted "
                    + plan.kind().displayName() + "\n" + plan.location().toTraceback());
        }
    }

    /**
     * Validates initial values of the carried variables that are read on entry.
     * Variables not read on entry are passed as undefined.
     *
     * @return the mismatch as a pre-bind failure cause, or null
     * @throws AnalysisException on a mismatch under strict conversion
     */
    private RuntimeException checkInitial(BlockPlan plan, List<Object> operands) {
        List<CarriedVariable> carried = plan.analysis().carried();
        RuntimeException failure = null;
        for (int i = 0; i < carried.size(); i++) {
            CarriedVariable variable = carried.get(i);
            if (!variable.liveOnEntry()) {
                operands.set(i, Undefined.INSTANCE);
                continue;
            }
            if (failure != null) {
                continue;
            }
            Optional<TypeMismatch> mismatch = checker.validateInitial(variable.name(), operands.get(i));
            if (mismatch.isPresent()) {
                failure = checker.toException(mismatch.get());
                if (checker.isStrict()) {
                    throw failure;
                }
            }
        }
        return failure;
    }

    private void checkProduced(BlockPlan plan, List<Object> initial, List<Object> produced) {
        List<String> names = plan.carried();
        for (int i = 0; i < names.size(); i++) {
            checker.checkProduced(plan.kind(), names.get(i), initial.get(i), produced.get(i));
        }
    }
}
