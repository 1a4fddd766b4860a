package io.surfworks.snakeweaver.trace;

import io.surfworks.snakeweaver.ConversionException;
import io.surfworks.snakeweaver.trace.PrimitiveResult.Committed;
import io.surfworks.snakeweaver.trace.PrimitiveResult.PostBindFailure;
import io.surfworks.snakeweaver.trace.PrimitiveResult.PreBindFailure;
import io.surfworks.snakeweaver.value.AbstractValue;
import io.surfworks.snakeweaver.value.Arithmetic;
import io.surfworks.snakeweaver.value.ElementType;
import io.surfworks.snakeweaver.value.Tracer;
import io.surfworks.snakeweaver.value.Undefined;
import io.surfworks.snakeweaver.value.ValueKind;
import io.surfworks.snakeweaver.value.Values;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reference tracing engine that records primitives into the session's graph.
 *
 * <p>Every primitive runs in three phases:
 * <ol>
 *   <li>pre-bind: operand validation, then tracing each closure once into its own region;</li>
 *   <li>bind: the primitive's node is appended to the graph;</li>
 *   <li>post-bind: the traced results are checked against the operands, and the
 *       remaining iterations are computed concretely.</li>
 * </ol>
 * A failure in the first phase leaves the graph untouched. A failure in the
 * last phase is reported with the bound node, which the caller must retract.
 */
public final class RecordingTracingEngine implements TracingEngine {

    private static final Logger LOGGER = Logger.getLogger(RecordingTracingEngine.class.getName());

    public static final long DEFAULT_MAX_ITERATIONS = 1_000_000L;

    private final long maxIterations;

    public RecordingTracingEngine() {
        this(DEFAULT_MAX_ITERATIONS);
    }

    /**
     * @param maxIterations bound on concrete while-loop iterations
     */
    public RecordingTracingEngine(long maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        this.maxIterations = maxIterations;
    }

    // ==================== Selection ====================

    @Override
    public PrimitiveResult select(TracingSession session, Tracer predicate,
                                  CarriedFunction onTrue, CarriedFunction onFalse, List<Object> operands) {
        RuntimeException invalid = validateOperands(operands, true);
        if (invalid == null) {
            invalid = validatePredicate(predicate);
        }
        if (invalid != null) {
            return new PreBindFailure(invalid);
        }
        TraceGraph graph = session.graph();

        RegionTrace trueBranch = traceRegion(graph, operands, operands.size(), onTrue);
        if (trueBranch.failure() != null) {
            return new PreBindFailure(trueBranch.failure());
        }
        RegionTrace falseBranch = traceRegion(graph, operands, operands.size(), onFalse);
        if (falseBranch.failure() != null) {
            return new PreBindFailure(falseBranch.failure());
        }

        List<Object> nodeOperands = new ArrayList<>();
        nodeOperands.add(predicate);
        nodeOperands.addAll(definedOnly(operands));
        TraceNode node = graph.bind("cond", nodeOperands,
                List.of(trueBranch.region(), falseBranch.region()), avals(trueBranch.results()));
        LOGGER.fine(() -> "Bound " + node + " with " + operands.size() + " carried values");

        RuntimeException mismatch = verify("cond", node.outputAvals(), falseBranch.results());
        if (mismatch != null) {
            return new PostBindFailure(node, mismatch);
        }

        boolean taken = Values.truthy(predicate.concrete());
        List<Object> selected = taken ? trueBranch.results() : falseBranch.results();
        return commit(graph, node, concretes(selected));
    }

    // ==================== Counted loop ====================

    @Override
    public PrimitiveResult forLoop(TracingSession session, LoopSource source,
                                   IndexedCarriedFunction body, List<Object> operands) {
        RuntimeException invalid = validateOperands(operands, false);
        if (invalid != null) {
            return new PreBindFailure(invalid);
        }
        TraceGraph graph = session.graph();
        long trips = source.tripCount();

        List<Object> nodeOperands = new ArrayList<>(source.operands());
        nodeOperands.addAll(operands);

        if (trips == 0) {
            TraceNode node = graph.bind("for_loop", nodeOperands, List.of(), avals(operands));
            LOGGER.fine(() -> "Bound " + node + " with zero iterations");
            return commit(graph, node, concretes(operands));
        }

        RegionTrace traced = traceRegion(graph, operands, operands.size(), params -> {
            Tracer index = graph.parameter(AbstractValue.scalar(ElementType.INT64), 0L);
            return body.apply(index, params);
        });
        if (traced.failure() != null) {
            return new PreBindFailure(traced.failure());
        }

        TraceNode node = graph.bind("for_loop", nodeOperands, List.of(traced.region()), avals(traced.results()));
        LOGGER.fine(() -> "Bound " + node + " over " + trips + " iterations");

        RuntimeException mismatch = verify("for_loop", avals(operands), traced.results());
        if (mismatch != null) {
            return new PostBindFailure(node, mismatch);
        }

        List<Object> state = concretes(traced.results());
        try (TracingSession.ConcreteScope ignored = session.concreteScope()) {
            for (long k = 1; k < trips; k++) {
                state = concretes(body.apply(k, state));
                mismatch = verify("for_loop", node.outputAvals(), state);
                if (mismatch != null) {
                    return new PostBindFailure(node, mismatch);
                }
            }
        } catch (ConversionException | SessionReentryException e) {
            throw e;
        } catch (RuntimeException e) {
            return new PostBindFailure(node, e);
        }
        return commit(graph, node, state);
    }

    // ==================== Conditional loop ====================

    @Override
    public PrimitiveResult whileLoop(TracingSession session, CarriedPredicate predicate,
                                     CarriedFunction body, List<Object> operands) {
        RuntimeException invalid = validateOperands(operands, false);
        if (invalid != null) {
            return new PreBindFailure(invalid);
        }
        TraceGraph graph = session.graph();

        RegionTrace test = traceRegion(graph, operands, 1, params -> List.of(predicate.test(params)));
        if (test.failure() != null) {
            return new PreBindFailure(test.failure());
        }
        Object condition = test.results().get(0);
        ValueKind conditionKind = Values.kindOf(condition);
        if (conditionKind != ValueKind.BOOLEAN && conditionKind != ValueKind.NUMERIC_SCALAR) {
            return new PreBindFailure(new IllegalArgumentException(
                    "while_loop condition must be a scalar, got " + Values.abstractOf(condition).describe()));
        }

        RegionTrace traced = traceRegion(graph, operands, operands.size(), body);
        if (traced.failure() != null) {
            return new PreBindFailure(traced.failure());
        }

        TraceNode node = graph.bind("while_loop", new ArrayList<>(operands),
                List.of(test.region(), traced.region()), avals(traced.results()));
        LOGGER.fine(() -> "Bound " + node);

        RuntimeException mismatch = verify("while_loop", avals(operands), traced.results());
        if (mismatch != null) {
            return new PostBindFailure(node, mismatch);
        }

        List<Object> state = concretes(operands);
        try (TracingSession.ConcreteScope ignored = session.concreteScope()) {
            long iterations = 0;
            while (Values.truthy(Values.concrete(predicate.test(state)))) {
                if (++iterations > maxIterations) {
                    throw new IllegalStateException("while_loop exceeded " + maxIterations + " iterations");
                }
                state = concretes(body.apply(state));
                mismatch = verify("while_loop", node.outputAvals(), state);
                if (mismatch != null) {
                    return new PostBindFailure(node, mismatch);
                }
            }
        } catch (ConversionException | SessionReentryException e) {
            throw e;
        } catch (RuntimeException e) {
            return new PostBindFailure(node, e);
        }
        return commit(graph, node, state);
    }

    // ==================== Logical primitives ====================

    @Override
    public Tracer logicalAnd(TracingSession session, Tracer left, Tracer right) {
        return session.graph().record("logical_and", List.of(left, right),
                Arithmetic.logicalAnd(left.concrete(), right.concrete()));
    }

    @Override
    public Tracer logicalOr(TracingSession session, Tracer left, Tracer right) {
        return session.graph().record("logical_or", List.of(left, right),
                Arithmetic.logicalOr(left.concrete(), right.concrete()));
    }

    @Override
    public Tracer logicalNot(TracingSession session, Tracer operand) {
        return session.graph().record("logical_not", List.of(operand), Arithmetic.logicalNot(operand.concrete()));
    }

    @Override
    public void retract(TracingSession session, TraceNode node) {
        if (session.graph().retract(node)) {
            LOGGER.fine(() -> "Retracted " + node);
        } else {
            LOGGER.warning(() -> "Retract requested for " + node + ", which is not in the graph");
        }
    }

    // ==================== Internals ====================

    private record RegionTrace(TraceRegion region, List<Object> results, RuntimeException failure) {}

    /**
     * Traces a closure into a fresh region whose parameters stand in for the operands.
     */
    private static RegionTrace traceRegion(TraceGraph graph, List<Object> operands, int expectedResults,
                                           CarriedFunction closure) {
        TraceRegion region = graph.openRegion();
        List<Object> results = List.of();
        try {
            List<Object> params = new ArrayList<>(operands.size());
            for (Object operand : operands) {
                params.add(operand instanceof Undefined
                        ? operand
                        : graph.parameter(Values.abstractOf(operand), Values.concrete(operand)));
            }
            results = closure.apply(params);
        } catch (ConversionException | SessionReentryException e) {
            throw e;
        } catch (RuntimeException e) {
            return new RegionTrace(region, List.of(), e);
        } finally {
            graph.closeRegion(region, results);
        }
        RuntimeException invalid = validateResults(results, expectedResults);
        return new RegionTrace(region, results, invalid);
    }

    private static RuntimeException validateOperands(List<Object> operands, boolean allowUndefined) {
        for (int i = 0; i < operands.size(); i++) {
            Object operand = operands.get(i);
            if (operand instanceof Undefined) {
                if (!allowUndefined) {
                    return new IllegalArgumentException("Carried value " + i + " is undefined on entry");
                }
            } else if (!Values.isRepresentable(operand)) {
                return new IllegalArgumentException("Carried value " + i + " has type "
                        + Values.typeName(operand) + ", which the tracing engine cannot represent");
            }
        }
        return null;
    }

    private static RuntimeException validatePredicate(Tracer predicate) {
        ValueKind kind = predicate.kind();
        if (kind != ValueKind.BOOLEAN && kind != ValueKind.NUMERIC_SCALAR) {
            return new IllegalArgumentException("cond predicate must be a scalar, got " + predicate.aval().describe());
        }
        return null;
    }

    private static RuntimeException validateResults(List<Object> results, int expected) {
        if (results.size() != expected) {
            return new IllegalStateException("Body returned " + results.size() + " values for "
                    + expected + " carried variables");
        }
        for (int i = 0; i < results.size(); i++) {
            Object result = results.get(i);
            if (result instanceof Undefined) {
                return new IllegalArgumentException("Carried value " + i + " is undefined on exit");
            }
            if (!Values.isRepresentable(result)) {
                return new IllegalArgumentException("Carried value " + i + " has type "
                        + Values.typeName(result) + ", which the tracing engine cannot represent");
            }
        }
        return null;
    }

    private static RuntimeException verify(String primitive, List<AbstractValue> expected, List<Object> actual) {
        if (expected.size() != actual.size()) {
            return new IllegalStateException(primitive + " produced " + actual.size()
                    + " results, expected " + expected.size());
        }
        for (int i = 0; i < expected.size(); i++) {
            AbstractValue got = Values.abstractOf(actual.get(i));
            if (!got.equals(expected.get(i))) {
                return new AbstractValueMismatchException(primitive, i, expected.get(i), got);
            }
        }
        return null;
    }

    private static PrimitiveResult commit(TraceGraph graph, TraceNode node, List<Object> concretes) {
        List<Object> outputs = new ArrayList<>(concretes.size());
        for (int i = 0; i < concretes.size(); i++) {
            outputs.add(graph.outputOf(node, i, concretes.get(i)));
        }
        return new Committed(node, outputs);
    }

    private static List<AbstractValue> avals(List<Object> values) {
        List<AbstractValue> avals = new ArrayList<>(values.size());
        for (Object value : values) {
            avals.add(Values.abstractOf(value));
        }
        return avals;
    }

    private static List<Object> concretes(List<Object> values) {
        List<Object> out = new ArrayList<>(values.size());
        for (Object value : values) {
            out.add(Values.concretize(value));
        }
        return out;
    }

    private static List<Object> definedOnly(List<Object> operands) {
        List<Object> out = new ArrayList<>();
        for (Object operand : operands) {
            if (!(operand instanceof Undefined)) {
                out.add(operand);
            }
        }
        return out;
    }
}
