package io.surfworks.snakeweaver.convert;

import io.surfworks.snakeweaver.ast.AgAst.LogicalOperator;
import io.surfworks.snakeweaver.trace.TraceOps;
import io.surfworks.snakeweaver.trace.TracingEngine;
import io.surfworks.snakeweaver.value.Tracer;
import io.surfworks.snakeweaver.value.Values;

import java.util.function.Supplier;

/**
 * {@code and}, {@code or} and {@code not} over eager and traced operands.
 *
 * <p>An eager left operand keeps host short-circuit semantics: the right operand
 * is evaluated only when needed and returned unchanged. Two traced operands
 * combine element-wise through the engine. A traced left operand with an eager
 * right operand would need the left operand as a host boolean, which fails.
 * {@code not} of an eager operand is the host negation and always a Boolean.
 */
final class LogicalOps {

    private final TracingEngine engine;
    private final TraceOps ops;

    LogicalOps(TracingEngine engine, TraceOps ops) {
        this.engine = engine;
        this.ops = ops;
    }

    Object apply(LogicalOperator op, Object left, Supplier<Object> right) {
        return op == LogicalOperator.AND ? and(left, right) : or(left, right);
    }

    Object and(Object left, Supplier<Object> right) {
        if (!(left instanceof Tracer l)) {
            return Values.truthy(left) ? right.get() : left;
        }
        Object r = right.get();
        if (r instanceof Tracer t) {
            return engine.logicalAnd(ops.session(), l, t);
        }
        // Host semantics: raises TracerBoolConversionException.
        return Values.truthy(l) ? r : l;
    }

    Object or(Object left, Supplier<Object> right) {
        if (!(left instanceof Tracer l)) {
            return Values.truthy(left) ? left : right.get();
        }
        Object r = right.get();
        if (r instanceof Tracer t) {
            return engine.logicalOr(ops.session(), l, t);
        }
        return Values.truthy(l) ? l : r;
    }

    Object not(Object operand) {
        if (operand instanceof Tracer t) {
            return engine.logicalNot(ops.session(), t);
        }
        return !Values.truthy(operand);
    }
}
