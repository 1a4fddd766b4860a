package io.surfworks.snakeweaver.trace;

import io.surfworks.snakeweaver.value.Tracer;

import java.util.List;

/**
 * Structured control-flow primitives of a tracing engine.
 *
 * <p>Closures handed to a primitive may throw. A RuntimeException thrown by a
 * closure is reported as a {@link PrimitiveResult.PreBindFailure}, except a
 * {@link io.surfworks.snakeweaver.ConversionException} or a
 * {@link SessionReentryException}, which propagate unchanged.
 * Implementations must leave no open region behind on any path.
 */
public interface TracingEngine {

    /**
     * Branch selection. Under tracing both branches are evaluated; the predicate selects the result.
     */
    PrimitiveResult select(TracingSession session, Tracer predicate,
                           CarriedFunction onTrue, CarriedFunction onFalse, List<Object> operands);

    /**
     * Counted loop over bounds or the rows of an array. The body receives the iteration position.
     */
    PrimitiveResult forLoop(TracingSession session, LoopSource source,
                            IndexedCarriedFunction body, List<Object> operands);

    /**
     * Conditional loop. The predicate runs before every iteration, including the first.
     */
    PrimitiveResult whileLoop(TracingSession session, CarriedPredicate predicate,
                              CarriedFunction body, List<Object> operands);

    Tracer logicalAnd(TracingSession session, Tracer left, Tracer right);

    Tracer logicalOr(TracingSession session, Tracer left, Tracer right);

    Tracer logicalNot(TracingSession session, Tracer operand);

    /**
     * Removes a node recorded by a primitive that failed after binding.
     */
    void retract(TracingSession session, TraceNode node);
}
