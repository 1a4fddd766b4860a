package io.surfworks.snakeweaver.trace;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a structured primitive call.
 *
 * <p>Failures are values, not exceptions: a pre-bind failure left the graph
 * untouched, a post-bind failure left {@code node} in the graph.
 */
public sealed interface PrimitiveResult
        permits PrimitiveResult.Committed, PrimitiveResult.PreBindFailure, PrimitiveResult.PostBindFailure {

    record Committed(TraceNode node, List<Object> results) implements PrimitiveResult {
        public Committed {
            Objects.requireNonNull(node, "node");
            results = List.copyOf(results);
        }
    }

    record PreBindFailure(RuntimeException cause) implements PrimitiveResult {
        public PreBindFailure {
            Objects.requireNonNull(cause, "cause");
        }
    }

    record PostBindFailure(TraceNode node, RuntimeException cause) implements PrimitiveResult {
        public PostBindFailure {
            Objects.requireNonNull(node, "node");
            Objects.requireNonNull(cause, "cause");
        }
    }
}
