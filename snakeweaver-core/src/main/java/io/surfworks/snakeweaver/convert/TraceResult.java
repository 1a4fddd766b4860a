package io.surfworks.snakeweaver.convert;

import io.surfworks.snakeweaver.trace.TraceGraph;
import io.surfworks.snakeweaver.value.Values;

import java.util.List;

/**
 * Result of tracing a converted callable.
 *
 * @param graph    the recorded graph
 * @param output   value returned by the callable, traced or eager
 * @param warnings fallback warnings emitted while tracing
 * @param outcomes every supervised block, in execution order
 */
public record TraceResult(TraceGraph graph, Object output, List<ConversionWarning> warnings,
                          List<BlockOutcome> outcomes) {

    public TraceResult {
        warnings = List.copyOf(warnings);
        outcomes = List.copyOf(outcomes);
    }

    /**
     * The output with every traced value replaced by its concrete value.
     */
    public Object concreteOutput() {
        return Values.concretize(output);
    }
}
