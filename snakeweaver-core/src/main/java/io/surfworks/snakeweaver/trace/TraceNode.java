package io.surfworks.snakeweaver.trace;

import io.surfworks.snakeweaver.value.AbstractValue;
import io.surfworks.snakeweaver.value.Tracer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A primitive application recorded in the trace graph.
 *
 * <p>Output tracers are attached after binding, once their concrete values are known.
 */
public final class TraceNode {

    private final int id;
    private final String primitive;
    private final List<Object> operands;
    private final List<TraceRegion> regions;
    private final List<AbstractValue> outputAvals;
    private final List<Tracer> outputs = new ArrayList<>();

    TraceNode(int id, String primitive, List<Object> operands, List<TraceRegion> regions,
              List<AbstractValue> outputAvals) {
        this.id = id;
        this.primitive = primitive;
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        this.regions = List.copyOf(regions);
        this.outputAvals = List.copyOf(outputAvals);
    }

    public int id() {
        return id;
    }

    public String primitive() {
        return primitive;
    }

    public List<Object> operands() {
        return operands;
    }

    public List<TraceRegion> regions() {
        return regions;
    }

    public List<AbstractValue> outputAvals() {
        return outputAvals;
    }

    public List<Tracer> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    void addOutput(Tracer output) {
        outputs.add(output);
    }

    @Override
    public String toString() {
        return primitive + "#" + id;
    }
}
