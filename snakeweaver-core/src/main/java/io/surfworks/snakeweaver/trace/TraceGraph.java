package io.surfworks.snakeweaver.trace;

import io.surfworks.snakeweaver.value.AbstractValue;
import io.surfworks.snakeweaver.value.Tracer;
import io.surfworks.snakeweaver.value.Values;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Data-flow graph built during a tracing session.
 *
 * Nodes are appended to the innermost open region. Structured primitives
 * (cond, for_loop, while_loop) own the regions their bodies were traced into.
 */
public final class TraceGraph {

    private final List<Tracer> inputs = new ArrayList<>();
    private final TraceRegion root = new TraceRegion();
    private final Deque<TraceRegion> open = new ArrayDeque<>();
    private int nextId;

    TraceGraph() {
        open.push(root);
    }

    /**
     * Adds a graph input carrying the given concrete value.
     */
    public Tracer input(Object concrete) {
        AbstractValue aval = Values.abstractOf(concrete);
        if (!aval.kind().isRepresentable()) {
            throw new IllegalArgumentException("Cannot trace an input of type " + Values.typeName(concrete));
        }
        Tracer tracer = new Tracer(nextId++, aval, concrete);
        inputs.add(tracer);
        return tracer;
    }

    /**
     * Adds a parameter to the innermost open region.
     */
    public Tracer parameter(AbstractValue aval, Object concrete) {
        Tracer tracer = new Tracer(nextId++, aval, concrete);
        open.peek().addParameter(tracer);
        return tracer;
    }

    /**
     * Records a single-output primitive and returns its output.
     */
    public Tracer record(String primitive, List<Object> operands, Object concrete) {
        AbstractValue aval = Values.abstractOf(concrete);
        TraceNode node = new TraceNode(nextId++, primitive, operands, List.of(), List.of(aval));
        open.peek().addNode(node);
        return outputOf(node, 0, concrete);
    }

    public TraceRegion openRegion() {
        TraceRegion region = new TraceRegion();
        open.push(region);
        return region;
    }

    public void closeRegion(TraceRegion region, List<Object> results) {
        if (open.peek() != region || region == root) {
            throw new IllegalStateException("Region closed out of order");
        }
        open.pop();
        region.setResults(results);
    }

    /**
     * Records a structured primitive. Its outputs are attached with {@link #outputOf}.
     */
    public TraceNode bind(String primitive, List<Object> operands, List<TraceRegion> regions,
                          List<AbstractValue> outputAvals) {
        TraceNode node = new TraceNode(nextId++, primitive, operands, regions, outputAvals);
        open.peek().addNode(node);
        return node;
    }

    public Tracer outputOf(TraceNode node, int index, Object concrete) {
        if (node.outputs().size() != index) {
            throw new IllegalStateException("Outputs of " + node + " must be attached in order");
        }
        Tracer tracer = new Tracer(nextId++, node.outputAvals().get(index), concrete);
        node.addOutput(tracer);
        return tracer;
    }

    /**
     * Removes a node from whichever region holds it.
     *
     * @return true if the node was found
     */
    public boolean retract(TraceNode node) {
        for (TraceRegion region : open) {
            if (region.removeNode(node)) {
                return true;
            }
        }
        return false;
    }

    public List<Tracer> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    /**
     * Top-level nodes, in recording order.
     */
    public List<TraceNode> nodes() {
        return root.nodes();
    }

    /**
     * True if any node, at any nesting depth, applies the given primitive.
     */
    public boolean contains(String primitive) {
        return count(root, primitive) > 0;
    }

    public int count(String primitive) {
        return count(root, primitive);
    }

    private static int count(TraceRegion region, String primitive) {
        int n = 0;
        for (TraceNode node : region.nodes()) {
            if (node.primitive().equals(primitive)) {
                n++;
            }
            for (TraceRegion nested : node.regions()) {
                n += count(nested, primitive);
            }
        }
        return n;
    }

    /**
     * Renders the graph as indented text, one node per line.
     */
    public String toText() {
        StringBuilder sb = new StringBuilder("graph(");
        for (int i = 0; i < inputs.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(name(inputs.get(i))).append(": ").append(inputs.get(i).aval().describe());
        }
        sb.append(")\n");
        appendRegion(sb, root, 1);
        return sb.toString();
    }

    private static void appendRegion(StringBuilder sb, TraceRegion region, int depth) {
        for (TraceNode node : region.nodes()) {
            indent(sb, depth);
            for (int i = 0; i < node.outputs().size(); i++) {
                sb.append(i > 0 ? ", " : "").append(name(node.outputs().get(i)));
            }
            if (!node.outputs().isEmpty()) {
                sb.append(" = ");
            }
            sb.append(node.primitive()).append('(');
            for (int i = 0; i < node.operands().size(); i++) {
                Object operand = node.operands().get(i);
                sb.append(i > 0 ? ", " : "")
                        .append(operand instanceof Tracer t ? name(t) : Values.repr(operand));
            }
            sb.append(")\n");
            for (TraceRegion nested : node.regions()) {
                indent(sb, depth + 1);
                sb.append("{");
                for (int i = 0; i < nested.parameters().size(); i++) {
                    sb.append(i > 0 ? ", " : " ").append(name(nested.parameters().get(i)));
                }
                sb.append(" ->\n");
                appendRegion(sb, nested, depth + 2);
                indent(sb, depth + 2);
                sb.append("yield");
                for (int i = 0; i < nested.results().size(); i++) {
                    Object result = nested.results().get(i);
                    sb.append(i > 0 ? ", " : " ").append(result instanceof Tracer t ? name(t) : Values.repr(result));
                }
                sb.append('\n');
                indent(sb, depth + 1);
                sb.append("}\n");
            }
        }
    }

    private static String name(Tracer tracer) {
        return "%" + tracer.id();
    }

    private static void indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
    }
}
