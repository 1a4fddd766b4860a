package io.surfworks.snakeweaver.trace;

import io.surfworks.snakeweaver.value.Tracer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A nested body of a structured primitive: its parameters, nodes and results.
 */
public final class TraceRegion {

    private final List<Tracer> parameters = new ArrayList<>();
    private final List<TraceNode> nodes = new ArrayList<>();
    private List<Object> results = List.of();

    TraceRegion() {}

    public List<Tracer> parameters() {
        return Collections.unmodifiableList(parameters);
    }

    public List<TraceNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<Object> results() {
        return results;
    }

    void addParameter(Tracer parameter) {
        parameters.add(parameter);
    }

    void addNode(TraceNode node) {
        nodes.add(node);
    }

    boolean removeNode(TraceNode node) {
        if (nodes.remove(node)) {
            return true;
        }
        for (TraceNode candidate : nodes) {
            for (TraceRegion region : candidate.regions()) {
                if (region.removeNode(node)) {
                    return true;
                }
            }
        }
        return false;
    }

    void setResults(List<Object> results) {
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
    }
}
