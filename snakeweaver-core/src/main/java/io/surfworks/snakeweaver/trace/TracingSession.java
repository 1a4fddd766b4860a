package io.surfworks.snakeweaver.trace;

/**
 * An active tracing session, obtained from {@link TracingGuard#enter()}.
 *
 * <p>The session owns the trace graph being built. It is passed explicitly to
 * everything that records into the graph. Closing it always releases the
 * guard. Always use try-with-resources.
 */
public final class TracingSession implements AutoCloseable {

    private final TraceGraph graph = new TraceGraph();
    private int concreteDepth;
    private boolean closed;

    TracingSession() {}

    public TraceGraph graph() {
        return graph;
    }

    /**
     * True while a primitive is computing concrete iterations. Code running in
     * that window evaluates eagerly and records nothing.
     */
    public boolean isConcrete() {
        return concreteDepth > 0;
    }

    public ConcreteScope concreteScope() {
        concreteDepth++;
        return new ConcreteScope();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            TracingGuard.release();
        }
    }

    /**
     * Scope during which the session evaluates concretely.
     */
    public final class ConcreteScope implements AutoCloseable {

        private boolean exited;

        private ConcreteScope() {}

        @Override
        public void close() {
            if (!exited) {
                exited = true;
                concreteDepth--;
            }
        }
    }
}
