package io.surfworks.snakeweaver.value;

import java.util.Objects;

/**
 * A traced value: a placeholder in the trace graph.
 *
 * <p>The reference engine also carries the value the placeholder would take
 * when the graph runs, so traced and eager results can be compared.
 *
 * @param id       unique id within the owning graph
 * @param aval     abstract value
 * @param concrete eager value of the same abstract value
 */
public record Tracer(int id, AbstractValue aval, Object concrete) {

    public Tracer {
        Objects.requireNonNull(aval, "aval");
        if (!aval.kind().isRepresentable()) {
            throw new IllegalArgumentException("Tracers must have a representable abstract value");
        }
    }

    public ValueKind kind() {
        return aval.kind();
    }

    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return "Traced<" + aval.describe() + ">(%" + id + ")";
    }
}
