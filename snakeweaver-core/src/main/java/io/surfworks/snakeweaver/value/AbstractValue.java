package io.surfworks.snakeweaver.value;

import java.util.List;
import java.util.Objects;

/**
 * Shape and type of a value as seen by the tracing engine.
 *
 * <p>Two values can be threaded through the same carried slot only if their
 * abstract values are equal.
 *
 * @param kind        semantic type class
 * @param elementType element type, null for unrepresentable values
 * @param shape       dimensions, empty for scalars
 */
public record AbstractValue(ValueKind kind, ElementType elementType, List<Integer> shape) {

    public static final AbstractValue UNREPRESENTABLE =
            new AbstractValue(ValueKind.UNREPRESENTABLE, null, List.of());

    public AbstractValue {
        Objects.requireNonNull(kind, "kind");
        shape = List.copyOf(shape);
        if (kind.isRepresentable() && elementType == null) {
            throw new IllegalArgumentException("Representable values need an element type");
        }
    }

    public static AbstractValue scalar(ElementType elementType) {
        ValueKind kind = elementType == ElementType.BOOL ? ValueKind.BOOLEAN : ValueKind.NUMERIC_SCALAR;
        return new AbstractValue(kind, elementType, List.of());
    }

    public static AbstractValue array(ElementType elementType, int... dims) {
        Integer[] boxed = new Integer[dims.length];
        for (int i = 0; i < dims.length; i++) {
            boxed[i] = dims[i];
        }
        return new AbstractValue(ValueKind.ARRAY, elementType, List.of(boxed));
    }

    /**
     * True if both values have the same kind and element type, whatever their shapes.
     */
    public boolean sameType(AbstractValue other) {
        return other != null && kind == other.kind && elementType == other.elementType;
    }

    public int rank() {
        return shape.size();
    }

    /**
     * Abstract value of one element along the leading dimension.
     */
    public AbstractValue row() {
        if (kind != ValueKind.ARRAY) {
            throw new IllegalStateException("Cannot take a row of " + describe());
        }
        if (shape.size() == 1) {
            return scalar(elementType);
        }
        return new AbstractValue(ValueKind.ARRAY, elementType, shape.subList(1, shape.size()));
    }

    /**
     * Returns a compact description such as {@code int64[]} or {@code float64[3]}.
     */
    public String describe() {
        if (!kind.isRepresentable()) {
            return "unrepresentable";
        }
        StringBuilder sb = new StringBuilder(elementType.typeName()).append('[');
        for (int i = 0; i < shape.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(shape.get(i));
        }
        return sb.append(']').toString();
    }

    @Override
    public String toString() {
        return describe();
    }
}
