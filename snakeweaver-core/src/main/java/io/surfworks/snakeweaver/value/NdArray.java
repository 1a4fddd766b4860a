package io.surfworks.snakeweaver.value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/**
 * Immutable fixed-shape array of rank one or more.
 *
 * <p>Elements are stored row-major as doubles; BOOL arrays hold 0 and 1,
 * INT64 arrays hold integral values.
 */
public final class NdArray {

    private final ElementType dtype;
    private final int[] shape;
    private final double[] data;

    public NdArray(ElementType dtype, int[] shape, double[] data) {
        Objects.requireNonNull(dtype, "dtype");
        if (shape.length == 0) {
            throw new IllegalArgumentException("NdArray must have rank >= 1");
        }
        int count = 1;
        for (int dim : shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("Negative dimension in shape " + Arrays.toString(shape));
            }
            count *= dim;
        }
        if (count != data.length) {
            throw new IllegalArgumentException(
                    "Shape " + Arrays.toString(shape) + " needs " + count + " elements, got " + data.length);
        }
        this.dtype = dtype;
        this.shape = shape.clone();
        this.data = data.clone();
        normalizeData(this.dtype, this.data);
    }

    public static NdArray ofLongs(long... values) {
        double[] data = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            data[i] = values[i];
        }
        return new NdArray(ElementType.INT64, new int[] {values.length}, data);
    }

    public static NdArray ofDoubles(double... values) {
        return new NdArray(ElementType.FLOAT64, new int[] {values.length}, values);
    }

    public static NdArray ofBooleans(boolean... values) {
        double[] data = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            data[i] = values[i] ? 1.0 : 0.0;
        }
        return new NdArray(ElementType.BOOL, new int[] {values.length}, data);
    }

    /**
     * Converts a host list to an array if its elements are uniform.
     *
     * <p>Numbers of mixed integer and float types promote to float64. Booleans
     * must not be mixed with numbers. Nested lists must all have the same shape.
     * An empty list becomes a float64 array of shape [0].
     */
    public static Optional<NdArray> tryFromList(List<?> list) {
        if (list.isEmpty()) {
            return Optional.of(new NdArray(ElementType.FLOAT64, new int[] {0}, new double[0]));
        }
        Object first = list.get(0);
        if (isScalar(first)) {
            return scalarsToArray(list);
        }
        List<NdArray> rows = new ArrayList<>();
        for (Object element : list) {
            NdArray row;
            if (element instanceof NdArray array) {
                row = array;
            } else if (element instanceof List<?> inner) {
                Optional<NdArray> converted = tryFromList(inner);
                if (converted.isEmpty()) {
                    return Optional.empty();
                }
                row = converted.get();
            } else {
                return Optional.empty();
            }
            rows.add(row);
        }
        return stack(rows);
    }

    /**
     * Stacks equally shaped arrays along a new leading dimension.
     */
    public static Optional<NdArray> stack(List<NdArray> rows) {
        NdArray first = rows.get(0);
        boolean bool = first.dtype == ElementType.BOOL;
        ElementType dtype = first.dtype;
        for (NdArray row : rows) {
            if (!Arrays.equals(row.shape, first.shape) || (row.dtype == ElementType.BOOL) != bool) {
                return Optional.empty();
            }
            dtype = ElementType.promote(dtype, row.dtype);
        }
        int[] shape = new int[first.shape.length + 1];
        shape[0] = rows.size();
        System.arraycopy(first.shape, 0, shape, 1, first.shape.length);
        double[] data = new double[rows.size() * first.data.length];
        for (int i = 0; i < rows.size(); i++) {
            System.arraycopy(rows.get(i).data, 0, data, i * first.data.length, first.data.length);
        }
        return Optional.of(new NdArray(dtype, shape, data));
    }

    private static Optional<NdArray> scalarsToArray(List<?> list) {
        boolean bool = list.get(0) instanceof Boolean;
        ElementType dtype = bool ? ElementType.BOOL : ElementType.INT64;
        double[] data = new double[list.size()];
        for (int i = 0; i < list.size(); i++) {
            Object element = list.get(i);
            if (!isScalar(element) || (element instanceof Boolean) != bool) {
                return Optional.empty();
            }
            if (element instanceof Double d) {
                dtype = ElementType.FLOAT64;
                data[i] = d;
            } else if (element instanceof Long l) {
                data[i] = l;
            } else {
                data[i] = ((Boolean) element) ? 1.0 : 0.0;
            }
        }
        return Optional.of(new NdArray(dtype, new int[] {list.size()}, data));
    }

    private static boolean isScalar(Object value) {
        return value instanceof Long || value instanceof Double || value instanceof Boolean;
    }

    private static void normalizeData(ElementType dtype, double[] data) {
        for (int i = 0; i < data.length; i++) {
            if (dtype == ElementType.BOOL) {
                data[i] = data[i] != 0.0 ? 1.0 : 0.0;
            } else if (dtype == ElementType.INT64 && !Double.isNaN(data[i]) && !Double.isInfinite(data[i])) {
                data[i] = (double) (long) data[i];
            }
        }
    }

    // ==================== Accessors ====================

    public ElementType dtype() {
        return dtype;
    }

    public int[] shape() {
        return shape.clone();
    }

    public int rank() {
        return shape.length;
    }

    /**
     * Length along the leading dimension.
     */
    public int length() {
        return shape[0];
    }

    public int elementCount() {
        return data.length;
    }

    public AbstractValue aval() {
        return AbstractValue.array(dtype, shape);
    }

    /**
     * Element at a flat row-major position, boxed as Long, Double or Boolean.
     */
    public Object flat(int i) {
        return box(dtype, data[i]);
    }

    public double flatDouble(int i) {
        return data[i];
    }

    /**
     * Element along the leading dimension: a scalar for rank 1, a sub-array otherwise.
     */
    public Object row(int i) {
        if (i < 0 || i >= shape[0]) {
            throw new IndexOutOfBoundsException("index " + i + " is out of bounds for axis 0 with size " + shape[0]);
        }
        if (shape.length == 1) {
            return flat(i);
        }
        int[] rowShape = Arrays.copyOfRange(shape, 1, shape.length);
        int rowSize = data.length / shape[0];
        return new NdArray(dtype, rowShape, Arrays.copyOfRange(data, i * rowSize, (i + 1) * rowSize));
    }

    public NdArray map(ElementType resultType, DoubleUnaryOperator op) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = op.applyAsDouble(data[i]);
        }
        return new NdArray(resultType, shape, out);
    }

    public NdArray astype(ElementType resultType) {
        return new NdArray(resultType, shape, data);
    }

    public List<Object> toList() {
        List<Object> out = new ArrayList<>();
        for (int i = 0; i < shape[0]; i++) {
            Object row = row(i);
            out.add(row instanceof NdArray array ? array.toList() : row);
        }
        return out;
    }

    static Object box(ElementType dtype, double value) {
        switch (dtype) {
            case BOOL:
                return value != 0.0;
            case INT64:
                return (long) value;
            default:
                return value;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NdArray other)) {
            return false;
        }
        return dtype == other.dtype && Arrays.equals(shape, other.shape) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dtype, Arrays.hashCode(shape), Arrays.hashCode(data));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("array(");
        appendRows(sb, 0, 0);
        if (dtype != ElementType.INT64 && dtype != ElementType.FLOAT64) {
            sb.append(", dtype=").append(dtype.typeName());
        }
        return sb.append(')').toString();
    }

    private int appendRows(StringBuilder sb, int dim, int offset) {
        sb.append('[');
        for (int i = 0; i < shape[dim]; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            if (dim == shape.length - 1) {
                sb.append(Values.repr(flat(offset)));
                offset++;
            } else {
                offset = appendRows(sb, dim + 1, offset);
            }
        }
        sb.append(']');
        return offset;
    }
}
