package io.surfworks.snakeweaver.value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Classification and coercion of host values.
 *
 * <p>Eager host values are Long, Double, Boolean, String, List (lists and
 * tuples), Map, NdArray, RangeValue, EnumerateValue and null. Anything else is
 * an opaque host object.
 */
public final class Values {

    private Values() {}

    /**
     * Semantic type class of a value. Pure; depends only on the value's shape and type.
     */
    public static ValueKind kindOf(Object value) {
        return abstractOf(value).kind();
    }

    public static AbstractValue abstractOf(Object value) {
        if (value instanceof Tracer tracer) {
            return tracer.aval();
        } else if (value instanceof Boolean) {
            return AbstractValue.scalar(ElementType.BOOL);
        } else if (value instanceof Long) {
            return AbstractValue.scalar(ElementType.INT64);
        } else if (value instanceof Double) {
            return AbstractValue.scalar(ElementType.FLOAT64);
        } else if (value instanceof NdArray array) {
            return array.aval();
        }
        return AbstractValue.UNREPRESENTABLE;
    }

    public static boolean isRepresentable(Object value) {
        return kindOf(value).isRepresentable();
    }

    public static boolean isTraced(Object value) {
        return value instanceof Tracer;
    }

    /**
     * Returns the concrete value behind a tracer, or the value itself.
     */
    public static Object concrete(Object value) {
        return value instanceof Tracer tracer ? tracer.concrete() : value;
    }

    /**
     * Replaces tracers by their concrete values, recursively through lists and ranges.
     */
    public static Object concretize(Object value) {
        if (value instanceof Tracer tracer) {
            return tracer.concrete();
        } else if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object element : list) {
                out.add(concretize(element));
            }
            return out;
        } else if (value instanceof RangeValue range) {
            return new RangeValue(concrete(range.start()), concrete(range.stop()), concrete(range.step()));
        } else if (value instanceof EnumerateValue enumerate) {
            return new EnumerateValue(concretize(enumerate.iterable()), enumerate.start());
        }
        return value;
    }

    public static boolean containsTracer(Object value) {
        if (value instanceof Tracer) {
            return true;
        } else if (value instanceof List<?> list) {
            for (Object element : list) {
                if (containsTracer(element)) {
                    return true;
                }
            }
        } else if (value instanceof RangeValue range) {
            return !range.isStatic();
        } else if (value instanceof EnumerateValue enumerate) {
            return containsTracer(enumerate.iterable());
        }
        return false;
    }

    /**
     * Host truth value.
     *
     * @throws TracerBoolConversionException if the value is traced
     */
    public static boolean truthy(Object value) {
        if (value instanceof Tracer tracer) {
            throw new TracerBoolConversionException(tracer);
        } else if (value == null) {
            return false;
        } else if (value instanceof Boolean b) {
            return b;
        } else if (value instanceof Long l) {
            return l != 0L;
        } else if (value instanceof Double d) {
            return d != 0.0;
        } else if (value instanceof String s) {
            return !s.isEmpty();
        } else if (value instanceof List<?> list) {
            return !list.isEmpty();
        } else if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        } else if (value instanceof NdArray array) {
            if (array.elementCount() != 1) {
                throw new IllegalArgumentException(
                        "The truth value of an array with more than one element is ambiguous");
            }
            return array.flatDouble(0) != 0.0;
        } else if (value instanceof RangeValue range) {
            return range.length() > 0;
        } else if (value instanceof Undefined) {
            throw new IllegalStateException("Truth value of an undefined variable");
        }
        return true;
    }

    /**
     * Host integer index.
     *
     * @throws TracerIntegerConversionException if the value is traced
     */
    public static long toIndex(Object value) {
        if (value instanceof Tracer tracer) {
            throw new TracerIntegerConversionException(tracer);
        } else if (value instanceof Long l) {
            return l;
        } else if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        throw new IllegalArgumentException("indices must be integers, not " + typeName(value));
    }

    /**
     * Host-language type name, as used in diagnostics.
     */
    public static String typeName(Object value) {
        if (value == null) {
            return "NoneType";
        } else if (value instanceof Boolean) {
            return "bool";
        } else if (value instanceof Long) {
            return "int";
        } else if (value instanceof Double) {
            return "float";
        } else if (value instanceof String) {
            return "str";
        } else if (value instanceof List) {
            return "list";
        } else if (value instanceof Map) {
            return "dict";
        } else if (value instanceof NdArray) {
            return "array";
        } else if (value instanceof Tracer) {
            return "tracer";
        } else if (value instanceof RangeValue) {
            return "range";
        } else if (value instanceof EnumerateValue) {
            return "enumerate";
        }
        return value.getClass().getSimpleName();
    }

    /**
     * Maps boxed Java numbers onto the value model's Long and Double.
     */
    public static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        } else if (value instanceof Float f) {
            return f.doubleValue();
        } else if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object element : list) {
                out.add(normalize(element));
            }
            return out;
        }
        return value;
    }

    /**
     * Host-language representation of a value.
     */
    public static String repr(Object value) {
        if (value == null) {
            return "None";
        } else if (value instanceof Boolean b) {
            return b ? "True" : "False";
        } else if (value instanceof Double d) {
            if (d.isNaN()) {
                return "nan";
            } else if (d.isInfinite()) {
                return d > 0 ? "inf" : "-inf";
            }
            return d.toString();
        } else if (value instanceof String s) {
            return "'" + s + "'";
        } else if (value instanceof List<?> list) {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(repr(list.get(i)));
            }
            return sb.append(']').toString();
        } else if (value instanceof Map<?, ?> map) {
            StringBuilder sb = new StringBuilder("{");
            boolean first = true;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                sb.append(repr(entry.getKey())).append(": ").append(repr(entry.getValue()));
            }
            return sb.append('}').toString();
        }
        return String.valueOf(value);
    }
}
