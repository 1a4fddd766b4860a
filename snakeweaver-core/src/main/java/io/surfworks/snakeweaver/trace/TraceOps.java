package io.surfworks.snakeweaver.trace;

import io.surfworks.snakeweaver.ast.AgAst.BinaryOperator;
import io.surfworks.snakeweaver.ast.AgAst.CompareOperator;
import io.surfworks.snakeweaver.value.Arithmetic;
import io.surfworks.snakeweaver.value.ElementType;
import io.surfworks.snakeweaver.value.EnumerateValue;
import io.surfworks.snakeweaver.value.NdArray;
import io.surfworks.snakeweaver.value.RangeValue;
import io.surfworks.snakeweaver.value.Tracer;
import io.surfworks.snakeweaver.value.TracerIntegerConversionException;
import io.surfworks.snakeweaver.value.ValueKind;
import io.surfworks.snakeweaver.value.Values;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Host operators that record a node whenever an operand is traced.
 *
 * <p>With no session, or while the session evaluates concretely, every
 * operation is eager and tracers are replaced by their concrete values.
 */
public final class TraceOps {

    private final TracingSession session;

    /**
     * @param session active session, or null for purely eager evaluation
     */
    public TraceOps(TracingSession session) {
        this.session = session;
    }

    public static TraceOps eager() {
        return new TraceOps(null);
    }

    public TracingSession session() {
        return session;
    }

    /**
     * True when tracers may flow and primitives may be recorded.
     */
    public boolean isTracing() {
        return session != null && !session.isConcrete();
    }

    /**
     * Prepares a value read from the host program for the current evaluation mode.
     */
    public Object operand(Object value) {
        return isTracing() ? value : Values.concretize(value);
    }

    public Object binary(BinaryOperator op, Object left, Object right) {
        Object l = operand(left);
        Object r = operand(right);
        if (!Values.isTraced(l) && !Values.isTraced(r)) {
            return Arithmetic.binary(op, l, r);
        }
        requireRepresentable(op.symbol(), l, r);
        return record(op.primitiveName(), List.of(l, r),
                Arithmetic.binary(op, Values.concrete(l), Values.concrete(r)));
    }

    public Object compare(CompareOperator op, Object left, Object right) {
        Object l = operand(left);
        Object r = operand(right);
        if (!Values.isTraced(l) && !Values.isTraced(r)) {
            return Arithmetic.compare(op, l, r);
        }
        requireRepresentable(op.symbol(), l, r);
        return record(op.primitiveName(), List.of(l, r),
                Arithmetic.compare(op, Values.concrete(l), Values.concrete(r)));
    }

    public Object negate(Object value) {
        Object v = operand(value);
        if (v instanceof Tracer tracer) {
            return record("neg", List.of(tracer), Arithmetic.negate(tracer.concrete()));
        }
        return Arithmetic.negate(v);
    }

    /**
     * Subscript. A traced index can only select from an array.
     *
     * @throws TracerIntegerConversionException if a traced index is used on a host sequence
     */
    public Object index(Object target, Object index) {
        Object t = operand(target);
        Object i = operand(index);
        if (i instanceof Tracer tracer) {
            if (!isArray(t) || tracer.aval().elementType() == ElementType.FLOAT64
                    || tracer.kind() == ValueKind.ARRAY) {
                throw new TracerIntegerConversionException(tracer);
            }
            return record("dynamic_index", List.of(t, tracer),
                    Arithmetic.index(Values.concrete(t), tracer.concrete()));
        }
        if (t instanceof Tracer tracer) {
            Object concrete = Arithmetic.index(tracer.concrete(), i);
            return record("index", List.of(tracer, i), concrete);
        }
        return Arithmetic.index(t, i);
    }

    public Object len(Object value) {
        Object v = operand(value);
        if (v instanceof Tracer tracer) {
            if (tracer.kind() != ValueKind.ARRAY) {
                throw new IllegalArgumentException("len() of unsized traced value " + tracer);
            }
            return (long) tracer.aval().shape().get(0);
        }
        return Arithmetic.len(v);
    }

    /**
     * Builds an array from a list, an array or a traced array.
     */
    public Object array(Object value) {
        Object v = operand(value);
        if (v instanceof NdArray || (v instanceof Tracer t && t.kind() == ValueKind.ARRAY)) {
            return v;
        }
        if (!(v instanceof List<?> list)) {
            throw new IllegalArgumentException("array() expects a list or an array, got " + Values.typeName(v));
        }
        NdArray concrete = NdArray.tryFromList((List<?>) Values.concretize(list)).orElseThrow(() ->
                new IllegalArgumentException("Could not convert " + Values.repr(Values.concretize(list))
                        + " to an array: elements must be numbers or booleans of uniform shape"));
        if (!Values.containsTracer(list)) {
            return concrete;
        }
        return record("stack", new ArrayList<>(list), concrete);
    }

    public Object kron(Object left, Object right) {
        Object l = operand(left);
        Object r = operand(right);
        if (!Values.isTraced(l) && !Values.isTraced(r)) {
            return Arithmetic.kron(l, r);
        }
        NdArray concrete = Arithmetic.kron(Values.concrete(l), Values.concrete(r));
        return record("kron", List.of(l, r), concrete);
    }

    /**
     * Element type conversion ({@code int}, {@code float}, {@code bool}).
     */
    public Object cast(ElementType type, Object value) {
        Object v = operand(value);
        if (v instanceof Tracer tracer) {
            if (tracer.aval().elementType() == type) {
                return tracer;
            }
            return record("convert_" + type.typeName(), List.of(tracer), Arithmetic.cast(type, tracer.concrete()));
        }
        return Arithmetic.cast(type, v);
    }

    /**
     * Host iteration. Traced arrays are unrolled row by row; traced range bounds cannot be iterated.
     *
     * @throws TracerIntegerConversionException if a range bound is traced
     */
    public Iterator<Object> iterate(Object iterable) {
        Object v = operand(iterable);
        if (v instanceof RangeValue range) {
            long start = Values.toIndex(range.start());
            long stop = Values.toIndex(range.stop());
            long step = Values.toIndex(range.step());
            RangeValue eager = new RangeValue(start, stop, step);
            long length = eager.length();
            return new Iterator<>() {
                private long k;

                @Override
                public boolean hasNext() {
                    return k < length;
                }

                @Override
                public Object next() {
                    if (!hasNext()) {
                        throw new NoSuchElementException();
                    }
                    return eager.get(k++);
                }
            };
        } else if (v instanceof EnumerateValue enumerate) {
            Iterator<Object> inner = iterate(enumerate.iterable());
            return new Iterator<>() {
                private long position = enumerate.start();

                @Override
                public boolean hasNext() {
                    return inner.hasNext();
                }

                @Override
                public Object next() {
                    return List.of(position++, inner.next());
                }
            };
        }
        return materialize(v).iterator();
    }

    /**
     * Destructures a value into exactly {@code arity} parts.
     */
    public List<Object> unpack(Object value, int arity) {
        Object v = operand(value);
        if (!(v instanceof List) && !isArray(v)) {
            throw new IllegalArgumentException("cannot unpack non-iterable " + Values.typeName(v) + " object");
        }
        List<Object> parts = materialize(v);
        if (parts.size() < arity) {
            throw new IllegalArgumentException(
                    "not enough values to unpack (expected " + arity + ", got " + parts.size() + ")");
        }
        if (parts.size() > arity) {
            throw new IllegalArgumentException("too many values to unpack (expected " + arity + ")");
        }
        return parts;
    }

    private List<Object> materialize(Object v) {
        List<Object> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            out.addAll(list);
        } else if (v instanceof String s) {
            for (int i = 0; i < s.length(); i++) {
                out.add(s.substring(i, i + 1));
            }
        } else if (v instanceof NdArray array) {
            for (int i = 0; i < array.length(); i++) {
                out.add(array.row(i));
            }
        } else if (v instanceof Tracer tracer && tracer.kind() == ValueKind.ARRAY) {
            for (int i = 0; i < tracer.aval().shape().get(0); i++) {
                out.add(index(tracer, (long) i));
            }
        } else if (v instanceof Map<?, ?> map) {
            out.addAll(map.keySet());
        } else if (v instanceof RangeValue || v instanceof EnumerateValue) {
            iterate(v).forEachRemaining(out::add);
        } else {
            throw new IllegalArgumentException("'" + Values.typeName(v) + "' object is not iterable");
        }
        return out;
    }

    private Tracer record(String primitive, List<Object> operands, Object concrete) {
        return session.graph().record(primitive, operands, concrete);
    }

    private static boolean isArray(Object value) {
        return value instanceof NdArray || (value instanceof Tracer t && t.kind() == ValueKind.ARRAY);
    }

    private static void requireRepresentable(String symbol, Object left, Object right) {
        if (!Values.isRepresentable(left) || !Values.isRepresentable(right)) {
            throw new IllegalArgumentException(String.format("unsupported operand type(s) for %s: '%s' and '%s'",
                    symbol, Values.typeName(left), Values.typeName(right)));
        }
    }
}
