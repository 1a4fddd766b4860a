package io.surfworks.snakeweaver.value;

import io.surfworks.snakeweaver.ast.AgAst.BinaryOperator;
import io.surfworks.snakeweaver.ast.AgAst.CompareOperator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Eager evaluation of host operators over concrete values.
 *
 * Scalars follow host-language semantics (floor division and modulo round
 * toward negative infinity, true division always yields a float). Arrays are
 * combined element-wise, broadcasting single-element operands.
 */
public final class Arithmetic {

    private Arithmetic() {}

    // ==================== Binary operators ====================

    public static Object binary(BinaryOperator op, Object left, Object right) {
        if (left instanceof NdArray || right instanceof NdArray) {
            if (isNumeric(left) || isNumeric(right) || (left instanceof NdArray && right instanceof NdArray)) {
                return arrayBinary(op, left, right);
            }
        } else if (isNumeric(left) && isNumeric(right)) {
            return numeric(op, left, right);
        } else if (op == BinaryOperator.ADD) {
            if (left instanceof String l && right instanceof String r) {
                return l + r;
            }
            if (left instanceof List<?> l && right instanceof List<?> r) {
                List<Object> out = new ArrayList<>(l);
                out.addAll(r);
                return out;
            }
        } else if (op == BinaryOperator.MUL) {
            if (left instanceof String s && isInteger(right)) {
                return s.repeat((int) Math.max(0, asLong(right)));
            }
            if (right instanceof String s && isInteger(left)) {
                return s.repeat((int) Math.max(0, asLong(left)));
            }
            if (left instanceof List<?> l && isInteger(right)) {
                return repeat(l, asLong(right));
            }
            if (right instanceof List<?> l && isInteger(left)) {
                return repeat(l, asLong(left));
            }
        }
        throw new IllegalArgumentException(String.format("unsupported operand type(s) for %s: '%s' and '%s'",
                op.symbol(), Values.typeName(left), Values.typeName(right)));
    }

    private static List<Object> repeat(List<?> list, long times) {
        List<Object> out = new ArrayList<>();
        for (long i = 0; i < times; i++) {
            out.addAll(list);
        }
        return out;
    }

    private static Object numeric(BinaryOperator op, Object left, Object right) {
        if (left instanceof Double || right instanceof Double) {
            return doubleOp(op, asDouble(left), asDouble(right));
        }
        long a = asLong(left);
        long b = asLong(right);
        switch (op) {
            case ADD:
                return a + b;
            case SUB:
                return a - b;
            case MUL:
                return a * b;
            case DIV:
                if (b == 0) {
                    throw new ArithmeticException("division by zero");
                }
                return (double) a / (double) b;
            case FLOOR_DIV:
                if (b == 0) {
                    throw new ArithmeticException("integer division or modulo by zero");
                }
                return Math.floorDiv(a, b);
            case MOD:
                if (b == 0) {
                    throw new ArithmeticException("integer division or modulo by zero");
                }
                return Math.floorMod(a, b);
            case POW:
                if (b < 0) {
                    return Math.pow(a, b);
                }
                long result = 1;
                for (long i = 0; i < b; i++) {
                    result *= a;
                }
                return result;
            default:
                throw new IllegalArgumentException("Unknown operator " + op);
        }
    }

    private static double doubleOp(BinaryOperator op, double a, double b) {
        switch (op) {
            case ADD:
                return a + b;
            case SUB:
                return a - b;
            case MUL:
                return a * b;
            case DIV:
                if (b == 0.0) {
                    throw new ArithmeticException("float division by zero");
                }
                return a / b;
            case FLOOR_DIV:
                if (b == 0.0) {
                    throw new ArithmeticException("float floor division by zero");
                }
                return Math.floor(a / b);
            case MOD:
                if (b == 0.0) {
                    throw new ArithmeticException("float modulo");
                }
                return a - b * Math.floor(a / b);
            case POW:
                return Math.pow(a, b);
            default:
                throw new IllegalArgumentException("Unknown operator " + op);
        }
    }

    private static NdArray arrayBinary(BinaryOperator op, Object left, Object right) {
        ElementType resultType = op == BinaryOperator.DIV
                ? ElementType.FLOAT64
                : ElementType.promoteArithmetic(elementTypeOf(left), elementTypeOf(right));
        boolean integral = resultType == ElementType.INT64;
        return elementwise(left, right, resultType, (x, y) -> {
            switch (op) {
                case ADD:
                    return x + y;
                case SUB:
                    return x - y;
                case MUL:
                    return x * y;
                case DIV:
                    return x / y;
                case FLOOR_DIV:
                    if (integral && y == 0.0) {
                        throw new ArithmeticException("integer division or modulo by zero");
                    }
                    return Math.floor(x / y);
                case MOD:
                    if (integral && y == 0.0) {
                        throw new ArithmeticException("integer division or modulo by zero");
                    }
                    return x - y * Math.floor(x / y);
                case POW:
                    return Math.pow(x, y);
                default:
                    throw new IllegalArgumentException("Unknown operator " + op);
            }
        });
    }

    // ==================== Comparisons ====================

    public static Object compare(CompareOperator op, Object left, Object right) {
        if (left instanceof NdArray || right instanceof NdArray) {
            return elementwise(left, right, ElementType.BOOL, (x, y) -> compareDoubles(op, x, y) ? 1.0 : 0.0);
        }
        if (isNumeric(left) && isNumeric(right)) {
            if (left instanceof Double || right instanceof Double) {
                return compareDoubles(op, asDouble(left), asDouble(right));
            }
            return compareOrdering(op, Long.compare(asLong(left), asLong(right)));
        }
        if (left instanceof String l && right instanceof String r) {
            return compareOrdering(op, l.compareTo(r));
        }
        if (op == CompareOperator.EQ) {
            return hostEquals(left, right);
        }
        if (op == CompareOperator.NE) {
            return !hostEquals(left, right);
        }
        throw new IllegalArgumentException(String.format("'%s' not supported between instances of '%s' and '%s'",
                op.symbol(), Values.typeName(left), Values.typeName(right)));
    }

    private static boolean compareDoubles(CompareOperator op, double a, double b) {
        switch (op) {
            case LT:
                return a < b;
            case LE:
                return a <= b;
            case GT:
                return a > b;
            case GE:
                return a >= b;
            case EQ:
                return a == b;
            case NE:
                return a != b;
            default:
                throw new IllegalArgumentException("Unknown operator " + op);
        }
    }

    private static boolean compareOrdering(CompareOperator op, int cmp) {
        switch (op) {
            case LT:
                return cmp < 0;
            case LE:
                return cmp <= 0;
            case GT:
                return cmp > 0;
            case GE:
                return cmp >= 0;
            case EQ:
                return cmp == 0;
            case NE:
                return cmp != 0;
            default:
                throw new IllegalArgumentException("Unknown operator " + op);
        }
    }

    /**
     * Host-language equality: numbers compare by value across int, float and bool.
     */
    public static boolean hostEquals(Object left, Object right) {
        if (isNumeric(left) && isNumeric(right)) {
            return asDouble(left) == asDouble(right);
        }
        if (left instanceof List<?> l && right instanceof List<?> r) {
            if (l.size() != r.size()) {
                return false;
            }
            for (int i = 0; i < l.size(); i++) {
                if (!hostEquals(l.get(i), r.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return left == null ? right == null : left.equals(right);
    }

    // ==================== Unary and logical operators ====================

    public static Object negate(Object value) {
        if (value instanceof Long l) {
            return -l;
        } else if (value instanceof Boolean b) {
            return b ? -1L : 0L;
        } else if (value instanceof Double d) {
            return -d;
        } else if (value instanceof NdArray array) {
            ElementType type = array.dtype() == ElementType.BOOL ? ElementType.INT64 : array.dtype();
            return array.map(type, x -> -x);
        }
        throw new IllegalArgumentException("bad operand type for unary -: '" + Values.typeName(value) + "'");
    }

    public static Object logicalNot(Object value) {
        if (value instanceof NdArray array) {
            return array.map(ElementType.BOOL, x -> x == 0.0 ? 1.0 : 0.0);
        }
        return !Values.truthy(value);
    }

    /**
     * Element-wise logical and. Scalars combine to a Boolean.
     */
    public static Object logicalAnd(Object left, Object right) {
        if (left instanceof NdArray || right instanceof NdArray) {
            return elementwise(left, right, ElementType.BOOL, (x, y) -> x != 0.0 && y != 0.0 ? 1.0 : 0.0);
        }
        return Values.truthy(left) && Values.truthy(right);
    }

    /**
     * Element-wise logical or. Scalars combine to a Boolean.
     */
    public static Object logicalOr(Object left, Object right) {
        if (left instanceof NdArray || right instanceof NdArray) {
            return elementwise(left, right, ElementType.BOOL, (x, y) -> x != 0.0 || y != 0.0 ? 1.0 : 0.0);
        }
        return Values.truthy(left) || Values.truthy(right);
    }

    // ==================== Array helpers ====================

    /**
     * Kronecker product of two rank-1 arrays.
     */
    public static NdArray kron(Object left, Object right) {
        if (!(left instanceof NdArray a) || !(right instanceof NdArray b) || a.rank() != 1 || b.rank() != 1) {
            throw new IllegalArgumentException("kron expects two rank-1 arrays, got "
                    + Values.typeName(left) + " and " + Values.typeName(right));
        }
        double[] out = new double[a.length() * b.length()];
        for (int i = 0; i < a.length(); i++) {
            for (int j = 0; j < b.length(); j++) {
                out[i * b.length() + j] = a.flatDouble(i) * b.flatDouble(j);
            }
        }
        ElementType type = ElementType.promoteArithmetic(a.dtype(), b.dtype());
        return new NdArray(type, new int[] {out.length}, out);
    }

    public static Object cast(ElementType type, Object value) {
        if (value instanceof NdArray array) {
            return array.astype(type);
        }
        switch (type) {
            case BOOL:
                return Values.truthy(value);
            case INT64:
                if (value instanceof Long) {
                    return value;
                } else if (value instanceof Boolean b) {
                    return b ? 1L : 0L;
                } else if (value instanceof Double d) {
                    return (long) d.doubleValue();
                } else if (value instanceof String s) {
                    try {
                        return Long.parseLong(s.strip());
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("invalid literal for int() with base 10: '" + s + "'", e);
                    }
                }
                break;
            case FLOAT64:
                if (isNumeric(value)) {
                    return asDouble(value);
                } else if (value instanceof String s) {
                    try {
                        return Double.parseDouble(s.strip());
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("could not convert string to float: '" + s + "'", e);
                    }
                }
                break;
            default:
                break;
        }
        throw new IllegalArgumentException("Cannot convert " + Values.typeName(value) + " to " + type);
    }

    /**
     * Host subscript on a concrete target. Negative indices count from the end.
     */
    public static Object index(Object target, Object index) {
        if (target instanceof Map<?, ?> map) {
            if (!map.containsKey(index)) {
                throw new NoSuchElementException("KeyError: " + Values.repr(index));
            }
            return map.get(index);
        }
        long i = Values.toIndex(index);
        if (target instanceof List<?> list) {
            return list.get(checkIndex(i, list.size(), "list"));
        } else if (target instanceof String s) {
            int k = checkIndex(i, s.length(), "string");
            return s.substring(k, k + 1);
        } else if (target instanceof NdArray array) {
            return array.row(checkIndex(i, array.length(), "array"));
        } else if (target instanceof RangeValue range) {
            return range.get(checkIndex(i, (int) range.length(), "range object"));
        }
        throw new IllegalArgumentException("'" + Values.typeName(target) + "' object is not subscriptable");
    }

    private static int checkIndex(long i, int size, String what) {
        long k = i < 0 ? i + size : i;
        if (k < 0 || k >= size) {
            throw new IndexOutOfBoundsException(what + " index out of range");
        }
        return (int) k;
    }

    public static long len(Object value) {
        if (value instanceof List<?> list) {
            return list.size();
        } else if (value instanceof String s) {
            return s.length();
        } else if (value instanceof Map<?, ?> map) {
            return map.size();
        } else if (value instanceof NdArray array) {
            return array.length();
        } else if (value instanceof RangeValue range) {
            return range.length();
        }
        throw new IllegalArgumentException("object of type '" + Values.typeName(value) + "' has no len()");
    }

    // ==================== Internals ====================

    @FunctionalInterface
    private interface DoubleBinary {
        double apply(double x, double y);
    }

    private static NdArray elementwise(Object left, Object right, ElementType resultType, DoubleBinary op) {
        double[] a = flatten(left);
        double[] b = flatten(right);
        int[] shape;
        if (left instanceof NdArray l && right instanceof NdArray r) {
            if (Arrays.equals(l.shape(), r.shape())) {
                shape = l.shape();
            } else if (r.elementCount() == 1) {
                shape = l.shape();
            } else if (l.elementCount() == 1) {
                shape = r.shape();
            } else {
                throw new IllegalArgumentException("operands could not be broadcast together with shapes "
                        + Arrays.toString(l.shape()) + " " + Arrays.toString(r.shape()));
            }
        } else {
            shape = left instanceof NdArray l ? l.shape() : ((NdArray) right).shape();
        }
        int count = Math.max(a.length, b.length);
        if (a.length == 0 || b.length == 0) {
            count = 0;
        }
        double[] out = new double[count];
        for (int i = 0; i < count; i++) {
            out[i] = op.apply(a.length == 1 ? a[0] : a[i], b.length == 1 ? b[0] : b[i]);
        }
        return new NdArray(resultType, shape, out);
    }

    private static double[] flatten(Object value) {
        if (value instanceof NdArray array) {
            double[] out = new double[array.elementCount()];
            for (int i = 0; i < out.length; i++) {
                out[i] = array.flatDouble(i);
            }
            return out;
        }
        if (!isNumeric(value)) {
            throw new IllegalArgumentException("Cannot combine an array with " + Values.typeName(value));
        }
        return new double[] {asDouble(value)};
    }

    static ElementType elementTypeOf(Object value) {
        if (value instanceof NdArray array) {
            return array.dtype();
        } else if (value instanceof Boolean) {
            return ElementType.BOOL;
        } else if (value instanceof Long) {
            return ElementType.INT64;
        }
        return ElementType.FLOAT64;
    }

    private static boolean isNumeric(Object value) {
        return value instanceof Long || value instanceof Double || value instanceof Boolean;
    }

    private static boolean isInteger(Object value) {
        return value instanceof Long || value instanceof Boolean;
    }

    private static long asLong(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        return ((Number) value).longValue();
    }

    private static double asDouble(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        return ((Number) value).doubleValue();
    }
}
