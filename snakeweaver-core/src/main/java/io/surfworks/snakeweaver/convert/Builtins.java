package io.surfworks.snakeweaver.convert;

import io.surfworks.snakeweaver.trace.TraceOps;
import io.surfworks.snakeweaver.value.ElementType;
import io.surfworks.snakeweaver.value.EnumerateValue;
import io.surfworks.snakeweaver.value.RangeValue;
import io.surfworks.snakeweaver.value.Tracer;
import io.surfworks.snakeweaver.value.Values;

import java.util.List;
import java.util.Set;

/**
 * Builtin functions available to every converted program.
 */
final class Builtins {

    private static final Set<String> NAMES = Set.of("range", "enumerate", "len", "int", "float", "bool", "array", "kron");

    private Builtins() {}

    static boolean isBuiltin(String name) {
        return NAMES.contains(name);
    }

    static Object call(String name, TraceOps ops, List<Object> args) {
        switch (name) {
            case "range":
                return range(args);
            case "enumerate":
                arity(name, args, 1, 2);
                return new EnumerateValue(args.get(0), args.size() == 2 ? Values.toIndex(args.get(1)) : 0L);
            case "len":
                arity(name, args, 1, 1);
                return ops.len(args.get(0));
            case "int":
                arity(name, args, 1, 1);
                return ops.cast(ElementType.INT64, args.get(0));
            case "float":
                arity(name, args, 1, 1);
                return ops.cast(ElementType.FLOAT64, args.get(0));
            case "bool":
                arity(name, args, 1, 1);
                return ops.cast(ElementType.BOOL, args.get(0));
            case "array":
                arity(name, args, 1, 1);
                return ops.array(args.get(0));
            case "kron":
                arity(name, args, 2, 2);
                return ops.kron(args.get(0), args.get(1));
            default:
                throw new IllegalArgumentException("Unknown builtin: " + name);
        }
    }

    private static RangeValue range(List<Object> args) {
        arity("range", args, 1, 3);
        if (args.size() == 1) {
            return new RangeValue(0L, integer(args.get(0)), 1L);
        }
        return new RangeValue(integer(args.get(0)), integer(args.get(1)), args.size() == 3 ? integer(args.get(2)) : 1L);
    }

    private static Object integer(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (value instanceof Long || value instanceof Tracer) {
            return value;
        }
        throw new IllegalArgumentException("'" + Values.typeName(value) + "' object cannot be interpreted as an integer");
    }

    private static void arity(String name, List<Object> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            String expected = min == max ? String.valueOf(min) : min + " to " + max;
            throw new IllegalArgumentException(name + "() takes " + expected + " arguments (" + args.size() + " given)");
        }
    }
}
