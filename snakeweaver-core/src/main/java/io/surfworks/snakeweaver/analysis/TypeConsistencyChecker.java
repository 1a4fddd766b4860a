package io.surfworks.snakeweaver.analysis;

import io.surfworks.snakeweaver.value.AbstractValue;
import io.surfworks.snakeweaver.value.Undefined;
import io.surfworks.snakeweaver.value.Values;

import java.util.List;
import java.util.Optional;

/**
 * Checks that carried variables keep one representable type across a block.
 *
 * <p>Booleans, integers and floats are distinct classes: a carried integer that
 * becomes a float (or a boolean) inside the block is the wrong type, not a
 * promotion. Text, lists, maps, None and other host objects are unrepresentable.
 *
 * <p>{@code validate*} methods report a mismatch; {@code check*} methods throw
 * it, as an {@link AnalysisException} under strict conversion and as a
 * {@link CarriedTypeMismatchException} otherwise.
 */
public final class TypeConsistencyChecker {

    private final boolean strict;

    public TypeConsistencyChecker(boolean strict) {
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * The value on entry must be a number, a boolean or an array. Undefined values are not checked.
     */
    public Optional<TypeMismatch> validateInitial(String name, Object initial) {
        if (initial instanceof Undefined || Values.isRepresentable(initial)) {
            return Optional.empty();
        }
        return Optional.of(new TypeMismatch(name, TypeMismatchKind.UNREPRESENTABLE_INITIAL, String.format(
                "'%s' was initialized with type %s, which is not compatible with the tracing engine's value model. "
                        + "Carried variables must hold numbers, booleans or arrays; "
                        + "initialize '%s' with a value of the type it takes inside the block.",
                name, Values.typeName(initial), name)));
    }

    /**
     * A value produced inside the block must have the type the variable had on entry.
     * Shape changes are left to the engine, which verifies full abstract values after binding.
     */
    public Optional<TypeMismatch> validateProduced(BlockKind kind, String name, Object initial, Object produced) {
        if (initial instanceof Undefined) {
            return Optional.empty();
        }
        AbstractValue before = Values.abstractOf(initial);
        AbstractValue after = produced instanceof Undefined ? null : Values.abstractOf(produced);
        if (before.sameType(after)) {
            return Optional.empty();
        }
        return Optional.of(new TypeMismatch(name, TypeMismatchKind.WRONG_TYPE, String.format(
                "'%s' was initialized with the wrong type, or is used with inconsistent types inside the %s: "
                        + "%s on entry, %s inside the block",
                name, kind.displayName(), before.describe(), after == null ? "undefined" : after.describe())));
    }

    /**
     * Every branch of a conditional must produce the same type.
     */
    public Optional<TypeMismatch> validateBranches(String name, Object first, Object second) {
        if (first instanceof Undefined || second instanceof Undefined) {
            return Optional.empty();
        }
        AbstractValue a = Values.abstractOf(first);
        AbstractValue b = Values.abstractOf(second);
        if (a.sameType(b) && a.kind().isRepresentable()) {
            return Optional.empty();
        }
        return Optional.of(new TypeMismatch(name, TypeMismatchKind.BRANCH_MISMATCH, String.format(
                "Branches of the if statement produce inconsistent types for '%s': %s and %s",
                name, describe(first), describe(second))));
    }

    public void checkInitial(String name, Object initial) {
        validateInitial(name, initial).ifPresent(this::fail);
    }

    public void checkProduced(BlockKind kind, String name, Object initial, Object produced) {
        validateProduced(kind, name, initial, produced).ifPresent(this::fail);
    }

    public void checkBranches(String name, Object first, Object second) {
        validateBranches(name, first, second).ifPresent(this::fail);
    }

    /**
     * Converts a mismatch to the exception matching this checker's mode.
     */
    public RuntimeException toException(TypeMismatch mismatch) {
        if (strict) {
            return new AnalysisException(List.of(mismatch.message()), List.of(mismatch.variable()), mismatch.kind());
        }
        return new CarriedTypeMismatchException(mismatch);
    }

    private void fail(TypeMismatch mismatch) {
        throw toException(mismatch);
    }

    private static String describe(Object value) {
        AbstractValue aval = Values.abstractOf(value);
        return aval.kind().isRepresentable() ? aval.describe() : Values.typeName(value);
    }
}
