package io.surfworks.snakeweaver.analysis;

import io.surfworks.snakeweaver.value.NdArray;
import io.surfworks.snakeweaver.value.Undefined;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Tests for {@link TypeConsistencyChecker}. */
@DisplayName("TypeConsistencyChecker")
class TypeConsistencyCheckerTest {

    private final TypeConsistencyChecker lenient = new TypeConsistencyChecker(false);
    private final TypeConsistencyChecker strict = new TypeConsistencyChecker(true);

    @Nested
    @DisplayName("Initial values")
    class InitialValues {

        @Test
        @DisplayName("numbers, booleans and arrays are accepted")
        void representable() {
            assertTrue(lenient.validateInitial("x", 1L).isEmpty());
            assertTrue(lenient.validateInitial("x", false).isEmpty());
            assertTrue(lenient.validateInitial("x", NdArray.ofDoubles(1.0)).isEmpty());
            assertTrue(lenient.validateInitial("x", Undefined.INSTANCE).isEmpty());
        }

        @Test
        @DisplayName("text is rejected with its host type name")
        void text() {
            TypeMismatch mismatch = lenient.validateInitial("x", "").orElseThrow();
            assertEquals(TypeMismatchKind.UNREPRESENTABLE_INITIAL, mismatch.kind());
            assertEquals("x", mismatch.variable());
            assertTrue(mismatch.message().startsWith("'x' was initialized with type str"), mismatch.message());
        }

        @Test
        @DisplayName("None, lists and maps are rejected")
        void otherHostValues() {
            assertTrue(lenient.validateInitial("x", null).isPresent());
            assertTrue(lenient.validateInitial("x", List.of(1L)).isPresent());
            assertTrue(lenient.validateInitial("x", Map.of()).isPresent());
        }
    }

    @Nested
    @DisplayName("Produced values")
    class ProducedValues {

        @Test
        @DisplayName("an integer that becomes a float is the wrong type")
        void intToFloat() {
            Optional<TypeMismatch> mismatch = lenient.validateProduced(BlockKind.COUNTED_LOOP, "x", 0.0, 3L);
            assertEquals(TypeMismatchKind.WRONG_TYPE, mismatch.orElseThrow().kind());
            assertTrue(mismatch.get().message().startsWith("'x' was initialized with the wrong type"));
            assertTrue(mismatch.get().message().contains("for loop"));
        }

        @Test
        @DisplayName("booleans and integers are not interchangeable")
        void boolToInt() {
            assertTrue(lenient.validateProduced(BlockKind.CONDITIONAL_LOOP, "b", true, 1L).isPresent());
        }

        @Test
        @DisplayName("a shape change is left to the engine")
        void shapeChange() {
            assertTrue(lenient.validateProduced(BlockKind.CONDITIONAL_LOOP, "arr",
                    NdArray.ofLongs(1, 2), NdArray.ofLongs(1, 2, 2, 4)).isEmpty());
        }

        @Test
        @DisplayName("an undefined initial value accepts anything")
        void undefinedInitial() {
            assertTrue(lenient.validateProduced(BlockKind.CONDITIONAL, "y", Undefined.INSTANCE, 1.5).isEmpty());
        }

        @Test
        @DisplayName("a variable unbound inside the block is the wrong type")
        void unboundInside() {
            assertTrue(lenient.validateProduced(BlockKind.COUNTED_LOOP, "y", 1L, Undefined.INSTANCE).isPresent());
        }
    }

    @Nested
    @DisplayName("Branches")
    class Branches {

        @Test
        @DisplayName("branches with different element types mismatch")
        void differentTypes() {
            TypeMismatch mismatch = lenient.validateBranches("y", 1L, 2.0).orElseThrow();
            assertEquals(TypeMismatchKind.BRANCH_MISMATCH, mismatch.kind());
        }

        @Test
        @DisplayName("unrepresentable branch values mismatch even when equal")
        void unrepresentable() {
            assertTrue(lenient.validateBranches("y", "a", "b").isPresent());
        }

        @Test
        @DisplayName("same types pass")
        void sameTypes() {
            assertTrue(lenient.validateBranches("y", 1L, 2L).isEmpty());
        }
    }

    @Nested
    @DisplayName("Modes")
    class Modes {

        @Test
        @DisplayName("strict mode throws an analysis error")
        void strictThrowsAnalysisException() {
            AnalysisException e = assertThrows(AnalysisException.class, () -> strict.checkInitial("s", "hi"));
            assertEquals(TypeMismatchKind.UNREPRESENTABLE_INITIAL, e.getMismatchKind());
            assertEquals(List.of("s"), e.getVariables());
        }

        @Test
        @DisplayName("lenient mode throws a recoverable mismatch")
        void lenientThrowsMismatch() {
            CarriedTypeMismatchException e = assertThrows(CarriedTypeMismatchException.class,
                    () -> lenient.checkProduced(BlockKind.COUNTED_LOOP, "x", 0.0, 1L));
            assertEquals("x", e.getVariable());
            assertEquals(TypeMismatchKind.WRONG_TYPE, e.getMismatchKind());
        }

        @Test
        @DisplayName("consistent values do not throw in either mode")
        void consistent() {
            assertDoesNotThrow(() -> strict.checkBranches("y", 1L, 2L));
            assertDoesNotThrow(() -> lenient.checkInitial("y", 1L));
        }
    }
}
