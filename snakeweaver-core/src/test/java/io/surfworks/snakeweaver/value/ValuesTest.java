package io.surfworks.snakeweaver.value;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Tests for {@link Values}. */
@DisplayName("Values")
class ValuesTest {

    private static Tracer tracer(Object concrete) {
        return new Tracer(0, Values.abstractOf(concrete), concrete);
    }

    @Nested
    @DisplayName("Kinds")
    class Kinds {

        @Test
        @DisplayName("numbers, booleans and arrays are representable")
        void representable() {
            assertEquals(ValueKind.NUMERIC_SCALAR, Values.kindOf(1L));
            assertEquals(ValueKind.NUMERIC_SCALAR, Values.kindOf(1.5));
            assertEquals(ValueKind.BOOLEAN, Values.kindOf(true));
            assertEquals(ValueKind.ARRAY, Values.kindOf(NdArray.ofLongs(1)));
        }

        @Test
        @DisplayName("text, lists, maps and None are not")
        void unrepresentable() {
            assertFalse(Values.isRepresentable("hi"));
            assertFalse(Values.isRepresentable(List.of(1L)));
            assertFalse(Values.isRepresentable(Map.of()));
            assertFalse(Values.isRepresentable(null));
        }

        @Test
        @DisplayName("a tracer reports its abstract value")
        void tracerKind() {
            Tracer t = tracer(NdArray.ofDoubles(1, 2));
            assertEquals(AbstractValue.array(ElementType.FLOAT64, 2), Values.abstractOf(t));
            assertTrue(Values.isTraced(t));
        }

        @Test
        @DisplayName("integers and floats are different types whatever the shape")
        void sameType() {
            AbstractValue ints = AbstractValue.array(ElementType.INT64, 2);
            assertTrue(ints.sameType(AbstractValue.array(ElementType.INT64, 4)));
            assertFalse(ints.sameType(AbstractValue.array(ElementType.FLOAT64, 2)));
            assertFalse(AbstractValue.scalar(ElementType.INT64).sameType(AbstractValue.scalar(ElementType.BOOL)));
        }
    }

    @Nested
    @DisplayName("Host conversions")
    class HostConversions {

        @Test
        @DisplayName("truth value of a tracer fails")
        void truthyTracer() {
            TracerBoolConversionException e = assertThrows(TracerBoolConversionException.class,
                    () -> Values.truthy(tracer(true)));
            assertEquals(ValueKind.BOOLEAN, e.getTracer().kind());
        }

        @Test
        @DisplayName("index from a tracer fails")
        void indexTracer() {
            assertThrows(TracerIntegerConversionException.class, () -> Values.toIndex(tracer(1L)));
        }

        @Test
        @DisplayName("host truth values")
        void truthy() {
            assertFalse(Values.truthy(0L));
            assertFalse(Values.truthy(""));
            assertFalse(Values.truthy(null));
            assertTrue(Values.truthy(List.of(0L)));
            assertThrows(IllegalArgumentException.class, () -> Values.truthy(NdArray.ofLongs(1, 2)));
        }

        @Test
        @DisplayName("concretize replaces tracers inside lists")
        void concretize() {
            List<Object> mixed = new ArrayList<>();
            mixed.add(tracer(3L));
            mixed.add(4L);
            assertEquals(List.of(3L, 4L), Values.concretize(mixed));
            assertTrue(Values.containsTracer(mixed));
        }

        @Test
        @DisplayName("normalize widens boxed Java numbers")
        void normalize() {
            assertEquals(3L, Values.normalize(3));
            assertEquals(1.5, Values.normalize(1.5f));
            assertEquals(List.of(1L, 2L), Values.normalize(List.of(1, 2)));
            Object same = "x";
            assertSame(same, Values.normalize(same));
        }

        @Test
        @DisplayName("type names and reprs read like the host language")
        void rendering() {
            assertEquals("str", Values.typeName("a"));
            assertEquals("NoneType", Values.typeName(null));
            assertEquals("[1, 'a', None, True]", Values.repr(java.util.Arrays.asList(1L, "a", null, true)));
        }
    }
}
