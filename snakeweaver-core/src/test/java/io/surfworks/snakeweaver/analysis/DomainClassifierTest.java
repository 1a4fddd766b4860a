package io.surfworks.snakeweaver.analysis;

import io.surfworks.snakeweaver.ast.AgAst.Const;
import io.surfworks.snakeweaver.ast.AgAst.Name;
import io.surfworks.snakeweaver.value.AbstractValue;
import io.surfworks.snakeweaver.value.ElementType;
import io.surfworks.snakeweaver.value.EnumerateValue;
import io.surfworks.snakeweaver.value.NdArray;
import io.surfworks.snakeweaver.value.RangeValue;
import io.surfworks.snakeweaver.value.Tracer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.surfworks.snakeweaver.ast.AstDsl.names;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Tests for {@link DomainClassifier}. */
@DisplayName("DomainClassifier")
class DomainClassifierTest {

    private static Tracer traced(AbstractValue aval, Object concrete) {
        return new Tracer(0, aval, concrete);
    }

    @Nested
    @DisplayName("Iteration domains")
    class Domains {

        @Test
        @DisplayName("a range with literal bounds is static")
        void staticRange() {
            IterationDomain domain = DomainClassifier.classify(new RangeValue(0L, 3L, 1L));
            assertEquals(DomainKind.STATIC_RANGE, domain.kind());
            assertEquals(ElementType.INT64, domain.elementType());
            assertTrue(domain.isConvertible());
        }

        @Test
        @DisplayName("a range with a traced bound is dynamic and still convertible")
        void dynamicRange() {
            Tracer n = traced(AbstractValue.scalar(ElementType.INT64), 4L);
            IterationDomain domain = DomainClassifier.classify(new RangeValue(0L, n, 1L));
            assertEquals(DomainKind.DYNAMIC_RANGE, domain.kind());
            assertTrue(domain.isConvertible());
        }

        @Test
        @DisplayName("uniform lists and arrays are homogeneous")
        void homogeneous() {
            assertEquals(DomainKind.HOMOGENEOUS_SEQUENCE, DomainClassifier.classify(List.of(1L, 2.5)).kind());
            assertEquals(ElementType.FLOAT64, DomainClassifier.classify(List.of(1L, 2.5)).elementType());
            assertEquals(DomainKind.HOMOGENEOUS_SEQUENCE, DomainClassifier.classify(NdArray.ofLongs(1)).kind());
            Tracer arr = traced(AbstractValue.array(ElementType.BOOL, 2), NdArray.ofBooleans(true, false));
            assertEquals(DomainKind.HOMOGENEOUS_SEQUENCE, DomainClassifier.classify(arr).kind());
        }

        @Test
        @DisplayName("lists of host objects are heterogeneous")
        void heterogeneous() {
            IterationDomain domain = DomainClassifier.classify(List.of("a", "b"));
            assertEquals(DomainKind.HETEROGENEOUS_SEQUENCE, domain.kind());
            assertNull(domain.elementType());
            assertFalse(domain.isConvertible());
            assertFalse(DomainClassifier.classify(List.of(true, 1L)).isConvertible());
        }

        @Test
        @DisplayName("other iterables are opaque")
        void opaque() {
            assertEquals(DomainKind.OPAQUE_ITERABLE, DomainClassifier.classify("abc").kind());
            assertEquals(DomainKind.OPAQUE_ITERABLE, DomainClassifier.classify(Map.of(1L, 2L)).kind());
        }

        @Test
        @DisplayName("enumerate is transparent and records its start")
        void enumerate() {
            IterationDomain domain = DomainClassifier.classify(
                    new EnumerateValue(List.of(1L, 2L), 5L), names("i", "x"));
            assertEquals(DomainKind.HOMOGENEOUS_SEQUENCE, domain.kind());
            assertTrue(domain.enumerated());
            assertEquals(5L, domain.offset());
            assertEquals(2, domain.unpackArity());
        }

        @Test
        @DisplayName("classification is pure")
        void pure() {
            List<Object> source = List.of(1L, 2L, 3L);
            assertEquals(DomainClassifier.classify(source), DomainClassifier.classify(source));
        }
    }

    @Nested
    @DisplayName("Predicates")
    class Predicates {

        @Test
        @DisplayName("only boolean literals are static constants")
        void staticConstants() {
            assertEquals(PredicateKind.STATIC_CONSTANT, DomainClassifier.classifyPredicate(new Const(true)));
            assertEquals(PredicateKind.RUNTIME, DomainClassifier.classifyPredicate(new Const(1L)));
            assertEquals(PredicateKind.RUNTIME, DomainClassifier.classifyPredicate(new Name("x")));
        }

        @Test
        @DisplayName("predicate values are dynamic only when traced")
        void predicateValues() {
            Tracer flag = traced(AbstractValue.scalar(ElementType.BOOL), true);
            assertEquals(PredicateValueKind.DYNAMIC, DomainClassifier.classifyPredicateValue(flag));
            assertEquals(PredicateValueKind.STATIC, DomainClassifier.classifyPredicateValue(true));
            assertEquals(PredicateValueKind.STATIC, DomainClassifier.classifyPredicateValue(List.of()));
        }
    }
}
