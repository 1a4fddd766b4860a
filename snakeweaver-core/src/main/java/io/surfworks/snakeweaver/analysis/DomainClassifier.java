package io.surfworks.snakeweaver.analysis;

import io.surfworks.snakeweaver.ast.AgAst.Const;
import io.surfworks.snakeweaver.ast.AgAst.Expr;
import io.surfworks.snakeweaver.ast.AgAst.Target;
import io.surfworks.snakeweaver.ast.AgAst.TupleTarget;
import io.surfworks.snakeweaver.value.ElementType;
import io.surfworks.snakeweaver.value.EnumerateValue;
import io.surfworks.snakeweaver.value.NdArray;
import io.surfworks.snakeweaver.value.RangeValue;
import io.surfworks.snakeweaver.value.Tracer;
import io.surfworks.snakeweaver.value.ValueKind;
import io.surfworks.snakeweaver.value.Values;

import java.util.List;
import java.util.Optional;

/**
 * Classifies loop iteration sources and conditional predicates.
 *
 * <p>All methods are pure: the result depends only on the argument.
 */
public final class DomainClassifier {

    private DomainClassifier() {}

    public static IterationDomain classify(Object iterable) {
        return classify(iterable, null);
    }

    /**
     * Classifies an iteration source. {@code enumerate} wrapping is transparent.
     *
     * @param target the loop target, used only for the unpack arity; may be null
     */
    public static IterationDomain classify(Object iterable, Target target) {
        int arity = target instanceof TupleTarget tuple ? tuple.elements().size() : 1;
        boolean enumerated = false;
        long offset = 0;
        Object source = iterable;
        if (source instanceof EnumerateValue enumerate) {
            enumerated = true;
            offset = enumerate.start();
            source = enumerate.iterable();
        }

        DomainKind kind;
        ElementType elementType = null;
        if (source instanceof RangeValue range) {
            kind = range.isStatic() ? DomainKind.STATIC_RANGE : DomainKind.DYNAMIC_RANGE;
            elementType = ElementType.INT64;
        } else if (source instanceof NdArray array) {
            kind = DomainKind.HOMOGENEOUS_SEQUENCE;
            elementType = array.dtype();
        } else if (source instanceof Tracer tracer && tracer.kind() == ValueKind.ARRAY) {
            kind = DomainKind.HOMOGENEOUS_SEQUENCE;
            elementType = tracer.aval().elementType();
        } else if (source instanceof List<?> list) {
            Optional<NdArray> array = NdArray.tryFromList((List<?>) Values.concretize(list));
            if (array.isPresent()) {
                kind = DomainKind.HOMOGENEOUS_SEQUENCE;
                elementType = array.get().dtype();
            } else {
                kind = DomainKind.HETEROGENEOUS_SEQUENCE;
            }
        } else {
            kind = DomainKind.OPAQUE_ITERABLE;
        }
        return new IterationDomain(kind, elementType, enumerated, offset, arity);
    }

    /**
     * A boolean literal is a static constant; anything else is decided at run time.
     */
    public static PredicateKind classifyPredicate(Expr test) {
        if (test instanceof Const c && c.value() instanceof Boolean) {
            return PredicateKind.STATIC_CONSTANT;
        }
        return PredicateKind.RUNTIME;
    }

    public static PredicateValueKind classifyPredicateValue(Object value) {
        return Values.isTraced(value) ? PredicateValueKind.DYNAMIC : PredicateValueKind.STATIC;
    }
}
