package io.surfworks.snakeweaver.trace;

import io.surfworks.snakeweaver.value.NdArray;
import io.surfworks.snakeweaver.value.RangeValue;
import io.surfworks.snakeweaver.value.Tracer;
import io.surfworks.snakeweaver.value.ValueKind;
import io.surfworks.snakeweaver.value.Values;

import java.util.List;

/**
 * What a counted loop iterates over.
 */
public sealed interface LoopSource permits LoopSource.Bounds, LoopSource.Sequence {

    /**
     * Number of iterations, from the concrete values behind the source.
     */
    long tripCount();

    /**
     * Operands the loop primitive is recorded with.
     */
    List<Object> operands();

    /**
     * Integer bounds. Each bound is a Long or an integer Tracer.
     */
    record Bounds(Object start, Object stop, Object step) implements LoopSource {

        @Override
        public long tripCount() {
            return new RangeValue(Values.concrete(start), Values.concrete(stop), Values.concrete(step)).length();
        }

        @Override
        public List<Object> operands() {
            return List.of(start, stop, step);
        }

        /**
         * True when position k maps directly to the element without offset or stride.
         */
        public boolean isUnitFromZero() {
            return Long.valueOf(0L).equals(start) && Long.valueOf(1L).equals(step);
        }
    }

    /**
     * Rows of an array, eager or traced.
     */
    record Sequence(Object array) implements LoopSource {

        public Sequence {
            if (!(array instanceof NdArray)
                    && !(array instanceof Tracer t && t.kind() == ValueKind.ARRAY)) {
                throw new IllegalArgumentException("Loop sequence must be an array, got " + Values.typeName(array));
            }
        }

        @Override
        public long tripCount() {
            return ((NdArray) Values.concrete(array)).length();
        }

        @Override
        public List<Object> operands() {
            return List.of(array);
        }
    }
}
