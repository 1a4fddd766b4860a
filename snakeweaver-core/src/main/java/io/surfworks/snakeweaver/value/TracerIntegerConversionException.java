package io.surfworks.snakeweaver.value;

/**
 * Thrown when a traced value is used to index a host sequence.
 */
public class TracerIntegerConversionException extends TracerConversionException {

    public TracerIntegerConversionException(Tracer tracer) {
        super("The index conversion was called on traced value " + tracer
                + ". A traced loop index cannot select from a host list;"
                + " wrap the list in array(...) so it can be indexed inside the graph.", tracer);
    }
}
