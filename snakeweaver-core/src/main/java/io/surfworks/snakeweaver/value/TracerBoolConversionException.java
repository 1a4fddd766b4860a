package io.surfworks.snakeweaver.value;

/**
 * Thrown when host control flow needs the truth value of a traced value.
 */
public class TracerBoolConversionException extends TracerConversionException {

    public TracerBoolConversionException(Tracer tracer) {
        super("Attempted boolean conversion of traced value " + tracer
                + ". The truth value of a traced value is only known when the graph runs,"
                + " so it cannot drive host control flow.", tracer);
    }
}
