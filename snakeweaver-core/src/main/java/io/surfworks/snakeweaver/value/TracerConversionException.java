package io.surfworks.snakeweaver.value;

/**
 * Base class for attempts to use a traced value where a concrete host value is required.
 */
public abstract class TracerConversionException extends RuntimeException {

    private final Tracer tracer;

    protected TracerConversionException(String message, Tracer tracer) {
        super(message);
        this.tracer = tracer;
    }

    public Tracer getTracer() {
        return tracer;
    }
}
