package io.surfworks.snakeweaver;

/**
 * Base class for errors raised by the conversion engine itself.
 *
 * <p>Tracing engines never turn a ConversionException thrown from a primitive
 * body into a recoverable failure. It always reaches the caller of
 * {@code convert} or of the converted callable.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
