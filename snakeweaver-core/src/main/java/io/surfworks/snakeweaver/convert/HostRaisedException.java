package io.surfworks.snakeweaver.convert;

/**
 * An exception raised by a {@code raise} statement of the converted program.
 */
public class HostRaisedException extends RuntimeException {

    private final String exceptionType;

    public HostRaisedException(String exceptionType, String message) {
        super(message == null ? exceptionType : message);
        this.exceptionType = exceptionType;
    }

    /**
     * Exception type named by the program, e.g. {@code RuntimeError}.
     */
    public String getExceptionType() {
        return exceptionType;
    }

    @Override
    public String toString() {
        return exceptionType + ": " + getMessage();
    }
}
