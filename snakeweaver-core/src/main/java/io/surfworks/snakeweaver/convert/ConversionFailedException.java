package io.surfworks.snakeweaver.convert;

/**
 * Conversion was attempted for the function and failed.
 */
public class ConversionFailedException extends RegistryException {

    private final String reason;

    public ConversionFailedException(CallableHandle handle, String reason) {
        super("Conversion of '" + handle.name() + "' failed: " + reason, handle);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
