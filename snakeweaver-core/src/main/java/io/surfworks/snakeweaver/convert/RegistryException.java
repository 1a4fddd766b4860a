package io.surfworks.snakeweaver.convert;

import io.surfworks.snakeweaver.ConversionException;

/**
 * Conversion state was queried for a function that has none to give.
 */
public class RegistryException extends ConversionException {

    private final CallableHandle handle;

    public RegistryException(String message, CallableHandle handle) {
        super(message);
        this.handle = handle;
    }

    /**
     * The handle queried, or null if the function was never registered.
     */
    public CallableHandle getHandle() {
        return handle;
    }
}
