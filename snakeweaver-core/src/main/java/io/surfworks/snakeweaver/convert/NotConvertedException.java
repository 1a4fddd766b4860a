package io.surfworks.snakeweaver.convert;

/**
 * Conversion was never attempted for the function.
 */
public class NotConvertedException extends RegistryException {

    public NotConvertedException(String functionName, CallableHandle handle) {
        super("Function '" + functionName + "' has not been converted", handle);
    }
}
