package io.surfworks.snakeweaver.convert;

/**
 * A name was read before any assignment to it.
 */
public class UnboundVariableException extends RuntimeException {

    private final String variable;

    public UnboundVariableException(String variable) {
        super("local variable '" + variable + "' referenced before assignment");
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
