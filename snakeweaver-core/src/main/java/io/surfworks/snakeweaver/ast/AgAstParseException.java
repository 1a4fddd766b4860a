package io.surfworks.snakeweaver.ast;

/**
 * Exception thrown when rewriter output cannot be read into the AST.
 */
public class AgAstParseException extends RuntimeException {

    private final String path;

    public AgAstParseException(String message) {
        super(message);
        this.path = null;
    }

    public AgAstParseException(String message, String path) {
        super(String.format("%s at %s", message, path));
        this.path = path;
    }

    public AgAstParseException(String message, Throwable cause) {
        super(message, cause);
        this.path = null;
    }

    /**
     * JSON path of the offending element, or null when unknown.
     */
    public String getPath() {
        return path;
    }
}
