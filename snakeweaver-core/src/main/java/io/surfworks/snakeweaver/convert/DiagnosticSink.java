package io.surfworks.snakeweaver.convert;

/**
 * Receives fallback warnings as they are emitted.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void warn(ConversionWarning warning);

    /**
     * A sink that discards everything.
     */
    static DiagnosticSink none() {
        return warning -> { };
    }
}
