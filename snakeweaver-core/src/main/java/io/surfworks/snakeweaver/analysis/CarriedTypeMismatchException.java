package io.surfworks.snakeweaver.analysis;

/**
 * Carried type mismatch outside strict conversion.
 *
 * <p>Reported as a primitive failure, so the block falls back to eager execution.
 */
public class CarriedTypeMismatchException extends RuntimeException {

    private final String variable;
    private final TypeMismatchKind mismatchKind;

    public CarriedTypeMismatchException(TypeMismatch mismatch) {
        super(mismatch.message());
        this.variable = mismatch.variable();
        this.mismatchKind = mismatch.kind();
    }

    public String getVariable() {
        return variable;
    }

    public TypeMismatchKind getMismatchKind() {
        return mismatchKind;
    }
}
