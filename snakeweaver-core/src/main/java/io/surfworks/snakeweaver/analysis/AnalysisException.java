package io.surfworks.snakeweaver.analysis;

import io.surfworks.snakeweaver.ConversionException;

import java.util.List;

/**
 * Fatal conversion error: uninitialized variables, unsupported statements,
 * or a carried type mismatch under strict conversion.
 */
public class AnalysisException extends ConversionException {

    private final List<String> errors;
    private final List<String> variables;
    private final TypeMismatchKind mismatchKind;

    public AnalysisException(List<String> errors, List<String> variables) {
        this(errors, variables, null);
    }

    public AnalysisException(List<String> errors, List<String> variables, TypeMismatchKind mismatchKind) {
        super(format(errors));
        this.errors = List.copyOf(errors);
        this.variables = List.copyOf(variables);
        this.mismatchKind = mismatchKind;
    }

    public AnalysisException(String error) {
        this(List.of(error), List.of(), null);
    }

    private static String format(List<String> errors) {
        if (errors.size() == 1) {
            return errors.get(0);
        }
        StringBuilder sb = new StringBuilder("Conversion failed:\n");
        for (String error : errors) {
            sb.append("  - ").append(error).append("\n");
        }
        return sb.toString();
    }

    public List<String> getErrors() {
        return errors;
    }

    /**
     * Names of the variables responsible, in the order the errors were found.
     */
    public List<String> getVariables() {
        return variables;
    }

    /**
     * The type mismatch, or null if this is not a type error.
     */
    public TypeMismatchKind getMismatchKind() {
        return mismatchKind;
    }
}
