package io.surfworks.snakeweaver.convert;

import io.surfworks.snakeweaver.analysis.BlockKind;
import io.surfworks.snakeweaver.ast.AgAst.SourceLocation;

import java.util.List;

/**
 * A fallback reported to the user.
 *
 * @param blockKind     the block that fell back
 * @param kind          why it fell back
 * @param message       user-facing text, including the traceback line
 * @param variables     carried variables of the block
 * @param location      the block's source location
 * @param exceptionType simple name of the triggering exception, or null for a domain fallback
 */
public record ConversionWarning(BlockKind blockKind, Kind kind, String message, List<String> variables,
                                SourceLocation location, String exceptionType) {

    public ConversionWarning {
        variables = List.copyOf(variables);
    }

    public enum Kind {
        /** The iteration domain could not be converted. */
        DOMAIN_FALLBACK,
        /** A primitive failed while tracing. */
        TRACING_FALLBACK
    }

    @Override
    public String toString() {
        return message;
    }
}
