package io.surfworks.snakeweaver.convert;

import io.surfworks.snakeweaver.analysis.BlockKind;
import io.surfworks.snakeweaver.ast.AgAst.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of one supervised block.
 *
 * @param kind     block kind
 * @param location block location
 * @param trail    states visited, in order
 * @param values   carried values after the block
 * @param failure  exception that caused the fallback, or null
 */
public record BlockOutcome(BlockKind kind, SourceLocation location, List<SupervisorState> trail,
                           List<Object> values, RuntimeException failure) {

    public BlockOutcome {
        trail = List.copyOf(trail);
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Final state.
     */
    public SupervisorState state() {
        return trail.get(trail.size() - 1);
    }

    public boolean isFallback() {
        return state() == SupervisorState.FALLBACK_EXECUTED;
    }
}
