package io.surfworks.snakeweaver.analysis;

import io.surfworks.snakeweaver.ast.AgAst.FunctionDef;
import io.surfworks.snakeweaver.ast.AgAst.Stmt;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Analysis of every control-flow block in a function, keyed by statement identity.
 */
public final class FunctionAnalysis {

    private final FunctionDef function;
    private final Map<Stmt, BlockAnalysis> blocks;
    private final List<BlockAnalysis> ordered;
    private final List<String> errors;
    private final List<String> invalidVariables;

    FunctionAnalysis(FunctionDef function, List<BlockAnalysis> ordered, List<String> errors,
                     List<String> invalidVariables) {
        this.function = function;
        this.ordered = List.copyOf(ordered);
        this.blocks = new IdentityHashMap<>();
        for (BlockAnalysis block : ordered) {
            blocks.put(block.block(), block);
        }
        this.errors = List.copyOf(errors);
        this.invalidVariables = List.copyOf(invalidVariables);
    }

    public FunctionDef function() {
        return function;
    }

    /**
     * Analysis of a block, or null if the statement is not a control-flow block of this function.
     */
    public BlockAnalysis block(Stmt stmt) {
        return blocks.get(stmt);
    }

    /**
     * All blocks, in source order.
     */
    public List<BlockAnalysis> blocks() {
        return ordered;
    }

    public List<String> errors() {
        return errors;
    }

    public List<String> invalidVariables() {
        return invalidVariables;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Throws if any variable is invalid.
     */
    public void check() {
        if (!errors.isEmpty()) {
            throw new AnalysisException(new ArrayList<>(errors), new ArrayList<>(invalidVariables));
        }
    }
}
