package io.surfworks.snakeweaver.analysis;

import io.surfworks.snakeweaver.ast.AgAst.Stmt;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Analysis result for one control-flow block.
 *
 * @param block          the if, for or while statement
 * @param kind           block kind
 * @param carried        carried variables, in first-assignment order
 * @param modified       names assigned anywhere inside the block
 * @param liveAfter      names read after the block before being reassigned
 * @param definedBefore  names assigned on every path reaching the block
 * @param containsReturn true if a return statement appears inside the block
 */
public record BlockAnalysis(Stmt block, BlockKind kind, List<CarriedVariable> carried, Set<String> modified,
                            Set<String> liveAfter, Set<String> definedBefore, boolean containsReturn) {

    public BlockAnalysis {
        carried = List.copyOf(carried);
        modified = Set.copyOf(modified);
        liveAfter = Set.copyOf(liveAfter);
        definedBefore = Set.copyOf(definedBefore);
    }

    public List<String> carriedNames() {
        List<String> names = new ArrayList<>(carried.size());
        for (CarriedVariable variable : carried) {
            names.add(variable.name());
        }
        return names;
    }

    /**
     * Names assigned in the block but neither read afterwards nor in a later iteration.
     */
    public Set<String> temporaries() {
        Set<String> temporaries = new TreeSet<>(modified);
        temporaries.removeAll(carriedNames());
        return temporaries;
    }
}
