package io.surfworks.snakeweaver.analysis;

import io.surfworks.snakeweaver.ast.AgAst.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Decides which variables each control-flow block of a function carries.
 *
 * Two passes over the structured AST:
 * - backward liveness, iterated to a fixpoint for loops, gives the names
 *   read after each block and the names a loop body reads before writing;
 * - forward definite assignment gives the names bound on every path
 *   reaching each block.
 *
 * A block carries the names it assigns that are read afterwards, or, for a
 * loop, read by a later iteration. A carried name that may be unbound after
 * the block is invalid.
 */
public final class CarriedVariableAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(CarriedVariableAnalyzer.class.getName());

    private final Map<Stmt, Set<String>> liveAfter = new IdentityHashMap<>();
    private final Map<Stmt, Set<String>> liveBefore = new IdentityHashMap<>();
    private final Map<Stmt, Set<String>> liveIntoBody = new IdentityHashMap<>();
    private final Map<Stmt, Set<String>> definedBefore = new IdentityHashMap<>();
    private final List<Stmt> blockOrder = new ArrayList<>();

    public CarriedVariableAnalyzer() {}

    public FunctionAnalysis analyze(FunctionDef function) {
        liveAfter.clear();
        liveBefore.clear();
        liveIntoBody.clear();
        definedBefore.clear();
        blockOrder.clear();

        liveBefore(function.body(), new HashSet<>());
        walkDefinitions(function.body(), new HashSet<>(function.params()));

        List<BlockAnalysis> blocks = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        for (Stmt stmt : blockOrder) {
            BlockAnalysis block = analyzeBlock(stmt, errors, invalid);
            blocks.add(block);
            LOGGER.fine(() -> String.format("%s '%s' line %d: carried=%s",
                    block.kind().displayName(), function.name(), stmt.location().line(), block.carriedNames()));
        }
        return new FunctionAnalysis(function, blocks, errors, invalid);
    }

    private BlockAnalysis analyzeBlock(Stmt stmt, List<String> errors, List<String> invalid) {
        Set<String> before = definedBefore.get(stmt);
        Set<String> after = liveAfter.get(stmt);
        Set<String> entry = liveBefore.get(stmt);
        Set<String> modified = new LinkedHashSet<>();
        collectModified(stmt, modified);

        BlockKind kind;
        Set<String> observed = new HashSet<>(after);
        if (stmt instanceof If) {
            kind = BlockKind.CONDITIONAL;
        } else if (stmt instanceof For f) {
            kind = BlockKind.COUNTED_LOOP;
            Set<String> exposed = new HashSet<>(liveIntoBody.get(stmt));
            exposed.removeAll(f.target().names());
            observed.addAll(exposed);
        } else {
            kind = BlockKind.CONDITIONAL_LOOP;
            observed.addAll(liveIntoBody.get(stmt));
            observed.addAll(uses(((While) stmt).test()));
        }

        Set<String> definedAfter = new HashSet<>(before);
        Set<String> assigned = mustAssign(List.of(stmt));
        if (assigned != null) {
            definedAfter.addAll(assigned);
        }

        List<CarriedVariable> carried = new ArrayList<>();
        for (String name : modified) {
            if (!observed.contains(name)) {
                continue;
            }
            boolean declared = before.contains(name);
            carried.add(new CarriedVariable(name, declared, entry.contains(name)));
            if (kind == BlockKind.CONDITIONAL) {
                if (assigned != null && !definedAfter.contains(name) && after.contains(name)) {
                    errors.add("Some branches did not define a value for variable '" + name + "'");
                    invalid.add(name);
                }
            } else if (!declared) {
                errors.add("'" + name + "' is potentially uninitialized");
                invalid.add(name);
            }
        }
        return new BlockAnalysis(stmt, kind, carried, modified, after, before, containsReturn(stmt));
    }

    // ==================== Liveness ====================

    private Set<String> liveBefore(List<Stmt> body, Set<String> liveOut) {
        Set<String> live = new HashSet<>(liveOut);
        for (int i = body.size() - 1; i >= 0; i--) {
            live = liveBefore(body.get(i), live);
        }
        return live;
    }

    private Set<String> liveBefore(Stmt stmt, Set<String> liveOut) {
        Set<String> live;
        if (stmt instanceof Assign a) {
            live = new HashSet<>(liveOut);
            live.removeAll(a.target().names());
            live.addAll(uses(a.value()));
        } else if (stmt instanceof AugAssign a) {
            live = new HashSet<>(liveOut);
            live.add(a.name());
            live.addAll(uses(a.value()));
        } else if (stmt instanceof ExprStmt e) {
            live = new HashSet<>(liveOut);
            live.addAll(uses(e.value()));
        } else if (stmt instanceof Return r) {
            live = r.value() == null ? new HashSet<>() : uses(r.value());
        } else if (stmt instanceof Raise r) {
            live = r.message() == null ? new HashSet<>() : uses(r.message());
        } else if (stmt instanceof Pass) {
            live = new HashSet<>(liveOut);
        } else if (stmt instanceof If i) {
            live = liveBeforeIf(i, liveOut);
        } else if (stmt instanceof For f) {
            live = liveBeforeFor(f, liveOut);
        } else if (stmt instanceof While w) {
            live = liveBeforeWhile(w, liveOut);
        } else {
            throw new IllegalArgumentException("Unknown statement: " + stmt);
        }
        return live;
    }

    private Set<String> liveBeforeIf(If stmt, Set<String> liveOut) {
        liveAfter.put(stmt, new HashSet<>(liveOut));
        // Evaluated backwards from the else end of the chain.
        Set<String> live = stmt.hasElse() ? null : new HashSet<>(liveOut);
        List<Branch> branches = stmt.branches();
        for (int b = branches.size() - 1; b >= 0; b--) {
            Branch branch = branches.get(b);
            Set<String> branchLive = liveBefore(branch.body(), liveOut);
            if (branch.isElse()) {
                live = branchLive;
            } else {
                branchLive.addAll(live);
                branchLive.addAll(uses(branch.test()));
                live = branchLive;
            }
        }
        liveBefore.put(stmt, new HashSet<>(live));
        return live;
    }

    private Set<String> liveBeforeFor(For stmt, Set<String> liveOut) {
        liveAfter.put(stmt, new HashSet<>(liveOut));
        List<String> target = stmt.target().names();
        Set<String> head = new HashSet<>(liveOut);
        while (true) {
            Set<String> bodyIn = liveBefore(stmt.body(), head);
            Set<String> next = new HashSet<>(liveOut);
            Set<String> fromBody = new HashSet<>(bodyIn);
            fromBody.removeAll(target);
            next.addAll(fromBody);
            if (next.equals(head)) {
                liveIntoBody.put(stmt, bodyIn);
                break;
            }
            head = next;
        }
        Set<String> live = new HashSet<>(head);
        live.addAll(uses(stmt.iter()));
        liveBefore.put(stmt, new HashSet<>(live));
        return live;
    }

    private Set<String> liveBeforeWhile(While stmt, Set<String> liveOut) {
        liveAfter.put(stmt, new HashSet<>(liveOut));
        Set<String> testUses = uses(stmt.test());
        Set<String> head = new HashSet<>(liveOut);
        head.addAll(testUses);
        while (true) {
            Set<String> bodyIn = liveBefore(stmt.body(), head);
            Set<String> next = new HashSet<>(liveOut);
            next.addAll(testUses);
            next.addAll(bodyIn);
            if (next.equals(head)) {
                liveIntoBody.put(stmt, bodyIn);
                break;
            }
            head = next;
        }
        liveBefore.put(stmt, new HashSet<>(head));
        return head;
    }

    // ==================== Definite assignment ====================

    private void walkDefinitions(List<Stmt> body, Set<String> in) {
        Set<String> defined = new HashSet<>(in);
        for (Stmt stmt : body) {
            if (stmt instanceof If i) {
                record(stmt, defined);
                for (Branch branch : i.branches()) {
                    walkDefinitions(branch.body(), defined);
                }
            } else if (stmt instanceof For f) {
                record(stmt, defined);
                Set<String> bodyIn = new HashSet<>(defined);
                bodyIn.addAll(f.target().names());
                walkDefinitions(f.body(), bodyIn);
            } else if (stmt instanceof While w) {
                record(stmt, defined);
                walkDefinitions(w.body(), defined);
            }
            Set<String> assigned = mustAssign(List.of(stmt));
            if (assigned != null) {
                defined.addAll(assigned);
            }
        }
    }

    private void record(Stmt block, Set<String> defined) {
        definedBefore.put(block, new HashSet<>(defined));
        blockOrder.add(block);
    }

    /**
     * Names assigned on every path through a statement list, or null if no path
     * reaches its end.
     */
    static Set<String> mustAssign(List<Stmt> body) {
        Set<String> assigned = new LinkedHashSet<>();
        for (Stmt stmt : body) {
            if (stmt instanceof Assign a) {
                assigned.addAll(a.target().names());
            } else if (stmt instanceof AugAssign a) {
                assigned.add(a.name());
            } else if (stmt instanceof Return || stmt instanceof Raise) {
                return null;
            } else if (stmt instanceof If i) {
                Set<String> common = null;
                boolean reachable = false;
                for (Branch branch : i.branches()) {
                    Set<String> branchAssigned = mustAssign(branch.body());
                    if (branchAssigned == null) {
                        continue;
                    }
                    reachable = true;
                    if (common == null) {
                        common = branchAssigned;
                    } else {
                        common.retainAll(branchAssigned);
                    }
                }
                if (!i.hasElse()) {
                    reachable = true;
                    common = new LinkedHashSet<>();
                }
                if (!reachable) {
                    return null;
                }
                assigned.addAll(common);
            }
            // Loops may run zero times and add nothing.
        }
        return assigned;
    }

    // ==================== Helpers ====================

    private static void collectModified(Stmt stmt, Set<String> out) {
        if (stmt instanceof Assign a) {
            out.addAll(a.target().names());
        } else if (stmt instanceof AugAssign a) {
            out.add(a.name());
        } else if (stmt instanceof If i) {
            for (Branch branch : i.branches()) {
                for (Stmt s : branch.body()) {
                    collectModified(s, out);
                }
            }
        } else if (stmt instanceof For f) {
            out.addAll(f.target().names());
            for (Stmt s : f.body()) {
                collectModified(s, out);
            }
        } else if (stmt instanceof While w) {
            for (Stmt s : w.body()) {
                collectModified(s, out);
            }
        }
    }

    private static boolean containsReturn(Stmt stmt) {
        if (stmt instanceof Return) {
            return true;
        }
        for (List<Stmt> body : bodies(stmt)) {
            for (Stmt s : body) {
                if (containsReturn(s)) {
                    return true;
                }
            }
        }
        return false;
    }

    static List<List<Stmt>> bodies(Stmt stmt) {
        List<List<Stmt>> bodies = new ArrayList<>();
        if (stmt instanceof If i) {
            for (Branch branch : i.branches()) {
                bodies.add(branch.body());
            }
        } else if (stmt instanceof For f) {
            bodies.add(f.body());
        } else if (stmt instanceof While w) {
            bodies.add(w.body());
        }
        return bodies;
    }

    /**
     * Variable names read by an expression. Called function names are not variables.
     */
    public static Set<String> uses(Expr expr) {
        Set<String> names = new LinkedHashSet<>();
        collectUses(expr, names);
        return names;
    }

    private static void collectUses(Expr expr, Set<String> out) {
        if (expr instanceof Name n) {
            out.add(n.id());
        } else if (expr instanceof ListExpr l) {
            l.elements().forEach(e -> collectUses(e, out));
        } else if (expr instanceof TupleExpr t) {
            t.elements().forEach(e -> collectUses(e, out));
        } else if (expr instanceof BinOp b) {
            collectUses(b.left(), out);
            collectUses(b.right(), out);
        } else if (expr instanceof Compare c) {
            collectUses(c.left(), out);
            collectUses(c.right(), out);
        } else if (expr instanceof BoolOp b) {
            collectUses(b.left(), out);
            collectUses(b.right(), out);
        } else if (expr instanceof Not n) {
            collectUses(n.operand(), out);
        } else if (expr instanceof Neg n) {
            collectUses(n.operand(), out);
        } else if (expr instanceof Index i) {
            collectUses(i.target(), out);
            collectUses(i.index(), out);
        } else if (expr instanceof Call c) {
            c.args().forEach(e -> collectUses(e, out));
        }
    }
}
