package io.surfworks.snakeweaver.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * AST classes for rewritten callables.
 *
 * The source rewriter hands the engine functions in this form: structured
 * statements with source locations, and the expressions they evaluate.
 * Control-flow statements are the conversion units.
 */
public final class AgAst {

    private AgAst() {}

    // ==================== Source locations ====================

    /**
     * Location of a statement in the user's original source.
     */
    public record SourceLocation(String file, int line, String functionName, String sourceLine) {

        public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", -1, "<unknown>", "");

        /**
         * Formats the location the way a user-facing traceback frame reads.
         */
        public String toTraceback() {
            StringBuilder sb = new StringBuilder();
            sb.append("  File \"").append(file).append("\", line ").append(line)
                    .append(", in ").append(functionName);
            if (sourceLine != null && !sourceLine.isBlank()) {
                sb.append("\n    ").append(sourceLine.strip());
            }
            return sb.toString();
        }
    }

    // ==================== Operators ====================

    public enum BinaryOperator {
        ADD("+", "add"),
        SUB("-", "sub"),
        MUL("*", "mul"),
        DIV("/", "div"),
        FLOOR_DIV("//", "floor_div"),
        MOD("%", "rem"),
        POW("**", "pow");

        private final String symbol;
        private final String primitiveName;

        BinaryOperator(String symbol, String primitiveName) {
            this.symbol = symbol;
            this.primitiveName = primitiveName;
        }

        public String symbol() {
            return symbol;
        }

        public String primitiveName() {
            return primitiveName;
        }

        public static BinaryOperator fromSymbol(String symbol) {
            for (BinaryOperator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Unknown binary operator: " + symbol);
        }
    }

    public enum CompareOperator {
        LT("<", "lt"),
        LE("<=", "le"),
        GT(">", "gt"),
        GE(">=", "ge"),
        EQ("==", "eq"),
        NE("!=", "ne");

        private final String symbol;
        private final String primitiveName;

        CompareOperator(String symbol, String primitiveName) {
            this.symbol = symbol;
            this.primitiveName = primitiveName;
        }

        public String symbol() {
            return symbol;
        }

        public String primitiveName() {
            return primitiveName;
        }

        public static CompareOperator fromSymbol(String symbol) {
            for (CompareOperator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
        }
    }

    public enum LogicalOperator {
        AND("and"),
        OR("or");

        private final String keyword;

        LogicalOperator(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        public static LogicalOperator fromKeyword(String keyword) {
            for (LogicalOperator op : values()) {
                if (op.keyword.equals(keyword)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Unknown logical operator: " + keyword);
        }
    }

    // ==================== Expressions ====================

    public sealed interface Expr permits Const, Name, ListExpr, TupleExpr, BinOp, Compare, BoolOp, Not, Neg, Index, Call {}

    /**
     * Literal: Long, Double, Boolean, String or null.
     */
    public record Const(Object value) implements Expr {}

    public record Name(String id) implements Expr {
        public Name {
            Objects.requireNonNull(id, "id");
        }
    }

    public record ListExpr(List<Expr> elements) implements Expr {
        public ListExpr {
            elements = List.copyOf(elements);
        }
    }

    public record TupleExpr(List<Expr> elements) implements Expr {
        public TupleExpr {
            elements = List.copyOf(elements);
        }
    }

    public record BinOp(BinaryOperator op, Expr left, Expr right) implements Expr {}

    public record Compare(CompareOperator op, Expr left, Expr right) implements Expr {}

    public record BoolOp(LogicalOperator op, Expr left, Expr right) implements Expr {}

    public record Not(Expr operand) implements Expr {}

    public record Neg(Expr operand) implements Expr {}

    public record Index(Expr target, Expr index) implements Expr {}

    public record Call(String function, List<Expr> args) implements Expr {
        public Call {
            Objects.requireNonNull(function, "function");
            args = List.copyOf(args);
        }
    }

    // ==================== Assignment targets ====================

    public sealed interface Target permits NameTarget, TupleTarget {

        /**
         * Names bound by this target, in order of appearance.
         */
        default List<String> names() {
            List<String> names = new ArrayList<>();
            collectNames(this, names);
            return names;
        }

        private static void collectNames(Target target, List<String> out) {
            if (target instanceof NameTarget nameTarget) {
                out.add(nameTarget.name());
            } else if (target instanceof TupleTarget tupleTarget) {
                for (Target element : tupleTarget.elements()) {
                    collectNames(element, out);
                }
            }
        }
    }

    public record NameTarget(String name) implements Target {
        public NameTarget {
            Objects.requireNonNull(name, "name");
        }
    }

    public record TupleTarget(List<Target> elements) implements Target {
        public TupleTarget {
            if (elements.isEmpty()) {
                throw new IllegalArgumentException("Tuple target must bind at least one name");
            }
            elements = List.copyOf(elements);
        }
    }

    // ==================== Statements ====================

    public sealed interface Stmt permits Assign, AugAssign, ExprStmt, If, For, While, Return, Raise, Pass {
        SourceLocation location();
    }

    public record Assign(Target target, Expr value, SourceLocation location) implements Stmt {}

    public record AugAssign(String name, BinaryOperator op, Expr value, SourceLocation location) implements Stmt {}

    public record ExprStmt(Expr value, SourceLocation location) implements Stmt {}

    /**
     * One entry of an if/elif/else chain. A null test marks the else branch.
     */
    public record Branch(Expr test, List<Stmt> body) {
        public Branch {
            body = List.copyOf(body);
        }

        public boolean isElse() {
            return test == null;
        }
    }

    /**
     * An if/elif/else chain.
     *
     * <p>At most one branch may omit its test, and only the last one.
     */
    public record If(List<Branch> branches, SourceLocation location) implements Stmt {
        public If {
            if (branches.isEmpty()) {
                throw new IllegalArgumentException("If statement needs at least one branch");
            }
            for (int i = 0; i < branches.size(); i++) {
                if (branches.get(i).isElse() && i != branches.size() - 1) {
                    throw new IllegalArgumentException("Only the last branch of an if chain may omit its test");
                }
            }
            if (branches.get(0).isElse()) {
                throw new IllegalArgumentException("The first branch of an if chain needs a test");
            }
            branches = List.copyOf(branches);
        }

        public boolean hasElse() {
            return branches.get(branches.size() - 1).isElse();
        }
    }

    public record For(Target target, Expr iter, List<Stmt> body, SourceLocation location) implements Stmt {
        public For {
            body = List.copyOf(body);
        }
    }

    public record While(Expr test, List<Stmt> body, SourceLocation location) implements Stmt {
        public While {
            body = List.copyOf(body);
        }
    }

    /**
     * Return statement. A null value returns None.
     */
    public record Return(Expr value, SourceLocation location) implements Stmt {}

    public record Raise(String exceptionType, Expr message, SourceLocation location) implements Stmt {}

    public record Pass(SourceLocation location) implements Stmt {}

    // ==================== Functions ====================

    public record FunctionDef(String name, List<String> params, List<Stmt> body, SourceLocation location) {
        public FunctionDef {
            Objects.requireNonNull(name, "name");
            params = List.copyOf(params);
            body = List.copyOf(body);
        }
    }

    public record Program(List<FunctionDef> functions) {
        public Program {
            functions = Collections.unmodifiableList(new ArrayList<>(functions));
        }

        public Optional<FunctionDef> function(String name) {
            for (FunctionDef function : functions) {
                if (function.name().equals(name)) {
                    return Optional.of(function);
                }
            }
            return Optional.empty();
        }
    }
}
