package io.surfworks.snakeweaver.ast;

import io.surfworks.snakeweaver.ast.AgAst.*;

import java.util.List;

/**
 * Prints AST nodes back as host-language source text.
 *
 * Used for diagnostics and for the converted-source view of a callable.
 */
public final class AgAstPrinter {

    private static final String INDENT = "    ";

    private AgAstPrinter() {}

    public static String print(Expr expr) {
        if (expr instanceof Const c) {
            return literal(c.value());
        } else if (expr instanceof Name n) {
            return n.id();
        } else if (expr instanceof ListExpr l) {
            return "[" + join(l.elements()) + "]";
        } else if (expr instanceof TupleExpr t) {
            if (t.elements().size() == 1) {
                return "(" + print(t.elements().get(0)) + ",)";
            }
            return "(" + join(t.elements()) + ")";
        } else if (expr instanceof BinOp b) {
            return operand(b.left()) + " " + b.op().symbol() + " " + operand(b.right());
        } else if (expr instanceof Compare c) {
            return operand(c.left()) + " " + c.op().symbol() + " " + operand(c.right());
        } else if (expr instanceof BoolOp b) {
            return operand(b.left()) + " " + b.op().keyword() + " " + operand(b.right());
        } else if (expr instanceof Not n) {
            return "not " + operand(n.operand());
        } else if (expr instanceof Neg n) {
            return "-" + operand(n.operand());
        } else if (expr instanceof Index i) {
            return operand(i.target()) + "[" + print(i.index()) + "]";
        } else if (expr instanceof Call c) {
            return c.function() + "(" + join(c.args()) + ")";
        }
        throw new IllegalArgumentException("Unknown expression: " + expr);
    }

    public static String print(Target target) {
        if (target instanceof NameTarget n) {
            return n.name();
        }
        TupleTarget tuple = (TupleTarget) target;
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < tuple.elements().size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(print(tuple.elements().get(i)));
        }
        if (tuple.elements().size() == 1) {
            sb.append(",");
        }
        return sb.append(")").toString();
    }

    /**
     * Returns the header line of a statement, without its body.
     */
    public static String header(Stmt stmt) {
        if (stmt instanceof Assign a) {
            return print(a.target()) + " = " + print(a.value());
        } else if (stmt instanceof AugAssign a) {
            return a.name() + " " + a.op().symbol() + "= " + print(a.value());
        } else if (stmt instanceof ExprStmt e) {
            return print(e.value());
        } else if (stmt instanceof If i) {
            return "if " + print(i.branches().get(0).test()) + ":";
        } else if (stmt instanceof For f) {
            return "for " + unparenthesized(f.target()) + " in " + print(f.iter()) + ":";
        } else if (stmt instanceof While w) {
            return "while " + print(w.test()) + ":";
        } else if (stmt instanceof Return r) {
            return r.value() == null ? "return" : "return " + print(r.value());
        } else if (stmt instanceof Raise r) {
            return "raise " + r.exceptionType() + "(" + (r.message() == null ? "" : print(r.message())) + ")";
        } else if (stmt instanceof Pass) {
            return "pass";
        }
        throw new IllegalArgumentException("Unknown statement: " + stmt);
    }

    public static String print(FunctionDef function) {
        StringBuilder sb = new StringBuilder();
        sb.append("def ").append(function.name()).append("(")
                .append(String.join(", ", function.params())).append("):\n");
        printBody(function.body(), 1, sb);
        return sb.toString();
    }

    public static void printBody(List<Stmt> body, int depth, StringBuilder sb) {
        if (body.isEmpty()) {
            indent(depth, sb).append("pass\n");
            return;
        }
        for (Stmt stmt : body) {
            printStmt(stmt, depth, sb);
        }
    }

    public static void printStmt(Stmt stmt, int depth, StringBuilder sb) {
        if (stmt instanceof If i) {
            for (int b = 0; b < i.branches().size(); b++) {
                Branch branch = i.branches().get(b);
                if (b == 0) {
                    indent(depth, sb).append("if ").append(print(branch.test())).append(":\n");
                } else if (branch.isElse()) {
                    indent(depth, sb).append("else:\n");
                } else {
                    indent(depth, sb).append("elif ").append(print(branch.test())).append(":\n");
                }
                printBody(branch.body(), depth + 1, sb);
            }
        } else if (stmt instanceof For f) {
            indent(depth, sb).append(header(f)).append("\n");
            printBody(f.body(), depth + 1, sb);
        } else if (stmt instanceof While w) {
            indent(depth, sb).append(header(w)).append("\n");
            printBody(w.body(), depth + 1, sb);
        } else {
            indent(depth, sb).append(header(stmt)).append("\n");
        }
    }

    public static StringBuilder indent(int depth, StringBuilder sb) {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
        return sb;
    }

    static String literal(Object value) {
        if (value == null) {
            return "None";
        } else if (value instanceof Boolean b) {
            return b ? "True" : "False";
        } else if (value instanceof String s) {
            return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
        }
        return String.valueOf(value);
    }

    private static String unparenthesized(Target target) {
        String text = print(target);
        if (target instanceof TupleTarget && text.startsWith("(") && text.endsWith(")")) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    private static String operand(Expr expr) {
        if (expr instanceof BinOp || expr instanceof Compare || expr instanceof BoolOp
                || expr instanceof Not || expr instanceof Neg) {
            return "(" + print(expr) + ")";
        }
        return print(expr);
    }

    private static String join(List<Expr> exprs) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(print(exprs.get(i)));
        }
        return sb.toString();
    }
}
