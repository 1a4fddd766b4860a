package io.surfworks.snakeweaver.convert;

import io.surfworks.snakeweaver.analysis.DomainClassifier;
import io.surfworks.snakeweaver.analysis.PredicateKind;
import io.surfworks.snakeweaver.ast.AgAst.Branch;
import io.surfworks.snakeweaver.ast.AgAst.Const;
import io.surfworks.snakeweaver.ast.AgAst.For;
import io.surfworks.snakeweaver.ast.AgAst.FunctionDef;
import io.surfworks.snakeweaver.ast.AgAst.If;
import io.surfworks.snakeweaver.ast.AgAst.Stmt;
import io.surfworks.snakeweaver.ast.AgAst.While;
import io.surfworks.snakeweaver.ast.AgAstPrinter;
import io.surfworks.snakeweaver.convert.ControlFlowTransformer.BlockPlan;

import java.util.List;
import java.util.Map;

/**
 * Prints a function the way it runs after conversion.
 *
 * <p>Each planned block becomes local functions for its bodies followed by a call
 * to the matching primitive:
 * <pre>
 * def for_body_3(itr, acc):
 *     x = itr
 *     acc = acc + x
 *     return (acc,)
 * (acc,) = for_stmt([0, 4, 5], for_body_3, (acc,))
 * </pre>
 * Branches whose test is a boolean literal are folded: only the taken branch is printed.
 */
public final class ConvertedSourcePrinter {

    private ConvertedSourcePrinter() {}

    public static String print(FunctionDef function, Map<Stmt, BlockPlan> plans) {
        StringBuilder sb = new StringBuilder();
        sb.append("def ").append(function.name()).append("(")
                .append(String.join(", ", function.params())).append("):\n");
        printBody(function.body(), plans, 1, sb);
        return sb.toString();
    }

    private static void printBody(List<Stmt> body, Map<Stmt, BlockPlan> plans, int depth, StringBuilder sb) {
        int length = sb.length();
        for (Stmt stmt : body) {
            BlockPlan plan = plans.get(stmt);
            if (plan == null) {
                AgAstPrinter.printStmt(stmt, depth, sb);
            } else if (stmt instanceof If i) {
                printIf(i, 0, plan, plans, depth, sb);
            } else if (stmt instanceof For f) {
                printFor(f, plan, plans, depth, sb);
            } else {
                printWhile((While) stmt, plan, plans, depth, sb);
            }
        }
        if (sb.length() == length) {
            AgAstPrinter.indent(depth, sb).append("pass\n");
        }
    }

    private static void printIf(If stmt, int from, BlockPlan plan, Map<Stmt, BlockPlan> plans, int depth,
                                StringBuilder sb) {
        List<Branch> branches = stmt.branches();
        if (from == branches.size()) {
            return;
        }
        Branch branch = branches.get(from);
        if (branch.isElse()) {
            printInline(branch.body(), plans, depth, sb);
            return;
        }
        if (DomainClassifier.classifyPredicate(branch.test()) == PredicateKind.STATIC_CONSTANT) {
            if ((Boolean) ((Const) branch.test()).value()) {
                printInline(branch.body(), plans, depth, sb);
            } else {
                printIf(stmt, from + 1, plan, plans, depth, sb);
            }
            return;
        }

        String suffix = suffix(stmt, from);
        List<String> carried = plan.carried();
        String params = String.join(", ", carried);
        String tuple = tuple(carried);

        AgAstPrinter.indent(depth, sb).append("def if_true_").append(suffix).append("(").append(params).append("):\n");
        printBody(branch.body(), plans, depth + 1, sb);
        AgAstPrinter.indent(depth + 1, sb).append("return ").append(tuple).append("\n");

        AgAstPrinter.indent(depth, sb).append("def if_false_").append(suffix).append("(").append(params).append("):\n");
        int length = sb.length();
        printIf(stmt, from + 1, plan, plans, depth + 1, sb);
        if (sb.length() == length) {
            AgAstPrinter.indent(depth + 1, sb).append("pass\n");
        }
        AgAstPrinter.indent(depth + 1, sb).append("return ").append(tuple).append("\n");

        AgAstPrinter.indent(depth, sb);
        assignment(carried, sb).append("if_stmt(").append(AgAstPrinter.print(branch.test()))
                .append(", if_true_").append(suffix).append(", if_false_").append(suffix)
                .append(", ").append(tuple).append(")\n");
    }

    private static void printFor(For stmt, BlockPlan plan, Map<Stmt, BlockPlan> plans, int depth, StringBuilder sb) {
        String suffix = String.valueOf(stmt.location().line());
        List<String> carried = plan.carried();
        String tuple = tuple(carried);

        AgAstPrinter.indent(depth, sb).append("def for_body_").append(suffix).append("(itr");
        for (String name : carried) {
            sb.append(", ").append(name);
        }
        sb.append("):\n");
        AgAstPrinter.indent(depth + 1, sb).append(AgAstPrinter.print(stmt.target())).append(" = itr\n");
        printInline(stmt.body(), plans, depth + 1, sb);
        AgAstPrinter.indent(depth + 1, sb).append("return ").append(tuple).append("\n");

        AgAstPrinter.indent(depth, sb);
        assignment(carried, sb).append("for_stmt(").append(AgAstPrinter.print(stmt.iter()))
                .append(", for_body_").append(suffix).append(", ").append(tuple).append(")\n");
    }

    private static void printWhile(While stmt, BlockPlan plan, Map<Stmt, BlockPlan> plans, int depth,
                                   StringBuilder sb) {
        String suffix = String.valueOf(stmt.location().line());
        List<String> carried = plan.carried();
        String params = String.join(", ", carried);
        String tuple = tuple(carried);

        AgAstPrinter.indent(depth, sb).append("def while_test_").append(suffix).append("(").append(params).append("):\n");
        AgAstPrinter.indent(depth + 1, sb).append("return ").append(AgAstPrinter.print(stmt.test())).append("\n");

        AgAstPrinter.indent(depth, sb).append("def while_body_").append(suffix).append("(").append(params).append("):\n");
        printBody(stmt.body(), plans, depth + 1, sb);
        AgAstPrinter.indent(depth + 1, sb).append("return ").append(tuple).append("\n");

        AgAstPrinter.indent(depth, sb);
        assignment(carried, sb).append("while_stmt(while_test_").append(suffix)
                .append(", while_body_").append(suffix).append(", ").append(tuple).append(")\n");
    }

    /**
     * Prints statements without an empty-body {@code pass}.
     */
    private static void printInline(List<Stmt> body, Map<Stmt, BlockPlan> plans, int depth, StringBuilder sb) {
        if (!body.isEmpty()) {
            printBody(body, plans, depth, sb);
        }
    }

    private static String suffix(If stmt, int branch) {
        String line = String.valueOf(stmt.location().line());
        return branch == 0 ? line : line + "_" + branch;
    }

    private static String tuple(List<String> names) {
        if (names.size() == 1) {
            return "(" + names.get(0) + ",)";
        }
        return "(" + String.join(", ", names) + ")";
    }

    private static StringBuilder assignment(List<String> carried, StringBuilder sb) {
        if (!carried.isEmpty()) {
            sb.append(tuple(carried)).append(" = ");
        }
        return sb;
    }
}
