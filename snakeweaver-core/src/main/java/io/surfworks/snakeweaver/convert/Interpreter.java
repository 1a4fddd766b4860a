package io.surfworks.snakeweaver.convert;

import io.surfworks.snakeweaver.ast.AgAst.*;
import io.surfworks.snakeweaver.trace.TraceOps;
import io.surfworks.snakeweaver.trace.TracingEngine;
import io.surfworks.snakeweaver.value.Values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes functions of a program with host semantics.
 *
 * <p>While the session is tracing, if, for and while statements with a plan are
 * handed to the {@link ControlFlowTransformer}. Everything else, including
 * every block while no session is tracing, runs as host control flow. Values
 * flow through {@link TraceOps}, so expressions over traced values record
 * nodes.
 */
final class Interpreter {

    /**
     * Signals a {@code return} out of the enclosing function.
     */
    record Completion(Object value) {}

    private final Program program;
    private final Map<String, HostFunction> hostFunctions;
    private final TraceOps ops;
    private final LogicalOps logical;
    private final ControlFlowTransformer transformer;

    /**
     * @param transformer dispatcher for converted blocks, or null to run every block as host control flow
     */
    Interpreter(Program program, Map<String, HostFunction> hostFunctions, TraceOps ops, TracingEngine engine,
                ControlFlowTransformer transformer) {
        this.program = program;
        this.hostFunctions = hostFunctions;
        this.ops = ops;
        this.logical = new LogicalOps(engine, ops);
        this.transformer = transformer;
    }

    TraceOps ops() {
        return ops;
    }

    Object call(FunctionDef function, List<Object> args) {
        if (args.size() != function.params().size()) {
            throw new IllegalArgumentException(String.format("%s() takes %d positional arguments but %d were given",
                    function.name(), function.params().size(), args.size()));
        }
        Frame frame = new Frame();
        for (int i = 0; i < args.size(); i++) {
            frame.assign(function.params().get(i), Values.normalize(args.get(i)));
        }
        Completion completion = execBody(function.body(), frame);
        return completion == null ? null : completion.value();
    }

    // ==================== Statements ====================

    /**
     * @return the completion of a {@code return}, or null if the body ran to its end
     */
    Completion execBody(List<Stmt> body, Frame frame) {
        for (Stmt stmt : body) {
            Completion completion = exec(stmt, frame);
            if (completion != null) {
                return completion;
            }
        }
        return null;
    }

    Completion exec(Stmt stmt, Frame frame) {
        if (stmt instanceof Assign a) {
            assignTarget(a.target(), eval(a.value(), frame), frame);
        } else if (stmt instanceof AugAssign a) {
            Object current = ops.operand(frame.get(a.name()));
            frame.assign(a.name(), ops.binary(a.op(), current, eval(a.value(), frame)));
        } else if (stmt instanceof ExprStmt e) {
            eval(e.value(), frame);
        } else if (stmt instanceof Return r) {
            return new Completion(r.value() == null ? null : eval(r.value(), frame));
        } else if (stmt instanceof Raise r) {
            String message = null;
            if (r.message() != null) {
                Object value = Values.concretize(eval(r.message(), frame));
                message = value instanceof String s ? s : Values.repr(value);
            }
            throw new HostRaisedException(r.exceptionType(), message);
        } else if (stmt instanceof Pass) {
            return null;
        } else if (transformer != null && ops.isTracing()) {
            return transformer.dispatch(stmt, frame, this);
        } else if (stmt instanceof If i) {
            return hostIf(i, 0, null, frame);
        } else if (stmt instanceof For f) {
            return hostFor(f, eval(f.iter(), frame), frame);
        } else if (stmt instanceof While w) {
            return hostWhile(w, frame);
        } else {
            throw new IllegalArgumentException("Unknown statement: " + stmt);
        }
        return null;
    }

    /**
     * Host if-chain starting at branch {@code from}.
     *
     * @param predicate already evaluated test of branch {@code from}, or null to evaluate it
     */
    Completion hostIf(If stmt, int from, Object predicate, Frame frame) {
        List<Branch> branches = stmt.branches();
        for (int b = from; b < branches.size(); b++) {
            Branch branch = branches.get(b);
            if (branch.isElse()) {
                return execBody(branch.body(), frame);
            }
            Object test = b == from && predicate != null ? predicate : eval(branch.test(), frame);
            if (Values.truthy(test)) {
                return execBody(branch.body(), frame);
            }
        }
        return null;
    }

    /**
     * Host loop over an already evaluated iterable.
     */
    Completion hostFor(For stmt, Object iterable, Frame frame) {
        Iterator<Object> it = ops.iterate(iterable);
        while (it.hasNext()) {
            assignTarget(stmt.target(), it.next(), frame);
            Completion completion = execBody(stmt.body(), frame);
            if (completion != null) {
                return completion;
            }
        }
        return null;
    }

    Completion hostWhile(While stmt, Frame frame) {
        while (Values.truthy(eval(stmt.test(), frame))) {
            Completion completion = execBody(stmt.body(), frame);
            if (completion != null) {
                return completion;
            }
        }
        return null;
    }

    void assignTarget(Target target, Object value, Frame frame) {
        if (target instanceof NameTarget n) {
            frame.assign(n.name(), value);
            return;
        }
        TupleTarget tuple = (TupleTarget) target;
        List<Object> parts = ops.unpack(value, tuple.elements().size());
        for (int i = 0; i < parts.size(); i++) {
            assignTarget(tuple.elements().get(i), parts.get(i), frame);
        }
    }

    // ==================== Expressions ====================

    Object eval(Expr expr, Frame frame) {
        if (expr instanceof Const c) {
            return Values.normalize(c.value());
        } else if (expr instanceof Name n) {
            return ops.operand(frame.get(n.id()));
        } else if (expr instanceof ListExpr l) {
            return evalAll(l.elements(), frame);
        } else if (expr instanceof TupleExpr t) {
            return Collections.unmodifiableList(evalAll(t.elements(), frame));
        } else if (expr instanceof BinOp b) {
            return ops.binary(b.op(), eval(b.left(), frame), eval(b.right(), frame));
        } else if (expr instanceof Compare c) {
            return ops.compare(c.op(), eval(c.left(), frame), eval(c.right(), frame));
        } else if (expr instanceof BoolOp b) {
            return logical.apply(b.op(), eval(b.left(), frame), () -> eval(b.right(), frame));
        } else if (expr instanceof Not n) {
            return logical.not(eval(n.operand(), frame));
        } else if (expr instanceof Neg n) {
            return ops.negate(eval(n.operand(), frame));
        } else if (expr instanceof Index i) {
            return ops.index(eval(i.target(), frame), eval(i.index(), frame));
        } else if (expr instanceof Call c) {
            return callFunction(c.function(), evalAll(c.args(), frame));
        }
        throw new IllegalArgumentException("Unknown expression: " + expr);
    }

    private List<Object> evalAll(List<Expr> exprs, Frame frame) {
        List<Object> values = new ArrayList<>(exprs.size());
        for (Expr expr : exprs) {
            values.add(eval(expr, frame));
        }
        return values;
    }

    /**
     * Resolves a called name: builtins first, then functions of the program, then host functions.
     */
    private Object callFunction(String name, List<Object> args) {
        if (Builtins.isBuiltin(name)) {
            return Builtins.call(name, ops, args);
        }
        Optional<FunctionDef> function = program.function(name);
        if (function.isPresent()) {
            return call(function.get(), args);
        }
        HostFunction host = hostFunctions.get(name);
        if (host != null) {
            return Values.normalize(host.call(Collections.unmodifiableList(args)));
        }
        throw new IllegalArgumentException("name '" + name + "' is not defined");
    }
}
