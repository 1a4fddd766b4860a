package io.surfworks.snakeweaver.ast;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import io.surfworks.snakeweaver.ast.AgAst.*;

import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads rewriter output into {@link AgAst} programs.
 *
 * <p>The rewriter emits one JSON document per source file:
 * <pre>{@code
 * {
 *   "file": "loops.py",
 *   "functions": [
 *     {"name": "f", "params": ["n"], "line": 1, "body": [
 *       {"kind": "assign", "line": 2, "source": "acc = 0",
 *        "target": "acc", "value": {"kind": "const", "value": 0}},
 *       ...
 *     ]}
 *   ]
 * }
 * }</pre>
 *
 * Statements and expressions are tagged by their {@code "kind"} field.
 * Assignment targets are either a bare name string or a
 * {@code {"kind": "tuple", "elements": [...]}} object.
 */
public final class AgAstJson {

    private final String file;

    private AgAstJson(String file) {
        this.file = file;
    }

    public static Program readProgram(String json) {
        try {
            return readProgram(JsonParser.parseString(json));
        } catch (JsonParseException e) {
            throw new AgAstParseException("Malformed rewriter JSON: " + e.getMessage(), e);
        }
    }

    public static Program readProgram(Reader reader) {
        try {
            return readProgram(JsonParser.parseReader(reader));
        } catch (JsonParseException e) {
            throw new AgAstParseException("Malformed rewriter JSON: " + e.getMessage(), e);
        }
    }

    private static Program readProgram(JsonElement root) {
        if (!root.isJsonObject()) {
            throw new AgAstParseException("Expected a program object", "$");
        }
        JsonObject program = root.getAsJsonObject();
        String file = optionalString(program, "file", "<rewritten>");
        AgAstJson reader = new AgAstJson(file);

        List<FunctionDef> functions = new ArrayList<>();
        JsonArray array = requireArray(program, "functions", "$");
        for (int i = 0; i < array.size(); i++) {
            functions.add(reader.readFunction(requireObject(array.get(i), "$.functions[" + i + "]"),
                    "$.functions[" + i + "]"));
        }
        return new Program(functions);
    }

    private FunctionDef readFunction(JsonObject obj, String path) {
        String name = requireString(obj, "name", path);
        List<String> params = new ArrayList<>();
        if (obj.has("params")) {
            JsonArray array = requireArray(obj, "params", path);
            for (int i = 0; i < array.size(); i++) {
                params.add(asString(array.get(i), path + ".params[" + i + "]"));
            }
        }
        int line = optionalInt(obj, "line", -1);
        String source = optionalString(obj, "source", "def " + name + "(" + String.join(", ", params) + "):");
        SourceLocation location = new SourceLocation(file, line, name, source);
        List<Stmt> body = readBody(obj, "body", name, path);
        return new FunctionDef(name, params, body, location);
    }

    private List<Stmt> readBody(JsonObject obj, String field, String functionName, String path) {
        List<Stmt> body = new ArrayList<>();
        JsonArray array = requireArray(obj, field, path);
        for (int i = 0; i < array.size(); i++) {
            String elementPath = path + "." + field + "[" + i + "]";
            body.add(readStmt(requireObject(array.get(i), elementPath), functionName, elementPath));
        }
        return body;
    }

    private Stmt readStmt(JsonObject obj, String functionName, String path) {
        String kind = requireString(obj, "kind", path);
        SourceLocation location = new SourceLocation(
                file, optionalInt(obj, "line", -1), functionName, optionalString(obj, "source", ""));

        switch (kind) {
            case "assign":
                return new Assign(readTarget(require(obj, "target", path), path + ".target"),
                        readExpr(obj, "value", path), location);
            case "aug_assign":
                return new AugAssign(requireString(obj, "name", path),
                        binaryOperator(requireString(obj, "op", path), path),
                        readExpr(obj, "value", path), location);
            case "expr":
                return new ExprStmt(readExpr(obj, "value", path), location);
            case "if": {
                JsonArray array = requireArray(obj, "branches", path);
                List<Branch> branches = new ArrayList<>();
                for (int i = 0; i < array.size(); i++) {
                    String branchPath = path + ".branches[" + i + "]";
                    JsonObject branch = requireObject(array.get(i), branchPath);
                    Expr test = branch.has("test") && !branch.get("test").isJsonNull()
                            ? readExpr(branch, "test", branchPath)
                            : null;
                    branches.add(new Branch(test, readBody(branch, "body", functionName, branchPath)));
                }
                try {
                    return new If(branches, location);
                } catch (IllegalArgumentException e) {
                    throw new AgAstParseException(e.getMessage(), path);
                }
            }
            case "for":
                return new For(readTarget(require(obj, "target", path), path + ".target"),
                        readExpr(obj, "iter", path),
                        readBody(obj, "body", functionName, path), location);
            case "while":
                return new While(readExpr(obj, "test", path),
                        readBody(obj, "body", functionName, path), location);
            case "return":
                return new Return(obj.has("value") && !obj.get("value").isJsonNull()
                        ? readExpr(obj, "value", path)
                        : null, location);
            case "raise":
                return new Raise(optionalString(obj, "exception", "RuntimeError"),
                        obj.has("message") ? readExpr(obj, "message", path) : null, location);
            case "pass":
                return new Pass(location);
            default:
                throw new AgAstParseException("Unknown statement kind '" + kind + "'", path);
        }
    }

    private Target readTarget(JsonElement element, String path) {
        if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
            return new NameTarget(element.getAsString());
        }
        JsonObject obj = requireObject(element, path);
        String kind = requireString(obj, "kind", path);
        switch (kind) {
            case "name":
                return new NameTarget(requireString(obj, "id", path));
            case "tuple": {
                JsonArray array = requireArray(obj, "elements", path);
                List<Target> elements = new ArrayList<>();
                for (int i = 0; i < array.size(); i++) {
                    elements.add(readTarget(array.get(i), path + ".elements[" + i + "]"));
                }
                if (elements.isEmpty()) {
                    throw new AgAstParseException("Tuple target must bind at least one name", path);
                }
                return new TupleTarget(elements);
            }
            default:
                throw new AgAstParseException("Unknown target kind '" + kind + "'", path);
        }
    }

    private Expr readExpr(JsonObject parent, String field, String path) {
        return readExpr(require(parent, field, path), path + "." + field);
    }

    private Expr readExpr(JsonElement element, String path) {
        JsonObject obj = requireObject(element, path);
        String kind = requireString(obj, "kind", path);
        switch (kind) {
            case "const":
                return new Const(constant(obj.get("value"), path));
            case "name":
                return new Name(requireString(obj, "id", path));
            case "list":
                return new ListExpr(readExprs(obj, "elements", path));
            case "tuple":
                return new TupleExpr(readExprs(obj, "elements", path));
            case "binop":
                return new BinOp(binaryOperator(requireString(obj, "op", path), path),
                        readExpr(obj, "left", path), readExpr(obj, "right", path));
            case "compare":
                try {
                    return new Compare(CompareOperator.fromSymbol(requireString(obj, "op", path)),
                            readExpr(obj, "left", path), readExpr(obj, "right", path));
                } catch (IllegalArgumentException e) {
                    throw new AgAstParseException(e.getMessage(), path);
                }
            case "boolop":
                try {
                    return new BoolOp(LogicalOperator.fromKeyword(requireString(obj, "op", path)),
                            readExpr(obj, "left", path), readExpr(obj, "right", path));
                } catch (IllegalArgumentException e) {
                    throw new AgAstParseException(e.getMessage(), path);
                }
            case "not":
                return new Not(readExpr(obj, "operand", path));
            case "neg":
                return new Neg(readExpr(obj, "operand", path));
            case "index":
                return new Index(readExpr(obj, "target", path), readExpr(obj, "index", path));
            case "call":
                return new Call(requireString(obj, "function", path),
                        obj.has("args") ? readExprs(obj, "args", path) : List.of());
            default:
                throw new AgAstParseException("Unknown expression kind '" + kind + "'", path);
        }
    }

    private List<Expr> readExprs(JsonObject obj, String field, String path) {
        JsonArray array = requireArray(obj, field, path);
        List<Expr> exprs = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            exprs.add(readExpr(array.get(i), path + "." + field + "[" + i + "]"));
        }
        return exprs;
    }

    private static Object constant(JsonElement element, String path) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonPrimitive()) {
            throw new AgAstParseException("Constant must be a JSON primitive", path);
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isString()) {
            return primitive.getAsString();
        }
        String text = primitive.getAsString();
        if (text.contains(".") || text.contains("e") || text.contains("E")) {
            return primitive.getAsDouble();
        }
        try {
            return primitive.getAsLong();
        } catch (NumberFormatException e) {
            throw new AgAstParseException("Integer constant out of range: " + text, path);
        }
    }

    private static BinaryOperator binaryOperator(String symbol, String path) {
        try {
            return BinaryOperator.fromSymbol(symbol);
        } catch (IllegalArgumentException e) {
            throw new AgAstParseException(e.getMessage(), path);
        }
    }

    // ==================== Field access ====================

    private static JsonElement require(JsonObject obj, String field, String path) {
        JsonElement element = obj.get(field);
        if (element == null || element.isJsonNull()) {
            throw new AgAstParseException("Missing field '" + field + "'", path);
        }
        return element;
    }

    private static JsonObject requireObject(JsonElement element, String path) {
        if (!element.isJsonObject()) {
            throw new AgAstParseException("Expected an object", path);
        }
        return element.getAsJsonObject();
    }

    private static JsonArray requireArray(JsonObject obj, String field, String path) {
        JsonElement element = require(obj, field, path);
        if (!element.isJsonArray()) {
            throw new AgAstParseException("Field '" + field + "' must be an array", path);
        }
        return element.getAsJsonArray();
    }

    private static String requireString(JsonObject obj, String field, String path) {
        return asString(require(obj, field, path), path + "." + field);
    }

    private static String asString(JsonElement element, String path) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new AgAstParseException("Expected a string", path);
        }
        return element.getAsString();
    }

    private static String optionalString(JsonObject obj, String field, String fallback) {
        JsonElement element = obj.get(field);
        if (element == null || element.isJsonNull()) {
            return fallback;
        }
        return asString(element, field);
    }

    private static int optionalInt(JsonObject obj, String field, int fallback) {
        JsonElement element = obj.get(field);
        if (element == null || element.isJsonNull()) {
            return fallback;
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new AgAstParseException("Field '" + field + "' must be a number");
        }
        return element.getAsInt();
    }
}
