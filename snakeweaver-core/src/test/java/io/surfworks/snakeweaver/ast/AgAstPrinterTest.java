package io.surfworks.snakeweaver.ast;

import io.surfworks.snakeweaver.ast.AgAst.FunctionDef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static io.surfworks.snakeweaver.ast.AstDsl.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

/** Tests for {@link AgAstPrinter}. */
@DisplayName("AgAstPrinter")
class AgAstPrinterTest {

    @Test
    @DisplayName("prints a function read from rewriter output")
    void printsFixture() throws IOException {
        FunctionDef accumulate = AgAstJsonTest.loadFixture("accumulate.json").function("accumulate").orElseThrow();

        assertEquals("""
                def accumulate(xs):
                    acc = 0
                    for x in xs:
                        if x > 1:
                            acc += x
                    return acc
                """, AgAstPrinter.print(accumulate));
    }

    @Test
    @DisplayName("parenthesizes nested operators")
    void nestedOperators() {
        assertEquals("(a + b) * c", AgAstPrinter.print(mul(add(n("a"), n("b")), n("c"))));
        assertEquals("not (x > 0)", AgAstPrinter.print(not(gt(n("x"), c(0)))));
        assertEquals("a and (b or c)", AgAstPrinter.print(and(n("a"), or(n("b"), n("c")))));
    }

    @Test
    @DisplayName("prints literals the way the host language writes them")
    void literals() {
        assertEquals("True", AgAstPrinter.print(c(true)));
        assertEquals("None", AgAstPrinter.print(c(null)));
        assertEquals("'it\\'s'", AgAstPrinter.print(c("it's")));
        assertEquals("(x,)", AgAstPrinter.print(tuple(n("x"))));
        assertEquals("data[i]", AgAstPrinter.print(index(n("data"), n("i"))));
    }

    @Test
    @DisplayName("prints elif chains, tuple targets and empty bodies")
    void statements() {
        FunctionDef f = def("f", params("xs"),
                forIn(names("i", "x"), call("enumerate", n("xs"))),
                ifChain(
                        when(gt(n("x"), c(3)), raise("ValueError", "big")),
                        when(gt(n("x"), c(1)), pass()),
                        otherwise(expr(call("print", n("x"))))));

        assertEquals("""
                def f(xs):
                    for i, x in enumerate(xs):
                        pass
                    if x > 3:
                        raise ValueError('big')
                    elif x > 1:
                        pass
                    else:
                        print(x)
                """, AgAstPrinter.print(f));
    }
}
