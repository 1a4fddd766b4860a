package io.surfworks.snakeweaver.convert;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.surfworks.snakeweaver.ast.AgAst.FunctionDef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static io.surfworks.snakeweaver.ast.AstDsl.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Tests for {@link ConversionRegistry}. */
@DisplayName("ConversionRegistry")
class ConversionRegistryTest {

    private final ConversionRegistry registry = new ConversionRegistry();

    @Test
    @DisplayName("handles are issued per function instance")
    void handles() {
        FunctionDef f = def("f", params(), ret(c(1)));
        FunctionDef sameName = def("f", params(), ret(c(1)));

        CallableHandle handle = registry.register(f);
        assertEquals(handle, registry.register(f));
        assertNotEquals(handle, registry.register(sameName));
        assertEquals("f#" + handle.id(), handle.toString());
    }

    @Test
    @DisplayName("a function never attempted has no converted source")
    void notConverted() {
        CallableHandle handle = registry.register(def("f", params(), ret(c(1))));

        NotConvertedException e = assertThrows(NotConvertedException.class, () -> registry.getConvertedSource(handle));
        assertEquals("Function 'f' has not been converted", e.getMessage());
        assertSame(handle, e.getHandle());
        assertFalse(registry.isConverted(handle));
        assertThrows(NotConvertedException.class, () -> registry.markConverted(handle, "def f():"));
    }

    @Test
    @DisplayName("a failed attempt keeps its reason until a later success")
    void failureThenSuccess() {
        CallableHandle handle = registry.register(def("f", params(), ret(c(1))));

        registry.recordAttempt(handle);
        registry.markFailed(handle, "bad loop");
        ConversionFailedException e = assertThrows(ConversionFailedException.class,
                () -> registry.getConvertedSource(handle));
        assertEquals("Conversion of 'f' failed: bad loop", e.getMessage());
        assertEquals("bad loop", e.getReason());

        registry.recordAttempt(handle);
        registry.markConverted(handle, "def f():\n    return 1\n");
        assertTrue(registry.isConverted(handle));
        assertEquals("def f():\n    return 1\n", registry.getConvertedSource(handle));
        ConversionRecord record = registry.record(handle).orElseThrow();
        assertEquals(2, record.attempts());
        assertNull(record.failureReason());
    }

    @Test
    @DisplayName("the snapshot lists every record as JSON")
    void toJson() {
        CallableHandle ok = registry.register(def("ok", params(), ret(c(1))));
        CallableHandle broken = registry.register(def("broken", params(), ret(c(1))));
        registry.recordAttempt(ok);
        registry.markConverted(ok, "def ok():");
        registry.recordAttempt(broken);
        registry.markFailed(broken, "nope");

        JsonObject root = JsonParser.parseString(registry.toJson()).getAsJsonObject();

        assertEquals(2, root.getAsJsonArray("records").size());
        JsonObject first = root.getAsJsonArray("records").get(0).getAsJsonObject();
        assertEquals("ok", first.get("function").getAsString());
        assertTrue(first.get("converted").getAsBoolean());
        assertEquals(1, first.get("attempts").getAsInt());
        assertTrue(first.get("failureReason").isJsonNull());
        JsonObject second = root.getAsJsonArray("records").get(1).getAsJsonObject();
        assertEquals("nope", second.get("failureReason").getAsString());
        assertEquals(broken.id(), second.get("handle").getAsLong());
    }

    @Test
    @DisplayName("the global registry is a single instance")
    void global() {
        assertSame(ConversionRegistry.global(), ConversionRegistry.global());
    }
}
