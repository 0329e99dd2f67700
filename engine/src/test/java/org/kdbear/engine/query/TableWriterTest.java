package org.kdbear.engine.query;

import org.kdbear.engine.execution.KdbSession;
import org.kdbear.engine.execution.QueryFailedException;
import org.kdbear.engine.execution.Value;
import org.kdbear.engine.test.ScriptedExecutor;
import org.kdbear.engine.types.TypeRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TableWriter Tests")
class TableWriterTest {

    private final TypeRegistry registry = TypeRegistry.standard();

    @Test
    @DisplayName("Columns render as typed lists")
    void testRender() {
        String q = TableWriter.render(registry, "quotes", List.of("ticker", "bid", "live"), List.of(
                List.of(Value.ofSymbol("GOOG"), Value.ofFloat(2.5), Value.ofBoolean(true)),
                List.of(Value.ofSymbol("MSFT"), Value.ofFloat(3.0), Value.ofBoolean(false))));

        assertEquals("quotes: ([] ticker:(`GOOG;`MSFT); bid:(2.5;3f); live:(1b;0b))", q);
    }

    @Test
    @DisplayName("A single row uses enlist")
    void testSingleRow() {
        String q = TableWriter.render(registry, "t", List.of("a", "b"),
                List.of(List.of(Value.ofLong(1), Value.ofSymbol("x"))));

        assertEquals("t: ([] a:enlist 1; b:enlist `x)", q);
    }

    @Test
    @DisplayName("Nulls take the null literal of the column type")
    void testNulls() {
        String q = TableWriter.render(registry, "t", List.of("price", "ticker", "note"), List.of(
                List.of(Value.NULL, Value.ofSymbol("GOOG"), Value.NULL),
                List.of(Value.ofLong(30), Value.NULL, Value.NULL)));

        assertEquals("t: ([] price:(0N;30); ticker:(`GOOG;`); note:(::;::))", q);
    }

    @Test
    @DisplayName("Shape and names are validated")
    void testValidation() {
        List<List<Value>> oneRow = List.of(List.of(Value.ofLong(1)));

        assertThrows(IllegalArgumentException.class, () -> TableWriter.render(registry, "t", List.of(), oneRow));
        assertThrows(IllegalArgumentException.class, () -> TableWriter.render(registry, "t", List.of("a"), List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> TableWriter.render(registry, "t", List.of("a", "b"), oneRow));
        assertThrows(IllegalArgumentException.class, () -> TableWriter.render(registry, "1t", List.of("a"), oneRow));
        assertThrows(IllegalArgumentException.class, () -> TableWriter.render(registry, "t", List.of("a b"), oneRow));
    }

    @Test
    @DisplayName("makeTable defines the global on the engine")
    void testMakeTable() {
        ScriptedExecutor executor = new ScriptedExecutor();
        TableWriter writer = new TableWriter(KdbSession.open(executor));

        writer.makeTable("t", List.of("a"), List.of(List.of(Value.ofLong(1)), List.of(Value.ofLong(2))));

        assertEquals(List.of("t: ([] a:(1;2))"), executor.sentQueries());
        assertTrue(executor.globals().contains("t"));
    }

    @Test
    @DisplayName("Engine rejection surfaces as QueryFailedException")
    void testRejected() {
        ScriptedExecutor executor = new ScriptedExecutor();
        executor.fail(q -> q.startsWith("t:"), "type");
        TableWriter writer = new TableWriter(KdbSession.open(executor));

        assertThrows(QueryFailedException.class,
                () -> writer.makeTable("t", List.of("a"), List.of(List.of(Value.ofLong(1)))));
        assertFalse(executor.globals().contains("t"));
    }
}
