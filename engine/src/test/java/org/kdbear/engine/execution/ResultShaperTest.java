package org.kdbear.engine.execution;

import org.kdbear.engine.KdbException;
import org.kdbear.engine.test.Fixtures;
import org.kdbear.engine.types.TypeRegistry;
import org.kdbear.engine.types.UnsupportedTypeException;
import org.kdbear.engine.wire.KObject.KTable;
import org.kdbear.engine.wire.KObject.KVector;
import org.kdbear.engine.wire.KObjects;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResultShaper Tests")
class ResultShaperTest {

    private final List<UnsupportedTypeException> unknown = new ArrayList<>();
    private final ResultShaper shaper = new ResultShaper(new ValueConverter(TypeRegistry.standard()), unknown::add);

    // ==================== Tables ====================

    @Nested
    @DisplayName("Table responses")
    class TableTests {

        @Test
        @DisplayName("Several rows shape to a table in response order")
        void testTable() {
            Result result = shaper.shapeTable(Fixtures.trades());

            TableResult table = assertInstanceOf(TableResult.class, result);
            assertEquals(3, table.rowCount());
            assertEquals(3, table.columnCount());
            assertEquals(Value.ofSymbol("GOOG"), table.getValue(0, 0));
            assertEquals(Value.ofLong(40), table.getValue(2, 1));
        }

        @Test
        @DisplayName("One row shapes to a row")
        void testSingleRow() {
            KTable one = KObjects.table(List.of("ticker", "price"),
                    List.of(KObjects.symbols("AAPL"), KObjects.longs(40)));

            RowResult row = assertInstanceOf(RowResult.class, shaper.shapeTable(one));
            assertEquals(Row.of(Value.ofSymbol("AAPL"), Value.ofLong(40)), row.row());
        }

        @Test
        @DisplayName("No rows shape to an empty table")
        void testEmpty() {
            KTable none = KObjects.table(List.of("ticker"), List.of(KObjects.symbols()));

            TableResult table = assertInstanceOf(TableResult.class, shaper.shapeTable(none));
            assertTrue(table.isEmpty());
        }

        @Test
        @DisplayName("Keyed tables are unkeyed, key columns first")
        void testKeyedTable() {
            KTable keys = KObjects.table(List.of("ticker"), List.of(KObjects.symbols("GOOG", "AAPL")));
            KTable values = KObjects.table(List.of("price"), List.of(KObjects.longs(20, 40)));

            Result result = shaper.shapeTable(KObjects.dict(keys, values));

            assertEquals(2, result.rowCount());
            assertEquals(Row.of(Value.ofSymbol("AAPL"), Value.ofLong(40)), result.rows().get(1));
        }

        @Test
        @DisplayName("Cells of unknown type become NULL and are reported")
        void testUnknownColumn() {
            KTable table = KObjects.table(List.of("id", "price"),
                    List.of(new KVector(2, new long[] { 1, 2 }), KObjects.longs(20, 40)));

            Result result = shaper.shapeTable(table);

            assertTrue(result.getValue(0, 0).isNull());
            assertEquals(Value.ofLong(40), result.getValue(1, 1));
            assertEquals(2, unknown.size());
            assertEquals(2, unknown.get(0).getTypeCode());
        }

        @Test
        @DisplayName("Non-table responses are rejected")
        void testNotATable() {
            assertThrows(KdbException.class, () -> shaper.shapeTable(KObjects.longs(1, 2)));
        }
    }

    // ==================== Lists ====================

    @Nested
    @DisplayName("List responses")
    class ListTests {

        @Test
        @DisplayName("Atom shapes to a scalar")
        void testAtom() {
            ScalarResult scalar = assertInstanceOf(ScalarResult.class, shaper.shapeList(KObjects.longAtom(7)));
            assertEquals(Value.ofLong(7), scalar.value());
        }

        @Test
        @DisplayName("Vector shapes to a row")
        void testVector() {
            RowResult row = assertInstanceOf(RowResult.class, shaper.shapeList(KObjects.longs(1, 2, 3)));
            assertEquals(3, row.columnCount());
        }

        @Test
        @DisplayName("List of lists shapes to a table, one row per element")
        void testNested() {
            var nested = KObjects.list(
                    KObjects.list(KObjects.symbolAtom("GOOG"), KObjects.longAtom(20)),
                    KObjects.list(KObjects.symbolAtom("MSFT"), KObjects.longAtom(30)));

            TableResult table = assertInstanceOf(TableResult.class, shaper.shapeList(nested));
            assertEquals(2, table.rowCount());
            assertEquals(Value.ofSymbol("MSFT"), table.getValue(1, 0));
            assertEquals(Value.ofLong(20), table.getValue(0, 1));
        }

        @Test
        @DisplayName("Mixed list of atoms shapes to a row")
        void testMixed() {
            var mixed = KObjects.list(KObjects.symbolAtom("GOOG"), KObjects.longAtom(20));

            RowResult row = assertInstanceOf(RowResult.class, shaper.shapeList(mixed));
            assertEquals(Row.of(Value.ofSymbol("GOOG"), Value.ofLong(20)), row.row());
        }

        @Test
        @DisplayName("Empty general list shapes to an empty row")
        void testEmptyList() {
            RowResult row = assertInstanceOf(RowResult.class, shaper.shapeList(KObjects.list()));
            assertEquals(0, row.columnCount());
        }

        @Test
        @DisplayName("Ragged nested lists are rejected")
        void testRagged() {
            var ragged = KObjects.list(KObjects.longs(1, 2), KObjects.longs(3));
            assertThrows(KdbException.class, () -> shaper.shapeList(ragged));
        }
    }

    // ==================== Selections ====================

    @Nested
    @DisplayName("Selections")
    class SelectionTests {

        @Test
        @DisplayName("One cell is a scalar")
        void testSingleCell() {
            assertInstanceOf(ScalarResult.class, shaper.shapeSelection(KObjects.longAtom(20), 1, 1));
            assertInstanceOf(ScalarResult.class,
                    shaper.shapeSelection(KObjects.list(KObjects.longs(20)), 1, 1));
        }

        @Test
        @DisplayName("One tall column or one wide row is a row")
        void testSingleAxis() {
            RowResult column = assertInstanceOf(RowResult.class,
                    shaper.shapeSelection(KObjects.longs(20, 30, 40), 3, 1));
            assertEquals(3, column.columnCount());

            var oneRow = KObjects.list(KObjects.list(KObjects.symbolAtom("GOOG"), KObjects.longAtom(20)));
            RowResult row = assertInstanceOf(RowResult.class, shaper.shapeSelection(oneRow, 1, 2));
            assertEquals(Row.of(Value.ofSymbol("GOOG"), Value.ofLong(20)), row.row());
        }

        @Test
        @DisplayName("Several rows and columns are a table")
        void testTable() {
            var cells = KObjects.list(KObjects.longs(20, 10), KObjects.longs(30, 20));
            TableResult table = assertInstanceOf(TableResult.class, shaper.shapeSelection(cells, 2, 2));
            assertEquals(Value.ofLong(20), table.getValue(1, 1));
        }

        @Test
        @DisplayName("Nothing selected is an empty table")
        void testEmpty() {
            TableResult table = assertInstanceOf(TableResult.class, shaper.shapeSelection(KObjects.list(), 0, 3));
            assertTrue(table.isEmpty());
        }
    }
}
