package org.kdbear.engine.wire;

import org.kdbear.engine.wire.KObject.KTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryResponse and wire model Tests")
class QueryResponseTest {

    @Test
    @DisplayName("Release runs exactly once")
    void testReleaseOnce() {
        AtomicInteger releases = new AtomicInteger();
        QueryResponse response = new QueryResponse(KObjects.longAtom(1), releases::incrementAndGet);

        try (response) {
            assertFalse(response.isReleased());
        }
        response.close();

        assertTrue(response.isReleased());
        assertEquals(1, releases.get());
    }

    @Test
    @DisplayName("Root is unavailable after release")
    void testRootAfterRelease() {
        QueryResponse response = QueryResponse.of(KObjects.longs(1, 2));
        response.close();
        assertThrows(IllegalStateException.class, response::root);
    }

    @Test
    @DisplayName("Tables expose row count, names and columns")
    void testTable() {
        KTable table = KObjects.table(List.of("a", "b"), List.of(KObjects.longs(1, 2, 3), KObjects.symbols("x", "y", "z")));

        assertEquals(KType.TABLE, table.type());
        assertEquals(3, table.count());
        assertEquals(2, table.columnCount());
        assertEquals("b", table.columnName(1));
        assertEquals(1, table.indexOf("b"));
        assertEquals(-1, table.indexOf("c"));
    }

    @Test
    @DisplayName("Malformed wire objects are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new KObject.KAtom(7, new long[] { 1 }));
        assertThrows(IllegalArgumentException.class, () -> new KObject.KVector(-7, new long[] { 1 }));
        assertThrows(IllegalArgumentException.class, () -> new KObject.KAtom(-7, new long[] { 1, 2 }));
        assertThrows(IllegalArgumentException.class,
                () -> new KObject.KTable(KObjects.symbols("a", "b"), KObjects.list(KObjects.longs(1))));
    }

    @Test
    @DisplayName("Unkey puts key columns first and rejects non-tables")
    void testUnkey() {
        KTable keys = KObjects.table(List.of("k"), List.of(KObjects.symbols("a")));
        KTable values = KObjects.table(List.of("v"), List.of(KObjects.longs(1)));

        KTable flat = KObjects.unkey(KObjects.dict(keys, values));

        assertEquals("k", flat.columnName(0));
        assertEquals("v", flat.columnName(1));
        assertThrows(IllegalArgumentException.class, () -> KObjects.unkey(KObjects.longs(1)));
    }
}
