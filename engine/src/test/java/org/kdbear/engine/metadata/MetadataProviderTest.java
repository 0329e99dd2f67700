package org.kdbear.engine.metadata;

import org.kdbear.engine.execution.KdbSession;
import org.kdbear.engine.execution.QueryFailedException;
import org.kdbear.engine.test.Fixtures;
import org.kdbear.engine.test.ScriptedExecutor;
import org.kdbear.engine.wire.KObjects;
import org.kdbear.engine.wire.KType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetadataProvider Tests")
class MetadataProviderTest {

    private final ScriptedExecutor executor = new ScriptedExecutor();
    private final MetadataProvider metadata = new MetadataProvider(KdbSession.open(executor));

    @Test
    @DisplayName("Reads columns in physical order with registry codes")
    void testGetMetadata() {
        executor.respond(MetadataProvider.metaQuery("trades"), Fixtures.tradesMeta());

        List<ColumnMeta> columns = metadata.getMetadata("trades");

        assertEquals(List.of(
                new ColumnMeta("ticker", 's', KType.SYMBOL),
                new ColumnMeta("price", 'j', KType.LONG),
                new ColumnMeta("size", 'j', KType.LONG)), columns);
        assertTrue(columns.get(0).isSymbol());
        assertEquals("select name:c, type:t from 0!meta `trades", executor.sentQueries().get(0));
        assertTrue(executor.allResponsesReleased());
    }

    @Test
    @DisplayName("Unregistered and blank tags map to code 0")
    void testUnknownTags() {
        executor.respond(MetadataProvider.metaQuery("t"), KObjects.table(List.of("name", "type"),
                List.of(KObjects.symbols("id", "notes"), KObjects.chars("g "))));

        List<ColumnMeta> columns = metadata.getMetadata("t");

        assertEquals(0, columns.get(0).typeCode());
        assertEquals(0, columns.get(1).typeCode());
    }

    @Test
    @DisplayName("Upper-case tags are nested columns, not their element type")
    void testNestedColumns() {
        executor.respond(MetadataProvider.metaQuery("t"), KObjects.table(List.of("name", "type"),
                List.of(KObjects.symbols("tags", "prices", "ticker"), KObjects.chars("SJs"))));

        List<ColumnMeta> columns = metadata.getMetadata("t");

        assertEquals(new ColumnMeta("tags", 'S', KType.GENERAL_LIST), columns.get(0));
        assertFalse(columns.get(0).isSymbol());
        assertEquals(KType.GENERAL_LIST, columns.get(1).typeCode());
        assertTrue(columns.get(2).isSymbol());
    }

    @Test
    @DisplayName("Missing name or type column fails closed")
    void testMissingColumns() {
        executor.respond(MetadataProvider.metaQuery("t"), KObjects.table(List.of("c", "t"),
                List.of(KObjects.symbols("a"), KObjects.chars("j"))));

        assertTrue(metadata.getMetadata("t").isEmpty());
        assertThrows(SchemaMismatchException.class, () -> metadata.requireMetadata("t"));
        assertTrue(executor.allResponsesReleased());
    }

    @Test
    @DisplayName("Non-table response and engine errors fail closed")
    void testNotATable() {
        executor.respond(MetadataProvider.metaQuery("t"), KObjects.longs(1));
        executor.fail(MetadataProvider.metaQuery("missing")::equals, "missing");

        assertTrue(metadata.getMetadata("t").isEmpty());
        assertTrue(metadata.getMetadata("missing").isEmpty());
    }

    @Test
    @DisplayName("Invalid table names never reach the engine")
    void testInvalidName() {
        assertThrows(IllegalArgumentException.class, () -> metadata.getMetadata("t; delete t from `."));
        assertTrue(executor.sentQueries().isEmpty());
    }

    @Test
    @DisplayName("Row count and shape")
    void testShape() {
        executor.respond("count trades", KObjects.longAtom(3));
        executor.respond("(count trades;count cols trades)", KObjects.longs(3, 3));

        assertEquals(3, metadata.rowCount("trades"));
        assertEquals(new TableShape(3, 3), metadata.shape("trades"));
    }

    @Test
    @DisplayName("Unexpected size response is a failure")
    void testBadCount() {
        executor.respond("count t", KObjects.symbolAtom("x"));
        assertThrows(QueryFailedException.class, () -> metadata.rowCount("t"));
        assertTrue(executor.allResponsesReleased());
    }
}
