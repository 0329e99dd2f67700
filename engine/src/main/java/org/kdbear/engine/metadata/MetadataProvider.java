package org.kdbear.engine.metadata;

import org.kdbear.engine.execution.KdbSession;
import org.kdbear.engine.execution.QueryFailedException;
import org.kdbear.engine.types.QLiterals;
import org.kdbear.engine.types.TypeDescriptor;
import org.kdbear.engine.wire.KObject;
import org.kdbear.engine.wire.KObject.KAtom;
import org.kdbear.engine.wire.KObject.KDict;
import org.kdbear.engine.wire.KObject.KTable;
import org.kdbear.engine.wire.KObject.KVector;
import org.kdbear.engine.wire.KObjects;
import org.kdbear.engine.wire.KType;
import org.kdbear.engine.wire.QueryResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads table schemas and sizes from the engine.
 */
public final class MetadataProvider {

    private static final Logger log = LoggerFactory.getLogger(MetadataProvider.class);

    private final KdbSession session;

    public MetadataProvider(KdbSession session) {
        this.session = Objects.requireNonNull(session, "session");
    }

    static String metaQuery(String table) {
        return "select name:c, type:t from 0!meta `" + table;
    }

    /**
     * Returns the columns of {@code table} in physical order.
     *
     * The result is empty when the schema query fails or its response is not a
     * table with a symbol {@code name} column and a char {@code type} column;
     * a partial schema is never returned.
     */
    public List<ColumnMeta> getMetadata(String table) {
        String query = metaQuery(QLiterals.requireName(table));
        QueryResponse response;
        try {
            response = session.query(query);
        } catch (QueryFailedException e) {
            log.warn("Schema query for table '{}' failed: {}", table, e.getMessage());
            return List.of();
        }
        try (response) {
            return readColumns(table, response.root());
        }
    }

    /**
     * Like {@link #getMetadata} but fails on an empty schema.
     *
     * @throws SchemaMismatchException if the schema could not be read
     */
    public List<ColumnMeta> requireMetadata(String table) {
        List<ColumnMeta> columns = getMetadata(table);
        if (columns.isEmpty()) {
            throw new SchemaMismatchException("No schema available for table '" + table + "'");
        }
        return columns;
    }

    private List<ColumnMeta> readColumns(String table, KObject root) {
        KTable meta;
        if (root instanceof KTable t) {
            meta = t;
        } else if (root instanceof KDict dict && dict.isKeyedTable()) {
            meta = KObjects.unkey(dict);
        } else {
            log.warn("Schema of table '{}' is not a table (type {})", table, root.type());
            return List.of();
        }
        int nameIndex = meta.indexOf("name");
        int typeIndex = meta.indexOf("type");
        if (nameIndex < 0 || typeIndex < 0
                || meta.column(nameIndex).type() != KType.SYMBOL
                || meta.column(typeIndex).type() != KType.CHAR) {
            log.warn("Schema of table '{}' lacks symbol 'name' and char 'type' columns", table);
            return List.of();
        }
        String[] names = (String[]) ((KVector) meta.column(nameIndex)).data();
        char[] tags = (char[]) ((KVector) meta.column(typeIndex)).data();
        List<ColumnMeta> columns = new ArrayList<>(names.length);
        for (int i = 0; i < names.length; i++) {
            columns.add(new ColumnMeta(names[i], tags[i], codeOf(table, names[i], tags[i])));
        }
        return List.copyOf(columns);
    }

    private int codeOf(String table, String column, char tag) {
        // upper-case tags are nested columns, one vector per row
        if (tag == ' ' || Character.isUpperCase(tag)) {
            return KType.GENERAL_LIST;
        }
        return session.registry().descriptorForTag(tag)
                .map(TypeDescriptor::code)
                .orElseGet(() -> {
                    log.warn("Column {}.{} has unregistered type tag '{}'", table, column, tag);
                    return KType.GENERAL_LIST;
                });
    }

    // ==================== Size ====================

    /**
     * @throws QueryFailedException if the engine rejects the query
     */
    public long rowCount(String table) {
        String query = "count " + QLiterals.requireName(table);
        try (QueryResponse response = session.query(query)) {
            if (response.root() instanceof KAtom atom && atom.elementType() == KType.LONG) {
                return ((long[]) atom.data())[0];
            }
            throw new QueryFailedException(query, "Expected a long atom, got type " + response.root().type());
        }
    }

    /**
     * @throws QueryFailedException if the engine rejects the query
     */
    public TableShape shape(String table) {
        String name = QLiterals.requireName(table);
        String query = "(count " + name + ";count cols " + name + ")";
        try (QueryResponse response = session.query(query)) {
            if (response.root() instanceof KVector vector && vector.type() == KType.LONG && vector.count() == 2) {
                long[] counts = (long[]) vector.data();
                return new TableShape(counts[0], counts[1]);
            }
            throw new QueryFailedException(query, "Expected two longs, got type " + response.root().type());
        }
    }
}
