package org.kdbear.engine.query;

import org.kdbear.engine.execution.KdbSession;
import org.kdbear.engine.execution.Result;
import org.kdbear.engine.metadata.ColumnMeta;
import org.kdbear.engine.metadata.MetadataProvider;
import org.kdbear.engine.types.QLiterals;
import org.kdbear.engine.wire.QueryResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Positional ({@code iloc}) and conditional ({@code loc}) selection.
 *
 * All validation happens before the selection query is sent.
 */
public final class TableSelector {

    private static final Logger log = LoggerFactory.getLogger(TableSelector.class);

    private final KdbSession session;
    private final MetadataProvider metadata;
    private final QueryBuilder builder;

    public TableSelector(KdbSession session, MetadataProvider metadata) {
        this.session = Objects.requireNonNull(session, "session");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.builder = new QueryBuilder(session.registry());
    }

    /**
     * Selects rows and columns by position. Empty lists select every row or
     * column; the requested column order is kept.
     *
     * @throws OutOfBoundsException if any index is outside the table
     */
    public Result iloc(String table, List<Integer> rows, List<Integer> columns) {
        QLiterals.requireName(table);
        List<ColumnMeta> schema = metadata.requireMetadata(table);
        long rowCount = metadata.rowCount(table);
        checkBounds("Row", rows, rowCount, table);
        checkBounds("Column", columns, schema.size(), table);

        String query = builder.iloc(table, rows, columns);
        int selectedRows = rows.isEmpty() ? Math.toIntExact(rowCount) : rows.size();
        int selectedColumns = columns.isEmpty() ? schema.size() : columns.size();
        log.debug("iloc {} selects {}x{} cells", table, selectedRows, selectedColumns);
        try (QueryResponse response = session.query(query)) {
            return session.shaper().shapeSelection(response.root(), selectedRows, selectedColumns);
        }
    }

    private static void checkBounds(String axis, List<Integer> indices, long size, String table) {
        for (Integer index : indices) {
            if (index == null || index < 0 || index >= size) {
                throw new OutOfBoundsException(axis + " index " + index + " out of range [0, " + size
                        + ") for table '" + table + "'");
            }
        }
    }

    /**
     * Filters rows by comma-separated conditions, applied left to right.
     *
     * @throws InvalidConditionException if any condition is malformed
     */
    public Result loc(String table, String conditions) {
        QLiterals.requireName(table);
        List<Condition> parsed = ConditionParser.parseAll(conditions);
        List<ColumnMeta> schema = parsed.isEmpty() ? List.of() : metadata.getMetadata(table);
        String query = builder.loc(table, parsed, schema);
        try (QueryResponse response = session.query(query)) {
            return session.shaper().shapeTable(response.root());
        }
    }
}
