package org.kdbear.engine.execution;

import java.util.List;
import java.util.Objects;

/**
 * Result holding a single row.
 */
public record RowResult(Row row) implements Result {

    public RowResult {
        Objects.requireNonNull(row, "row");
    }

    @Override
    public int rowCount() {
        return 1;
    }

    @Override
    public int columnCount() {
        return row.size();
    }

    @Override
    public List<Row> rows() {
        return List.of(row);
    }
}
