package org.kdbear.engine.execution;

import java.util.List;

/**
 * Result holding zero or more rows of identical width.
 */
public record TableResult(List<Row> rows) implements Result {

    public TableResult {
        rows = List.copyOf(rows);
        if (!rows.isEmpty()) {
            int width = rows.get(0).size();
            for (int i = 1; i < rows.size(); i++) {
                if (rows.get(i).size() != width) {
                    throw new IllegalArgumentException("Row " + i + " has " + rows.get(i).size()
                            + " values, expected " + width);
                }
            }
        }
    }

    public static TableResult empty() {
        return new TableResult(List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public int rowCount() {
        return rows.size();
    }

    @Override
    public int columnCount() {
        return rows.isEmpty() ? 0 : rows.get(0).size();
    }
}
