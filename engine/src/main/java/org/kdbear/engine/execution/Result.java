package org.kdbear.engine.execution;

import java.util.List;

/**
 * Sealed interface representing a decoded query result.
 *
 * Exactly one of:
 * - {@link ScalarResult}: a single value
 * - {@link RowResult}: one row, a value per column
 * - {@link TableResult}: rows of identical width
 */
public sealed interface Result permits ScalarResult, RowResult, TableResult {

    /**
     * Gets the number of rows (1 for scalars and rows).
     */
    int rowCount();

    /**
     * Gets the number of columns.
     */
    int columnCount();

    /**
     * Returns the result as rows; a scalar is a 1x1 table.
     */
    List<Row> rows();

    /**
     * Gets a value at the specified row and column index.
     */
    default Value getValue(int rowIndex, int columnIndex) {
        return rows().get(rowIndex).get(columnIndex);
    }
}
