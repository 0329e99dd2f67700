package org.kdbear.engine.metadata;

/**
 * Row and column count of a table.
 */
public record TableShape(long rows, long columns) {

    public TableShape {
        if (rows < 0 || columns < 0) {
            throw new IllegalArgumentException("Negative table shape: " + rows + "x" + columns);
        }
    }
}
