package org.kdbear.engine.execution;

import java.util.List;
import java.util.Objects;

/**
 * Result holding a single value.
 *
 * Produced when a selection addresses exactly one cell, or when the engine
 * answers with an atom.
 */
public record ScalarResult(Value value) implements Result {

    public ScalarResult {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public int rowCount() {
        return 1;
    }

    @Override
    public int columnCount() {
        return 1;
    }

    @Override
    public List<Row> rows() {
        return List.of(Row.of(value));
    }

    @Override
    public Value getValue(int rowIndex, int columnIndex) {
        if (rowIndex != 0 || columnIndex != 0) {
            throw new IndexOutOfBoundsException("ScalarResult only has value at [0,0]");
        }
        return value;
    }
}
