package org.kdbear.engine.execution;

import java.util.List;

/**
 * An ordered sequence of values, one per column in schema order.
 */
public record Row(List<Value> values) {

    public Row {
        values = List.copyOf(values);
    }

    public static Row of(Value... values) {
        return new Row(List.of(values));
    }

    /**
     * Gets the value at the specified index.
     */
    public Value get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }
}
