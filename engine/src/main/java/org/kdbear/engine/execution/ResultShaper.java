package org.kdbear.engine.execution;

import org.kdbear.engine.KdbException;
import org.kdbear.engine.types.UnsupportedTypeException;
import org.kdbear.engine.wire.KObject;
import org.kdbear.engine.wire.KObject.KAtom;
import org.kdbear.engine.wire.KObject.KDict;
import org.kdbear.engine.wire.KObject.KList;
import org.kdbear.engine.wire.KObject.KTable;
import org.kdbear.engine.wire.KObject.KVector;
import org.kdbear.engine.wire.KObjects;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Classifies decoded responses as {@link ScalarResult}, {@link RowResult} or
 * {@link TableResult}.
 *
 * Cells of unregistered types become {@link Value#NULL} and are reported to the
 * {@link UnknownTypeListener}; structural problems raise {@link KdbException}.
 */
public final class ResultShaper {

    private final ValueConverter converter;
    private final UnknownTypeListener listener;

    public ResultShaper(ValueConverter converter) {
        this(converter, UnknownTypeListener.logging());
    }

    public ResultShaper(ValueConverter converter, UnknownTypeListener listener) {
        this.converter = Objects.requireNonNull(converter, "converter");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    // ==================== Tables ====================

    /**
     * Shapes a table response: no rows gives an empty table, one row a
     * {@link RowResult}, more rows a {@link TableResult}. Keyed tables are
     * unkeyed first.
     */
    public Result shapeTable(KObject response) {
        List<Row> rows = decodeTable(toTable(response));
        if (rows.size() == 1) {
            return new RowResult(rows.get(0));
        }
        return new TableResult(rows);
    }

    /**
     * Decodes every row of a table response, regardless of its row count.
     */
    public TableResult decodeTable(KObject response) {
        return new TableResult(decodeTable(toTable(response)));
    }

    private List<Row> decodeTable(KTable table) {
        int rowCount = table.count();
        List<Row> rows = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) {
            List<Value> values = new ArrayList<>(table.columnCount());
            for (int c = 0; c < table.columnCount(); c++) {
                KObject column = table.column(c);
                values.add(r < column.count() ? cell(column, r) : Value.NULL);
            }
            rows.add(new Row(values));
        }
        return rows;
    }

    private static KTable toTable(KObject response) {
        if (response instanceof KTable table) {
            return table;
        }
        if (response instanceof KDict dict && dict.isKeyedTable()) {
            return KObjects.unkey(dict);
        }
        throw new KdbException("Expected a table response, got type " + response.type());
    }

    // ==================== Lists ====================

    /**
     * Shapes a list response: an atom gives a scalar, a vector a row, a general
     * list whose first element is itself a list a table (one row per element),
     * any other general list a row.
     */
    public Result shapeList(KObject response) {
        if (response instanceof KAtom atom) {
            return new ScalarResult(cell(atom, 0));
        }
        if (response instanceof KVector vector) {
            return new RowResult(rowOf(vector));
        }
        if (response instanceof KList list) {
            if (list.count() > 0 && isList(list.get(0))) {
                List<Row> rows = new ArrayList<>(list.count());
                for (KObject element : list.elements()) {
                    rows.add(isList(element) ? rowOf(element) : Row.of(cell(element, 0)));
                }
                try {
                    return new TableResult(rows);
                } catch (IllegalArgumentException e) {
                    throw new KdbException("Nested list response is ragged", e);
                }
            }
            return new RowResult(rowOf(list));
        }
        if (response instanceof KTable || response instanceof KDict) {
            return shapeTable(response);
        }
        throw new KdbException("Expected a list response, got type " + response.type());
    }

    /**
     * Shapes a positional selection of {@code rows} by {@code columns} cells:
     * one cell gives a scalar, a single row or single column gives a row (values
     * in response order), anything else a table.
     */
    public Result shapeSelection(KObject response, int rows, int columns) {
        if (rows == 0 || columns == 0) {
            return TableResult.empty();
        }
        Result shaped = shapeList(response);
        if (rows == 1 && columns == 1) {
            return new ScalarResult(shaped.getValue(0, 0));
        }
        if (rows == 1 || columns == 1) {
            List<Value> values = new ArrayList<>(rows * columns);
            for (Row row : shaped.rows()) {
                values.addAll(row.values());
            }
            return new RowResult(new Row(values));
        }
        if (shaped instanceof TableResult table) {
            return table;
        }
        throw new KdbException("Expected " + rows + "x" + columns + " cells, got a single row");
    }

    // ==================== Cells ====================

    private Row rowOf(KObject list) {
        List<Value> values = new ArrayList<>(list.count());
        for (int i = 0; i < list.count(); i++) {
            values.add(cell(list, i));
        }
        return new Row(values);
    }

    private Value cell(KObject object, int index) {
        try {
            return converter.convert(object, index);
        } catch (UnsupportedTypeException e) {
            listener.onUnknownType(e);
            return Value.NULL;
        }
    }

    private static boolean isList(KObject object) {
        return object instanceof KVector || object instanceof KList;
    }
}
