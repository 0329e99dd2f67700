package org.kdbear.engine.query;

import org.kdbear.engine.execution.KdbSession;
import org.kdbear.engine.execution.Value;
import org.kdbear.engine.types.QLiterals;
import org.kdbear.engine.types.TypeDescriptor;
import org.kdbear.engine.types.TypeRegistry;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Creates global tables on the engine from host values.
 */
public final class TableWriter {

    private static final String UNTYPED_NULL = "::";

    private final KdbSession session;

    public TableWriter(KdbSession session) {
        this.session = Objects.requireNonNull(session, "session");
    }

    /**
     * Defines {@code name} as a table with the given columns and rows,
     * replacing any existing global of that name.
     *
     * @param rows row-major values, each row as wide as {@code columns}
     * @throws IllegalArgumentException if columns or rows are empty or a row has the wrong width
     * @throws org.kdbear.engine.execution.QueryFailedException if the engine rejects the table
     */
    public void makeTable(String name, List<String> columns, List<List<Value>> rows) {
        session.run(render(session.registry(), name, columns, rows));
    }

    static String render(TypeRegistry registry, String name, List<String> columns, List<List<Value>> rows) {
        QLiterals.requireName(name);
        if (columns.isEmpty() || rows.isEmpty()) {
            throw new IllegalArgumentException("Table '" + name + "' needs at least one column and one row");
        }
        for (int r = 0; r < rows.size(); r++) {
            if (rows.get(r).size() != columns.size()) {
                throw new IllegalArgumentException("Row " + r + " has " + rows.get(r).size()
                        + " values, expected " + columns.size());
            }
        }
        StringJoiner definition = new StringJoiner("; ", name + ": ([] ", ")");
        for (int c = 0; c < columns.size(); c++) {
            String column = QLiterals.requireName(columns.get(c));
            Optional<TypeDescriptor> type = columnType(registry, rows, c);
            if (rows.size() == 1) {
                definition.add(column + ":enlist " + literal(registry, type, rows.get(0).get(c)));
            } else {
                StringJoiner values = new StringJoiner(";", "(", ")");
                for (List<Value> row : rows) {
                    values.add(literal(registry, type, row.get(c)));
                }
                definition.add(column + ":" + values);
            }
        }
        return definition.toString();
    }

    /**
     * Type of the first non-null value in the column, used to render its nulls.
     */
    private static Optional<TypeDescriptor> columnType(TypeRegistry registry, List<List<Value>> rows, int column) {
        for (List<Value> row : rows) {
            Value value = row.get(column);
            if (!value.isNull()) {
                return registry.descriptorForKind(value.kind());
            }
        }
        return Optional.empty();
    }

    private static String literal(TypeRegistry registry, Optional<TypeDescriptor> columnType, Value value) {
        if (value.isNull()) {
            return columnType.map(TypeDescriptor::nullLiteral).orElse(UNTYPED_NULL);
        }
        return registry.toLiteral(value);
    }
}
