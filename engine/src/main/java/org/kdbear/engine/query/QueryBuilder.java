package org.kdbear.engine.query;

import org.kdbear.engine.metadata.ColumnMeta;
import org.kdbear.engine.query.ConditionExpression.Binary;
import org.kdbear.engine.query.ConditionExpression.ColumnRef;
import org.kdbear.engine.query.ConditionExpression.FunctionCall;
import org.kdbear.engine.query.ConditionExpression.NumberLiteral;
import org.kdbear.engine.query.ConditionExpression.StringLiteral;
import org.kdbear.engine.types.QLiterals;
import org.kdbear.engine.types.TypeDescriptor;
import org.kdbear.engine.types.TypeRegistry;

import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Renders selection queries as q text. Pure: nothing here talks to the engine.
 */
public final class QueryBuilder {

    private final TypeRegistry registry;

    public QueryBuilder(TypeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    // ==================== iloc ====================

    /**
     * {@code (0!t)[rows;(cols t)[cols]]}; an empty list selects everything.
     */
    public String iloc(String table, List<Integer> rows, List<Integer> columns) {
        String rowList = rows.isEmpty() ? "til count " + table : indexList(rows);
        String columnList = columns.isEmpty() ? "til count cols " + table : indexList(columns);
        return "(0!" + table + ")[" + rowList + ";(cols " + table + ")[" + columnList + "]]";
    }

    /**
     * Renders indices as {@code (i;j;k)}. A single index renders as {@code (i)},
     * which q reads as an atom.
     */
    static String indexList(List<Integer> indices) {
        StringJoiner joiner = new StringJoiner(";", "(", ")");
        for (Integer index : indices) {
            joiner.add(Integer.toString(index));
        }
        return joiner.toString();
    }

    // ==================== loc ====================

    /**
     * Nests one filter per condition around the previous one, starting from the
     * bare table. With no conditions the whole table is selected.
     */
    public String loc(String table, List<Condition> conditions, List<ColumnMeta> schema) {
        if (conditions.isEmpty()) {
            return "(0!" + table + ")";
        }
        String query = table;
        for (Condition condition : conditions) {
            query = locStep(query, condition, schema);
        }
        return query;
    }

    String locStep(String previous, Condition condition, List<ColumnMeta> schema) {
        return "(0!select from (" + previous + ") where " + renderCondition(condition, schema) + ")";
    }

    String renderCondition(Condition condition, List<ColumnMeta> schema) {
        String right = isSymbolComparison(condition, schema)
                ? symbolLiteral(condition.right())
                : render(condition.right());
        return render(condition.left()) + " " + condition.operator().qOperator() + " " + right;
    }

    /**
     * A bare symbol column compared with a bare identifier, number or string
     * compares against a symbol literal; {@code like} keeps its string pattern.
     */
    private static boolean isSymbolComparison(Condition condition, List<ColumnMeta> schema) {
        if (condition.operator() == ComparisonOperator.LIKE
                || !(condition.left() instanceof ColumnRef column) || !condition.right().isSimple()) {
            return false;
        }
        return schema.stream().anyMatch(meta -> meta.name().equals(column.name()) && meta.isSymbol());
    }

    private String symbolLiteral(ConditionExpression expression) {
        TypeDescriptor symbol = registry.descriptorForName("symbol").orElseThrow();
        if (expression instanceof ColumnRef ref) {
            return symbol.literalFromText(ref.name());
        }
        if (expression instanceof NumberLiteral number) {
            return symbol.literalFromText(number.text());
        }
        return symbol.literalFromText(((StringLiteral) expression).value());
    }

    /**
     * Renders an expression; every arithmetic step is parenthesized so that q's
     * right-to-left evaluation keeps the parsed grouping.
     */
    static String render(ConditionExpression expression) {
        if (expression instanceof ColumnRef ref) {
            return ref.name();
        }
        if (expression instanceof NumberLiteral number) {
            return number.text();
        }
        if (expression instanceof StringLiteral string) {
            // a one-character q string literal is a char atom
            String literal = QLiterals.string(string.value());
            return string.value().length() == 1 ? "(enlist " + literal + ")" : literal;
        }
        if (expression instanceof FunctionCall call) {
            StringJoiner joiner = new StringJoiner(";", call.name() + "[", "]");
            for (ConditionExpression argument : call.arguments()) {
                joiner.add(render(argument));
            }
            return joiner.toString();
        }
        Binary binary = (Binary) expression;
        return "(" + render(binary.left()) + " " + binary.operator().qOperator() + " " + render(binary.right()) + ")";
    }
}
