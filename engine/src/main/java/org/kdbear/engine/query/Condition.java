package org.kdbear.engine.query;

import java.util.Objects;

/**
 * A parsed {@code <expr> <op> <expr>} condition.
 *
 * @param left     left-hand side
 * @param operator comparison
 * @param right    right-hand side
 * @param text     the trimmed source text
 */
public record Condition(ConditionExpression left, ComparisonOperator operator, ConditionExpression right,
        String text) {

    public Condition {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(text, "text");
    }
}
