package org.kdbear.engine.query;

import java.util.List;
import java.util.Objects;

/**
 * One side of a condition.
 */
public sealed interface ConditionExpression
        permits ConditionExpression.ColumnRef, ConditionExpression.NumberLiteral,
        ConditionExpression.StringLiteral, ConditionExpression.FunctionCall, ConditionExpression.Binary {

    /**
     * True for a lone column name, number or string.
     */
    default boolean isSimple() {
        return !(this instanceof Binary) && !(this instanceof FunctionCall);
    }

    /**
     * A bare identifier: a column, or a symbol when compared with a symbol column.
     */
    record ColumnRef(String name) implements ConditionExpression {
        public ColumnRef {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Numeric literal as written, including a leading minus sign.
     */
    record NumberLiteral(String text) implements ConditionExpression {
        public NumberLiteral {
            Objects.requireNonNull(text, "text");
        }
    }

    record StringLiteral(String value) implements ConditionExpression {
        public StringLiteral {
            Objects.requireNonNull(value, "value");
        }
    }

    record FunctionCall(String name, List<ConditionExpression> arguments) implements ConditionExpression {
        public FunctionCall {
            Objects.requireNonNull(name, "name");
            arguments = List.copyOf(arguments);
        }
    }

    record Binary(ConditionExpression left, ArithmeticOperator operator, ConditionExpression right)
            implements ConditionExpression {
        public Binary {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }
    }
}
