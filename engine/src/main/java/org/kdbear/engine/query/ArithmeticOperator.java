package org.kdbear.engine.query;

/**
 * Binary arithmetic operators. {@code /} is q's {@code %} and {@code %} is
 * q's {@code mod}.
 */
public enum ArithmeticOperator {
    PLUS("+", "+"),
    MINUS("-", "-"),
    TIMES("*", "*"),
    DIVIDE("/", "%"),
    MODULO("%", "mod");

    private final String symbol;
    private final String qOperator;

    ArithmeticOperator(String symbol, String qOperator) {
        this.symbol = symbol;
        this.qOperator = qOperator;
    }

    public String symbol() {
        return symbol;
    }

    public String qOperator() {
        return qOperator;
    }

    static ArithmeticOperator fromToken(ConditionToken token) {
        return switch (token) {
            case PLUS -> PLUS;
            case MINUS -> MINUS;
            case STAR -> TIMES;
            case SLASH -> DIVIDE;
            case PERCENT -> MODULO;
            default -> null;
        };
    }
}
