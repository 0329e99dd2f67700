package org.kdbear.engine.query;

/**
 * Comparison operators accepted in conditions and the q operator each maps to.
 */
public enum ComparisonOperator {
    GT(">", ">"),
    LT("<", "<"),
    GE(">=", ">="),
    LE("<=", "<="),
    EQ("=", "="),
    EQEQ("==", "="),
    NE("!=", "<>"),
    MATCH("~", "~"),
    LIKE("like", "like");

    private final String symbol;
    private final String qOperator;

    ComparisonOperator(String symbol, String qOperator) {
        this.symbol = symbol;
        this.qOperator = qOperator;
    }

    public String symbol() {
        return symbol;
    }

    public String qOperator() {
        return qOperator;
    }

    static ComparisonOperator fromToken(ConditionToken token) {
        return switch (token) {
            case GT -> GT;
            case LT -> LT;
            case GE -> GE;
            case LE -> LE;
            case EQ -> EQ;
            case EQEQ -> EQEQ;
            case NE -> NE;
            case TILDE -> MATCH;
            case LIKE -> LIKE;
            default -> null;
        };
    }
}
