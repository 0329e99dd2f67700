package org.kdbear.engine.query;

import org.kdbear.engine.query.ConditionExpression.Binary;
import org.kdbear.engine.query.ConditionExpression.ColumnRef;
import org.kdbear.engine.query.ConditionExpression.FunctionCall;
import org.kdbear.engine.query.ConditionExpression.NumberLiteral;
import org.kdbear.engine.query.ConditionExpression.StringLiteral;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for condition text.
 *
 * Grammar:
 * <pre>
 * condition      := expr op expr
 * op             := '>' | '<' | '>=' | '<=' | '=' | '==' | '!=' | '~' | 'like'
 * expr           := additive
 * additive       := multiplicative (('+' | '-') multiplicative)*
 * multiplicative := term (('*' | '/' | '%') term)*
 * term           := IDENTIFIER
 *                 | IDENTIFIER '(' [expr (';' expr)*] ')'
 *                 | NUMBER | '-' NUMBER | STRING
 *                 | '(' expr ')'
 * </pre>
 */
public final class ConditionParser {

    private final ConditionLexer lexer;

    private ConditionParser(String text) {
        this.lexer = new ConditionLexer(text);
    }

    /**
     * Parses one condition.
     *
     * @throws InvalidConditionException if the text is not a well-formed condition
     */
    public static Condition parse(String text) {
        String trimmed = text.trim();
        return new ConditionParser(trimmed).parseCondition(trimmed);
    }

    /**
     * Splits comma-separated condition text and parses every segment, failing on
     * the first malformed one.
     */
    public static List<Condition> parseAll(String text) {
        List<Condition> conditions = new ArrayList<>();
        for (String segment : ConditionSplitter.split(text)) {
            conditions.add(parse(segment));
        }
        return conditions;
    }

    // ==================== Token Helpers ====================

    private boolean check(ConditionToken t) {
        return lexer.token() == t;
    }

    private boolean consumeIf(ConditionToken t) {
        if (check(t)) {
            lexer.nextToken();
            return true;
        }
        return false;
    }

    private void expect(ConditionToken t) {
        if (!consumeIf(t)) {
            throw error("Expected " + t);
        }
    }

    private InvalidConditionException error(String message) {
        return new InvalidConditionException(message + ", found " + lexer.info(), lexer.text(), lexer.tokenPos());
    }

    // ==================== Grammar ====================

    private Condition parseCondition(String text) {
        if (check(ConditionToken.EOF)) {
            throw error("Empty condition");
        }
        ConditionExpression left = parseExpression();
        ComparisonOperator operator = ComparisonOperator.fromToken(lexer.token());
        if (operator == null) {
            throw error("Expected comparison operator");
        }
        lexer.nextToken();
        ConditionExpression right = parseExpression();
        if (!check(ConditionToken.EOF)) {
            throw error("Unexpected trailing input");
        }
        return new Condition(left, operator, right, text);
    }

    private ConditionExpression parseExpression() {
        ConditionExpression left = parseMultiplicative();
        while (check(ConditionToken.PLUS) || check(ConditionToken.MINUS)) {
            ArithmeticOperator op = ArithmeticOperator.fromToken(lexer.token());
            lexer.nextToken();
            left = new Binary(left, op, parseMultiplicative());
        }
        return left;
    }

    private ConditionExpression parseMultiplicative() {
        ConditionExpression left = parseTerm();
        while (check(ConditionToken.STAR) || check(ConditionToken.SLASH) || check(ConditionToken.PERCENT)) {
            ArithmeticOperator op = ArithmeticOperator.fromToken(lexer.token());
            lexer.nextToken();
            left = new Binary(left, op, parseTerm());
        }
        return left;
    }

    private ConditionExpression parseTerm() {
        switch (lexer.token()) {
            case IDENTIFIER -> {
                String name = lexer.stringVal();
                lexer.nextToken();
                if (consumeIf(ConditionToken.LPAREN)) {
                    return parseCall(name);
                }
                return new ColumnRef(name);
            }
            case NUMBER -> {
                String number = lexer.stringVal();
                lexer.nextToken();
                return new NumberLiteral(number);
            }
            case MINUS -> {
                lexer.nextToken();
                if (!check(ConditionToken.NUMBER)) {
                    throw error("Expected number after '-'");
                }
                String number = lexer.stringVal();
                lexer.nextToken();
                return new NumberLiteral("-" + number);
            }
            case STRING -> {
                String value = lexer.stringVal();
                lexer.nextToken();
                return new StringLiteral(value);
            }
            case LPAREN -> {
                lexer.nextToken();
                ConditionExpression inner = parseExpression();
                expect(ConditionToken.RPAREN);
                return inner;
            }
            default -> throw error("Expected column, literal or '('");
        }
    }

    private ConditionExpression parseCall(String name) {
        List<ConditionExpression> arguments = new ArrayList<>();
        if (!check(ConditionToken.RPAREN)) {
            do {
                arguments.add(parseExpression());
            } while (consumeIf(ConditionToken.SEMICOLON));
        }
        expect(ConditionToken.RPAREN);
        return new FunctionCall(name, arguments);
    }
}
