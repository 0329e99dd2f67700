package org.kdbear.engine.query;

/**
 * Lexer for a single condition, e.g. {@code price * 2 >= size + 10}.
 *
 * Strings may be quoted with either {@code "} or {@code '}; a backslash escapes
 * the next character. {@code like} is the only keyword.
 */
public final class ConditionLexer {

    private final String text;
    private int pos;
    private char ch;

    // Current token state
    private ConditionToken token;
    private String stringVal;
    private int tokenPos;

    public ConditionLexer(String text) {
        this.text = text;
        this.pos = 0;
        this.ch = pos < text.length() ? text.charAt(pos) : '\0';
        nextToken();
    }

    // ==================== Token Access ====================

    public ConditionToken token() {
        return token;
    }

    public String stringVal() {
        return stringVal;
    }

    public int tokenPos() {
        return tokenPos;
    }

    public String text() {
        return text;
    }

    public String info() {
        return token + (stringVal != null ? "(" + stringVal + ")" : "");
    }

    // ==================== Scanning ====================

    public void nextToken() {
        while (Character.isWhitespace(ch)) {
            advance();
        }

        tokenPos = pos;
        stringVal = null;

        if (atEnd()) {
            token = ConditionToken.EOF;
            return;
        }
        if (isIdentifierStart(ch)) {
            scanIdentifier();
            return;
        }
        if (ch == '"' || ch == '\'') {
            scanString(ch);
            return;
        }
        if (isDigit(ch) || (ch == '.' && isDigit(peek()))) {
            scanNumber();
            return;
        }
        scanOperator();
    }

    private void scanIdentifier() {
        int start = pos;
        while (isIdentifierPart(ch)) {
            advance();
        }
        stringVal = text.substring(start, pos);
        token = stringVal.equals("like") ? ConditionToken.LIKE : ConditionToken.IDENTIFIER;
    }

    private void scanString(char quote) {
        int start = pos;
        advance();
        StringBuilder sb = new StringBuilder();
        while (!atEnd() && ch != quote) {
            if (ch == '\\') {
                advance();
                if (atEnd()) {
                    break;
                }
            }
            sb.append(ch);
            advance();
        }
        if (atEnd()) {
            throw new InvalidConditionException("Unterminated string", text, start);
        }
        advance();
        stringVal = sb.toString();
        token = ConditionToken.STRING;
    }

    private void scanNumber() {
        int start = pos;
        while (isDigit(ch)) {
            advance();
        }
        if (ch == '.') {
            advance();
            while (isDigit(ch)) {
                advance();
            }
        }
        // Scientific notation: 1e10, 1E-5
        if ((ch == 'e' || ch == 'E') && (isDigit(peek()) || ((peek() == '+' || peek() == '-') && isDigit(peek(2))))) {
            advance();
            if (ch == '+' || ch == '-') {
                advance();
            }
            while (isDigit(ch)) {
                advance();
            }
        }
        if (isIdentifierStart(ch)) {
            throw new InvalidConditionException("Malformed number", text, start);
        }
        stringVal = text.substring(start, pos);
        token = ConditionToken.NUMBER;
    }

    private void scanOperator() {
        int start = pos;
        switch (ch) {
            case '(' -> { advance(); token = ConditionToken.LPAREN; }
            case ')' -> { advance(); token = ConditionToken.RPAREN; }
            case ';' -> { advance(); token = ConditionToken.SEMICOLON; }
            case '+' -> { advance(); token = ConditionToken.PLUS; }
            case '-' -> { advance(); token = ConditionToken.MINUS; }
            case '*' -> { advance(); token = ConditionToken.STAR; }
            case '/' -> { advance(); token = ConditionToken.SLASH; }
            case '%' -> { advance(); token = ConditionToken.PERCENT; }
            case '~' -> { advance(); token = ConditionToken.TILDE; }
            case '=' -> {
                advance();
                if (ch == '=') { advance(); token = ConditionToken.EQEQ; }
                else { token = ConditionToken.EQ; }
            }
            case '<' -> {
                advance();
                if (ch == '=') { advance(); token = ConditionToken.LE; }
                else { token = ConditionToken.LT; }
            }
            case '>' -> {
                advance();
                if (ch == '=') { advance(); token = ConditionToken.GE; }
                else { token = ConditionToken.GT; }
            }
            case '!' -> {
                advance();
                if (ch == '=') { advance(); token = ConditionToken.NE; }
                else throw new InvalidConditionException("Expected = after !", text, start);
            }
            default -> throw new InvalidConditionException("Unexpected character '" + ch + "'", text, start);
        }
    }

    // ==================== Helpers ====================

    private void advance() {
        pos++;
        ch = pos < text.length() ? text.charAt(pos) : '\0';
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private char peek() {
        return peek(1);
    }

    private char peek(int ahead) {
        return pos + ahead < text.length() ? text.charAt(pos + ahead) : '\0';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == '.';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
