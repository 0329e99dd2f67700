package org.kdbear.engine.query;

/**
 * Token types of condition text.
 */
public enum ConditionToken {
    // Literals
    EOF,
    IDENTIFIER,
    NUMBER,
    STRING,

    // Punctuation
    LPAREN,
    RPAREN,
    SEMICOLON,

    // Arithmetic
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,

    // Comparison
    GT,
    LT,
    GE,
    LE,
    EQ,
    EQEQ,
    NE,
    TILDE,
    LIKE
}
