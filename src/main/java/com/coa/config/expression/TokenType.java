package com.coa.config.expression;

/**
 * Token types for rule condition expressions.
 */
public enum TokenType {
    // Identifiers and literals
    IDENT,
    STRING,
    NUMBER,
    BOOLEAN,

    // Delimiters
    LPAREN,
    RPAREN,

    // Logical operators
    AND,
    OR,
    NOT,

    // Comparison operators
    EQ,
    NE,
    GT,
    GTE,
    LT,
    LTE,

    // Special
    EOF;

    public boolean isComparison() {
        return this == EQ || this == NE || this == GT || this == GTE || this == LT || this == LTE;
    }
}
