package com.decisionflow.expression.parser;

/**
 * Token types for logic expression parsing.
 */
public enum TokenType {
    // Identifiers
    IDENT,

    // Delimiters
    LPAREN,
    RPAREN,

    // Logical operators
    AND,
    OR,
    NOT,

    // Special
    EOF
}
