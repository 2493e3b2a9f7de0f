package com.decisionflow.expression.parser;

import java.util.Map;

/**
 * Keywords and operator symbols of the logic expression language.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Keywords mapped to token types. Matched case-insensitively.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.of(
            "AND", TokenType.AND,
            "OR", TokenType.OR,
            "NOT", TokenType.NOT
    );

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char UNDERSCORE = '_';
        public static final char DOLLAR = '$';

        private Operators() {
        }
    }
}
