package com.decisionflow.expression.parser;

import com.decisionflow.exception.ExpressionSyntaxException;

import java.util.ArrayList;
import java.util.List;

import static com.decisionflow.expression.parser.ExpressionConfig.*;

/**
 * Tokenizer for logic expressions.
 * Converts input string into a sequence of tokens.
 */
public final class ExpressionTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, terminated by an EOF token
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case Operators.LEFT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.LPAREN, "(", start));
                }
                case Operators.RIGHT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.RPAREN, ")", start));
                }
                default -> {
                    if (isIdentifierStart(c)) {
                        tokens.add(readIdentifierOrKeyword());
                    } else {
                        throw error("Unexpected character '" + c + "'", start);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", pos));
        return tokens;
    }

    private Token readIdentifierOrKeyword() {
        int start = pos;

        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        TokenType keywordType = KEYWORDS.get(text.toUpperCase());
        if (keywordType != null) {
            return new Token(keywordType, text, start);
        }

        return new Token(TokenType.IDENT, text, start);
    }

    private boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == Operators.UNDERSCORE || c == Operators.DOLLAR;
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c)
                || c == Operators.UNDERSCORE
                || c == Operators.DOLLAR;
    }

    private void advance() {
        pos++;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private ExpressionSyntaxException error(String message, int position) {
        return new ExpressionSyntaxException("Invalid logic at position "
                + position + ": " + message + " in '" + input + "'", position);
    }
}
