package com.decisionflow.expression.parser;

import com.decisionflow.exception.ExpressionSyntaxException;
import com.decisionflow.expression.And;
import com.decisionflow.expression.BooleanExpr;
import com.decisionflow.expression.Identifier;
import com.decisionflow.expression.Not;
import com.decisionflow.expression.Or;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for logic expressions.
 * Converts tokens into a BooleanExpr tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: NOT > AND > OR):
 * <pre>
 * expression := or
 * or         := and ('or' and)*
 * and        := not ('and' not)*
 * not        := 'not' not | primary
 * primary    := '(' expression ')' | identifier
 * </pre>
 * A chain of the same operator becomes one n-ary node; parenthesized groups
 * stay nested.
 */
public final class ExpressionParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    public ExpressionParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into a BooleanExpr tree.
     *
     * @return Root expression
     */
    public BooleanExpr parse() {
        BooleanExpr result = parseExpression();
        expect(TokenType.EOF);
        return result;
    }

    private BooleanExpr parseExpression() {
        return parseOr();
    }

    private BooleanExpr parseOr() {
        BooleanExpr left = parseAnd();
        List<BooleanExpr> operands = new ArrayList<>();
        operands.add(left);

        while (match(TokenType.OR)) {
            operands.add(parseAnd());
        }

        return operands.size() == 1 ? left : new Or(operands);
    }

    private BooleanExpr parseAnd() {
        BooleanExpr left = parseNot();
        List<BooleanExpr> operands = new ArrayList<>();
        operands.add(left);

        while (match(TokenType.AND)) {
            operands.add(parseNot());
        }

        return operands.size() == 1 ? left : new And(operands);
    }

    private BooleanExpr parseNot() {
        if (match(TokenType.NOT)) {
            return new Not(parseNot());
        }
        return parsePrimary();
    }

    private BooleanExpr parsePrimary() {
        if (match(TokenType.LPAREN)) {
            BooleanExpr expr = parseExpression();
            expect(TokenType.RPAREN);
            return expr;
        }

        Token identifier = consume(TokenType.IDENT, "Expected identifier");
        return new Identifier(identifier.text());
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    private void expect(TokenType type) {
        if (!check(type)) {
            throw error("Expected " + type + " but found " + peek());
        }
        advance();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private ExpressionSyntaxException error(String message) {
        int position = peek().position();
        return new ExpressionSyntaxException("Invalid logic at position "
                + position + ": " + message + " in '" + input + "'", position);
    }
}
