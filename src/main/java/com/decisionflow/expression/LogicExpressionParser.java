package com.decisionflow.expression;

import com.decisionflow.exception.ExpressionSyntaxException;
import com.decisionflow.expression.parser.ExpressionParser;
import com.decisionflow.expression.parser.ExpressionTokenizer;
import com.decisionflow.expression.parser.Token;

import java.util.List;

/**
 * Facade for parsing logic text into BooleanExpr trees.
 * <p>
 * Supports:
 * <ul>
 *   <li>Identifiers: letters, digits, '_' and '$', not starting with a digit</li>
 *   <li>Logical operators: and, or, not (case-insensitive)</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 * <p>
 * Precedence: not > and > or (parentheses override)
 */
public final class LogicExpressionParser {

    private LogicExpressionParser() {
    }

    /**
     * Parse logic text into an expression tree.
     *
     * @param logic Logic text, e.g. {@code (Q1 and not (Q5 and Q4)) or (Q2 and Q3)}
     * @return Parsed expression
     * @throws ExpressionSyntaxException if the text is blank or malformed
     */
    public static BooleanExpr parse(String logic) {
        if (logic == null || logic.isBlank()) {
            throw new ExpressionSyntaxException("Logic expression is empty", 0);
        }

        List<Token> tokens = new ExpressionTokenizer(logic).tokenize();
        return new ExpressionParser(logic, tokens).parse();
    }
}
