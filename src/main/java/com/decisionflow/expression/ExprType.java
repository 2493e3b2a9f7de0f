package com.decisionflow.expression;

/**
 * Node kinds of a boolean decision expression.
 */
public enum ExprType {
    IDENTIFIER,
    NOT,
    AND,
    OR
}
