package com.decisionflow.expression;

import java.util.Objects;

/**
 * Logical negation of a nested expression.
 *
 * @param operand Negated expression
 */
public record Not(BooleanExpr operand) implements BooleanExpr {

    public Not {
        Objects.requireNonNull(operand, "NOT requires an operand");
    }

    @Override
    public ExprType type() {
        return ExprType.NOT;
    }

    @Override
    public String toString() {
        return "NOT(" + operand + ")";
    }
}
