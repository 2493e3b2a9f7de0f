package com.decisionflow.expression;

import java.util.List;

/**
 * Logical disjunction.
 *
 * @param operands Alternative expressions, left to right
 */
public record Or(List<BooleanExpr> operands) implements BooleanExpr {

    public Or {
        operands = List.copyOf(operands);
    }

    @Override
    public ExprType type() {
        return ExprType.OR;
    }

    @Override
    public String toString() {
        return "OR(" + operands + ")";
    }
}
