package com.decisionflow.expression;

import java.util.List;

/**
 * Logical conjunction. Operand order is preserved; it drives the chain order
 * of the rendered decision graph.
 *
 * @param operands Conjoined expressions, left to right
 */
public record And(List<BooleanExpr> operands) implements BooleanExpr {

    public And {
        operands = List.copyOf(operands);
    }

    @Override
    public ExprType type() {
        return ExprType.AND;
    }

    @Override
    public String toString() {
        return "AND(" + operands + ")";
    }
}
