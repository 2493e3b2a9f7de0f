package com.decisionflow.expression;

import java.util.Objects;

/**
 * Reference to a named yes/no question.
 *
 * @param name Identifier as written in the logic text (e.g., "Q1")
 */
public record Identifier(String name) implements BooleanExpr {

    public Identifier {
        Objects.requireNonNull(name, "Identifier name cannot be null");
    }

    @Override
    public ExprType type() {
        return ExprType.IDENTIFIER;
    }

    @Override
    public String toString() {
        return name;
    }
}
