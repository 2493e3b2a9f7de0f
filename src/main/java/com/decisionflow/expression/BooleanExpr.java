package com.decisionflow.expression;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Boolean decision expression over named yes/no questions.
 * <p>
 * The variant set is closed: {@link Identifier}, {@link Not}, {@link And} and {@link Or}.
 * Passes dispatch with a {@code switch} over {@link #type()} so that adding a variant
 * breaks every pass that does not handle it.
 */
public sealed interface BooleanExpr permits Identifier, Not, And, Or {

    /**
     * Get the node kind.
     */
    ExprType type();

    /**
     * Distinct identifiers in first-appearance order (left to right, depth first).
     */
    default Set<String> identifiers() {
        Set<String> names = new LinkedHashSet<>();
        collectIdentifiers(this, names);
        return names;
    }

    static Identifier identifier(String name) {
        return new Identifier(name);
    }

    static Not not(BooleanExpr operand) {
        return new Not(operand);
    }

    static And and(BooleanExpr... operands) {
        return new And(List.of(operands));
    }

    static Or or(BooleanExpr... operands) {
        return new Or(List.of(operands));
    }

    private static void collectIdentifiers(BooleanExpr expr, Set<String> names) {
        switch (expr.type()) {
            case IDENTIFIER -> names.add(((Identifier) expr).name());
            case NOT -> collectIdentifiers(((Not) expr).operand(), names);
            case AND -> ((And) expr).operands().forEach(o -> collectIdentifiers(o, names));
            case OR -> ((Or) expr).operands().forEach(o -> collectIdentifiers(o, names));
        }
    }
}
