package com.decisionflow.logic;

import com.decisionflow.expression.BooleanExpr;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Result of negation normalization.
 *
 * @param expression    Tree in which no NOT remains
 * @param negatedNames  Identifiers rewritten from {@code not X} to bare {@code X}
 */
public record NormalizedExpression(BooleanExpr expression, Set<String> negatedNames) {

    public NormalizedExpression {
        negatedNames = Collections.unmodifiableSet(new LinkedHashSet<>(negatedNames));
    }

    public boolean isNegated(String name) {
        return negatedNames.contains(name);
    }
}
