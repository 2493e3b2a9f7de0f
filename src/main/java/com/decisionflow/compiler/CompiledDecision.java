package com.decisionflow.compiler;

import com.decisionflow.config.DecisionDocument;
import com.decisionflow.factoring.FactoringResult;
import com.decisionflow.graph.DecisionGraph;
import com.decisionflow.logic.Dnf;
import com.decisionflow.logic.NormalizedExpression;

/**
 * Intermediate and final products of one compilation.
 *
 * @param document   Input document
 * @param factoring  Factoring outcome (unchanged input when disabled or not applicable)
 * @param normalized NOT-free expression and negated identifiers
 * @param dnf        Disjunctive normal form of the normalized expression
 * @param graph      Decision graph
 */
public record CompiledDecision(
        DecisionDocument document,
        FactoringResult factoring,
        NormalizedExpression normalized,
        Dnf dnf,
        DecisionGraph graph
) {
}
