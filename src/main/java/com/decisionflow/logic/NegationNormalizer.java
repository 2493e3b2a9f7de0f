package com.decisionflow.logic;

import com.decisionflow.expression.And;
import com.decisionflow.expression.BooleanExpr;
import com.decisionflow.expression.Identifier;
import com.decisionflow.expression.Not;
import com.decisionflow.expression.Or;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pushes NOT inward with De Morgan's laws until it only applies to identifiers,
 * then drops it and records the identifier as negated.
 * <ul>
 *   <li>{@code not X} becomes {@code X}, X recorded</li>
 *   <li>{@code not (a and b)} becomes {@code (not a) or (not b)}, normalized again</li>
 *   <li>{@code not (a or b)} becomes {@code (not a) and (not b)}, normalized again</li>
 *   <li>{@code not not e} becomes {@code e}, normalized again</li>
 * </ul>
 * The decision graph stage consults the negated set to flip edge polarity.
 */
public class NegationNormalizer {

    private static final Logger log = LoggerFactory.getLogger(NegationNormalizer.class);

    /**
     * Normalize an expression tree.
     *
     * @param expr Parsed expression
     * @return NOT-free tree and the identifiers that were negated
     */
    public NormalizedExpression normalize(BooleanExpr expr) {
        return normalize(expr, new LinkedHashSet<>());
    }

    /**
     * Normalize a previous result again, keeping its negated identifiers.
     * A no-op on an already normalized result.
     */
    public NormalizedExpression normalize(NormalizedExpression previous) {
        return normalize(previous.expression(), new LinkedHashSet<>(previous.negatedNames()));
    }

    private NormalizedExpression normalize(BooleanExpr expr, Set<String> negatedNames) {
        BooleanExpr result = rewrite(expr, negatedNames);
        if (!negatedNames.isEmpty()) {
            log.debug("Normalized negations, negated identifiers: {}", negatedNames);
        }
        return new NormalizedExpression(result, negatedNames);
    }

    private BooleanExpr rewrite(BooleanExpr expr, Set<String> negatedNames) {
        return switch (expr.type()) {
            case IDENTIFIER -> expr;
            case NOT -> pushNegation(((Not) expr).operand(), negatedNames);
            case AND -> new And(rewriteAll(((And) expr).operands(), negatedNames));
            case OR -> new Or(rewriteAll(((Or) expr).operands(), negatedNames));
        };
    }

    private BooleanExpr pushNegation(BooleanExpr operand, Set<String> negatedNames) {
        return switch (operand.type()) {
            case IDENTIFIER -> {
                negatedNames.add(((Identifier) operand).name());
                yield operand;
            }
            case NOT -> rewrite(((Not) operand).operand(), negatedNames);
            case AND -> rewrite(new Or(negateAll(((And) operand).operands())), negatedNames);
            case OR -> rewrite(new And(negateAll(((Or) operand).operands())), negatedNames);
        };
    }

    private List<BooleanExpr> rewriteAll(List<BooleanExpr> operands, Set<String> negatedNames) {
        List<BooleanExpr> rewritten = new ArrayList<>(operands.size());
        for (BooleanExpr operand : operands) {
            rewritten.add(rewrite(operand, negatedNames));
        }
        return rewritten;
    }

    private List<BooleanExpr> negateAll(List<BooleanExpr> operands) {
        List<BooleanExpr> negated = new ArrayList<>(operands.size());
        for (BooleanExpr operand : operands) {
            negated.add(new Not(operand));
        }
        return negated;
    }
}
