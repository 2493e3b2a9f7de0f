package com.decisionflow.logic;

import com.decisionflow.expression.And;
import com.decisionflow.expression.BooleanExpr;
import com.decisionflow.expression.LogicExpressionParser;
import com.decisionflow.expression.Or;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static com.decisionflow.expression.BooleanExpr.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NegationNormalizer.
 */
class NegationNormalizerTest {

    private NegationNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new NegationNormalizer();
    }

    private NormalizedExpression normalize(String logic) {
        return normalizer.normalize(LogicExpressionParser.parse(logic));
    }

    @Test
    @DisplayName("Negated identifier becomes bare and is recorded")
    void stripsNegatedIdentifier() {
        NormalizedExpression result = normalize("not Q1");

        assertEquals(identifier("Q1"), result.expression());
        assertEquals(Set.of("Q1"), result.negatedNames());
    }

    @Test
    @DisplayName("NOT over AND becomes OR of negations")
    void deMorganOverAnd() {
        NormalizedExpression result = normalize("not (Q1 and Q2)");

        assertEquals(or(identifier("Q1"), identifier("Q2")), result.expression());
        assertEquals(List.of("Q1", "Q2"), List.copyOf(result.negatedNames()));
    }

    @Test
    @DisplayName("NOT over OR becomes AND of negations")
    void deMorganOverOr() {
        NormalizedExpression result = normalize("not (Q1 or Q2)");

        assertEquals(and(identifier("Q1"), identifier("Q2")), result.expression());
        assertEquals(Set.of("Q1", "Q2"), result.negatedNames());
    }

    @Test
    @DisplayName("Nested negations are pushed all the way down")
    void pushesNestedNegations() {
        NormalizedExpression result = normalize("not (Q1 and (Q2 or not Q3))");

        assertEquals(or(identifier("Q1"), and(identifier("Q2"), identifier("Q3"))), result.expression());
        assertEquals(List.of("Q1", "Q2"), List.copyOf(result.negatedNames()));
    }

    @Test
    @DisplayName("Double negation cancels out")
    void cancelsDoubleNegation() {
        NormalizedExpression result = normalize("not not Q1");

        assertEquals(identifier("Q1"), result.expression());
        assertTrue(result.negatedNames().isEmpty());
    }

    @Test
    @DisplayName("Negation-free trees pass through unchanged")
    void keepsNegationFreeTree() {
        BooleanExpr expr = LogicExpressionParser.parse("Q1 and (Q2 or Q3)");
        NormalizedExpression result = normalizer.normalize(expr);

        assertEquals(expr, result.expression());
        assertTrue(result.negatedNames().isEmpty());
    }

    @ParameterizedTest
    @DisplayName("Output contains no NOT and normalizing it again changes nothing")
    @ValueSource(strings = {
            "(Q1 and not (Q5 and Q4)) or (Q2 and Q3)",
            "not (Q1 and not (Q2 or not (Q3 and Q4)))",
            "not ((Q1 or Q2) and not (Q3 or Q4))",
            "Q1 and Q2"
    })
    void isIdempotent(String logic) {
        NormalizedExpression first = normalize(logic);
        NormalizedExpression second = normalizer.normalize(first);

        assertFalse(containsNot(first.expression()));
        assertEquals(first.expression(), second.expression());
        assertEquals(first.negatedNames(), second.negatedNames());
    }

    private boolean containsNot(BooleanExpr expr) {
        return switch (expr.type()) {
            case IDENTIFIER -> false;
            case NOT -> true;
            case AND -> ((And) expr).operands().stream().anyMatch(this::containsNot);
            case OR -> ((Or) expr).operands().stream().anyMatch(this::containsNot);
        };
    }
}
