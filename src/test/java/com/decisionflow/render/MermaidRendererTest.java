package com.decisionflow.render;

import com.decisionflow.expression.LogicExpressionParser;
import com.decisionflow.factoring.FactoringResult;
import com.decisionflow.factoring.OrGroupFactorizer;
import com.decisionflow.graph.DecisionGraph;
import com.decisionflow.graph.DecisionGraphBuilder;
import com.decisionflow.logic.DnfConverter;
import com.decisionflow.logic.NegationNormalizer;
import com.decisionflow.logic.NormalizedExpression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MermaidRenderer.
 */
class MermaidRendererTest {

    private final MermaidRenderer renderer = new MermaidRenderer();

    static DecisionGraph graphOf(String logic, Map<String, String> questions, boolean factor) {
        FactoringResult factoring = factor
                ? new OrGroupFactorizer().factor(logic, questions)
                : FactoringResult.unchanged(logic, questions);
        NormalizedExpression normalized = new NegationNormalizer()
                .normalize(LogicExpressionParser.parse(factoring.logic()));
        return new DecisionGraphBuilder().build(
                new DnfConverter().toDnf(normalized.expression()),
                factoring.questions(),
                factoring.groups(),
                normalized.negatedNames());
    }

    private static List<String> lines(String diagram) {
        return Arrays.asList(diagram.split("\n"));
    }

    @Test
    @DisplayName("Conjunction renders the full flowchart")
    void rendersConjunction() {
        String diagram = renderer.render(graphOf("Q1 and Q2", Map.of("Q1", "a?", "Q2", "b?"), false));

        String expected = String.join("\n",
                MermaidRenderer.INIT_DIRECTIVE,
                "flowchart TD",
                "Start[\"Start\"]",
                "Q1[\"a?\"]",
                "Q2[\"b?\"]",
                "Approve[\"Yes\"]",
                "Deny[\"No\"]",
                "Start --> Q1",
                "Q1 -->|Yes| Q2",
                "Q1 -->|No| Deny",
                "Q2 -->|Yes| Approve",
                "Q2 -->|No| Deny",
                String.join("\n", MermaidRenderer.STYLES));
        assertEquals(expected, diagram);
    }

    @Test
    @DisplayName("Virtual entry is expanded into its members")
    void expandsVirtualEntry() {
        Map<String, String> questions = Map.of("Q1", "a?", "Q2", "b?", "Q3", "c?");
        List<String> lines = lines(renderer.render(graphOf("Q1 and (Q2 or Q3)", questions, true)));

        assertTrue(lines.contains("V1[\"Does patient meet either:<br/>b? OR c??\"]:::virtual"));
        assertTrue(lines.contains("Q2[\"b?\"]"));
        assertTrue(lines.contains("Q3[\"c?\"]"));
        assertTrue(lines.contains("Start --> Q2"));
        assertTrue(lines.contains("Start --> Q3"));
        assertFalse(lines.contains("Start --> V1"));
        assertTrue(lines.contains("Q2 -->|Yes| V1"));
        assertTrue(lines.contains("Q2 -->|No| Deny"));
        assertTrue(lines.contains("Q3 -->|Yes| V1"));
        assertTrue(lines.contains("V1 -->|Yes| Q1"));
        assertTrue(lines.contains("V1 -->|No| Deny"));
        assertTrue(lines.contains("Q1 -->|Yes| Approve"));
        assertTrue(lines.indexOf("Start --> Q2") < lines.indexOf("Q2 -->|Yes| V1"));
        assertTrue(lines.indexOf("Q2 -->|Yes| V1") < lines.indexOf("V1 -->|Yes| Q1"));
    }

    @Test
    @DisplayName("Quotes in question text are escaped")
    void escapesQuotes() {
        String diagram = renderer.render(graphOf("Q1", Map.of("Q1", "Is it \"urgent\"?"), false));

        assertTrue(lines(diagram).contains("Q1[\"Is it #quot;urgent#quot;?\"]"));
    }

    @Test
    @DisplayName("Style block closes the diagram")
    void appendsStyles() {
        List<String> lines = lines(renderer.render(graphOf("Q1 or Q2", Map.of(), false)));

        assertEquals(5, lines.stream().filter(l -> l.startsWith("classDef ")).count());
        assertEquals(3, lines.stream().filter(l -> l.startsWith("class ")).count());
        assertEquals("linkStyle default stroke:#333,stroke-width:2px", lines.get(lines.size() - 1));
        assertTrue(lines.contains("Q1[\"Q1\"]"));
    }

    @Test
    @DisplayName("Rendering is deterministic")
    void deterministic() {
        Map<String, String> questions = Map.of("Q1", "a?", "Q2", "b?", "Q3", "c?", "Q4", "d?", "Q5", "e?");
        String logic = "(Q1 and not (Q5 and Q4)) or (Q2 and Q3)";

        assertEquals(renderer.render(graphOf(logic, questions, true)),
                renderer.render(graphOf(logic, questions, true)));
    }

    @Test
    @DisplayName("Format lookup returns the diagram renderer")
    void formatLookup() {
        assertEquals(OutputFormat.DIAGRAM, renderer.format());
        assertInstanceOf(MermaidRenderer.class, GraphRenderer.forFormat(OutputFormat.DIAGRAM));
        assertInstanceOf(DagDocumentRenderer.class, GraphRenderer.forFormat(OutputFormat.DAG));
    }
}
