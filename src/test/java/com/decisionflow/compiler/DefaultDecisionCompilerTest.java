package com.decisionflow.compiler;

import com.decisionflow.config.DecisionDocument;
import com.decisionflow.exception.ConfigurationException;
import com.decisionflow.exception.ExpressionSyntaxException;
import com.decisionflow.graph.DecisionGraph;
import com.decisionflow.graph.EdgeLabel;
import com.decisionflow.graph.GraphEdge;
import com.decisionflow.logic.Dnf;
import com.decisionflow.logic.Term;
import com.decisionflow.render.OutputFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.decisionflow.graph.DecisionGraph.APPROVE;
import static com.decisionflow.graph.DecisionGraph.DENY;
import static com.decisionflow.logic.Literal.positive;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for DefaultDecisionCompiler.
 */
class DefaultDecisionCompilerTest {

    private static final Map<String, String> QUESTIONS = Map.of(
            "Q1", "a?", "Q2", "b?", "Q3", "c?", "Q4", "d?", "Q5", "e?");

    private static final String SAMPLE_LOGIC = "(Q1 and not (Q5 and Q4)) or (Q2 and Q3)";

    private DecisionCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = DecisionCompilerFactory.createDefault();
    }

    private static GraphEdge edge(String source, EdgeLabel label, String target) {
        return new GraphEdge(source, label, target);
    }

    // =====================================================================
    // Pipeline
    // =====================================================================

    @Test
    @DisplayName("Sample logic compiles into split chains with negated routing")
    void compilesSampleLogic() {
        CompiledDecision compiled = compiler.compileGraph(new DecisionDocument(SAMPLE_LOGIC, QUESTIONS));

        assertFalse(compiled.factoring().applied());
        assertEquals(Set.of("Q5", "Q4"), compiled.normalized().negatedNames());
        assertEquals(Dnf.of(
                Term.of(positive("Q1"), positive("Q5")),
                Term.of(positive("Q1"), positive("Q4")),
                Term.of(positive("Q2"), positive("Q3"))), compiled.dnf());

        DecisionGraph graph = compiled.graph();
        assertEquals(List.of("Q1", "Q1_1", "Q2"), graph.getEntryNodes());
        assertEquals(Set.of(
                edge("Q1", EdgeLabel.YES, DENY),
                edge("Q1", EdgeLabel.NO, "Q5"),
                edge("Q5", EdgeLabel.YES, DENY),
                edge("Q5", EdgeLabel.NO, APPROVE),
                edge("Q1_1", EdgeLabel.YES, DENY),
                edge("Q1_1", EdgeLabel.NO, "Q4"),
                edge("Q4", EdgeLabel.YES, DENY),
                edge("Q4", EdgeLabel.NO, APPROVE),
                edge("Q2", EdgeLabel.YES, "Q3"),
                edge("Q2", EdgeLabel.NO, DENY),
                edge("Q3", EdgeLabel.YES, APPROVE),
                edge("Q3", EdgeLabel.NO, DENY)), graph.getEdges());
    }

    @Test
    @DisplayName("Sample logic renders a DAG with deduplicated Start targets")
    void rendersSampleDag() {
        String json = compiler.compile(new DecisionDocument(SAMPLE_LOGIC, QUESTIONS), OutputFormat.DAG);

        assertTrue(json.contains("\"Start\":{\"Start\":[\"Q1\",\"Q2\"]}"));
        assertTrue(json.contains("\"Q1\":{\"Yes\":[\"Deny\"],\"No\":[\"Q4\"]}"));
    }

    @Test
    @DisplayName("Factoring introduces a virtual node when enabled")
    void factorsWhenEnabled() {
        DecisionDocument document = new DecisionDocument("Q1 and (Q2 or Q3)", QUESTIONS);

        CompiledDecision factored = compiler.compileGraph(document);
        assertTrue(factored.factoring().applied());
        assertEquals(List.of("V1"), factored.graph().getEntryNodes());

        CompiledDecision plain = DecisionCompilerFactory.create(CompilerSettings.defaults().withFactoring(false))
                .compileGraph(document);
        assertFalse(plain.factoring().applied());
        assertEquals(List.of("Q1", "Q1_1"), plain.graph().getEntryNodes());
        assertNull(plain.graph().getNode("V1"));
    }

    @Test
    @DisplayName("Diagram output is reproducible")
    void diagramIsReproducible() {
        DecisionDocument document = new DecisionDocument(SAMPLE_LOGIC, QUESTIONS);

        String first = compiler.compile(document, OutputFormat.DIAGRAM);
        String second = compiler.compile(document, OutputFormat.DIAGRAM);

        assertEquals(first, second);
        assertTrue(first.startsWith("%%{init:"));
    }

    // =====================================================================
    // Errors
    // =====================================================================

    @Test
    @DisplayName("Malformed logic surfaces a syntax error")
    void rejectsMalformedLogic() {
        DecisionDocument document = new DecisionDocument("Q1 and (Q2 or", QUESTIONS);

        assertThrows(ExpressionSyntaxException.class,
                () -> compiler.compile(document, OutputFormat.DIAGRAM));
    }

    @Test
    @DisplayName("Blank logic is rejected before compilation")
    void rejectsBlankLogic() {
        assertThrows(ConfigurationException.class, () -> new DecisionDocument(" ", QUESTIONS));
    }

    @Test
    @DisplayName("Factor depth must be positive")
    void validatesSettings() {
        assertThrows(ConfigurationException.class, () -> new CompilerSettings(true, 0));
        assertTrue(CompilerSettings.defaults().factorOrGroups());
    }
}
