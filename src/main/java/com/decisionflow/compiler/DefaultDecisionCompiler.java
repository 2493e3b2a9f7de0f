package com.decisionflow.compiler;

import com.decisionflow.config.DecisionDocument;
import com.decisionflow.expression.BooleanExpr;
import com.decisionflow.expression.LogicExpressionParser;
import com.decisionflow.factoring.FactoringResult;
import com.decisionflow.factoring.OrGroupFactorizer;
import com.decisionflow.graph.DecisionGraph;
import com.decisionflow.graph.DecisionGraphBuilder;
import com.decisionflow.logic.Dnf;
import com.decisionflow.logic.DnfConverter;
import com.decisionflow.logic.NegationNormalizer;
import com.decisionflow.logic.NormalizedExpression;
import com.decisionflow.render.GraphRenderer;
import com.decisionflow.render.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default pipeline: factor OR-groups, parse, normalize negations, convert to DNF,
 * build the decision graph, render.
 * Every stage is instantiated per call.
 */
public class DefaultDecisionCompiler implements DecisionCompiler {

    private static final Logger log = LoggerFactory.getLogger(DefaultDecisionCompiler.class);

    private final CompilerSettings settings;

    public DefaultDecisionCompiler(CompilerSettings settings) {
        this.settings = settings;
    }

    @Override
    public CompiledDecision compileGraph(DecisionDocument document) {
        log.debug("Compiling logic: {}", document.logic());

        FactoringResult factoring = settings.factorOrGroups()
                ? new OrGroupFactorizer(settings.maxFactorDepth()).factor(document.logic(), document.questions())
                : FactoringResult.unchanged(document.logic(), document.questions());

        BooleanExpr expr = LogicExpressionParser.parse(factoring.logic());
        NormalizedExpression normalized = new NegationNormalizer().normalize(expr);
        Dnf dnf = new DnfConverter().toDnf(normalized.expression());
        DecisionGraph graph = new DecisionGraphBuilder().build(
                dnf, factoring.questions(), factoring.groups(), normalized.negatedNames());

        log.info("Compiled '{}' into {} terms, {} nodes, {} edges",
                document.logic(), dnf.size(), graph.getNodes().size(), graph.getEdges().size());

        return new CompiledDecision(document, factoring, normalized, dnf, graph);
    }

    @Override
    public String compile(DecisionDocument document, OutputFormat format) {
        DecisionGraph graph = compileGraph(document).graph();
        return GraphRenderer.forFormat(format).render(graph);
    }

    public CompilerSettings getSettings() {
        return settings;
    }
}
