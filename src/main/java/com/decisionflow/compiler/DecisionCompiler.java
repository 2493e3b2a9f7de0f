package com.decisionflow.compiler;

import com.decisionflow.config.DecisionDocument;
import com.decisionflow.render.OutputFormat;

/**
 * Compiles decision documents into decision graphs and their renderings.
 * Calls are independent; no state is shared between them.
 */
public interface DecisionCompiler {

    /**
     * Run the pipeline up to the decision graph.
     *
     * @param document Logic and questions
     * @return Compiled decision with all intermediate results
     * @throws com.decisionflow.exception.ExpressionSyntaxException if the logic is malformed
     */
    CompiledDecision compileGraph(DecisionDocument document);

    /**
     * Compile and render in one step.
     *
     * @param document Logic and questions
     * @param format   Diagram or DAG output
     * @return Rendered output
     */
    String compile(DecisionDocument document, OutputFormat format);
}
