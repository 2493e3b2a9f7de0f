package com.decisionflow.render;

import com.decisionflow.graph.DecisionGraph;

/**
 * Serializes a decision graph into one output format.
 */
public interface GraphRenderer {

    /**
     * Render the graph.
     *
     * @param graph Compiled decision graph
     * @return Rendered text
     */
    String render(DecisionGraph graph);

    /**
     * Get the format this renderer produces.
     */
    OutputFormat format();

    /**
     * Get the renderer for a format.
     */
    static GraphRenderer forFormat(OutputFormat format) {
        return switch (format) {
            case DIAGRAM -> new MermaidRenderer();
            case DAG -> new DagDocumentRenderer();
        };
    }
}
