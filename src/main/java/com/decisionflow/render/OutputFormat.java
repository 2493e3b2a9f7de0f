package com.decisionflow.render;

/**
 * Output formats of a compiled decision graph.
 */
public enum OutputFormat {
    /**
     * Mermaid flowchart text (default).
     */
    DIAGRAM,

    /**
     * Compact JSON decision DAG document.
     */
    DAG
}
