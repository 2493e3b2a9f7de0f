package com.decisionflow.graph;

/**
 * Question node of a decision graph.
 *
 * @param id       Node id, the identifier itself or the identifier with a disambiguation suffix
 * @param baseName Identifier the node asks about
 * @param text     Display text
 * @param virtual  true if the identifier stands for a factored OR-group
 */
public record GraphNode(String id, String baseName, String text, boolean virtual) {
}
