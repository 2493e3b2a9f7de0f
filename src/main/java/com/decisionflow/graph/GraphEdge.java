package com.decisionflow.graph;

/**
 * Labeled edge between two graph nodes.
 *
 * @param source Source node id
 * @param label  Yes or No branch
 * @param target Target node id (a question node, Approve or Deny)
 */
public record GraphEdge(String source, EdgeLabel label, String target) {

    @Override
    public String toString() {
        return source + " -" + label.label() + "-> " + target;
    }
}
