package com.decisionflow.graph;

/**
 * Branch label of a decision edge.
 */
public enum EdgeLabel {
    YES("Yes"),
    NO("No");

    private final String label;

    EdgeLabel(String label) {
        this.label = label;
    }

    /**
     * Label as rendered in both output formats.
     */
    public String label() {
        return label;
    }
}
