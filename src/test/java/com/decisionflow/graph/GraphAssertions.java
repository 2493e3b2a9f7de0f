package com.decisionflow.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Structural checks shared by graph tests.
 */
final class GraphAssertions {

    private GraphAssertions() {
    }

    /**
     * Every question node, expansion members included, has exactly one Yes and one No edge.
     */
    static void assertBinary(DecisionGraph graph) {
        List<GraphEdge> edges = allEdges(graph);
        List<String> ids = new ArrayList<>();
        graph.getNodes().forEach(n -> ids.add(n.id()));
        graph.getExpansions().forEach(e -> e.members().forEach(m -> ids.add(m.id())));

        for (String id : ids) {
            long yes = edges.stream().filter(e -> e.source().equals(id) && e.label() == EdgeLabel.YES).count();
            long no = edges.stream().filter(e -> e.source().equals(id) && e.label() == EdgeLabel.NO).count();
            assertEquals(1, yes, "Yes edges of " + id);
            assertEquals(1, no, "No edges of " + id);
        }
    }

    /**
     * Every path from Start ends in Approve or Deny without revisiting a node.
     */
    static void assertTerminates(DecisionGraph graph) {
        List<GraphEdge> edges = allEdges(graph);
        for (String entry : startTargets(graph)) {
            walk(entry, edges, new HashSet<>());
        }
    }

    static List<String> startTargets(DecisionGraph graph) {
        List<String> targets = new ArrayList<>();
        for (String entry : graph.getEntryNodes()) {
            GroupExpansion expansion = graph.getExpansion(entry);
            if (expansion == null) {
                targets.add(entry);
            } else {
                expansion.members().forEach(m -> targets.add(m.id()));
            }
        }
        return targets;
    }

    private static void walk(String node, List<GraphEdge> edges, Set<String> path) {
        if (DecisionGraph.APPROVE.equals(node) || DecisionGraph.DENY.equals(node)) {
            return;
        }
        assertTrue(path.add(node), "Cycle through " + node);
        List<GraphEdge> outgoing = edges.stream().filter(e -> e.source().equals(node)).toList();
        assertFalse(outgoing.isEmpty(), "Dead end at " + node);
        for (GraphEdge edge : outgoing) {
            walk(edge.target(), edges, path);
        }
        path.remove(node);
    }

    private static List<GraphEdge> allEdges(DecisionGraph graph) {
        List<GraphEdge> edges = new ArrayList<>(graph.getEdges());
        graph.getExpansions().forEach(e -> edges.addAll(e.edges()));
        return edges;
    }
}
