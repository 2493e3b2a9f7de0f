package com.decisionflow.render;

import com.decisionflow.exception.DecisionFlowException;
import com.decisionflow.graph.DecisionGraph;
import com.decisionflow.graph.GraphEdge;
import com.decisionflow.graph.GraphNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders a decision graph as a compact JSON document:
 * <pre>
 * {"nodes":{"Start":"Decision Point","Q1":"..."},
 *  "edges":{"Start":{"Start":["Q1"]},"Q1":{"Yes":["Approve"],"No":["Deny"]}},
 *  "terminal_nodes":{"Approve":"Yes","Deny":"No"}}
 * </pre>
 * Nodes and edges are keyed by identifier; disambiguated node instances collapse
 * onto one entry and the last edge written per (identifier, label) wins.
 * Virtual identifiers are plain nodes here.
 */
public class DagDocumentRenderer implements GraphRenderer {

    static final String START_TEXT = "Decision Point";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String render(DecisionGraph graph) {
        try {
            return objectMapper.writeValueAsString(toDocument(graph));
        } catch (JsonProcessingException e) {
            throw new DecisionFlowException("Failed to serialize decision DAG: " + e.getMessage(), e);
        }
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.DAG;
    }

    /**
     * Build the document as nested ordered maps.
     */
    public Map<String, Object> toDocument(DecisionGraph graph) {
        Map<String, String> nodes = new LinkedHashMap<>();
        nodes.put(DecisionGraph.START, START_TEXT);
        for (GraphNode node : graph.getNodes()) {
            nodes.put(node.baseName(), node.text());
        }

        Map<String, Map<String, List<String>>> edges = new LinkedHashMap<>();
        Set<String> startTargets = new LinkedHashSet<>();
        for (String entry : graph.getEntryNodes()) {
            startTargets.add(graph.baseName(entry));
        }
        Map<String, List<String>> start = new LinkedHashMap<>();
        start.put(DecisionGraph.START, new ArrayList<>(startTargets));
        edges.put(DecisionGraph.START, start);

        for (GraphEdge edge : graph.getEdges()) {
            String source = graph.baseName(edge.source());
            String target = graph.baseName(edge.target());
            edges.computeIfAbsent(source, k -> new LinkedHashMap<>())
                    .put(edge.label().label(), List.of(target));
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("nodes", nodes);
        document.put("edges", edges);
        document.put("terminal_nodes", DecisionGraph.TERMINALS);
        return document;
    }
}
