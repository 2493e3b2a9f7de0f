package com.decisionflow.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Binary decision graph compiled from a DNF.
 * <p>
 * {@link #START}, {@link #APPROVE} and {@link #DENY} are implicit sentinel nodes.
 * Every question node has one outgoing Yes edge and one outgoing No edge.
 * All collections keep insertion order so rendering is reproducible.
 */
public final class DecisionGraph {

    public static final String START = "Start";
    public static final String APPROVE = "Approve";
    public static final String DENY = "Deny";

    /**
     * Terminal nodes and the answer each one stands for.
     */
    public static final Map<String, String> TERMINALS;

    static {
        Map<String, String> terminals = new LinkedHashMap<>();
        terminals.put(APPROVE, "Yes");
        terminals.put(DENY, "No");
        TERMINALS = Collections.unmodifiableMap(terminals);
    }

    private final Map<String, GraphNode> nodes;
    private final Set<GraphEdge> edges;
    private final List<String> entryNodes;
    private final List<GroupExpansion> expansions;

    DecisionGraph(Map<String, GraphNode> nodes,
                  Set<GraphEdge> edges,
                  Collection<String> entryNodes,
                  List<GroupExpansion> expansions) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = Collections.unmodifiableSet(new LinkedHashSet<>(edges));
        this.entryNodes = List.copyOf(entryNodes);
        this.expansions = List.copyOf(expansions);
    }

    /**
     * Question nodes in creation order (sentinels excluded).
     */
    public Collection<GraphNode> getNodes() {
        return nodes.values();
    }

    /**
     * Get a question node by id.
     *
     * @return the node, or null for sentinels and unknown ids
     */
    public GraphNode getNode(String id) {
        return nodes.get(id);
    }

    /**
     * All edges between question nodes and terminals, in creation order.
     */
    public Set<GraphEdge> getEdges() {
        return edges;
    }

    /**
     * Node ids Start fans out to: the first node of every term, deduplicated.
     */
    public List<String> getEntryNodes() {
        return entryNodes;
    }

    /**
     * Diagram-only expansions of virtual entry nodes.
     */
    public List<GroupExpansion> getExpansions() {
        return expansions;
    }

    /**
     * Get the expansion of an entry node.
     *
     * @return the expansion, or null if the entry node is not virtual
     */
    public GroupExpansion getExpansion(String entryNodeId) {
        return expansions.stream()
                .filter(e -> e.virtualNodeId().equals(entryNodeId))
                .findFirst()
                .orElse(null);
    }

    /**
     * Identifier behind a node id. Sentinels map to themselves.
     */
    public String baseName(String id) {
        GraphNode node = nodes.get(id);
        return node != null ? node.baseName() : id;
    }

    /**
     * Outgoing edges of a node.
     */
    public List<GraphEdge> outgoing(String id) {
        List<GraphEdge> result = new ArrayList<>();
        for (GraphEdge edge : edges) {
            if (edge.source().equals(id)) {
                result.add(edge);
            }
        }
        return result;
    }

    public boolean isSentinel(String id) {
        return START.equals(id) || APPROVE.equals(id) || DENY.equals(id);
    }

    @Override
    public String toString() {
        return "DecisionGraph{nodes=" + nodes.keySet() + ", edges=" + edges.size()
                + ", entries=" + entryNodes + "}";
    }
}
