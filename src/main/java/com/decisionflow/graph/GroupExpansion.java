package com.decisionflow.graph;

import com.decisionflow.factoring.FactorGroup;

import java.util.List;
import java.util.stream.Stream;

/**
 * Two-level sub-decision that replaces a virtual entry node in the diagram:
 * Start fans out to each member, and each member converges on the virtual node.
 * Not part of the structured DAG document.
 *
 * @param virtualNodeId Entry node being expanded
 * @param group         Factor group behind the virtual node
 * @param members       One node per group member
 */
public record GroupExpansion(String virtualNodeId, FactorGroup group, List<GraphNode> members) {

    public GroupExpansion {
        members = List.copyOf(members);
    }

    /**
     * Edges from every member node: the satisfying branch leads to the virtual node,
     * the other one to Deny.
     */
    public List<GraphEdge> edges() {
        String yesTarget = group.negated() ? DecisionGraph.DENY : virtualNodeId;
        String noTarget = group.negated() ? virtualNodeId : DecisionGraph.DENY;
        return members.stream()
                .flatMap(m -> Stream.of(
                        new GraphEdge(m.id(), EdgeLabel.YES, yesTarget),
                        new GraphEdge(m.id(), EdgeLabel.NO, noTarget)))
                .toList();
    }
}
