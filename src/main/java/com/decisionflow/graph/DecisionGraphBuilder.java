package com.decisionflow.graph;

import com.decisionflow.factoring.FactorGroup;
import com.decisionflow.logic.Dnf;
import com.decisionflow.logic.Literal;
import com.decisionflow.logic.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Synthesizes a binary decision graph from DNF terms.
 * <p>
 * Each term becomes a chain of question nodes from Start to a terminal. A node id is
 * the identifier itself on first use. A reused identifier keeps the bare id while that
 * node has no edge yet; otherwise a new id {@code <identifier>_<n>} is minted with a
 * counter per identifier.
 * <p>
 * Edge polarity: with {@code negated} = the current literal's identifier was negated
 * during normalization, the edge from the previous node takes Yes to the current node
 * when {@code previous.positive != negated}, else No does; the other branch goes to
 * Deny. The last literal applies the same test with its own polarity to choose between
 * Approve and Deny.
 * <p>
 * All state lives in one {@link #build} call; the builder itself holds none.
 */
public class DecisionGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DecisionGraphBuilder.class);

    /**
     * Build the decision graph.
     *
     * @param dnf           Terms to chain, in order
     * @param questions     Identifier to display text; unknown identifiers show their own name
     * @param factorGroups  Groups behind virtual identifiers (may be empty)
     * @param negatedNames  Identifiers negated during normalization
     * @return Decision graph
     */
    public DecisionGraph build(Dnf dnf,
                               Map<String, String> questions,
                               List<FactorGroup> factorGroups,
                               Set<String> negatedNames) {
        Assembly assembly = new Assembly(questions, factorGroups, negatedNames);

        if (dnf.isEmpty()) {
            log.warn("Logic has no satisfiable term; decision graph has no approvable path");
        }
        for (Term term : dnf.terms()) {
            assembly.addTerm(term);
        }
        assembly.expandGroups();

        DecisionGraph graph = assembly.toGraph();
        log.debug("Built {}", graph);
        return graph;
    }

    /**
     * Mutable state of a single build.
     */
    private static final class Assembly {

        private final Map<String, String> questions;
        private final Map<String, FactorGroup> groupsById = new LinkedHashMap<>();
        private final Set<String> negatedNames;

        private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
        private final Set<GraphEdge> edges = new LinkedHashSet<>();
        private final Set<String> touched = new HashSet<>();
        private final Set<String> usedIdentifiers = new HashSet<>();
        private final Map<String, Integer> suffixCounters = new HashMap<>();
        private final Set<String> entryNodes = new LinkedHashSet<>();
        private final Set<String> expansionNodeIds = new HashSet<>();
        private final List<GroupExpansion> expansions = new ArrayList<>();

        Assembly(Map<String, String> questions, List<FactorGroup> factorGroups, Set<String> negatedNames) {
            this.questions = questions;
            this.negatedNames = negatedNames;
            for (FactorGroup group : factorGroups) {
                groupsById.put(group.virtualId(), group);
            }
        }

        void addTerm(Term term) {
            if (term.isEmpty()) {
                log.warn("Skipping empty term (unconditional approval is not representable)");
                return;
            }
            List<Literal> literals = virtualFirst(term);

            Literal previous = null;
            String previousNode = null;
            for (int i = 0; i < literals.size(); i++) {
                Literal literal = literals.get(i);
                String node = assignNodeId(literal.name());
                boolean negated = negatedNames.contains(literal.name());

                if (previousNode != null) {
                    if (previous.positive() != negated) {
                        addEdge(previousNode, EdgeLabel.YES, node);
                        addEdge(previousNode, EdgeLabel.NO, DecisionGraph.DENY);
                    } else {
                        addEdge(previousNode, EdgeLabel.YES, DecisionGraph.DENY);
                        addEdge(previousNode, EdgeLabel.NO, node);
                    }
                }

                if (i == literals.size() - 1) {
                    if (literal.positive() != negated) {
                        addEdge(node, EdgeLabel.YES, DecisionGraph.APPROVE);
                        addEdge(node, EdgeLabel.NO, DecisionGraph.DENY);
                    } else {
                        addEdge(node, EdgeLabel.YES, DecisionGraph.DENY);
                        addEdge(node, EdgeLabel.NO, DecisionGraph.APPROVE);
                    }
                }

                if (i == 0) {
                    entryNodes.add(node);
                }
                previous = literal;
                previousNode = node;
            }
        }

        /**
         * Virtual literals lead their term so the diagram can expand them from Start.
         * Relative order is otherwise kept.
         */
        private List<Literal> virtualFirst(Term term) {
            if (groupsById.isEmpty()) {
                return term.literals();
            }
            List<Literal> ordered = new ArrayList<>(term.size());
            for (Literal literal : term.literals()) {
                if (groupsById.containsKey(literal.name())) {
                    ordered.add(literal);
                }
            }
            for (Literal literal : term.literals()) {
                if (!groupsById.containsKey(literal.name())) {
                    ordered.add(literal);
                }
            }
            return ordered;
        }

        private String assignNodeId(String name) {
            String id;
            if (!usedIdentifiers.contains(name) && !nodes.containsKey(name)) {
                id = name;
            } else if (isBareNodeOf(name) && !touched.contains(name)) {
                id = name;
            } else {
                id = mint(name);
            }
            usedIdentifiers.add(name);
            nodes.putIfAbsent(id, new GraphNode(id, name, displayText(name), groupsById.containsKey(name)));
            return id;
        }

        private boolean isBareNodeOf(String name) {
            GraphNode node = nodes.get(name);
            return node != null && node.baseName().equals(name);
        }

        private String mint(String name) {
            String id;
            do {
                int n = suffixCounters.merge(name, 1, Integer::sum);
                id = name + "_" + n;
            } while (nodes.containsKey(id) || expansionNodeIds.contains(id));
            return id;
        }

        private void addEdge(String source, EdgeLabel label, String target) {
            edges.add(new GraphEdge(source, label, target));
            touched.add(source);
            touched.add(target);
        }

        private String displayText(String name) {
            String text = questions.get(name);
            return text != null ? text : name;
        }

        void expandGroups() {
            for (String entry : entryNodes) {
                FactorGroup group = groupsById.get(nodes.get(entry).baseName());
                if (group == null) {
                    continue;
                }
                List<GraphNode> members = new ArrayList<>(group.members().size());
                for (String member : group.members()) {
                    String id = nodes.containsKey(member) || expansionNodeIds.contains(member)
                            ? mint(member)
                            : member;
                    expansionNodeIds.add(id);
                    members.add(new GraphNode(id, member, displayText(member), false));
                }
                expansions.add(new GroupExpansion(entry, group, members));
                log.debug("Expanded virtual entry {} into {}", entry, group.members());
            }
        }

        DecisionGraph toGraph() {
            return new DecisionGraph(nodes, edges, entryNodes, expansions);
        }
    }
}
