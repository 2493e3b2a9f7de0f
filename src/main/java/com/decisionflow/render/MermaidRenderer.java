package com.decisionflow.render;

import com.decisionflow.graph.DecisionGraph;
import com.decisionflow.graph.GraphEdge;
import com.decisionflow.graph.GraphNode;
import com.decisionflow.graph.GroupExpansion;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a decision graph as a Mermaid flowchart.
 * Virtual entry nodes are expanded into their member questions.
 */
public class MermaidRenderer implements GraphRenderer {

    static final String INIT_DIRECTIVE =
            "%%{init: {'flowchart': {'rankSpacing': 25, 'nodeSpacing': 50, 'padding': 5}}}%%";
    static final String DIRECTION = "flowchart TD";

    static final List<String> STYLES = List.of(
            "classDef default fill:#f0f0f0,stroke:#333,stroke-width:1px,color:black",
            "classDef start fill:#FFA500,stroke:#333,color:white",
            "classDef approval fill:#4CAF50,stroke:#333,color:white",
            "classDef rejection fill:#DC143C,stroke:#333,color:white",
            "classDef virtual fill:#87CEEB,stroke:#333,color:black",
            "class Start start",
            "class Approve approval",
            "class Deny rejection",
            "linkStyle default stroke:#333,stroke-width:2px"
    );

    @Override
    public String render(DecisionGraph graph) {
        List<String> lines = new ArrayList<>();
        lines.add(INIT_DIRECTIVE);
        lines.add(DIRECTION);

        lines.add(declare(DecisionGraph.START, "Start", false));
        for (GraphNode node : graph.getNodes()) {
            lines.add(declare(node.id(), node.text(), node.virtual()));
        }
        for (GroupExpansion expansion : graph.getExpansions()) {
            for (GraphNode member : expansion.members()) {
                lines.add(declare(member.id(), member.text(), false));
            }
        }
        lines.add(declare(DecisionGraph.APPROVE, DecisionGraph.TERMINALS.get(DecisionGraph.APPROVE), false));
        lines.add(declare(DecisionGraph.DENY, DecisionGraph.TERMINALS.get(DecisionGraph.DENY), false));

        for (String entry : graph.getEntryNodes()) {
            GroupExpansion expansion = graph.getExpansion(entry);
            if (expansion == null) {
                lines.add(DecisionGraph.START + " --> " + entry);
            } else {
                for (GraphNode member : expansion.members()) {
                    lines.add(DecisionGraph.START + " --> " + member.id());
                }
            }
        }

        for (GroupExpansion expansion : graph.getExpansions()) {
            for (GraphEdge edge : expansion.edges()) {
                lines.add(connect(edge));
            }
        }
        for (GraphEdge edge : graph.getEdges()) {
            lines.add(connect(edge));
        }

        lines.addAll(STYLES);
        return String.join("\n", lines);
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.DIAGRAM;
    }

    private String declare(String id, String text, boolean virtual) {
        return id + "[\"" + escape(text) + "\"]" + (virtual ? ":::virtual" : "");
    }

    private String connect(GraphEdge edge) {
        return edge.source() + " -->|" + edge.label().label() + "| " + edge.target();
    }

    private String escape(String text) {
        return text.replace("\"", "#quot;")
                .replace("\r\n", "<br/>")
                .replace("\n", "<br/>");
    }
}
