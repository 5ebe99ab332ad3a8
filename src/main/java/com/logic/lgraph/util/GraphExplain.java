package com.logic.lgraph.util;

import com.logic.lgraph.engine.PropagationEngine;
import com.logic.lgraph.engine.PropagationResult;
import com.logic.lgraph.graph.Edge;
import com.logic.lgraph.graph.EdgeTransform;
import com.logic.lgraph.graph.Graph;
import com.logic.lgraph.node.Node;

import java.util.List;

/**
 * Diagnostic text for a graph and its last run.
 *
 * <p>
 * Meant for debugging sessions and error logs. Not for hot paths: every call
 * walks the graph and builds strings.
 */
public final class GraphExplain {
    private final Graph graph;
    private final PropagationEngine engine;

    public GraphExplain(Graph graph) {
        this(graph, null);
    }

    public GraphExplain(Graph graph, PropagationEngine engine) {
        this.graph = graph;
        this.engine = engine;
    }

    /** Configuration and current state of a single node. */
    public String explainNode(String nodeId) {
        Node node = graph.requireNode(nodeId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeId).append(" (").append(node.getName()).append(")\n")
                .append("  Kind: ").append(node.getKind().id()).append('\n')
                .append("  Operator: ").append(node.getOperator().id()).append('\n')
                .append("  Layer: ").append(node.getLayer()).append('\n')
                .append("  Branches: ").append(node.getBranchLabels()).append('\n')
                .append("  Value: ").append(node.getState().getValue()).append('\n');
        if (node.getState().hasError())
            sb.append("  Error: ").append(node.getState().getError()).append('\n');
        appendIds(sb, "Parents", graph.parents(nodeId));
        appendIds(sb, "Children", graph.children(nodeId));
        return sb.toString();
    }

    private static void appendIds(StringBuilder sb, String title, List<String> ids) {
        sb.append("  ").append(title).append(" (").append(ids.size()).append("): ")
                .append(String.join(", ", ids)).append('\n');
    }

    /** One-line summary of the engine's last run. */
    public String explainLastRun() {
        if (engine == null)
            return "No engine attached";
        PropagationResult last = engine.getLastResult();
        if (last == null)
            return "No run yet";
        return "Run " + engine.runCount() + " [" + last.getStrategy().id() + "] " + last.getStatus()
                + ", evaluated " + last.getMetrics().getNodesEvaluated() + "/" + graph.getNodes().size()
                + ", errors " + last.getErrors().size();
    }

    /** Every node with its outgoing edges, in insertion order. */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph ").append(graph.getName()).append(" (").append(graph.getNodes().size())
                .append(" nodes, ").append(graph.getEdges().size()).append(" edges):\n");
        for (Node node : graph.getNodes().values()) {
            sb.append("  ").append(node.getId()).append(" [").append(node.getKind().id()).append(']');
            List<Edge> out = graph.outgoingEdges(node.getId());
            if (graph.incomingEdges(node.getId()).isEmpty())
                sb.append(" (SRC)");
            if (!out.isEmpty()) {
                sb.append(" -> ");
                for (int i = 0; i < out.size(); i++) {
                    Edge e = out.get(i);
                    sb.append(e.getTarget());
                    if (e.getTransform() != EdgeTransform.DIRECT)
                        sb.append('(').append(e.getTransform().id()).append(')');
                    if (i < out.size() - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /** Mermaid flowchart of the graph with the current node values. */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");
        for (Node node : graph.getNodes().values()) {
            double v = node.getState().getValue();
            String value = Double.isNaN(v) ? "-" : String.format("%.4f", v);
            sb.append("  ").append(sanitize(node.getId())).append("[\"").append(node.getName())
                    .append("<br/>").append(node.getOperator().id()).append("<br/><b>").append(value)
                    .append("</b>\"];\n");
        }
        for (Edge e : graph.getEdges().values()) {
            sb.append("  ").append(sanitize(e.getSource()));
            if (!e.getLabel().isEmpty())
                sb.append(" -- \"").append(e.getLabel()).append("\" --> ");
            else
                sb.append(" --> ");
            sb.append(sanitize(e.getTarget())).append(";\n");
        }
        return sb.toString();
    }

    private static String sanitize(String id) {
        return id.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
