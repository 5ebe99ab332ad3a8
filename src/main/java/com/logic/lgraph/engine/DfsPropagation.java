package com.logic.lgraph.engine;

import com.logic.lgraph.graph.Edge;
import com.logic.lgraph.graph.Graph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Depth-first traversal with an explicit stack. Start nodes and children are
 * pushed in reverse so they are visited left to right. A node receives only
 * the value of the parent that discovered it.
 */
public final class DfsPropagation extends PropagationStrategy {

    public DfsPropagation(Graph graph) {
        super(graph);
    }

    @Override
    public StrategyType type() {
        return StrategyType.DFS;
    }

    @Override
    protected void run(PropagationRequest request) {
        Deque<BfsPropagation.Visit> stack = new ArrayDeque<>();
        List<String> start = request.startNodes();
        for (int i = start.size() - 1; i >= 0; i--)
            stack.push(new BfsPropagation.Visit(start.get(i), request.inputsFor(i), 0));

        while (!stack.isEmpty()) {
            BfsPropagation.Visit v = stack.pop();
            if (!visited.add(v.nodeId))
                continue;
            metrics.depth(v.depth);

            double result = evaluateNode(v.nodeId, v.inputs, PropagationStep.DFS_EVALUATE, Map.of("depth", v.depth));
            List<Edge> outgoing = graph.outgoingEdges(v.nodeId);
            for (int i = outgoing.size() - 1; i >= 0; i--) {
                Edge e = outgoing.get(i);
                if (!passes(e, result))
                    continue;
                metrics.edgeTraversed();
                double out = e.evaluate(result);
                if (!visited.contains(e.getTarget()))
                    stack.push(new BfsPropagation.Visit(e.getTarget(), new double[] { out }, v.depth + 1));
            }
        }
    }
}
