package com.logic.lgraph.engine;

import com.logic.lgraph.graph.Edge;
import com.logic.lgraph.graph.Graph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Breadth-first traversal. Unlike {@link ForwardPropagation}, a node receives
 * only the value of the parent that discovered it.
 */
public final class BfsPropagation extends PropagationStrategy {

    public BfsPropagation(Graph graph) {
        super(graph);
    }

    @Override
    public StrategyType type() {
        return StrategyType.BFS;
    }

    @Override
    protected void run(PropagationRequest request) {
        Deque<Visit> queue = new ArrayDeque<>();
        List<String> start = request.startNodes();
        for (int i = 0; i < start.size(); i++)
            queue.add(new Visit(start.get(i), request.inputsFor(i), 0));

        while (!queue.isEmpty()) {
            Visit v = queue.poll();
            if (!visited.add(v.nodeId))
                continue;
            metrics.depth(v.depth);

            double result = evaluateNode(v.nodeId, v.inputs, PropagationStep.BFS_EVALUATE, Map.of("depth", v.depth));
            for (Edge e : graph.outgoingEdges(v.nodeId)) {
                if (!passes(e, result))
                    continue;
                metrics.edgeTraversed();
                double out = e.evaluate(result);
                if (!visited.contains(e.getTarget()))
                    queue.add(new Visit(e.getTarget(), new double[] { out }, v.depth + 1));
            }
        }
    }

    /** A node waiting in the worklist with the input it was discovered with. */
    static final class Visit {
        final String nodeId;
        final double[] inputs;
        final int depth;

        Visit(String nodeId, double[] inputs, int depth) {
            this.nodeId = nodeId;
            this.inputs = inputs;
            this.depth = depth;
        }
    }
}
