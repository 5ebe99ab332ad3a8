package com.logic.lgraph.engine;

import com.logic.lgraph.graph.Graph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Worklist propagation from the start nodes.
 *
 * <p>
 * Nodes are taken FIFO and evaluated once, with every value pushed to them so
 * far, in the order the edges were traversed (not by target port). Each result
 * then flows through the node's passing outgoing edges; targets not yet
 * visited are queued.
 */
public final class ForwardPropagation extends PropagationStrategy {

    public ForwardPropagation(Graph graph) {
        super(graph);
    }

    @Override
    public StrategyType type() {
        return StrategyType.FORWARD;
    }

    @Override
    protected void run(PropagationRequest request) {
        Deque<String> queue = new ArrayDeque<>(request.startNodes());
        Map<String, List<Double>> pending = seedInputs(request);
        Map<String, Integer> depth = new HashMap<>();

        while (!queue.isEmpty()) {
            String nodeId = queue.poll();
            if (!visited.add(nodeId))
                continue;
            int d = depth.getOrDefault(nodeId, 0);
            metrics.depth(d);

            double result = evaluateNode(nodeId, toArray(pending.get(nodeId)), PropagationStep.EVALUATE, null);
            for (String target : pushToChildren(nodeId, result, pending)) {
                if (!visited.contains(target)) {
                    queue.add(target);
                    depth.putIfAbsent(target, d + 1);
                }
            }
        }
    }
}
