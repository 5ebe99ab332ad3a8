package com.logic.lgraph.engine;

import com.logic.lgraph.graph.Graph;

import java.util.List;
import java.util.Map;

/**
 * Evaluates every node of the graph once, each after all of its parents.
 * Fails with a CYCLIC_GRAPH {@link com.logic.lgraph.exception.StructuralException}
 * before evaluating anything if the graph has a cycle.
 */
public final class TopologicalPropagation extends PropagationStrategy {

    public TopologicalPropagation(Graph graph) {
        super(graph);
    }

    @Override
    public StrategyType type() {
        return StrategyType.TOPOLOGICAL;
    }

    @Override
    protected void run(PropagationRequest request) {
        TopologicalOrder topology = TopologicalOrder.of(graph);
        Map<String, List<Double>> pending = seedInputs(request);
        int n = topology.nodeCount();
        int[] depth = new int[n];

        for (int ti = 0; ti < n; ti++) {
            String nodeId = topology.nodeId(ti);
            visited.add(nodeId);
            metrics.depth(depth[ti]);
            double result = evaluateNode(nodeId, toArray(pending.get(nodeId)), PropagationStep.TOPOLOGICAL_EVALUATE,
                    null);
            pushToChildren(nodeId, result, pending);

            for (int i = 0; i < topology.childCount(ti); i++) {
                int child = topology.child(ti, i);
                depth[child] = Math.max(depth[child], depth[ti] + 1);
            }
        }
    }
}
