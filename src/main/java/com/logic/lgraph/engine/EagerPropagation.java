package com.logic.lgraph.engine;

import com.logic.lgraph.exception.StructuralException;
import com.logic.lgraph.graph.Graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Evaluates every node once, in dependency order when the graph has one. On a
 * cyclic graph it falls back to insertion order instead of failing: the
 * fallback is logged at WARN and recorded as a {@code fallback} step, and
 * nodes inside a cycle then see only the values pushed before them.
 */
@Log4j2
public final class EagerPropagation extends PropagationStrategy {

    public EagerPropagation(Graph graph) {
        super(graph);
    }

    @Override
    public StrategyType type() {
        return StrategyType.EAGER;
    }

    @Override
    protected void run(PropagationRequest request) {
        List<String> order;
        try {
            order = graph.topologicalSort();
        } catch (StructuralException e) {
            log.warn("Graph {} has no topological order, evaluating in insertion order: {}", graph.getName(),
                    e.getMessage());
            order = new ArrayList<>(graph.getNodes().keySet());
            recordStep(graph.getId(), PropagationStep.FALLBACK, Double.NaN, Map.of("reason", e.getMessage()));
        }

        Map<String, List<Double>> pending = seedInputs(request);
        for (String nodeId : order) {
            visited.add(nodeId);
            double result = evaluateNode(nodeId, toArray(pending.get(nodeId)), PropagationStep.EAGER_EVALUATE, null);
            pushToChildren(nodeId, result, pending);
        }
    }
}
