package com.logic.lgraph.engine;

import com.logic.lgraph.exception.EvaluationException;
import com.logic.lgraph.graph.Edge;
import com.logic.lgraph.graph.Graph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Goal seeking: starts from the goal nodes with their target values and walks
 * incoming edges, inverting each edge transform to get the value implied at
 * the parent. When several children imply a value for the same parent, the
 * last edge walked wins.
 *
 * <p>
 * Nodes are not evaluated, so node state is left alone. An edge whose inverse
 * is undefined (scaling transform with weight 0) is recorded as an error of
 * its source node and the parent is not reached through it.
 *
 * <p>
 * Inverted edge values are kept by the pass and written to the edges when the
 * run ends. As a sub-pass of a bidirectional run they are left for the owner
 * to write with {@link #applyEdgeState(boolean)}.
 */
public final class BackwardPropagation extends PropagationStrategy {
    private final Map<Edge, Double> edgeValues = new LinkedHashMap<>();
    private final Map<Edge, String> edgeErrors = new LinkedHashMap<>();

    public BackwardPropagation(Graph graph) {
        super(graph);
    }

    @Override
    public StrategyType type() {
        return StrategyType.BACKWARD;
    }

    @Override
    public void reset() {
        super.reset();
        edgeValues.clear();
        edgeErrors.clear();
    }

    @Override
    protected void run(PropagationRequest request) {
        List<String> goals = request.effectiveGoals();
        Deque<String> queue = new ArrayDeque<>(goals);
        Map<String, Double> targets = new HashMap<>();
        Map<String, Integer> depth = new HashMap<>();
        for (int i = 0; i < goals.size(); i++)
            targets.put(goals.get(i), request.targetFor(i));

        while (!queue.isEmpty()) {
            String nodeId = queue.poll();
            if (!visited.add(nodeId))
                continue;
            token().throwIfCancelled(nodeId);
            int d = depth.getOrDefault(nodeId, 0);
            metrics.depth(d);

            double target = targets.get(nodeId);
            results.put(nodeId, target);
            metrics.nodeEvaluated();
            recordStep(nodeId, PropagationStep.BACKWARD_EVALUATE, target, Map.of("depth", d));
            if (listener() != null)
                listener().onNodeEvaluated(runId(), nodeId, target, 0);

            for (Edge e : graph.incomingEdges(nodeId)) {
                metrics.edgeTraversed();
                String parent = e.getSource();
                double implied;
                try {
                    implied = e.inverse(target);
                } catch (EvaluationException ex) {
                    edgeErrors.put(e, ex.getMessage());
                    recordEdgeError(e, parent, ex.getMessage());
                    continue;
                }
                edgeValues.put(e, implied);
                targets.put(parent, implied);
                if (!visited.contains(parent)) {
                    queue.add(parent);
                    depth.putIfAbsent(parent, d + 1);
                }
            }
        }
        if (!isNested())
            applyEdgeState(false);
    }

    /**
     * Writes the inverted values and inversion errors of the last run to the
     * edges. Must not run while another pass writes edge state.
     *
     * @param keepActive leave edges another pass has already set active
     */
    void applyEdgeState(boolean keepActive) {
        edgeValues.forEach((e, v) -> {
            if (!keepActive || !e.getState().isActive())
                e.record(v);
        });
        edgeErrors.forEach((e, message) -> {
            if (e.getState().getError() == null)
                e.getState().setError(message);
        });
    }
}
