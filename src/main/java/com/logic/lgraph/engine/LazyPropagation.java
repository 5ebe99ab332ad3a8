package com.logic.lgraph.engine;

import com.logic.lgraph.exception.StructuralException;
import com.logic.lgraph.graph.Edge;
import com.logic.lgraph.graph.Graph;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Demand-driven propagation. A run resolves the goal nodes (or the start
 * nodes when no goals are given) through {@link #getValue(String)}, which
 * pulls every parent first and memoises each node, so a node is evaluated at
 * most once per run however many dependents ask for it.
 *
 * <p>
 * Start nodes given inputs by the caller use them instead of pulling their
 * parents. A dependency cycle met while resolving fails the run with a
 * CYCLIC_GRAPH {@link StructuralException}.
 */
public final class LazyPropagation extends PropagationStrategy {
    private final Map<String, double[]> provided = new HashMap<>();
    // Nodes whose resolution is in progress, outermost first
    private final Set<String> resolving = new LinkedHashSet<>();

    public LazyPropagation(Graph graph) {
        super(graph);
    }

    @Override
    public StrategyType type() {
        return StrategyType.LAZY;
    }

    @Override
    public void reset() {
        super.reset();
        provided.clear();
        resolving.clear();
    }

    @Override
    protected void run(PropagationRequest request) {
        List<String> start = request.startNodes();
        for (int i = 0; i < start.size(); i++) {
            if (request.hasInputsFor(i))
                provided.put(start.get(i), request.inputsFor(i));
        }
        for (String target : request.effectiveGoals())
            getValue(target);
    }

    /**
     * Value of a node in the current run, evaluating it and its ancestors on
     * first request.
     *
     * @throws StructuralException (CYCLIC_GRAPH) if the node depends on itself.
     */
    public double getValue(String nodeId) {
        Double memo = results.get(nodeId);
        if (memo != null)
            return memo;
        graph.requireNode(nodeId);
        if (!resolving.add(nodeId)) {
            throw new StructuralException(StructuralException.Kind.CYCLIC_GRAPH,
                    "Cyclic dependency while resolving " + nodeId + ": " + resolving);
        }
        metrics.depth(resolving.size() - 1);

        double[] inputs = provided.get(nodeId);
        if (inputs == null) {
            List<Edge> incoming = graph.incomingEdges(nodeId);
            double[] buf = new double[incoming.size()];
            int n = 0;
            for (Edge e : incoming) {
                double upstream = getValue(e.getSource());
                metrics.edgeTraversed();
                if (passes(e, upstream))
                    buf[n++] = e.evaluate(upstream);
            }
            inputs = Arrays.copyOf(buf, n);
        }

        visited.add(nodeId);
        double result = evaluateNode(nodeId, inputs, PropagationStep.LAZY_EVALUATE, null);
        resolving.remove(nodeId);
        return result;
    }
}
