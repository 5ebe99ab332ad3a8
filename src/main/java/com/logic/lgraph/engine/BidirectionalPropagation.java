package com.logic.lgraph.engine;

import com.logic.lgraph.graph.Graph;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a forward pass from the start nodes and a backward pass from the goal
 * nodes as two tasks on the engine executor, then merges them: forward
 * results win on shared nodes, counters are summed and the step logs are
 * interleaved chronologically.
 *
 * <p>
 * Only the forward pass writes edge state while the passes run. The backward
 * pass keeps its inverted edge values to itself; they are written after the
 * join to the edges the forward pass did not reach.
 */
public final class BidirectionalPropagation extends PropagationStrategy {

    public BidirectionalPropagation(Graph graph) {
        super(graph);
    }

    @Override
    public StrategyType type() {
        return StrategyType.BIDIRECTIONAL;
    }

    @Override
    protected void run(PropagationRequest request) {
        ForwardPropagation forward = new ForwardPropagation(graph);
        BackwardPropagation backward = new BackwardPropagation(graph);
        for (PropagationStrategy pass : List.of(forward, backward)) {
            pass.configure(runId(), listener(), token(), executor());
            pass.nest();
        }

        PropagationRequest forwardRequest = PropagationRequest.of(request.startNodes(), request.inputs());
        PropagationRequest backwardRequest = PropagationRequest.goals(request.goalNodes(), request.targetValues());

        List<PropagationResult> done = joinAll(List.of(
                CompletableFuture.supplyAsync(() -> forward.propagate(forwardRequest), executor()),
                CompletableFuture.supplyAsync(() -> backward.propagate(backwardRequest), executor())));
        PropagationResult f = done.get(0);
        PropagationResult b = done.get(1);

        backward.applyEdgeState(true);
        results.putAll(b.getResults());
        results.putAll(f.getResults());
        visited.addAll(forward.getVisited());
        visited.addAll(backward.getVisited());
        errors.addAll(f.getErrors());
        errors.addAll(b.getErrors());
        metrics.merge(f.getMetrics());
        metrics.merge(b.getMetrics());
        steps.addAll(f.getSteps());
        steps.addAll(b.getSteps());
        steps.sort(PropagationStep.CHRONOLOGICAL);
    }
}
