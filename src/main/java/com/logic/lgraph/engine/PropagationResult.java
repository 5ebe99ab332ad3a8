package com.logic.lgraph.engine;

import com.logic.lgraph.graph.NodeError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

/** Immutable outcome of a completed run. */
@Getter
public final class PropagationResult {
    private final StrategyType strategy;
    private final Map<String, Double> results;
    private final List<PropagationStep> steps;
    private final PropagationMetrics metrics;
    private final RunStatus status;
    private final List<NodeError> errors;

    PropagationResult(StrategyType strategy, Map<String, Double> results, List<PropagationStep> steps,
            PropagationMetrics metrics, RunStatus status, List<NodeError> errors) {
        this.strategy = strategy;
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.steps = List.copyOf(steps);
        this.metrics = metrics.snapshot();
        this.status = status;
        this.errors = List.copyOf(errors);
    }

    /** Result of a node, or NaN if the run did not reach it. */
    public double get(String nodeId) {
        Double v = results.get(nodeId);
        return v == null ? Double.NaN : v;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return strategy.id() + " " + status + " " + results + (errors.isEmpty() ? "" : " errors=" + errors);
    }
}
