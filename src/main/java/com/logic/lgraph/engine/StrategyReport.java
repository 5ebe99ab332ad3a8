package com.logic.lgraph.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Per-strategy entry of {@link PropagationEngine#compareStrategies}: metrics and results, or an error. */
public final class StrategyReport {
    private final PropagationMetrics metrics;
    private final Map<String, Double> results;
    private final String error;

    private StrategyReport(PropagationMetrics metrics, Map<String, Double> results, String error) {
        this.metrics = metrics;
        this.results = results;
        this.error = error;
    }

    static StrategyReport success(PropagationResult result) {
        return new StrategyReport(result.getMetrics(), result.getResults(), null);
    }

    static StrategyReport failure(String error) {
        return new StrategyReport(null, Collections.emptyMap(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** Null for failed strategies. */
    public PropagationMetrics getMetrics() {
        return metrics;
    }

    public Map<String, Double> getResults() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? metrics + " " + results : "error: " + error;
    }
}
