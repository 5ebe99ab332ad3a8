package com.logic.lgraph.fn.fuzzy;

import com.logic.lgraph.fn.fuzzy.FuzzyInferenceSystem.RuleActivation;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Intermediate and final values of one {@link FuzzyInferenceSystem#infer} call. */
public final class InferenceResult {
    private final Map<String, Map<String, Double>> fuzzifiedInputs;
    private final List<RuleActivation> ruleActivations;
    private final Map<String, Map<String, Double>> aggregatedOutputs;
    private final Map<String, Double> crispOutputs;

    InferenceResult(Map<String, Map<String, Double>> fuzzifiedInputs, List<RuleActivation> ruleActivations,
            Map<String, Map<String, Double>> aggregatedOutputs, Map<String, Double> crispOutputs) {
        this.fuzzifiedInputs = Collections.unmodifiableMap(fuzzifiedInputs);
        this.ruleActivations = Collections.unmodifiableList(ruleActivations);
        this.aggregatedOutputs = Collections.unmodifiableMap(aggregatedOutputs);
        this.crispOutputs = Collections.unmodifiableMap(crispOutputs);
    }

    public Map<String, Map<String, Double>> fuzzifiedInputs() {
        return fuzzifiedInputs;
    }

    public List<RuleActivation> ruleActivations() {
        return ruleActivations;
    }

    public Map<String, Map<String, Double>> aggregatedOutputs() {
        return aggregatedOutputs;
    }

    public Map<String, Double> crispOutputs() {
        return crispOutputs;
    }

    /** Crisp value of an output variable, or NaN when no rule reached it. */
    public double crisp(String variable) {
        Double v = crispOutputs.get(variable);
        return v == null ? Double.NaN : v;
    }
}
