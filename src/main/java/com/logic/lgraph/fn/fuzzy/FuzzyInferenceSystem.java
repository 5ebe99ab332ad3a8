package com.logic.lgraph.fn.fuzzy;

import com.logic.lgraph.api.MembershipFunction;
import com.logic.lgraph.exception.ValidationException;
import com.logic.lgraph.fn.Fn2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Mamdani fuzzy inference.
 *
 * <p>
 * {@link #infer(Map)} runs four stages:
 * <ol>
 * <li>Fuzzify: every term of every known input variable is evaluated.</li>
 * <li>Rules: the antecedent degrees are folded with the rule T-norm and scaled
 * by the rule weight. Rules that do not fire are dropped.</li>
 * <li>Aggregate: activations per output variable and term are folded with the
 * S-norm.</li>
 * <li>Defuzzify: the clipped terms are combined into one curve, sampled over
 * the variable's range.</li>
 * </ol>
 *
 * <p>
 * Defaults are MIN / MAX / MAMDANI / COG at resolution 100. Not thread-safe
 * while being configured; {@code infer} itself does not mutate the system.
 */
@Log4j2
public final class FuzzyInferenceSystem {
    public static final int DEFAULT_RESOLUTION = 100;

    private final Map<String, LinguisticVariable> inputs = new LinkedHashMap<>();
    private final Map<String, LinguisticVariable> outputs = new LinkedHashMap<>();
    private final List<Rule> rules = new ArrayList<>();

    private Fn2 tNorm = TNorm.MIN;
    private Fn2 sNorm = SNorm.MAX;
    private Fn2 implication = Implication.MAMDANI;
    private Defuzzifier defuzzifier = Defuzzifier.COG;
    private int resolution = DEFAULT_RESOLUTION;

    public FuzzyInferenceSystem tNorm(Fn2 tNorm) {
        this.tNorm = tNorm;
        return this;
    }

    public FuzzyInferenceSystem sNorm(Fn2 sNorm) {
        this.sNorm = sNorm;
        return this;
    }

    public FuzzyInferenceSystem implication(Fn2 implication) {
        this.implication = implication;
        return this;
    }

    public FuzzyInferenceSystem defuzzifier(Defuzzifier defuzzifier) {
        this.defuzzifier = defuzzifier;
        return this;
    }

    public FuzzyInferenceSystem resolution(int resolution) {
        if (resolution < 1)
            throw new ValidationException("Resolution must be positive: " + resolution);
        this.resolution = resolution;
        return this;
    }

    public FuzzyInferenceSystem addInput(String name, double min, double max, Map<String, MembershipFunction> terms) {
        inputs.put(name, new LinguisticVariable(name, min, max, terms));
        return this;
    }

    public FuzzyInferenceSystem addOutput(String name, double min, double max,
            Map<String, MembershipFunction> terms) {
        if (min > max)
            throw new ValidationException("Output range is empty for " + name + ": [" + min + ", " + max + "]");
        outputs.put(name, new LinguisticVariable(name, min, max, terms));
        return this;
    }

    public FuzzyInferenceSystem addRule(Map<String, String> antecedent, Map<String, String> consequent) {
        return addRule(antecedent, consequent, 1.0);
    }

    public FuzzyInferenceSystem addRule(Map<String, String> antecedent, Map<String, String> consequent,
            double weight) {
        if (weight < 0 || Double.isNaN(weight))
            throw new ValidationException("Rule weight must be non-negative: " + weight);
        rules.add(new Rule(antecedent, consequent, weight));
        return this;
    }

    public List<Rule> rules() {
        return Collections.unmodifiableList(rules);
    }

    public InferenceResult infer(Map<String, Double> inputValues) {
        Map<String, Map<String, Double>> fuzzified = fuzzify(inputValues);
        List<RuleActivation> activations = evaluateRules(fuzzified);
        Map<String, Map<String, Double>> aggregated = aggregate(activations);
        Map<String, Double> crisp = defuzzify(aggregated);
        log.debug("Inference fired {}/{} rules -> {}", activations.size(), rules.size(), crisp);
        return new InferenceResult(fuzzified, activations, aggregated, crisp);
    }

    Map<String, Map<String, Double>> fuzzify(Map<String, Double> inputValues) {
        Map<String, Map<String, Double>> fuzzified = new LinkedHashMap<>();
        inputValues.forEach((name, value) -> {
            LinguisticVariable variable = inputs.get(name);
            if (variable == null || value == null)
                return;
            Map<String, Double> degrees = new LinkedHashMap<>();
            variable.terms.forEach((term, mf) -> degrees.put(term, mf.degree(value)));
            fuzzified.put(name, degrees);
        });
        return fuzzified;
    }

    List<RuleActivation> evaluateRules(Map<String, Map<String, Double>> fuzzified) {
        List<RuleActivation> fired = new ArrayList<>();
        for (Rule rule : rules) {
            double activation = 0;
            boolean first = true;
            for (var clause : rule.antecedent.entrySet()) {
                Map<String, Double> degrees = fuzzified.get(clause.getKey());
                Double degree = degrees == null ? null : degrees.get(clause.getValue());
                if (degree == null)
                    continue;
                activation = first ? degree : tNorm.apply(activation, degree);
                first = false;
            }
            activation *= rule.weight;
            if (activation > 0)
                fired.add(new RuleActivation(rule.consequent, activation));
        }
        return fired;
    }

    Map<String, Map<String, Double>> aggregate(List<RuleActivation> activations) {
        Map<String, Map<String, Double>> aggregated = new LinkedHashMap<>();
        for (RuleActivation ra : activations) {
            ra.consequent.forEach((variable, term) -> {
                Map<String, Double> terms = aggregated.computeIfAbsent(variable, k -> new LinkedHashMap<>());
                terms.put(term, sNorm.apply(terms.getOrDefault(term, 0.0), ra.activation));
            });
        }
        return aggregated;
    }

    Map<String, Double> defuzzify(Map<String, Map<String, Double>> aggregated) {
        Map<String, Double> crisp = new LinkedHashMap<>();
        aggregated.forEach((name, termActivations) -> {
            LinguisticVariable variable = outputs.get(name);
            if (variable == null)
                return;
            crisp.put(name, defuzzifier.defuzzify(x -> {
                double m = 0;
                for (var e : termActivations.entrySet()) {
                    MembershipFunction mf = variable.terms.get(e.getKey());
                    if (mf != null)
                        m = sNorm.apply(m, implication.apply(e.getValue(), mf.degree(x)));
                }
                return m;
            }, variable.min, variable.max, resolution));
        });
        return crisp;
    }

    /** A named variable over [min, max] with its linguistic terms. */
    public static final class LinguisticVariable {
        private final String name;
        private final double min, max;
        private final Map<String, MembershipFunction> terms;

        LinguisticVariable(String name, double min, double max, Map<String, MembershipFunction> terms) {
            this.name = name;
            this.min = min;
            this.max = max;
            this.terms = new LinkedHashMap<>(terms);
        }

        public String name() {
            return name;
        }

        public double min() {
            return min;
        }

        public double max() {
            return max;
        }

        public Map<String, MembershipFunction> terms() {
            return Collections.unmodifiableMap(terms);
        }
    }

    /** IF antecedent THEN consequent, both as variable-to-term maps. */
    public static final class Rule {
        private final Map<String, String> antecedent;
        private final Map<String, String> consequent;
        private final double weight;

        Rule(Map<String, String> antecedent, Map<String, String> consequent, double weight) {
            this.antecedent = new LinkedHashMap<>(antecedent);
            this.consequent = new LinkedHashMap<>(consequent);
            this.weight = weight;
        }

        public Map<String, String> antecedent() {
            return Collections.unmodifiableMap(antecedent);
        }

        public Map<String, String> consequent() {
            return Collections.unmodifiableMap(consequent);
        }

        public double weight() {
            return weight;
        }
    }

    /** A rule that fired, with its weighted activation. */
    public static final class RuleActivation {
        private final Map<String, String> consequent;
        private final double activation;

        RuleActivation(Map<String, String> consequent, double activation) {
            this.consequent = consequent;
            this.activation = activation;
        }

        public Map<String, String> consequent() {
            return Collections.unmodifiableMap(consequent);
        }

        public double activation() {
            return activation;
        }

        @Override
        public String toString() {
            return consequent + "@" + activation;
        }
    }
}
