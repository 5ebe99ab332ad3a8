package com.logic.lgraph.node;

import com.logic.lgraph.api.MembershipFunction;
import com.logic.lgraph.api.NodeEvaluator;
import com.logic.lgraph.exception.EvaluationException;
import com.logic.lgraph.fn.fuzzy.FuzzyGateEvaluator;
import com.logic.lgraph.fn.fuzzy.FuzzyGateType;
import com.logic.lgraph.fn.logic.GateEvaluator;
import com.logic.lgraph.fn.logic.GateType;
import com.logic.lgraph.util.Props;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Standard evaluation of every {@link NodeKind}.
 *
 * <ul>
 * <li>LOGIC_GATE: arity check, then the truth table if the node has one (a
 * missing row is 0), else the gate over inputs clamped to [0,1].</li>
 * <li>FUZZY_GATE: inputs mapped through the node's membership function if
 * set, then clamped to [0,1]. With two branches the result is thresholded at
 * {@code fuzzyThreshold} (default 0.5); otherwise [0,1] is split into
 * {@code branchCount} equal intervals and the interval index is returned.</li>
 * <li>PROBABILISTIC: samples a branch index from the node's distribution; 0
 * without one.</li>
 * <li>MULTI_VALUED: the multi-valued gate on raw inputs.</li>
 * <li>DECISION, HYBRID, STATISTICAL: the custom function if set; otherwise the
 * (weighted) mean plus bias is scored and bucketed by the thresholds.</li>
 * </ul>
 */
public final class DefaultNodeEvaluator implements NodeEvaluator {
    public static final double DEFAULT_FUZZY_THRESHOLD = 0.5;

    private final GateEvaluator gates = new GateEvaluator();
    private final FuzzyGateEvaluator fuzzy = new FuzzyGateEvaluator();
    private final Random random;

    public DefaultNodeEvaluator() {
        this(new Random());
    }

    /** @param random Source for probabilistic nodes; seed it for reproducible runs. */
    public DefaultNodeEvaluator(Random random) {
        this.random = random;
    }

    @Override
    public double evaluate(Node node, double[] inputs) {
        return switch (node.getKind()) {
            case LOGIC_GATE -> evaluateGate(node, inputs);
            case FUZZY_GATE -> evaluateFuzzy(node, inputs);
            case PROBABILISTIC -> sample(node.getProbabilities());
            case MULTI_VALUED -> gates.evaluate((GateType) node.getOperator(), inputs, node.getMetadata());
            case DECISION, HYBRID, STATISTICAL -> evaluateDecision(node, inputs);
        };
    }

    private double evaluateGate(Node node, double[] inputs) {
        GateType type = (GateType) node.getOperator();
        gates.validateArity(type, inputs.length);
        if (node.getTruthTable() != null) {
            String key = GateEvaluator.truthKey(GateEvaluator.normalize(inputs));
            return Boolean.TRUE.equals(node.getTruthTable().get(key)) ? 1 : 0;
        }
        return gates.evaluateNormalized(type, inputs, node.getMetadata());
    }

    private double evaluateFuzzy(Node node, double[] inputs) {
        double[] degrees = inputs;
        MembershipFunction mf = node.getMembership();
        if (mf != null) {
            degrees = new double[inputs.length];
            for (int i = 0; i < inputs.length; i++)
                degrees[i] = mf.degree(inputs[i]);
        }
        Map<String, Object> params = new LinkedHashMap<>(node.getMetadata());
        if (node.getWeights().length > 0)
            params.putIfAbsent("weights", node.getWeights());
        double result = fuzzy.evaluate((FuzzyGateType) node.getOperator(), degrees, params);

        int branches = node.getBranchCount();
        if (branches == 2) {
            double threshold = Props.getDouble(node.getMetadata(), "fuzzyThreshold", DEFAULT_FUZZY_THRESHOLD);
            return result >= threshold ? 1 : 0;
        }
        double step = 1.0 / branches;
        for (int i = 0; i < branches; i++) {
            if (result <= (i + 1) * step)
                return i;
        }
        return branches - 1;
    }

    private double sample(double[] distribution) {
        if (distribution == null || distribution.length == 0)
            return 0;
        double u = random.nextDouble();
        double cumulative = 0;
        for (int i = 0; i < distribution.length; i++) {
            cumulative += distribution[i];
            if (u <= cumulative)
                return i;
        }
        return distribution.length - 1;
    }

    private double evaluateDecision(Node node, double[] inputs) {
        if (node.getCustomFunction() != null)
            return node.getCustomFunction().apply(inputs.clone());

        double score = score(node, mean(inputs, node.getWeights()) + node.getBias());
        double[] thresholds = node.getThresholds();
        for (int i = 0; i < thresholds.length; i++) {
            if (score < thresholds[i])
                return i;
        }
        return thresholds.length;
    }

    private static double score(Node node, double x) {
        if (node.getScoring() == ScoringFunction.CUSTOM) {
            if (node.getCustomScoring() == null)
                throw new EvaluationException("Node " + node.getId() + ": custom scoring selected but no function set");
            return node.getCustomScoring().applyAsDouble(x);
        }
        return node.getScoring().apply(x);
    }

    /** Weighted when the weights line up with the inputs, plain mean otherwise. 0 for no inputs. */
    static double mean(double[] inputs, double[] weights) {
        if (inputs.length == 0)
            return 0;
        if (weights.length == inputs.length) {
            double sum = 0, weightSum = 0;
            for (int i = 0; i < inputs.length; i++) {
                sum += inputs[i] * weights[i];
                weightSum += weights[i];
            }
            return weightSum == 0 ? 0 : sum / weightSum;
        }
        double sum = 0;
        for (double v : inputs)
            sum += v;
        return sum / inputs.length;
    }
}
