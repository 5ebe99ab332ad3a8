package com.logic.lgraph.fn.logic;

import com.logic.lgraph.exception.EvaluationException;
import com.logic.lgraph.exception.ValidationException;
import com.logic.lgraph.fn.Fn2;
import com.logic.lgraph.fn.FnN;
import com.logic.lgraph.util.Props;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evaluates a {@link GateType} over numeric inputs.
 *
 * <p>
 * Boolean results are returned as 1/0. Gate parameters come from a property
 * map:
 * <ul>
 * <li>{@code k} for THRESHOLD, EXACTLY and AT_MOST (default 1)</li>
 * <li>{@code maxValue} for the Łukasiewicz and Post gates (default 2)</li>
 * </ul>
 */
public final class GateEvaluator {
    public static final int MAX_TRUTH_TABLE_INPUTS = 20;

    /** Fails with InvalidArity when fewer inputs than the gate's minimum are given. */
    public void validateArity(GateType type, int inputCount) {
        if (inputCount < type.minArity()) {
            throw EvaluationException.invalidArity(type.id(), type.minArity(), inputCount);
        }
    }

    public double evaluate(GateType type, double[] inputs) {
        return evaluate(type, inputs, Collections.emptyMap());
    }

    public double evaluate(GateType type, double[] inputs, Map<String, ?> params) {
        validateArity(type, inputs.length);
        int k = Props.getInt(params, "k", 1);
        double maxValue = Props.getDouble(params, "maxValue", 2);
        return switch (type) {
            case AND -> bit(LogicGates.and(inputs));
            case OR -> bit(LogicGates.or(inputs));
            case NOT -> bit(LogicGates.not(inputs));
            case NAND -> bit(LogicGates.nand(inputs));
            case NOR -> bit(LogicGates.nor(inputs));
            case XOR -> bit(LogicGates.xor(inputs));
            case XNOR -> bit(LogicGates.xnor(inputs));
            case IMPLY -> bit(LogicGates.imply(inputs));
            case NIMPLY -> bit(LogicGates.nimply(inputs));

            case MAJORITY -> bit(ThresholdGates.majority(inputs));
            case MINORITY -> bit(ThresholdGates.minority(inputs));
            case THRESHOLD -> bit(ThresholdGates.atLeast(inputs, k));
            case EXACTLY -> bit(ThresholdGates.exactly(inputs, k));
            case AT_MOST -> bit(ThresholdGates.atMost(inputs, k));

            case LUKASIEWICZ_AND -> MultiValuedGates.lukasiewiczAnd(inputs);
            case LUKASIEWICZ_OR -> MultiValuedGates.lukasiewiczOr(inputs);
            case LUKASIEWICZ_NOT -> MultiValuedGates.lukasiewiczNot(first(inputs), maxValue);
            case LUKASIEWICZ_IMPLY -> MultiValuedGates.lukasiewiczImply(inputs[0], inputs[1], maxValue);
            case POST_CYCLIC_NOT -> MultiValuedGates.postCyclicNot(first(inputs), (int) maxValue + 1);
            case POST_MIN -> MultiValuedGates.postMin(inputs);
            case POST_MAX -> MultiValuedGates.postMax(inputs);
            case TERNARY_AND -> fold(inputs, MultiValuedGates::ternaryAnd);
            case TERNARY_OR -> fold(inputs, MultiValuedGates::ternaryOr);
            case TERNARY_NOT -> MultiValuedGates.ternaryNot(first(inputs));
            case CONSENSUS -> fold(inputs, MultiValuedGates::consensus);
            case QUATERNARY_AND -> MultiValuedGates.quaternaryAnd(inputs);
            case QUATERNARY_OR -> MultiValuedGates.quaternaryOr(inputs);
            case QUATERNARY_NOT -> MultiValuedGates.quaternaryNot(first(inputs));
            case QUATERNARY_AVERAGE -> MultiValuedGates.quaternaryAverage(inputs);

            case MUX -> bit(SpecialGates.mux(inputs));
            case ENCODER -> SpecialGates.encoder(inputs);
            case PARITY -> bit(SpecialGates.parity(inputs));
            case COMPARATOR -> SpecialGates.comparator(inputs[0], inputs[1]);

            case CUSTOM -> throw new EvaluationException("Custom gate requires a truth table");
        };
    }

    /**
     * Clamps every input to [0,1] before evaluating. Used by crisp logic gate
     * nodes, whose upstream values may be arbitrary scores.
     */
    public double evaluateNormalized(GateType type, double[] inputs, Map<String, ?> params) {
        return evaluate(type, normalize(inputs), params);
    }

    /** Copy of {@code inputs} clamped to [0,1]; NaN becomes 0. */
    public static double[] normalize(double[] inputs) {
        double[] normalized = new double[inputs.length];
        for (int i = 0; i < inputs.length; i++)
            normalized[i] = clamp01(inputs[i]);
        return normalized;
    }

    /**
     * Builds a gate backed by a truth table. Keys are input bits in order, e.g.
     * {@code "10"} for (true, false). Missing keys evaluate to 0.
     */
    public FnN customGate(Map<String, Boolean> truthTable) {
        Map<String, Boolean> table = Map.copyOf(truthTable);
        return inputs -> bit(Boolean.TRUE.equals(table.get(truthKey(inputs))));
    }

    /**
     * Enumerates all 2^n input combinations of a gate. Input {@code j} of row
     * {@code i} is bit {@code j} of {@code i}.
     *
     * @throws ValidationException if {@code inputCount} is negative or above
     *                             {@link #MAX_TRUTH_TABLE_INPUTS}.
     */
    public Map<String, Boolean> truthTable(GateType type, int inputCount) {
        if (inputCount < 0 || inputCount > MAX_TRUTH_TABLE_INPUTS)
            throw new ValidationException(
                    "Truth table input count must be in [0, " + MAX_TRUTH_TABLE_INPUTS + "], got " + inputCount);
        Map<String, Boolean> table = new LinkedHashMap<>();
        int combinations = 1 << inputCount;
        double[] row = new double[inputCount];
        for (int i = 0; i < combinations; i++) {
            for (int j = 0; j < inputCount; j++)
                row[j] = (i & (1 << j)) != 0 ? 1 : 0;
            table.put(truthKey(row), evaluate(type, row) != 0);
        }
        return table;
    }

    public static String truthKey(double[] inputs) {
        StringBuilder sb = new StringBuilder(inputs.length);
        for (double v : inputs)
            sb.append(LogicGates.truthy(v) ? '1' : '0');
        return sb.toString();
    }

    static double clamp01(double v) {
        if (Double.isNaN(v))
            return 0;
        return Math.max(0, Math.min(1, v));
    }

    private static double bit(boolean b) {
        return b ? 1 : 0;
    }

    private static double first(double[] inputs) {
        return inputs.length == 0 ? 0 : inputs[0];
    }

    private static double fold(double[] inputs, Fn2 op) {
        double acc = inputs[0];
        for (int i = 1; i < inputs.length; i++)
            acc = op.apply(acc, inputs[i]);
        return acc;
    }
}
