package com.logic.lgraph.fn.logic;

import com.logic.lgraph.exception.ValidationException;

/**
 * Selector, coder and comparison gates.
 */
public final class SpecialGates {
    private SpecialGates() {
        // Utility class
    }

    /**
     * Multiplexer: {@code inputs[0]} selects one of the remaining inputs.
     * An out of range selector yields false.
     */
    public static boolean mux(double[] inputs) {
        if (inputs.length < 2)
            return false;
        int dataIndex = (int) Math.floor(inputs[0]) + 1;
        return dataIndex >= 1 && dataIndex < inputs.length && LogicGates.truthy(inputs[dataIndex]);
    }

    /** Routes {@code data} to output {@code selector mod outputCount}; the rest are 0. */
    public static double[] demux(double selector, double data, int outputCount) {
        requireOutputs(outputCount);
        double[] outputs = new double[outputCount];
        outputs[Math.floorMod((int) Math.floor(selector), outputCount)] = data;
        return outputs;
    }

    /** Index of the first true input, or 0 if none. */
    public static int encoder(double[] inputs) {
        for (int i = 0; i < inputs.length; i++)
            if (LogicGates.truthy(inputs[i]))
                return i;
        return 0;
    }

    /** One-hot vector with position {@code value mod outputCount} set. */
    public static double[] decoder(double value, int outputCount) {
        requireOutputs(outputCount);
        double[] outputs = new double[outputCount];
        outputs[Math.floorMod((int) Math.floor(value), outputCount)] = 1;
        return outputs;
    }

    /** Even parity bit: true when the number of true inputs is even. */
    public static boolean parity(double[] inputs) {
        return ThresholdGates.trueCount(inputs) % 2 == 0;
    }

    /** -1 if a &lt; b, 1 if a &gt; b, else 0. */
    public static int comparator(double a, double b) {
        if (a < b)
            return -1;
        return a > b ? 1 : 0;
    }

    private static void requireOutputs(int outputCount) {
        if (outputCount < 1)
            throw new ValidationException("Output count must be at least 1, got " + outputCount);
    }
}
