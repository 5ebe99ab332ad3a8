package com.logic.lgraph.fn.logic;

/**
 * Standard boolean gates over numeric inputs. Any non-zero value is true.
 */
public final class LogicGates {
    private LogicGates() {
        // Utility class
    }

    static boolean truthy(double v) {
        return v != 0.0 && !Double.isNaN(v);
    }

    /** All inputs true. Empty input is false. */
    public static boolean and(double[] inputs) {
        if (inputs.length == 0)
            return false;
        for (double v : inputs)
            if (!truthy(v))
                return false;
        return true;
    }

    /** At least one input true. Empty input is false. */
    public static boolean or(double[] inputs) {
        for (double v : inputs)
            if (truthy(v))
                return true;
        return false;
    }

    /** Inverts the first input; an empty input yields true. */
    public static boolean not(double[] inputs) {
        return inputs.length == 0 || !truthy(inputs[0]);
    }

    public static boolean nand(double[] inputs) {
        return !and(inputs);
    }

    public static boolean nor(double[] inputs) {
        return !or(inputs);
    }

    /** Odd parity. */
    public static boolean xor(double[] inputs) {
        boolean result = false;
        for (double v : inputs)
            result ^= truthy(v);
        return result;
    }

    /** Even parity. */
    public static boolean xnor(double[] inputs) {
        return !xor(inputs);
    }

    /** Material implication A -> B. */
    public static boolean imply(double[] inputs) {
        if (inputs.length < 2)
            return true;
        return !truthy(inputs[0]) || truthy(inputs[1]);
    }

    /** A AND NOT B. */
    public static boolean nimply(double[] inputs) {
        if (inputs.length < 2)
            return false;
        return truthy(inputs[0]) && !truthy(inputs[1]);
    }
}
