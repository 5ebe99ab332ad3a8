package com.logic.lgraph.fn.logic;

/**
 * Counting gates: majority, minority and the k-of-n family.
 */
public final class ThresholdGates {
    private ThresholdGates() {
        // Utility class
    }

    static int trueCount(double[] inputs) {
        int n = 0;
        for (double v : inputs)
            if (LogicGates.truthy(v))
                n++;
        return n;
    }

    /** More than half of the inputs are true. */
    public static boolean majority(double[] inputs) {
        if (inputs.length == 0)
            return false;
        return trueCount(inputs) > inputs.length / 2.0;
    }

    /** Fewer than half of the inputs are true. */
    public static boolean minority(double[] inputs) {
        if (inputs.length == 0)
            return false;
        return trueCount(inputs) < inputs.length / 2.0;
    }

    /** At least {@code k} inputs are true. */
    public static boolean atLeast(double[] inputs, int k) {
        if (inputs.length == 0)
            return false;
        return trueCount(inputs) >= k;
    }

    /** Exactly {@code k} inputs are true. */
    public static boolean exactly(double[] inputs, int k) {
        return trueCount(inputs) == k;
    }

    /** At most {@code k} inputs are true. */
    public static boolean atMost(double[] inputs, int k) {
        return trueCount(inputs) <= k;
    }
}
