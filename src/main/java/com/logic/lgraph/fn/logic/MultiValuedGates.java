package com.logic.lgraph.fn.logic;

/**
 * Multi-valued logics.
 *
 * <ul>
 * <li>Łukasiewicz over {0..maxVal}</li>
 * <li>Post algebra over {0..n-1}</li>
 * <li>Ternary Kleene logic: 0 = false, 1 = unknown, 2 = true</li>
 * <li>Quaternary: 0 = false, 1 = weakly false, 2 = weakly true, 3 = true</li>
 * </ul>
 */
public final class MultiValuedGates {
    public static final double TERNARY_FALSE = 0;
    public static final double TERNARY_UNKNOWN = 1;
    public static final double TERNARY_TRUE = 2;

    private MultiValuedGates() {
        // Utility class
    }

    static double min(double[] inputs) {
        if (inputs.length == 0)
            return 0;
        double m = inputs[0];
        for (int i = 1; i < inputs.length; i++)
            m = Math.min(m, inputs[i]);
        return m;
    }

    static double max(double[] inputs) {
        if (inputs.length == 0)
            return 0;
        double m = inputs[0];
        for (int i = 1; i < inputs.length; i++)
            m = Math.max(m, inputs[i]);
        return m;
    }

    // ── Łukasiewicz ──────────────────────────────────────────────

    public static double lukasiewiczAnd(double[] inputs) {
        return min(inputs);
    }

    public static double lukasiewiczOr(double[] inputs) {
        return max(inputs);
    }

    public static double lukasiewiczNot(double x, double maxVal) {
        return maxVal - x;
    }

    public static double lukasiewiczImply(double a, double b, double maxVal) {
        return Math.min(maxVal, maxVal - a + b);
    }

    // ── Post algebra ─────────────────────────────────────────────

    /** Cyclic negation {@code (x + 1) mod n}. */
    public static double postCyclicNot(double x, int n) {
        return (x + 1) % n;
    }

    public static double postMin(double[] inputs) {
        return min(inputs);
    }

    public static double postMax(double[] inputs) {
        return max(inputs);
    }

    // ── Ternary (Kleene) ─────────────────────────────────────────

    public static double ternaryAnd(double a, double b) {
        if (a == TERNARY_FALSE || b == TERNARY_FALSE)
            return TERNARY_FALSE;
        if (a == TERNARY_TRUE && b == TERNARY_TRUE)
            return TERNARY_TRUE;
        return TERNARY_UNKNOWN;
    }

    public static double ternaryOr(double a, double b) {
        if (a == TERNARY_TRUE || b == TERNARY_TRUE)
            return TERNARY_TRUE;
        if (a == TERNARY_FALSE && b == TERNARY_FALSE)
            return TERNARY_FALSE;
        return TERNARY_UNKNOWN;
    }

    public static double ternaryNot(double x) {
        return TERNARY_TRUE - x;
    }

    /** The shared value when both agree, otherwise unknown. */
    public static double consensus(double a, double b) {
        return a == b ? a : TERNARY_UNKNOWN;
    }

    // ── Quaternary ───────────────────────────────────────────────

    public static double quaternaryAnd(double[] inputs) {
        return min(inputs);
    }

    public static double quaternaryOr(double[] inputs) {
        return max(inputs);
    }

    public static double quaternaryNot(double x) {
        return 3 - x;
    }

    /** Rounded mean of the inputs. */
    public static double quaternaryAverage(double[] inputs) {
        if (inputs.length == 0)
            return 0;
        double sum = 0;
        for (double v : inputs)
            sum += v;
        return Math.round(sum / inputs.length);
    }
}
