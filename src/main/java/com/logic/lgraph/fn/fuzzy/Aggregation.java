package com.logic.lgraph.fn.fuzzy;

import java.util.Arrays;

/** Aggregation operators over a set of membership degrees. All return 0 for no values. */
public final class Aggregation {
    public static final double HARMONIC_EPSILON = 1e-10;

    private Aggregation() {
        // Utility class
    }

    /**
     * Weighted mean. Missing weights, or weights whose length does not match the
     * values, fall back to equal weighting. A zero weight sum gives 0.
     */
    public static double weightedAverage(double[] values, double[] weights) {
        if (values.length == 0)
            return 0;
        boolean uniform = weights == null || weights.length != values.length;
        double sum = 0, weightSum = 0;
        for (int i = 0; i < values.length; i++) {
            double w = uniform ? 1 : weights[i];
            sum += values[i] * w;
            weightSum += w;
        }
        return weightSum == 0 ? 0 : sum / weightSum;
    }

    /** Ordered weighted average: values sorted descending, then weighted. */
    public static double owa(double[] values, double[] weights) {
        if (values.length == 0)
            return 0;
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        for (int i = 0, j = sorted.length - 1; i < j; i++, j--) {
            double tmp = sorted[i];
            sorted[i] = sorted[j];
            sorted[j] = tmp;
        }
        return weightedAverage(sorted, weights);
    }

    public static double geometricMean(double[] values) {
        if (values.length == 0)
            return 0;
        double product = 1;
        for (double v : values)
            product *= v;
        return Math.pow(product, 1.0 / values.length);
    }

    /** Harmonic mean; 0 when any value is below {@link #HARMONIC_EPSILON}. */
    public static double harmonicMean(double[] values) {
        if (values.length == 0)
            return 0;
        double sumReciprocals = 0;
        for (double v : values) {
            if (v < HARMONIC_EPSILON)
                return 0;
            sumReciprocals += 1 / v;
        }
        return values.length / sumReciprocals;
    }
}
