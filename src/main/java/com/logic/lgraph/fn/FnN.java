package com.logic.lgraph.fn;

/**
 * Functional interface for a computation over N inputs.
 *
 * <p>
 * Used for node custom functions and for aggregation operators. The input
 * array belongs to the caller; implementations must not keep a reference to
 * it or modify it.
 */
@FunctionalInterface
public interface FnN {
    /**
     * Computes a result from an array of inputs.
     *
     * @param inputs The input values (read-only).
     * @return The result.
     */
    double apply(double[] inputs);
}
