package com.logic.lgraph.fn;

/**
 * Functional interface for a binary operator on truth degrees.
 *
 * <p>
 * Implemented by the T-norm, S-norm and implication families and used by
 * {@link com.logic.lgraph.fn.fuzzy.FuzzyGateEvaluator#evaluateMultiple(double[], Fn2)}
 * to fold an input sequence.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code Math::min}</li>
 * <li>{@code (a, b) -> a + b - a * b}</li>
 * </ul>
 */
@FunctionalInterface
public interface Fn2 {
    /**
     * Applies the operator.
     *
     * @param a First operand.
     * @param b Second operand.
     * @return The result.
     */
    double apply(double a, double b);
}
