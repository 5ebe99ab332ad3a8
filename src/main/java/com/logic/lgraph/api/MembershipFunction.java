package com.logic.lgraph.api;

/**
 * Maps a crisp value to a degree of membership in [0,1].
 *
 * <p>
 * Serialisable shapes are provided by
 * {@link com.logic.lgraph.fn.fuzzy.ParametricMembership}; arbitrary lambdas work
 * everywhere except in JSON snapshots.
 */
@FunctionalInterface
public interface MembershipFunction {
    double degree(double x);
}
