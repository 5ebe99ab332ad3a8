package com.logic.lgraph.fn.fuzzy;

import com.logic.lgraph.api.MembershipFunction;

import java.util.Arrays;

/**
 * A membership function described by a {@link MembershipShape} and its
 * parameters. Parameters are validated once, at construction.
 */
public final class ParametricMembership implements MembershipFunction {
    private final MembershipShape shape;
    private final double[] params;

    public ParametricMembership(MembershipShape shape, double... params) {
        shape.validate(params);
        this.shape = shape;
        this.params = params.clone();
    }

    public static ParametricMembership triangular(double left, double peak, double right) {
        return new ParametricMembership(MembershipShape.TRIANGULAR, left, peak, right);
    }

    public static ParametricMembership trapezoidal(double left, double leftPeak, double rightPeak, double right) {
        return new ParametricMembership(MembershipShape.TRAPEZOIDAL, left, leftPeak, rightPeak, right);
    }

    public static ParametricMembership gaussian(double mean, double sigma) {
        return new ParametricMembership(MembershipShape.GAUSSIAN, mean, sigma);
    }

    public static ParametricMembership bell(double width, double slope, double center) {
        return new ParametricMembership(MembershipShape.BELL, width, slope, center);
    }

    public static ParametricMembership sigmoid(double slope, double inflection) {
        return new ParametricMembership(MembershipShape.SIGMOID, slope, inflection);
    }

    public static ParametricMembership sCurve(double start, double end) {
        return new ParametricMembership(MembershipShape.S_CURVE, start, end);
    }

    public static ParametricMembership zCurve(double start, double end) {
        return new ParametricMembership(MembershipShape.Z_CURVE, start, end);
    }

    public static ParametricMembership piShaped(double leftFoot, double leftShoulder, double rightShoulder,
            double rightFoot) {
        return new ParametricMembership(MembershipShape.PI_SHAPED, leftFoot, leftShoulder, rightShoulder, rightFoot);
    }

    /** Points as {@code {x, y}} pairs in ascending x order. */
    public static ParametricMembership piecewiseLinear(double[][] points) {
        double[] flat = new double[points.length * 2];
        for (int i = 0; i < points.length; i++) {
            flat[2 * i] = points[i][0];
            flat[2 * i + 1] = points[i][1];
        }
        return new ParametricMembership(MembershipShape.PIECEWISE_LINEAR, flat);
    }

    @Override
    public double degree(double x) {
        return shape.evaluate(x, params);
    }

    public MembershipShape shape() {
        return shape;
    }

    public double[] params() {
        return params.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ParametricMembership other))
            return false;
        return shape == other.shape && Arrays.equals(params, other.params);
    }

    @Override
    public int hashCode() {
        return 31 * shape.hashCode() + Arrays.hashCode(params);
    }

    @Override
    public String toString() {
        return shape.id() + Arrays.toString(params);
    }
}
