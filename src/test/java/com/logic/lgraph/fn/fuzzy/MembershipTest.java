package com.logic.lgraph.fn.fuzzy;

import com.logic.lgraph.exception.ValidationException;
import org.junit.Test;

import static org.junit.Assert.*;

public class MembershipTest {
    private static final double EPS = 1e-9;

    @Test
    public void testTriangular() {
        ParametricMembership mf = ParametricMembership.triangular(0, 5, 10);
        assertEquals(0, mf.degree(0), EPS);
        assertEquals(0.5, mf.degree(2.5), EPS);
        assertEquals(1, mf.degree(5), EPS);
        assertEquals(0.2, mf.degree(9), EPS);
        assertEquals(0, mf.degree(12), EPS);
    }

    @Test
    public void testTrapezoidalPlateau() {
        ParametricMembership mf = ParametricMembership.trapezoidal(0, 2, 4, 6);
        assertEquals(1, mf.degree(3), EPS);
        assertEquals(0.5, mf.degree(1), EPS);
        assertEquals(0.5, mf.degree(5), EPS);
    }

    @Test
    public void testSmoothShapes() {
        assertEquals(1, ParametricMembership.gaussian(3, 1).degree(3), EPS);
        assertEquals(Math.exp(-0.5), ParametricMembership.gaussian(3, 1).degree(4), EPS);
        assertEquals(1, ParametricMembership.bell(2, 1, 5).degree(5), EPS);
        assertEquals(0.5, ParametricMembership.bell(2, 1, 5).degree(7), EPS);
        assertEquals(0.5, ParametricMembership.sigmoid(3, 1).degree(1), EPS);
    }

    @Test
    public void testSAndZCurves() {
        ParametricMembership s = ParametricMembership.sCurve(0, 10);
        ParametricMembership z = ParametricMembership.zCurve(0, 10);
        assertEquals(0, s.degree(-1), EPS);
        assertEquals(0.5, s.degree(5), EPS);
        assertEquals(1, s.degree(11), EPS);
        for (double x = 0; x <= 10; x += 0.5)
            assertEquals(1, s.degree(x) + z.degree(x), EPS);

        ParametricMembership pi = ParametricMembership.piShaped(0, 4, 6, 10);
        assertEquals(1, pi.degree(5), EPS);
        assertEquals(0.5, pi.degree(2), EPS);
        assertEquals(0.5, pi.degree(8), EPS);
    }

    @Test
    public void testPiecewiseLinear() {
        ParametricMembership mf = ParametricMembership.piecewiseLinear(new double[][] { { 0, 0 }, { 4, 1 }, { 8, 0.5 } });
        assertEquals(0, mf.degree(-5), EPS);
        assertEquals(0.25, mf.degree(1), EPS);
        assertEquals(0.75, mf.degree(6), EPS);
        assertEquals(0.5, mf.degree(20), EPS);
        assertEquals(MembershipShape.PIECEWISE_LINEAR, mf.shape());
        assertEquals(6, mf.params().length);
    }

    @Test(expected = ValidationException.class)
    public void testTriangularOrderIsValidated() {
        ParametricMembership.triangular(5, 5, 10);
    }

    @Test(expected = ValidationException.class)
    public void testGaussianSigmaIsValidated() {
        ParametricMembership.gaussian(0, 0);
    }

    @Test(expected = ValidationException.class)
    public void testParameterCountIsValidated() {
        new ParametricMembership(MembershipShape.TRAPEZOIDAL, 0, 1, 2);
    }

    @Test(expected = ValidationException.class)
    public void testPiecewiseNeedsTwoPoints() {
        ParametricMembership.piecewiseLinear(new double[][] { { 0, 1 } });
    }

    @Test(expected = ValidationException.class)
    public void testPiecewiseNeedsAscendingX() {
        ParametricMembership.piecewiseLinear(new double[][] { { 0, 0 }, { 6, 1 }, { 4, 0 } });
    }

    @Test
    public void testShapeNames() {
        assertSame(MembershipShape.S_CURVE, MembershipShape.fromString("s_curve"));
        assertSame(MembershipShape.PIECEWISE_LINEAR, MembershipShape.fromString("piecewiselinear"));
        assertEquals("pi_shaped", MembershipShape.PI_SHAPED.id());
    }

    @Test
    public void testEquality() {
        assertEquals(ParametricMembership.triangular(0, 1, 2), ParametricMembership.triangular(0, 1, 2));
        assertNotEquals(ParametricMembership.triangular(0, 1, 2), ParametricMembership.triangular(0, 1, 3));
    }
}
