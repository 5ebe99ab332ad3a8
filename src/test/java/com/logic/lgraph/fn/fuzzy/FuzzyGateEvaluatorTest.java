package com.logic.lgraph.fn.fuzzy;

import com.logic.lgraph.exception.EvaluationException;
import com.logic.lgraph.exception.ValidationException;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class FuzzyGateEvaluatorTest {
    private static final double EPS = 1e-9;

    private final FuzzyGateEvaluator fuzzy = new FuzzyGateEvaluator();

    @Test
    public void testMinGate() {
        assertEquals(0.3, fuzzy.evaluate(FuzzyGateType.FUZZY_MIN, new double[] { 0.3, 0.7 }), EPS);
    }

    @Test
    public void testNormBounds() {
        for (int i = 0; i <= 10; i++) {
            for (int j = 0; j <= 10; j++) {
                double a = i / 10.0, b = j / 10.0;
                double min = TNorm.MIN.apply(a, b);
                double max = SNorm.MAX.apply(a, b);
                assertTrue(min <= a && min <= b);
                assertTrue(max >= a && max >= b);
                // every t-norm is bounded by MIN, every s-norm by MAX
                for (TNorm t : TNorm.values())
                    assertTrue(t + " at " + a + "," + b, t.apply(a, b) <= min + EPS);
                for (SNorm s : SNorm.values())
                    assertTrue(s + " at " + a + "," + b, s.apply(a, b) >= max - EPS);
            }
        }
    }

    @Test
    public void testStandardComplementIsInvolutive() {
        for (int i = 0; i <= 100; i++) {
            double x = i / 100.0;
            assertEquals(x, Complement.STANDARD.apply(Complement.STANDARD.apply(x)), EPS);
        }
    }

    @Test
    public void testParameterisedComplements() {
        assertEquals(1.0 / 3, Complement.SUGENO.apply(0.5, 1), EPS);
        assertEquals(Math.sqrt(0.75), Complement.YAGER.apply(0.5, 2), EPS);
        assertEquals(0.5, Complement.YAGER.apply(0.5), EPS);

        Map<String, Object> lambda = Map.of("lambda", 1.0);
        assertEquals(1.0 / 3, fuzzy.evaluate(FuzzyGateType.FUZZY_SUGENO_NOT, new double[] { 0.5 }, lambda), EPS);
    }

    @Test
    public void testHamacherGamma() {
        assertEquals(0.25, TNorm.hamacher(1).apply(0.5, 0.5), EPS);
        assertEquals(0.2, TNorm.hamacher(2).apply(0.5, 0.5), EPS);
        assertEquals(0.2, fuzzy.evaluate(FuzzyGateType.FUZZY_HAMACHER_AND, new double[] { 0.5, 0.5 },
                Map.of("gamma", 2)), EPS);
    }

    @Test
    public void testImplications() {
        assertEquals(0.7, Implication.KLEENE_DIENES.apply(0.3, 0.2), EPS);
        assertEquals(1, Implication.GODEL.apply(0.2, 0.3), EPS);
        assertEquals(0.5, Implication.GOGUEN.apply(0.8, 0.4), EPS);
        assertEquals(0.3, fuzzy.evaluate(FuzzyGateType.FUZZY_MAMDANI, new double[] { 0.3, 0.9 }), EPS);
        assertEquals(0.27, fuzzy.evaluate(FuzzyGateType.FUZZY_LARSEN, new double[] { 0.3, 0.9 }), EPS);
    }

    @Test
    public void testAggregations() {
        assertEquals(0.5, Aggregation.weightedAverage(new double[] { 0.2, 0.8 }, null), EPS);
        assertEquals(0.65, Aggregation.weightedAverage(new double[] { 0.2, 0.8 }, new double[] { 1, 3 }), EPS);
        // weights applied to values sorted high to low
        assertEquals(0.35, Aggregation.owa(new double[] { 0.2, 0.8 }, new double[] { 1, 3 }), EPS);
        assertEquals(0.4, Aggregation.geometricMean(new double[] { 0.2, 0.8 }), EPS);
        assertEquals(0.32, Aggregation.harmonicMean(new double[] { 0.2, 0.8 }), EPS);
        assertEquals(0, Aggregation.harmonicMean(new double[] { 0.5, 0 }), EPS);

        assertEquals(0.65, fuzzy.evaluate(FuzzyGateType.FUZZY_AVERAGE, new double[] { 0.2, 0.8 },
                Map.of("weights", new double[] { 1, 3 })), EPS);
    }

    @Test
    public void testInputsAreClamped() {
        assertEquals(1, fuzzy.evaluate(FuzzyGateType.FUZZY_MAX, new double[] { 4, 0.2 }), EPS);
        assertEquals(0, fuzzy.evaluate(FuzzyGateType.FUZZY_MIN, new double[] { -1, 0.2 }), EPS);
    }

    @Test
    public void testEvaluateMultiple() {
        assertEquals(0, fuzzy.evaluateMultiple(new double[0], TNorm.PRODUCT), EPS);
        assertEquals(0.4, fuzzy.evaluateMultiple(new double[] { 0.4 }, TNorm.PRODUCT), EPS);
        assertEquals(0.125, fuzzy.evaluateMultiple(new double[] { 0.5, 0.5, 0.5 }, TNorm.PRODUCT), EPS);
        assertEquals(0.875, fuzzy.evaluateMultiple(new double[] { 0.5, 0.5, 0.5 }, SNorm.PROBABILISTIC), EPS);
    }

    @Test(expected = EvaluationException.class)
    public void testImplicationNeedsTwoInputs() {
        fuzzy.evaluate(FuzzyGateType.FUZZY_IMPLY, new double[] { 0.5 });
    }

    @Test
    public void testAliases() {
        assertSame(FuzzyGateType.FUZZY_MIN, FuzzyGateType.fromString("fuzzy_and"));
        assertSame(FuzzyGateType.FUZZY_MAX, FuzzyGateType.fromString("FUZZY_OR"));
        assertSame(FuzzyGateType.FUZZY_OWA, FuzzyGateType.fromString("fuzzy_owa"));
    }

    @Test(expected = ValidationException.class)
    public void testUnknownFuzzyGate() {
        FuzzyGateType.fromString("fuzzy_maybe");
    }
}
