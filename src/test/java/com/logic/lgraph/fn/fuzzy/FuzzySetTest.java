package com.logic.lgraph.fn.fuzzy;

import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class FuzzySetTest {
    private static final double EPS = 1e-9;

    private FuzzySet<String> warm;
    private FuzzySet<String> humid;

    @Before
    public void setUp() {
        warm = new FuzzySet<String>()
                .setMembership("mon", 0.2)
                .setMembership("tue", 0.9)
                .setMembership("wed", 1.0);
        humid = new FuzzySet<String>()
                .setMembership("tue", 0.4)
                .setMembership("thu", 0.7);
    }

    @Test
    public void testDegreesAreClamped() {
        FuzzySet<String> s = new FuzzySet<String>().setMembership("a", 1.4).setMembership("b", -2);
        assertEquals(1, s.getMembership("a"), EPS);
        assertEquals(0, s.getMembership("b"), EPS);
        assertEquals(0, s.getMembership("missing"), EPS);
    }

    @Test
    public void testUnionAndIntersectionCoverBothSets() {
        FuzzySet<String> union = warm.union(humid);
        FuzzySet<String> inter = warm.intersection(humid);

        assertEquals(4, union.size());
        assertEquals(0.9, union.getMembership("tue"), EPS);
        assertEquals(0.7, union.getMembership("thu"), EPS);
        assertEquals(0.4, inter.getMembership("tue"), EPS);
        assertEquals(0, inter.getMembership("thu"), EPS);

        FuzzySet<String> product = warm.intersection(humid, TNorm.PRODUCT);
        assertEquals(0.36, product.getMembership("tue"), EPS);
    }

    @Test
    public void testComplement() {
        FuzzySet<String> not = warm.complement();
        assertEquals(0.8, not.getMembership("mon"), EPS);
        assertEquals(0, not.getMembership("wed"), EPS);

        FuzzySet<String> sugeno = warm.complement(a -> Complement.SUGENO.apply(a, 1));
        assertEquals(0.8 / 1.2, sugeno.getMembership("mon"), EPS);
    }

    @Test
    public void testCuts() {
        assertEquals(List.of("tue", "wed"), warm.alphaCut(0.5));
        assertEquals(List.of("mon", "tue", "wed"), warm.support());
        assertEquals(List.of("wed"), warm.core());
        assertEquals(2.1, warm.cardinality(), EPS);
    }
}
