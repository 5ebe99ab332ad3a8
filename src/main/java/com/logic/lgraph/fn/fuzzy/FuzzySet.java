package com.logic.lgraph.fn.fuzzy;

import com.logic.lgraph.fn.Fn2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * A discrete fuzzy set: element to membership degree, clamped to [0,1].
 * Elements that were never set have degree 0. Iteration follows insertion
 * order.
 */
public final class FuzzySet<T> {
    public static final double SUPPORT_ALPHA = 0.00001;
    public static final double CORE_ALPHA = 0.99999;

    private final Map<T, Double> elements = new LinkedHashMap<>();

    public FuzzySet<T> setMembership(T element, double degree) {
        elements.put(element, Math.max(0, Math.min(1, degree)));
        return this;
    }

    public double getMembership(T element) {
        return elements.getOrDefault(element, 0.0);
    }

    public FuzzySet<T> union(FuzzySet<T> other) {
        return union(other, SNorm.MAX);
    }

    public FuzzySet<T> union(FuzzySet<T> other, Fn2 sNorm) {
        return combine(other, sNorm);
    }

    public FuzzySet<T> intersection(FuzzySet<T> other) {
        return intersection(other, TNorm.MIN);
    }

    public FuzzySet<T> intersection(FuzzySet<T> other, Fn2 tNorm) {
        return combine(other, tNorm);
    }

    public FuzzySet<T> complement() {
        return complement(Complement.STANDARD::apply);
    }

    public FuzzySet<T> complement(DoubleUnaryOperator op) {
        FuzzySet<T> result = new FuzzySet<>();
        elements.forEach((x, m) -> result.setMembership(x, op.applyAsDouble(m)));
        return result;
    }

    /** Elements whose degree is at least {@code alpha}, in insertion order. */
    public List<T> alphaCut(double alpha) {
        List<T> result = new ArrayList<>();
        elements.forEach((x, m) -> {
            if (m >= alpha)
                result.add(x);
        });
        return result;
    }

    public List<T> support() {
        return alphaCut(SUPPORT_ALPHA);
    }

    public List<T> core() {
        return alphaCut(CORE_ALPHA);
    }

    /** Sigma-count: the sum of all degrees. */
    public double cardinality() {
        double sum = 0;
        for (double m : elements.values())
            sum += m;
        return sum;
    }

    public int size() {
        return elements.size();
    }

    public Map<T, Double> asMap() {
        return Collections.unmodifiableMap(elements);
    }

    private FuzzySet<T> combine(FuzzySet<T> other, Fn2 op) {
        FuzzySet<T> result = new FuzzySet<>();
        elements.forEach((x, m) -> result.setMembership(x, op.apply(m, other.getMembership(x))));
        other.elements.forEach((x, m) -> {
            if (!elements.containsKey(x))
                result.setMembership(x, op.apply(getMembership(x), m));
        });
        return result;
    }

    @Override
    public String toString() {
        return "FuzzySet" + elements;
    }
}
