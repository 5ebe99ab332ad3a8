package com.logic.lgraph.fn.fuzzy;

import com.logic.lgraph.fn.Fn2;

/**
 * Triangular norms (fuzzy AND). HAMACHER uses gamma 0; see
 * {@link #hamacher(double)} for other parameters.
 */
public enum TNorm implements Fn2 {
    MIN(Math::min),
    PRODUCT((a, b) -> a * b),
    LUKASIEWICZ((a, b) -> Math.max(0, a + b - 1)),
    DRASTIC((a, b) -> {
        if (a == 1)
            return b;
        if (b == 1)
            return a;
        return 0;
    }),
    HAMACHER((a, b) -> hamacherProduct(a, b, 0)),
    EINSTEIN((a, b) -> (a * b) / (2 - (a + b - a * b))),
    NILPOTENT((a, b) -> a + b > 1 ? Math.min(a, b) : 0);

    private final Fn2 fn;

    TNorm(Fn2 fn) {
        this.fn = fn;
    }

    @Override
    public double apply(double a, double b) {
        return fn.apply(a, b);
    }

    public static Fn2 hamacher(double gamma) {
        return (a, b) -> hamacherProduct(a, b, gamma);
    }

    static double hamacherProduct(double a, double b, double gamma) {
        if (gamma == 0)
            return a * b;
        double denominator = gamma + (1 - gamma) * (a + b - a * b);
        return denominator == 0 ? 0 : (a * b) / denominator;
    }
}
