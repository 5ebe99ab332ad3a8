package com.logic.lgraph.fn.fuzzy;

import com.logic.lgraph.fn.Fn2;

/**
 * Triangular conorms (fuzzy OR). HAMACHER uses gamma 0; see
 * {@link #hamacher(double)} for other parameters.
 */
public enum SNorm implements Fn2 {
    MAX(Math::max),
    PROBABILISTIC((a, b) -> a + b - a * b),
    LUKASIEWICZ((a, b) -> Math.min(1, a + b)),
    DRASTIC((a, b) -> {
        if (a == 0)
            return b;
        if (b == 0)
            return a;
        return 1;
    }),
    HAMACHER((a, b) -> hamacherSum(a, b, 0)),
    EINSTEIN((a, b) -> (a + b) / (1 + a * b)),
    NILPOTENT((a, b) -> a + b < 1 ? Math.max(a, b) : 1);

    private final Fn2 fn;

    SNorm(Fn2 fn) {
        this.fn = fn;
    }

    @Override
    public double apply(double a, double b) {
        return fn.apply(a, b);
    }

    public static Fn2 hamacher(double gamma) {
        return (a, b) -> hamacherSum(a, b, gamma);
    }

    static double hamacherSum(double a, double b, double gamma) {
        if (gamma == 0)
            return a + b - a * b;
        double denominator = 1 - (1 - gamma) * a * b;
        return denominator == 0 ? 0 : (a + b - (2 - gamma) * a * b) / denominator;
    }
}
