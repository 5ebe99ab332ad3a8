package com.logic.lgraph.fn.fuzzy;

import com.logic.lgraph.fn.Fn2;

/** Fuzzy implication operators, {@code apply(antecedent, consequent)}. */
public enum Implication implements Fn2 {
    KLEENE_DIENES((a, b) -> Math.max(1 - a, b)),
    LUKASIEWICZ((a, b) -> Math.min(1, 1 - a + b)),
    GODEL((a, b) -> a <= b ? 1 : b),
    GOGUEN((a, b) -> a == 0 ? 1 : Math.min(1, b / a)),
    MAMDANI(Math::min),
    LARSEN((a, b) -> a * b);

    private final Fn2 fn;

    Implication(Fn2 fn) {
        this.fn = fn;
    }

    @Override
    public double apply(double a, double b) {
        return fn.apply(a, b);
    }
}
