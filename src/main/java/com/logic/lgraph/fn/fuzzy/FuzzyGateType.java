package com.logic.lgraph.fn.fuzzy;

import com.logic.lgraph.exception.ValidationException;
import com.logic.lgraph.fn.OperatorType;

import java.util.Locale;

/**
 * Gate operators of fuzzy gate nodes, evaluated by {@link FuzzyGateEvaluator}.
 * {@code fuzzy_and} and {@code fuzzy_or} are accepted as aliases of
 * {@link #FUZZY_MIN} and {@link #FUZZY_MAX}.
 */
public enum FuzzyGateType implements OperatorType {
    FUZZY_MIN(Kind.T_NORM, "fuzzy_and"),
    FUZZY_PRODUCT(Kind.T_NORM),
    FUZZY_LUKASIEWICZ_AND(Kind.T_NORM),
    FUZZY_DRASTIC_AND(Kind.T_NORM),
    FUZZY_HAMACHER_AND(Kind.T_NORM),
    FUZZY_EINSTEIN_AND(Kind.T_NORM),
    FUZZY_NILPOTENT_AND(Kind.T_NORM),

    FUZZY_MAX(Kind.S_NORM, "fuzzy_or"),
    FUZZY_SUM(Kind.S_NORM),
    FUZZY_LUKASIEWICZ_OR(Kind.S_NORM),
    FUZZY_DRASTIC_OR(Kind.S_NORM),
    FUZZY_HAMACHER_OR(Kind.S_NORM),
    FUZZY_EINSTEIN_OR(Kind.S_NORM),
    FUZZY_NILPOTENT_OR(Kind.S_NORM),

    FUZZY_NOT(Kind.COMPLEMENT),
    FUZZY_SUGENO_NOT(Kind.COMPLEMENT),
    FUZZY_YAGER_NOT(Kind.COMPLEMENT),

    FUZZY_IMPLY(Kind.IMPLICATION),
    FUZZY_LUKASIEWICZ_IMPLY(Kind.IMPLICATION),
    FUZZY_GODEL_IMPLY(Kind.IMPLICATION),
    FUZZY_GOGUEN_IMPLY(Kind.IMPLICATION),
    FUZZY_MAMDANI(Kind.IMPLICATION),
    FUZZY_LARSEN(Kind.IMPLICATION),

    FUZZY_AVERAGE(Kind.AGGREGATION),
    FUZZY_OWA(Kind.AGGREGATION),
    FUZZY_GEOMETRIC(Kind.AGGREGATION),
    FUZZY_HARMONIC(Kind.AGGREGATION);

    public enum Kind {
        T_NORM(0),
        S_NORM(0),
        COMPLEMENT(1),
        IMPLICATION(2),
        AGGREGATION(0);

        private final int minArity;

        Kind(int minArity) {
            this.minArity = minArity;
        }
    }

    private final Kind kind;
    private final String alias;

    FuzzyGateType(Kind kind) {
        this(kind, null);
    }

    FuzzyGateType(Kind kind, String alias) {
        this.kind = kind;
        this.alias = alias;
    }

    public Kind kind() {
        return kind;
    }

    public int minArity() {
        return kind.minArity;
    }

    @Override
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive lookup including aliases; null when unknown. */
    public static FuzzyGateType find(String text) {
        for (FuzzyGateType t : values()) {
            if (t.name().equalsIgnoreCase(text) || (t.alias != null && t.alias.equalsIgnoreCase(text))) {
                return t;
            }
        }
        return null;
    }

    public static FuzzyGateType fromString(String text) {
        FuzzyGateType t = find(text);
        if (t == null)
            throw new ValidationException("Unknown fuzzy gate type: " + text);
        return t;
    }
}
