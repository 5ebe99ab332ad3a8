package com.logic.lgraph.node;

import com.logic.lgraph.exception.ValidationException;

import java.util.Locale;

/** Maps a decision node's averaged input to its score. */
public enum ScoringFunction {
    LINEAR,
    TANH,
    SIGMOID,
    RELU,
    /** Uses the node's own scoring function. */
    CUSTOM;

    /** Applies a built-in function; CUSTOM is resolved by the evaluator. */
    public double apply(double x) {
        return switch (this) {
            case LINEAR, CUSTOM -> x;
            case TANH -> Math.tanh(x);
            case SIGMOID -> 1 / (1 + Math.exp(-x));
            case RELU -> Math.max(0, x);
        };
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ScoringFunction fromString(String text) {
        for (ScoringFunction f : values()) {
            if (f.name().equalsIgnoreCase(text))
                return f;
        }
        throw new ValidationException("Unknown scoring function: " + text);
    }
}
