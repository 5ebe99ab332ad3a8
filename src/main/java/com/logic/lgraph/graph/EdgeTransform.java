package com.logic.lgraph.graph;

import com.logic.lgraph.exception.EvaluationException;
import com.logic.lgraph.exception.ValidationException;

import java.util.Locale;

/**
 * What an edge does to the value crossing it.
 *
 * <pre>
 * transform    forward      inverse
 * DIRECT       v            v
 * NEGATE       -v           -v
 * AMPLIFY      v * weight   v / weight
 * DAMPEN       v * weight   v / weight
 * DELAY        v            v
 * </pre>
 *
 * DELAY carries no timing of its own; it is kept so that graphs can mark the
 * edge for schedulers that do.
 */
public enum EdgeTransform {
    DIRECT,
    NEGATE,
    AMPLIFY,
    DAMPEN,
    DELAY;

    public double apply(double v, double weight) {
        return switch (this) {
            case DIRECT, DELAY -> v;
            case NEGATE -> -v;
            case AMPLIFY, DAMPEN -> v * weight;
        };
    }

    /**
     * Value at the source that produces {@code v} at the target.
     *
     * @throws EvaluationException for a scaling transform with weight 0.
     */
    public double inverse(double v, double weight) {
        return switch (this) {
            case DIRECT, DELAY -> v;
            case NEGATE -> -v;
            case AMPLIFY, DAMPEN -> {
                if (weight == 0)
                    throw new EvaluationException("Cannot invert " + id() + " edge with weight 0");
                yield v / weight;
            }
        };
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EdgeTransform fromString(String text) {
        for (EdgeTransform t : values()) {
            if (t.name().equalsIgnoreCase(text))
                return t;
        }
        throw new ValidationException("Unknown edge operator: " + text);
    }
}
