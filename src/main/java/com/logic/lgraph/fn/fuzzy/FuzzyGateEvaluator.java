package com.logic.lgraph.fn.fuzzy;

import com.logic.lgraph.exception.EvaluationException;
import com.logic.lgraph.fn.Fn2;
import com.logic.lgraph.util.Props;

import java.util.Collections;
import java.util.Map;

/**
 * Evaluates a {@link FuzzyGateType} over membership degrees. Inputs are
 * clamped to [0,1] first.
 *
 * <p>
 * Parameters: {@code lambda} (Sugeno, default 0), {@code w} (Yager, default 1),
 * {@code gamma} (Hamacher, default 0), {@code weights} (average / OWA).
 */
public final class FuzzyGateEvaluator {

    public double evaluate(FuzzyGateType type, double[] inputs) {
        return evaluate(type, inputs, Collections.emptyMap());
    }

    public double evaluate(FuzzyGateType type, double[] inputs, Map<String, ?> params) {
        if (inputs.length < type.minArity())
            throw EvaluationException.invalidArity(type.id(), type.minArity(), inputs.length);
        double[] x = new double[inputs.length];
        for (int i = 0; i < inputs.length; i++)
            x[i] = Double.isNaN(inputs[i]) ? 0 : Math.max(0, Math.min(1, inputs[i]));
        double gamma = Props.getDouble(params, "gamma", 0);

        return switch (type) {
            case FUZZY_MIN -> evaluateMultiple(x, TNorm.MIN);
            case FUZZY_PRODUCT -> evaluateMultiple(x, TNorm.PRODUCT);
            case FUZZY_LUKASIEWICZ_AND -> evaluateMultiple(x, TNorm.LUKASIEWICZ);
            case FUZZY_DRASTIC_AND -> evaluateMultiple(x, TNorm.DRASTIC);
            case FUZZY_HAMACHER_AND -> evaluateMultiple(x, TNorm.hamacher(gamma));
            case FUZZY_EINSTEIN_AND -> evaluateMultiple(x, TNorm.EINSTEIN);
            case FUZZY_NILPOTENT_AND -> evaluateMultiple(x, TNorm.NILPOTENT);

            case FUZZY_MAX -> evaluateMultiple(x, SNorm.MAX);
            case FUZZY_SUM -> evaluateMultiple(x, SNorm.PROBABILISTIC);
            case FUZZY_LUKASIEWICZ_OR -> evaluateMultiple(x, SNorm.LUKASIEWICZ);
            case FUZZY_DRASTIC_OR -> evaluateMultiple(x, SNorm.DRASTIC);
            case FUZZY_HAMACHER_OR -> evaluateMultiple(x, SNorm.hamacher(gamma));
            case FUZZY_EINSTEIN_OR -> evaluateMultiple(x, SNorm.EINSTEIN);
            case FUZZY_NILPOTENT_OR -> evaluateMultiple(x, SNorm.NILPOTENT);

            case FUZZY_NOT -> Complement.STANDARD.apply(x[0]);
            case FUZZY_SUGENO_NOT -> Complement.SUGENO.apply(x[0], Props.getDouble(params, "lambda", 0));
            case FUZZY_YAGER_NOT -> Complement.YAGER.apply(x[0], Props.getDouble(params, "w", 1));

            case FUZZY_IMPLY -> Implication.KLEENE_DIENES.apply(x[0], x[1]);
            case FUZZY_LUKASIEWICZ_IMPLY -> Implication.LUKASIEWICZ.apply(x[0], x[1]);
            case FUZZY_GODEL_IMPLY -> Implication.GODEL.apply(x[0], x[1]);
            case FUZZY_GOGUEN_IMPLY -> Implication.GOGUEN.apply(x[0], x[1]);
            case FUZZY_MAMDANI -> Implication.MAMDANI.apply(x[0], x[1]);
            case FUZZY_LARSEN -> Implication.LARSEN.apply(x[0], x[1]);

            case FUZZY_AVERAGE -> Aggregation.weightedAverage(x, Props.getDoubleArray(params, "weights"));
            case FUZZY_OWA -> Aggregation.owa(x, Props.getDoubleArray(params, "weights"));
            case FUZZY_GEOMETRIC -> Aggregation.geometricMean(x);
            case FUZZY_HARMONIC -> Aggregation.harmonicMean(x);
        };
    }

    /** Left fold of a binary operator; 0 for no inputs, the input itself for one. */
    public double evaluateMultiple(double[] inputs, Fn2 op) {
        if (inputs.length == 0)
            return 0;
        double acc = inputs[0];
        for (int i = 1; i < inputs.length; i++)
            acc = op.apply(acc, inputs[i]);
        return acc;
    }
}
