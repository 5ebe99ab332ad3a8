package com.logic.lgraph.fn.fuzzy;

import java.util.function.DoubleUnaryOperator;

/**
 * Reduces an aggregated output curve to a crisp value. Each method samples
 * {@code resolution + 1} points {@code min + i * step} across the range.
 */
public enum Defuzzifier {
    /** Center of gravity; range midpoint when the curve is empty. */
    COG {
        @Override
        public double defuzzify(DoubleUnaryOperator curve, double min, double max, int resolution) {
            double step = (max - min) / resolution;
            double numerator = 0, denominator = 0;
            for (int i = 0; i <= resolution; i++) {
                double x = min + i * step;
                double m = curve.applyAsDouble(x);
                numerator += x * m;
                denominator += m;
            }
            return denominator == 0 ? (min + max) / 2 : numerator / denominator;
        }
    },
    /** Mean of maxima. */
    MOM {
        @Override
        public double defuzzify(DoubleUnaryOperator curve, double min, double max, int resolution) {
            double step = (max - min) / resolution;
            double best = 0, sum = 0;
            int count = 0;
            for (int i = 0; i <= resolution; i++) {
                double x = min + i * step;
                double m = curve.applyAsDouble(x);
                if (m > best) {
                    best = m;
                    sum = x;
                    count = 1;
                } else if (m == best && m > 0) {
                    sum += x;
                    count++;
                }
            }
            return count == 0 ? (min + max) / 2 : sum / count;
        }
    },
    /** Smallest of maxima. */
    SOM {
        @Override
        public double defuzzify(DoubleUnaryOperator curve, double min, double max, int resolution) {
            double step = (max - min) / resolution;
            double best = 0, at = min;
            for (int i = 0; i <= resolution; i++) {
                double x = min + i * step;
                double m = curve.applyAsDouble(x);
                if (m > best) {
                    best = m;
                    at = x;
                }
            }
            return at;
        }
    },
    /** Largest of maxima. */
    LOM {
        @Override
        public double defuzzify(DoubleUnaryOperator curve, double min, double max, int resolution) {
            double step = (max - min) / resolution;
            double best = 0, at = min;
            for (int i = 0; i <= resolution; i++) {
                double x = min + i * step;
                double m = curve.applyAsDouble(x);
                if (m >= best) {
                    best = m;
                    at = x;
                }
            }
            return at;
        }
    },
    /** Bisector of area: first sample where the running area reaches half the total. */
    BOA {
        @Override
        public double defuzzify(DoubleUnaryOperator curve, double min, double max, int resolution) {
            double step = (max - min) / resolution;
            double[] cumulative = new double[resolution + 1];
            double total = 0;
            for (int i = 0; i <= resolution; i++) {
                total += curve.applyAsDouble(min + i * step);
                cumulative[i] = total;
            }
            double half = total / 2;
            for (int i = 0; i <= resolution; i++) {
                if (cumulative[i] >= half)
                    return min + i * step;
            }
            return (min + max) / 2;
        }
    };

    public abstract double defuzzify(DoubleUnaryOperator curve, double min, double max, int resolution);
}
