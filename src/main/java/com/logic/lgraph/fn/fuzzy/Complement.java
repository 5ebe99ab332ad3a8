package com.logic.lgraph.fn.fuzzy;

/**
 * Fuzzy negation. SUGENO takes lambda (default 0), YAGER takes w (default 1);
 * with the defaults both reduce to STANDARD.
 */
public enum Complement {
    STANDARD {
        @Override
        public double apply(double a, double param) {
            return 1 - a;
        }
    },
    SUGENO {
        @Override
        public double apply(double a, double lambda) {
            return (1 - a) / (1 + lambda * a);
        }
    },
    YAGER {
        @Override
        public double apply(double a, double w) {
            return Math.pow(1 - Math.pow(a, w), 1 / w);
        }

        @Override
        double defaultParam() {
            return 1;
        }
    };

    public abstract double apply(double a, double param);

    public double apply(double a) {
        return apply(a, defaultParam());
    }

    double defaultParam() {
        return 0;
    }
}
