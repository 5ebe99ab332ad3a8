package com.logic.lgraph.fn.fuzzy;

import com.logic.lgraph.exception.ValidationException;

import java.util.Locale;

/**
 * Parameterised membership curves.
 *
 * <pre>
 * TRIANGULAR        [left, peak, right]                  left &lt; peak &lt; right
 * TRAPEZOIDAL       [left, leftPeak, rightPeak, right]   a &lt; b &lt;= c &lt; d
 * GAUSSIAN          [mean, sigma]                        sigma &gt; 0
 * BELL              [width, slope, center]               width, slope &gt; 0
 * SIGMOID           [slope, inflection]
 * S_CURVE / Z_CURVE [start, end]                         start &lt; end
 * PI_SHAPED         [leftFoot, leftShoulder, rightShoulder, rightFoot]
 * PIECEWISE_LINEAR  [x0, y0, x1, y1, ...]                at least 2 points
 * </pre>
 */
public enum MembershipShape {
    TRIANGULAR {
        @Override
        void validate(double[] p) {
            requireLength(p, 3);
            if (p[0] >= p[1] || p[1] >= p[2])
                throw new ValidationException("Triangular parameters must satisfy: left < peak < right");
        }

        @Override
        double evaluate(double x, double[] p) {
            double a = p[0], b = p[1], c = p[2];
            if (x <= a || x >= c)
                return 0;
            if (x == b)
                return 1;
            if (x < b)
                return (x - a) / (b - a);
            return (c - x) / (c - b);
        }
    },
    TRAPEZOIDAL {
        @Override
        void validate(double[] p) {
            requireLength(p, 4);
            if (p[0] >= p[1] || p[1] > p[2] || p[2] >= p[3])
                throw new ValidationException(
                        "Trapezoidal parameters must satisfy: left < leftPeak <= rightPeak < right");
        }

        @Override
        double evaluate(double x, double[] p) {
            double a = p[0], b = p[1], c = p[2], d = p[3];
            if (x <= a || x >= d)
                return 0;
            if (x >= b && x <= c)
                return 1;
            if (x < b)
                return (x - a) / (b - a);
            return (d - x) / (d - c);
        }
    },
    GAUSSIAN {
        @Override
        void validate(double[] p) {
            requireLength(p, 2);
            if (p[1] <= 0)
                throw new ValidationException("Standard deviation must be positive");
        }

        @Override
        double evaluate(double x, double[] p) {
            double z = (x - p[0]) / p[1];
            return Math.exp(-0.5 * z * z);
        }
    },
    BELL {
        @Override
        void validate(double[] p) {
            requireLength(p, 3);
            if (p[0] <= 0 || p[1] <= 0)
                throw new ValidationException("Width and slope must be positive");
        }

        @Override
        double evaluate(double x, double[] p) {
            return 1 / (1 + Math.pow(Math.abs((x - p[2]) / p[0]), 2 * p[1]));
        }
    },
    SIGMOID {
        @Override
        void validate(double[] p) {
            requireLength(p, 2);
        }

        @Override
        double evaluate(double x, double[] p) {
            return 1 / (1 + Math.exp(-p[0] * (x - p[1])));
        }
    },
    S_CURVE {
        @Override
        void validate(double[] p) {
            requireLength(p, 2);
            if (p[0] >= p[1])
                throw new ValidationException("S-curve parameters must satisfy: start < end");
        }

        @Override
        double evaluate(double x, double[] p) {
            return sCurve(x, p[0], p[1]);
        }
    },
    Z_CURVE {
        @Override
        void validate(double[] p) {
            S_CURVE.validate(p);
        }

        @Override
        double evaluate(double x, double[] p) {
            return 1 - sCurve(x, p[0], p[1]);
        }
    },
    PI_SHAPED {
        @Override
        void validate(double[] p) {
            requireLength(p, 4);
            if (p[0] >= p[1] || p[1] > p[2] || p[2] >= p[3])
                throw new ValidationException(
                        "Pi-shaped parameters must satisfy: leftFoot < leftShoulder <= rightShoulder < rightFoot");
        }

        @Override
        double evaluate(double x, double[] p) {
            if (x <= p[0] || x >= p[3])
                return 0;
            if (x >= p[1] && x <= p[2])
                return 1;
            if (x < p[1])
                return sCurve(x, p[0], p[1]);
            return 1 - sCurve(x, p[2], p[3]);
        }
    },
    PIECEWISE_LINEAR {
        @Override
        void validate(double[] p) {
            if (p == null || p.length < 4 || p.length % 2 != 0)
                throw new ValidationException("Piecewise linear function requires at least 2 [x, y] points");
            for (int i = 2; i < p.length; i += 2) {
                if (!(p[i] > p[i - 2]))
                    throw new ValidationException("Piecewise linear x values must be strictly ascending");
            }
        }

        @Override
        double evaluate(double x, double[] p) {
            int points = p.length / 2;
            if (x <= p[0])
                return p[1];
            if (x >= p[2 * (points - 1)])
                return p[2 * (points - 1) + 1];
            for (int i = 1; i < points; i++) {
                double x1 = p[2 * i];
                if (x <= x1) {
                    double x0 = p[2 * (i - 1)], y0 = p[2 * (i - 1) + 1], y1 = p[2 * i + 1];
                    return y0 + (y1 - y0) * (x - x0) / (x1 - x0);
                }
            }
            return 0;
        }
    };

    abstract void validate(double[] params);

    abstract double evaluate(double x, double[] params);

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MembershipShape fromString(String text) {
        for (MembershipShape s : values()) {
            if (s.name().equalsIgnoreCase(text) || s.name().replace("_", "").equalsIgnoreCase(text)) {
                return s;
            }
        }
        throw new ValidationException("Unknown membership shape: " + text);
    }

    static double sCurve(double x, double a, double b) {
        if (x <= a)
            return 0;
        if (x >= b)
            return 1;
        double mid = (a + b) / 2;
        if (x <= mid) {
            double t = (x - a) / (b - a);
            return 2 * t * t;
        }
        double t = (x - b) / (b - a);
        return 1 - 2 * t * t;
    }

    private static void requireLength(double[] p, int n) {
        if (p == null || p.length != n)
            throw new ValidationException("Membership shape requires " + n + " parameters");
    }
}
