package com.logic.lgraph.util;

import com.logic.lgraph.exception.ValidationException;

import java.util.List;
import java.util.Map;

/**
 * Typed reads from loosely typed property maps (node metadata, JSON
 * properties). Numbers may arrive as any {@link Number} or as strings;
 * anything else is a {@link ValidationException}.
 */
public final class Props {
    private Props() {
        // Utility class
    }

    public static double getDouble(Map<String, ?> props, String key, double def) {
        if (props == null)
            return def;
        Object v = props.get(key);
        if (v == null)
            return def;
        if (v instanceof Number n)
            return n.doubleValue();
        try {
            return Double.parseDouble(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Property " + key + " is not a number: " + v, e);
        }
    }

    public static int getInt(Map<String, ?> props, String key, int def) {
        if (props == null)
            return def;
        Object v = props.get(key);
        if (v == null)
            return def;
        if (v instanceof Number n)
            return n.intValue();
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Property " + key + " is not an integer: " + v, e);
        }
    }

    /** Reads a numeric array stored as a list of numbers or a double[]. */
    public static double[] getDoubleArray(Map<String, ?> props, String key) {
        if (props == null)
            return null;
        Object v = props.get(key);
        if (v instanceof double[] arr)
            return arr;
        if (v instanceof List<?> list) {
            double[] out = new double[list.size()];
            for (int i = 0; i < out.length; i++) {
                if (!(list.get(i) instanceof Number n))
                    throw new ValidationException("Property " + key + " must hold numbers, got " + list.get(i));
                out[i] = n.doubleValue();
            }
            return out;
        }
        if (v != null)
            throw new ValidationException("Property " + key + " must be a list of numbers, got " + v);
        return null;
    }
}
