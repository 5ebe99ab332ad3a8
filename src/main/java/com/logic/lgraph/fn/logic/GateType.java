package com.logic.lgraph.fn.logic;

import com.logic.lgraph.exception.ValidationException;
import com.logic.lgraph.fn.OperatorType;

import java.util.Locale;

/**
 * Closed set of crisp and multi-valued gates understood by {@link GateEvaluator}.
 *
 * <p>
 * Each constant carries its family and the minimum number of inputs it
 * accepts. {@link GateEvaluator#evaluate} switches over this enum exhaustively,
 * so adding a constant without an implementation does not compile.
 */
public enum GateType implements OperatorType {
    // Boolean
    AND(Family.BOOLEAN, 1),
    OR(Family.BOOLEAN, 1),
    NOT(Family.BOOLEAN, 1),
    NAND(Family.BOOLEAN, 1),
    NOR(Family.BOOLEAN, 1),
    XOR(Family.BOOLEAN, 1),
    XNOR(Family.BOOLEAN, 1),
    IMPLY(Family.BOOLEAN, 2),
    NIMPLY(Family.BOOLEAN, 2),

    // Threshold
    MAJORITY(Family.THRESHOLD, 1),
    MINORITY(Family.THRESHOLD, 1),
    THRESHOLD(Family.THRESHOLD, 1),
    EXACTLY(Family.THRESHOLD, 1),
    AT_MOST(Family.THRESHOLD, 1),

    // Multi-valued
    LUKASIEWICZ_AND(Family.MULTI_VALUED, 1),
    LUKASIEWICZ_OR(Family.MULTI_VALUED, 1),
    LUKASIEWICZ_NOT(Family.MULTI_VALUED, 1),
    LUKASIEWICZ_IMPLY(Family.MULTI_VALUED, 2),
    POST_CYCLIC_NOT(Family.MULTI_VALUED, 1),
    POST_MIN(Family.MULTI_VALUED, 1),
    POST_MAX(Family.MULTI_VALUED, 1),
    TERNARY_AND(Family.MULTI_VALUED, 2),
    TERNARY_OR(Family.MULTI_VALUED, 2),
    TERNARY_NOT(Family.MULTI_VALUED, 1),
    CONSENSUS(Family.MULTI_VALUED, 2),
    QUATERNARY_AND(Family.MULTI_VALUED, 1),
    QUATERNARY_OR(Family.MULTI_VALUED, 1),
    QUATERNARY_NOT(Family.MULTI_VALUED, 1),
    QUATERNARY_AVERAGE(Family.MULTI_VALUED, 1),

    // Special purpose
    MUX(Family.SPECIAL, 2),
    ENCODER(Family.SPECIAL, 1),
    PARITY(Family.SPECIAL, 1),
    COMPARATOR(Family.SPECIAL, 2),

    // Truth-table driven
    CUSTOM(Family.CUSTOM, 1);

    public enum Family {
        BOOLEAN,
        THRESHOLD,
        MULTI_VALUED,
        SPECIAL,
        CUSTOM
    }

    private final Family family;
    private final int minArity;

    GateType(Family family, int minArity) {
        this.family = family;
        this.minArity = minArity;
    }

    public Family family() {
        return family;
    }

    public int minArity() {
        return minArity;
    }

    @Override
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive lookup; returns null when the name is not a gate. */
    public static GateType find(String text) {
        for (GateType t : values()) {
            if (t.name().equalsIgnoreCase(text)) {
                return t;
            }
        }
        return null;
    }

    public static GateType fromString(String text) {
        GateType t = find(text);
        if (t == null)
            throw new ValidationException("Unknown gate type: " + text);
        return t;
    }
}
