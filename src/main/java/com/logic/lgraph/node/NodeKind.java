package com.logic.lgraph.node;

import com.logic.lgraph.exception.ValidationException;
import com.logic.lgraph.fn.OperatorType;
import com.logic.lgraph.fn.fuzzy.FuzzyGateType;
import com.logic.lgraph.fn.logic.GateType;

import java.util.Locale;

/** How a node turns its inputs into an output. HYBRID and STATISTICAL evaluate as DECISION. */
public enum NodeKind {
    DECISION(GateType.THRESHOLD),
    LOGIC_GATE(GateType.THRESHOLD),
    FUZZY_GATE(FuzzyGateType.FUZZY_MIN),
    PROBABILISTIC(GateType.THRESHOLD),
    MULTI_VALUED(GateType.TERNARY_AND),
    HYBRID(GateType.THRESHOLD),
    STATISTICAL(GateType.THRESHOLD);

    private final OperatorType defaultOperator;

    NodeKind(OperatorType defaultOperator) {
        this.defaultOperator = defaultOperator;
    }

    /** Operator used when a node config names none. */
    public OperatorType defaultOperator() {
        return defaultOperator;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static NodeKind fromString(String text) {
        for (NodeKind k : values()) {
            if (k.name().equalsIgnoreCase(text))
                return k;
        }
        throw new ValidationException("Unknown node type: " + text);
    }
}
