package com.logic.lgraph.fn;

import com.logic.lgraph.exception.ValidationException;
import com.logic.lgraph.fn.fuzzy.FuzzyGateType;
import com.logic.lgraph.fn.logic.GateType;

/**
 * An operator a node can be configured with: either a crisp/multi-valued
 * {@link GateType} or a {@link FuzzyGateType}.
 */
public interface OperatorType {

    /** Lower-case wire name, e.g. {@code "and"} or {@code "fuzzy_min"}. */
    String id();

    /**
     * Resolves a wire name against both operator families.
     *
     * @throws ValidationException if neither family knows the name.
     */
    static OperatorType parse(String text) {
        if (text == null || text.isBlank())
            throw new ValidationException("Operator name must not be blank");
        GateType gate = GateType.find(text);
        if (gate != null)
            return gate;
        FuzzyGateType fuzzy = FuzzyGateType.find(text);
        if (fuzzy != null)
            return fuzzy;
        throw new ValidationException("Unknown operator type: " + text);
    }
}
