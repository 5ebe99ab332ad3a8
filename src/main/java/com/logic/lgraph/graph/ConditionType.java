package com.logic.lgraph.graph;

import com.logic.lgraph.exception.ValidationException;

import java.util.Locale;

/** Gate on an edge. CUSTOM defers to the edge's {@link com.logic.lgraph.api.EdgeCondition}. */
public enum ConditionType {
    ALWAYS,
    NEVER,
    CUSTOM;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConditionType fromString(String text) {
        for (ConditionType c : values()) {
            if (c.name().equalsIgnoreCase(text))
                return c;
        }
        throw new ValidationException("Unknown edge condition: " + text);
    }
}
