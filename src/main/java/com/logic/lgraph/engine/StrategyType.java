package com.logic.lgraph.engine;

import com.logic.lgraph.exception.ValidationException;

import java.util.Locale;

public enum StrategyType {
    FORWARD,
    BACKWARD,
    BIDIRECTIONAL,
    BFS,
    DFS,
    TOPOLOGICAL,
    PARALLEL,
    LAZY,
    EAGER;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws ValidationException for names that match no strategy.
     */
    public static StrategyType fromString(String text) {
        if (text != null) {
            for (StrategyType t : values()) {
                if (t.name().equalsIgnoreCase(text.trim()))
                    return t;
            }
        }
        throw new ValidationException("Unknown strategy: " + text);
    }
}
