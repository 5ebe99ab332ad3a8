package com.logic.lgraph.graph;

import com.logic.lgraph.exception.ValidationException;

import java.util.Locale;

public enum GraphType {
    DAG,
    CYCLIC,
    HYPERGRAPH;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static GraphType fromString(String text) {
        for (GraphType t : values()) {
            if (t.name().equalsIgnoreCase(text))
                return t;
        }
        throw new ValidationException("Unknown graph type: " + text);
    }
}
