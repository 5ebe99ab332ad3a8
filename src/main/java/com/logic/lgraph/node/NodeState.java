package com.logic.lgraph.node;

import lombok.Getter;
import lombok.Setter;

/**
 * Per-run mutable state of a node. Cleared at the start of every run; a node
 * is written only by the task evaluating it.
 */
@Getter
@Setter
public final class NodeState {
    /** Last output, NaN before the first evaluation of a run. */
    private double value = Double.NaN;
    private boolean active;
    private boolean visited;
    private boolean locked;
    private String error;

    public void reset() {
        value = Double.NaN;
        active = false;
        visited = false;
        locked = false;
        error = null;
    }

    public boolean hasError() {
        return error != null;
    }
}
