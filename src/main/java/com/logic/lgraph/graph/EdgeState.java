package com.logic.lgraph.graph;

import lombok.Getter;
import lombok.Setter;

/** Per-run state of an edge; {@code flow} is the magnitude of the last value. */
@Getter
@Setter
public final class EdgeState {
    private boolean active;
    private double value = Double.NaN;
    private double flow;
    private String error;

    public void reset() {
        active = false;
        value = Double.NaN;
        flow = 0;
        error = null;
    }
}
