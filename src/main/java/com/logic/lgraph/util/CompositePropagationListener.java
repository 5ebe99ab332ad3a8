package com.logic.lgraph.util;

import com.logic.lgraph.api.PropagationListener;
import com.logic.lgraph.engine.RunStatus;
import com.logic.lgraph.engine.StrategyType;

import java.util.Arrays;

/**
 * Fans callbacks out to several {@link PropagationListener}s, in the order
 * they were added. Adding copies the array, so iteration needs no lock.
 */
public class CompositePropagationListener implements PropagationListener {
    private volatile PropagationListener[] listeners = new PropagationListener[0];

    public synchronized CompositePropagationListener add(PropagationListener listener) {
        PropagationListener[] old = listeners;
        PropagationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRunStart(long runId, StrategyType strategy) {
        for (PropagationListener l : listeners)
            l.onRunStart(runId, strategy);
    }

    @Override
    public void onNodeEvaluated(long runId, String nodeId, double value, long durationNanos) {
        for (PropagationListener l : listeners)
            l.onNodeEvaluated(runId, nodeId, value, durationNanos);
    }

    @Override
    public void onNodeError(long runId, String nodeId, String message) {
        for (PropagationListener l : listeners)
            l.onNodeError(runId, nodeId, message);
    }

    @Override
    public void onRunEnd(long runId, int nodesEvaluated, RunStatus status) {
        for (PropagationListener l : listeners)
            l.onRunEnd(runId, nodesEvaluated, status);
    }
}
