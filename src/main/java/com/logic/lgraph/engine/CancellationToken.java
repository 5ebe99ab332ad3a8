package com.logic.lgraph.engine;

import com.logic.lgraph.exception.PropagationCancelledException;

/**
 * Cooperative cancellation flag. Strategies check it before every node
 * evaluation; {@link #cancel()} may be called from any thread.
 */
public final class CancellationToken {
    private volatile boolean cancelled;
    private volatile String reason;

    public void cancel() {
        cancel("cancelled by caller");
    }

    public void cancel(String reason) {
        this.reason = reason;
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /** Clears the flag so the token can be reused for another run. */
    public void reset() {
        cancelled = false;
        reason = null;
    }

    public void throwIfCancelled(String nodeId) {
        if (cancelled)
            throw new PropagationCancelledException("Propagation cancelled before node " + nodeId + ": " + reason);
    }
}
