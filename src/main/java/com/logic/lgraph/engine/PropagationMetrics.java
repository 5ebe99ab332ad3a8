package com.logic.lgraph.engine;

/**
 * Counters of one run. Written by the coordinating thread only; callers get
 * copies through {@link #snapshot()}.
 */
public final class PropagationMetrics {
    private int nodesEvaluated;
    private int edgesTraversed;
    private int maxDepth;
    private long startNanos;
    private long endNanos;

    void start() {
        startNanos = System.nanoTime();
        endNanos = startNanos;
    }

    void stop() {
        endNanos = System.nanoTime();
    }

    void reset() {
        nodesEvaluated = 0;
        edgesTraversed = 0;
        maxDepth = 0;
        startNanos = 0;
        endNanos = 0;
    }

    void nodeEvaluated() {
        nodesEvaluated++;
    }

    void edgeTraversed() {
        edgesTraversed++;
    }

    void depth(int depth) {
        if (depth > maxDepth)
            maxDepth = depth;
    }

    /** Sums counters, keeps the deeper depth and the wider time span. */
    void merge(PropagationMetrics other) {
        nodesEvaluated += other.nodesEvaluated;
        edgesTraversed += other.edgesTraversed;
        maxDepth = Math.max(maxDepth, other.maxDepth);
    }

    public PropagationMetrics snapshot() {
        PropagationMetrics copy = new PropagationMetrics();
        copy.nodesEvaluated = nodesEvaluated;
        copy.edgesTraversed = edgesTraversed;
        copy.maxDepth = maxDepth;
        copy.startNanos = startNanos;
        copy.endNanos = endNanos;
        return copy;
    }

    public int getNodesEvaluated() {
        return nodesEvaluated;
    }

    public int getEdgesTraversed() {
        return edgesTraversed;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public long getElapsedNanos() {
        return endNanos - startNanos;
    }

    public double getAvgNanosPerNode() {
        return nodesEvaluated == 0 ? 0 : getElapsedNanos() / (double) nodesEvaluated;
    }

    @Override
    public String toString() {
        return String.format("nodes=%d edges=%d depth=%d elapsed=%.1fus avg=%.1fus", nodesEvaluated, edgesTraversed,
                maxDepth, getElapsedNanos() / 1000.0, getAvgNanosPerNode() / 1000.0);
    }
}
