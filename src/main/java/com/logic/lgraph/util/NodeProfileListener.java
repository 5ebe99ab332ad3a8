package com.logic.lgraph.util;

import com.logic.lgraph.api.PropagationListener;
import com.logic.lgraph.engine.RunStatus;
import com.logic.lgraph.engine.StrategyType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Aggregates evaluation time and error counts per node to find slow or failing nodes. */
public class NodeProfileListener implements PropagationListener {

    public static class NodeStats {
        public final String nodeId;
        public long count;
        public long errors;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;
        public long lastDurationNanos;

        public NodeStats(String nodeId) {
            this.nodeId = nodeId;
        }

        synchronized void update(long duration) {
            count++;
            totalDurationNanos += duration;
            lastDurationNanos = duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        synchronized void error() {
            errors++;
        }

        public synchronized double avgMicros() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1000.0;
        }
    }

    // Level-parallel runs report from executor threads
    private final Map<String, NodeStats> stats = new ConcurrentHashMap<>();
    private volatile long runs;

    public NodeStats stats(String nodeId) {
        return stats.get(nodeId);
    }

    public long runs() {
        return runs;
    }

    @Override
    public void onRunStart(long runId, StrategyType strategy) {
        // No-op
    }

    @Override
    public void onNodeEvaluated(long runId, String nodeId, double value, long durationNanos) {
        stats.computeIfAbsent(nodeId, NodeStats::new).update(durationNanos);
    }

    @Override
    public void onNodeError(long runId, String nodeId, String message) {
        stats.computeIfAbsent(nodeId, NodeStats::new).error();
    }

    @Override
    public void onRunEnd(long runId, int nodesEvaluated, RunStatus status) {
        runs++;
    }

    public void reset() {
        stats.clear();
        runs = 0;
    }

    /** Formatted table of node statistics, slowest total first. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-30s | %8s | %6s | %10s | %10s | %10s | %10s%n", "Node", "Count", "Errors",
                "Recent(us)", "Avg (us)", "Min (us)", "Max (us)"));
        sb.append("-".repeat(106)).append('\n');

        List<NodeStats> valid = new ArrayList<>();
        for (NodeStats s : stats.values()) {
            if (s.count > 0)
                valid.add(s);
        }
        valid.sort(Comparator.comparingLong((NodeStats s) -> s.totalDurationNanos).reversed());

        for (NodeStats s : valid) {
            sb.append(String.format("%-30s | %8d | %6d | %10.2f | %10.2f | %10.2f | %10.2f%n",
                    truncate(s.nodeId, 30),
                    s.count,
                    s.errors,
                    s.lastDurationNanos / 1000.0,
                    s.avgMicros(),
                    s.minDurationNanos / 1000.0,
                    s.maxDurationNanos / 1000.0));
        }
        return sb.toString();
    }

    private static String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return s.substring(0, len - 3) + "...";
    }
}
