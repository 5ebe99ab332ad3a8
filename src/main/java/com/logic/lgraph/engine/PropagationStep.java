package com.logic.lgraph.engine;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import lombok.Getter;

/** One entry of a run's replay log. */
@Getter
public final class PropagationStep {
    public static final String EVALUATE = "evaluate";
    public static final String BACKWARD_EVALUATE = "backward_evaluate";
    public static final String BFS_EVALUATE = "bfs_evaluate";
    public static final String DFS_EVALUATE = "dfs_evaluate";
    public static final String TOPOLOGICAL_EVALUATE = "topological_evaluate";
    public static final String PARALLEL_EVALUATE = "parallel_evaluate";
    public static final String LAZY_EVALUATE = "lazy_evaluate";
    public static final String EAGER_EVALUATE = "eager_evaluate";
    public static final String FALLBACK = "fallback";
    public static final String EDGE_ERROR = "edge_error";

    /** Timestamp first, then sequence for steps taken within the same millisecond. */
    public static final Comparator<PropagationStep> CHRONOLOGICAL = Comparator
            .comparingLong(PropagationStep::getTimestamp)
            .thenComparingLong(PropagationStep::getSequence);

    // Shared by all strategies so merged logs keep a total order
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final String nodeId;
    private final String action;
    private final double value;
    private final Map<String, Object> metadata;
    private final long timestamp;
    private final long sequence;

    public PropagationStep(String nodeId, String action, double value, Map<String, Object> metadata) {
        this.nodeId = nodeId;
        this.action = action;
        this.value = value;
        this.metadata = metadata == null || metadata.isEmpty() ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.timestamp = System.currentTimeMillis();
        this.sequence = SEQUENCE.incrementAndGet();
    }

    @Override
    public String toString() {
        return "#" + sequence + " " + action + " " + nodeId + " = " + value + (metadata.isEmpty() ? "" : " " + metadata);
    }
}
