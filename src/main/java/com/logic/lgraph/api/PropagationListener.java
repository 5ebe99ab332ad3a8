package com.logic.lgraph.api;

import com.logic.lgraph.engine.RunStatus;
import com.logic.lgraph.engine.StrategyType;

/**
 * Observability hook for propagation runs.
 *
 * <p>
 * Registered on the {@link com.logic.lgraph.engine.PropagationEngine}; every
 * strategy calls it from its node loop. Level-parallel runs may call
 * {@link #onNodeEvaluated} from executor threads, so implementations that keep
 * state must be thread-safe.
 *
 * <p>
 * Callbacks run inline with evaluation. Keep them light.
 */
public interface PropagationListener {

    /**
     * Called before the first node of a run is evaluated.
     *
     * @param runId    Increasing run number of the engine.
     * @param strategy The strategy executing the run.
     */
    void onRunStart(long runId, StrategyType strategy);

    /**
     * Called after a node has been evaluated, whether or not it recorded an
     * error.
     *
     * @param runId         Current run.
     * @param nodeId        The node.
     * @param value         Its output.
     * @param durationNanos Wall time spent in {@code Node.evaluate}.
     */
    void onNodeEvaluated(long runId, String nodeId, double value, long durationNanos);

    /**
     * Called when a node evaluation failed and degraded to 0.
     *
     * @param runId   Current run.
     * @param nodeId  The failing node.
     * @param message The recorded error.
     */
    void onNodeError(long runId, String nodeId, String message);

    /**
     * Called when the run has finished, successfully or not.
     *
     * @param runId          Current run.
     * @param nodesEvaluated Number of node evaluations in the run.
     * @param status         COMPLETED or FAILED.
     */
    void onRunEnd(long runId, int nodesEvaluated, RunStatus status);
}
