package com.logic.lgraph.engine;

/**
 * Lifecycle of a propagation run: IDLE, then RUNNING, then COMPLETED or
 * FAILED. Node evaluation errors never fail a run; structural errors and
 * cancellation do.
 */
public enum RunStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED
}
