package com.logic.lgraph.graph;

import java.util.Objects;

/** A node that failed during a run and degraded to 0. */
public final class NodeError {
    private final String nodeId;
    private final String message;

    public NodeError(String nodeId, String message) {
        this.nodeId = nodeId;
        this.message = message;
    }

    public String nodeId() {
        return nodeId;
    }

    public String message() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NodeError other))
            return false;
        return nodeId.equals(other.nodeId) && Objects.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId, message);
    }

    @Override
    public String toString() {
        return nodeId + ": " + message;
    }
}
