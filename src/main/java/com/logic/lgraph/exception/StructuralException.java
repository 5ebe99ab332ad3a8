package com.logic.lgraph.exception;

/**
 * Thrown when the shape of the graph makes an operation impossible.
 *
 * <p>Edge insertion that would close a cycle fails with {@link Kind#CYCLE_DETECTED}
 * and leaves the graph untouched. Ordering a cyclic graph fails with
 * {@link Kind#CYCLIC_GRAPH} and marks the current run as failed.</p>
 */
public class StructuralException extends LogicGraphException {

    public enum Kind {
        CYCLE_DETECTED,
        CYCLIC_GRAPH
    }

    private final Kind kind;

    public StructuralException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
