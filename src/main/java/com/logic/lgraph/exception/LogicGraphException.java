package com.logic.lgraph.exception;

/**
 * Base exception for logic graph operations.
 *
 * <p>All lgraph exceptions extend this class, so callers can catch every
 * graph-related failure with a single handler.</p>
 */
public class LogicGraphException extends RuntimeException {

    public LogicGraphException(String message) {
        super(message);
    }

    public LogicGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
