package com.logic.lgraph.exception;

/**
 * Thrown synchronously for bad configuration: unknown operator or strategy
 * names, invalid membership parameters, duplicate ids, dangling edge endpoints.
 */
public class ValidationException extends LogicGraphException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
