package com.logic.lgraph.exception;

/**
 * Thrown from a strategy's node loop once its cancellation token has fired.
 */
public class PropagationCancelledException extends LogicGraphException {

    public PropagationCancelledException(String message) {
        super(message);
    }
}
