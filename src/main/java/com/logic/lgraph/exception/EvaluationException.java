package com.logic.lgraph.exception;

/**
 * Failure while computing a single node or edge value.
 *
 * <p>Never escapes {@code Node.evaluate}: it is recorded on the node and in the
 * run's error list and the node degrades to 0.</p>
 */
public class EvaluationException extends LogicGraphException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Input count below the operator's minimum. */
    public static EvaluationException invalidArity(String operator, int required, int actual) {
        return new EvaluationException(
                "InvalidArity: " + operator + " requires at least " + required + " input(s), got " + actual);
    }
}
