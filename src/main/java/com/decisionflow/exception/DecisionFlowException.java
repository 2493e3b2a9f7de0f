package com.decisionflow.exception;

/**
 * Base exception for the decision flow compiler.
 */
public class DecisionFlowException extends RuntimeException {

    public DecisionFlowException(String message) {
        super(message);
    }

    public DecisionFlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
