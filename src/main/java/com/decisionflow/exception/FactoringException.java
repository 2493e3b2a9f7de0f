package com.decisionflow.exception;

/**
 * Raised inside the OR-group factoring pass. Never leaves the factorizer.
 */
public class FactoringException extends DecisionFlowException {

    public FactoringException(String message) {
        super(message);
    }

    public FactoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
