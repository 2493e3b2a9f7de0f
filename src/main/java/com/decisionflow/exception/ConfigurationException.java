package com.decisionflow.exception;

/**
 * Exception thrown when a decision document or the compiler settings are invalid.
 */
public class ConfigurationException extends DecisionFlowException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
