package com.decisionflow.exception;

/**
 * Exception thrown when logic text does not conform to the identifier/not/and/or grammar.
 * Aborts compilation; no partial output is produced.
 */
public class ExpressionSyntaxException extends DecisionFlowException {

    private final int position;

    public ExpressionSyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Character offset in the logic text where the error was detected.
     */
    public int getPosition() {
        return position;
    }
}
