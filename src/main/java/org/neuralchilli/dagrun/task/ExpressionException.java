package org.neuralchilli.dagrun.task;

/**
 * Thrown when a JEXL expression cannot be compiled or evaluated.
 * Provides clear error messages with context.
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
