package org.neuralchilli.dagrun.core;

/**
 * Thrown when resolving a parameter re-enters a parameter already being resolved,
 * or the reference chain grows past the configured depth limit.
 */
public class CyclicParameterException extends RuntimeException {

    public CyclicParameterException(String message) {
        super(message);
    }

    public CyclicParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
