package org.neuralchilli.dagrun.core;

/**
 * Thrown when a workflow graph is not acyclic.
 * Raised by leveling before any task executes; the members of the cycle are not identified.
 */
public class CycleDetectedException extends RuntimeException {

    public CycleDetectedException(String message) {
        super(message);
    }

    public CycleDetectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
