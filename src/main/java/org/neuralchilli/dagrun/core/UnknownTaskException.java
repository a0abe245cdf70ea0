package org.neuralchilli.dagrun.core;

/**
 * Thrown when a run's scope filter (start, end or task subset) names a task
 * that does not exist in the graph being executed.
 */
public class UnknownTaskException extends RuntimeException {

    public UnknownTaskException(String message) {
        super(message);
    }

    public UnknownTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
