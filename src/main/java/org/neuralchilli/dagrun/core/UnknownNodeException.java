package org.neuralchilli.dagrun.core;

/**
 * Thrown when an edge or lookup references a task id that was never added to the graph.
 * A configuration error: raised at the call that detected it and never retried.
 */
public class UnknownNodeException extends RuntimeException {

    public UnknownNodeException(String message) {
        super(message);
    }

    public UnknownNodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
