package org.neuralchilli.dagrun.domain;

/**
 * Lifecycle status of a single task within one run.
 */
public enum TaskStatus {
    /**
     * Task is in scope and waiting for its level to be dispatched
     */
    PENDING,

    /**
     * Task parameters are resolved and the unit of work is executing
     */
    RUNNING,

    /**
     * Task returned a result
     */
    SUCCESS,

    /**
     * Task raised an error
     */
    FAILED,

    /**
     * Task was in scope but never started because a fail-fast abort came first
     */
    SKIPPED;

    /**
     * Check if this is a terminal state (task finished)
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == SKIPPED;
    }
}
