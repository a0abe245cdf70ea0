package org.neuralchilli.dagrun.domain;

/**
 * Lifecycle status of one engine run over a graph.
 */
public enum RunStatus {
    /**
     * Run accepted, scope not yet computed
     */
    PENDING,

    /**
     * Levels are being dispatched
     */
    RUNNING,

    /**
     * Every task in scope completed
     */
    SUCCESS,

    /**
     * At least one task failed, or the run was rejected before dispatch
     */
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
