package org.neuralchilli.dagrun.monitoring;

import org.neuralchilli.dagrun.domain.WorkflowFailure;

/**
 * Receives terminal run failures. Implementations own message formatting and transport
 * (webhook, mail, chat); the engine only hands over the failure data.
 * <p>
 * Called on the thread that finished the run. Exceptions thrown here are logged by the
 * engine and do not change the run's outcome.
 */
@FunctionalInterface
public interface AlertSink {

    /**
     * Sink that ignores every failure
     */
    AlertSink NO_OP = failure -> {
    };

    void workflowFailed(WorkflowFailure failure);
}
