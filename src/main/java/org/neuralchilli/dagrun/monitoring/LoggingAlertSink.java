package org.neuralchilli.dagrun.monitoring;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.dagrun.domain.WorkflowFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default alert sink: writes the failure to the log.
 * Replaced as soon as the application declares its own {@link AlertSink} bean.
 */
@DefaultBean
@ApplicationScoped
public class LoggingAlertSink implements AlertSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertSink.class);

    @Override
    public void workflowFailed(WorkflowFailure failure) {
        if (failure.isBackfill()) {
            log.error("Workflow '{}' failed for date {} at task '{}': {}",
                    failure.workflowName(), failure.backfillDate(),
                    failure.failedTaskId(), failure.errorMessage());
        } else {
            log.error("Workflow '{}' failed at task '{}': {}",
                    failure.workflowName(), failure.failedTaskId(), failure.errorMessage());
        }
        log.error("  started: {}, completed: {}, not completed: {}",
                failure.startedAt(), failure.completedTasks(), failure.uncompletedTasks());
    }
}
