package org.neuralchilli.dagrun.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * What a notifier needs to report a failed run. The core builds it; formatting and
 * transport belong to the {@code AlertSink} implementation.
 */
public record WorkflowFailure(
        String workflowName,
        Instant startedAt,
        String failedTaskId,
        String errorMessage,
        List<String> completedTasks,
        List<String> uncompletedTasks,
        LocalDate backfillDate
) {

    public WorkflowFailure {
        completedTasks = completedTasks != null ? List.copyOf(completedTasks) : List.of();
        uncompletedTasks = uncompletedTasks != null ? List.copyOf(uncompletedTasks) : List.of();
    }

    public static WorkflowFailure from(ExecutionRecord record) {
        return new WorkflowFailure(
                record.workflowName(),
                record.startedAt(),
                record.failedTaskId(),
                record.errorMessage(),
                record.completedTasks(),
                record.uncompletedTasks(),
                record.datePoint()
        );
    }

    public boolean isBackfill() {
        return backfillDate != null;
    }
}
