package org.neuralchilli.dagrun.domain;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * History entry for one engine run. Created when the run ends and never mutated.
 *
 * @param params          parameter snapshot the run resolved against
 * @param plannedTasks    scope after start/end/subset filtering
 * @param completedTasks  task ids in completion order
 * @param failedTaskId    first task that failed, or {@code null}
 * @param errorMessage    message of the first failure (task or configuration), or {@code null}
 * @param uncompletedTasks planned tasks that neither completed nor were the first failure
 * @param taskRuns        per-task outcome for every planned task
 * @param datePoint       logical date when the run is part of a backfill
 */
public record ExecutionRecord(
        UUID id,
        String workflowName,
        Instant startedAt,
        Instant completedAt,
        RunStatus status,
        Map<String, Object> params,
        String startFrom,
        String endAt,
        List<String> onlyTasks,
        boolean failFast,
        Set<String> plannedTasks,
        List<String> completedTasks,
        String failedTaskId,
        String errorMessage,
        List<String> uncompletedTasks,
        Map<String, TaskRun> taskRuns,
        LocalDate datePoint
) {

    public ExecutionRecord {
        if (id == null) {
            throw new IllegalArgumentException("Execution record ID cannot be null");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("Started at cannot be null");
        }
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Execution record must carry a terminal status, got: " + status);
        }

        // Parameter values may legitimately be null, so Map.copyOf is not an option here
        params = params != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(params))
                : Map.of();
        onlyTasks = onlyTasks != null ? List.copyOf(onlyTasks) : List.of();
        plannedTasks = plannedTasks != null ? Set.copyOf(plannedTasks) : Set.of();
        completedTasks = completedTasks != null ? List.copyOf(completedTasks) : List.of();
        uncompletedTasks = uncompletedTasks != null ? List.copyOf(uncompletedTasks) : List.of();
        taskRuns = taskRuns != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(taskRuns))
                : Map.of();
    }

    public boolean isSuccess() {
        return status == RunStatus.SUCCESS;
    }

    public Duration duration() {
        return completedAt != null ? Duration.between(startedAt, completedAt) : Duration.ZERO;
    }

    public Optional<LocalDate> backfillDate() {
        return Optional.ofNullable(datePoint);
    }

    /**
     * Status of a single planned task in this run
     */
    public Optional<TaskStatus> statusOf(String taskId) {
        TaskRun run = taskRuns.get(taskId);
        return run != null ? Optional.of(run.status()) : Optional.empty();
    }
}
