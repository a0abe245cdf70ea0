package org.neuralchilli.dagrun.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of a single task within one run.
 * Immutable; state transitions return a new instance.
 */
public record TaskRun(
        String taskId,
        TaskStatus status,
        Instant startedAt,
        Instant completedAt,
        Long durationMillis,
        String error
) {

    public TaskRun {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be null or empty");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
    }

    /**
     * Create a pending task run
     */
    public static TaskRun pending(String taskId) {
        return new TaskRun(taskId, TaskStatus.PENDING, null, null, null, null);
    }

    /**
     * Mark as running
     */
    public TaskRun start() {
        return new TaskRun(taskId, TaskStatus.RUNNING, Instant.now(), null, null, null);
    }

    /**
     * Mark as succeeded
     */
    public TaskRun succeed() {
        Instant now = Instant.now();
        return new TaskRun(taskId, TaskStatus.SUCCESS, startedAt, now, elapsedUntil(now), null);
    }

    /**
     * Mark as failed
     */
    public TaskRun fail(String errorMessage) {
        Instant now = Instant.now();
        return new TaskRun(taskId, TaskStatus.FAILED, startedAt, now, elapsedUntil(now), errorMessage);
    }

    /**
     * Mark as skipped
     */
    public TaskRun skip(String reason) {
        return new TaskRun(taskId, TaskStatus.SKIPPED, startedAt, Instant.now(), null, reason);
    }

    public boolean isFinished() {
        return status.isTerminal();
    }

    public Duration getDuration() {
        return durationMillis != null ? Duration.ofMillis(durationMillis) : Duration.ZERO;
    }

    private Long elapsedUntil(Instant end) {
        return startedAt != null ? Duration.between(startedAt, end).toMillis() : null;
    }
}
