package org.neuralchilli.dagrun.core;

/**
 * Wraps the failure of a task's unit of work with the id of the task that raised it.
 * The engine only relies on the message; the original error stays available as the cause.
 */
public class TaskExecutionException extends RuntimeException {

    private final String taskId;

    public TaskExecutionException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public TaskExecutionException(String taskId, String message, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
