package org.neuralchilli.dagrun.config;

import org.neuralchilli.dagrun.task.CommandTask;
import org.neuralchilli.dagrun.task.ExpressionTask;
import org.neuralchilli.dagrun.task.Task;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable description of one configured task.
 * {@link #toTask()} builds a new runnable instance on every call.
 *
 * @param type            {@code command} or {@code expression}
 * @param timeoutSeconds  command timeout, defaults to one hour
 * @param assertion       for expressions: fail unless the result is {@code true}
 */
public record TaskDefinition(
        String id,
        String type,
        String command,
        String expression,
        int timeoutSeconds,
        String workingDir,
        boolean assertion,
        Map<String, Object> params,
        List<String> dependsOn
) {

    public static final String COMMAND = "command";
    public static final String EXPRESSION = "expression";

    public TaskDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id is required");
        }
        if (type == null || type.isBlank()) {
            type = COMMAND;
        }
        type = type.trim().toLowerCase();

        switch (type) {
            case COMMAND -> {
                if (command == null || command.isBlank()) {
                    throw new IllegalArgumentException("Command task '" + id + "' must have a command");
                }
            }
            case EXPRESSION -> {
                if (expression == null || expression.isBlank()) {
                    throw new IllegalArgumentException("Expression task '" + id + "' must have an expression");
                }
            }
            default -> throw new IllegalArgumentException(
                    "Unknown type '" + type + "' for task '" + id + "'. Use: command, expression"
            );
        }

        if (timeoutSeconds <= 0) {
            timeoutSeconds = 3600;
        }
        params = params != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(params))
                : Map.of();
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
    }

    /**
     * Command task definition with default timeout and no dependencies
     */
    public static TaskDefinition command(String id, String command, Map<String, Object> params) {
        return new TaskDefinition(id, COMMAND, command, null, 0, null, false, params, List.of());
    }

    /**
     * New task instance with its own copy of the parameters
     */
    public Task toTask() {
        if (EXPRESSION.equals(type)) {
            return new ExpressionTask(id, expression, params, assertion);
        }
        return new CommandTask(id, command, params, workingDir != null ? Path.of(workingDir) : null, timeoutSeconds);
    }
}
