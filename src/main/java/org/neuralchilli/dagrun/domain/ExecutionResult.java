package org.neuralchilli.dagrun.domain;

import java.util.Collections;
import java.util.Map;

/**
 * Return value of a run that did not raise: the per-task result map plus the
 * history entry recorded for it.
 * <p>
 * Result values are whatever the tasks returned and may be {@code null}.
 */
public record ExecutionResult(Map<String, Object> results, ExecutionRecord record) {

    public ExecutionResult {
        if (record == null) {
            throw new IllegalArgumentException("Execution record cannot be null");
        }
        results = results != null ? Collections.unmodifiableMap(results) : Map.of();
    }

    public boolean isSuccess() {
        return record.isSuccess();
    }

    public Object resultOf(String taskId) {
        return results.get(taskId);
    }
}
