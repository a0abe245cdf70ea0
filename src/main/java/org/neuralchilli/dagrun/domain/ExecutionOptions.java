package org.neuralchilli.dagrun.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * Scope filters and failure policy for one engine run.
 * <p>
 * When {@code onlyTasks} is non-empty it wins: {@code startFrom} and {@code endAt}
 * are ignored for that run.
 */
public record ExecutionOptions(
        String startFrom,
        String endAt,
        List<String> onlyTasks,
        boolean failFast,
        LocalDate datePoint
) {

    public ExecutionOptions {
        onlyTasks = onlyTasks != null ? List.copyOf(onlyTasks) : List.of();
    }

    /**
     * Run every task, fail fast
     */
    public static ExecutionOptions defaults() {
        return new ExecutionOptions(null, null, List.of(), true, null);
    }

    public boolean hasTaskSubset() {
        return !onlyTasks.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String startFrom;
        private String endAt;
        private List<String> onlyTasks = List.of();
        private boolean failFast = true;
        private LocalDate datePoint;

        public Builder startFrom(String startFrom) {
            this.startFrom = startFrom;
            return this;
        }

        public Builder endAt(String endAt) {
            this.endAt = endAt;
            return this;
        }

        public Builder onlyTasks(List<String> onlyTasks) {
            this.onlyTasks = onlyTasks;
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public Builder datePoint(LocalDate datePoint) {
            this.datePoint = datePoint;
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(startFrom, endAt, onlyTasks, failFast, datePoint);
        }
    }
}
