package org.neuralchilli.dagrun.domain;

import javax.annotation.Nonnull;
import java.time.LocalDate;
import java.util.List;

/**
 * Aggregate outcome of a backfill over all planned date points.
 */
public record BackfillResult(
        List<LocalDate> plannedDates,
        int successCount,
        int failureCount,
        List<LocalDate> failedDates,
        List<ExecutionRecord> records,
        boolean dryRun,
        boolean declined
) {

    public BackfillResult {
        if (successCount < 0) {
            throw new IllegalArgumentException("Success count cannot be negative");
        }
        if (failureCount < 0) {
            throw new IllegalArgumentException("Failure count cannot be negative");
        }
        plannedDates = plannedDates != null ? List.copyOf(plannedDates) : List.of();
        failedDates = failedDates != null ? List.copyOf(failedDates) : List.of();
        records = records != null ? List.copyOf(records) : List.of();
    }

    /**
     * Result of a backfill whose confirmation gate was refused
     */
    public static BackfillResult declined(List<LocalDate> plannedDates) {
        return new BackfillResult(plannedDates, 0, 0, List.of(), List.of(), false, true);
    }

    /**
     * Overall success: confirmed and no failed date point
     */
    public boolean isSuccess() {
        return !declined && failedDates.isEmpty();
    }

    /**
     * Date specification that re-runs only the failed date points
     */
    public DateSpec retrySpec() {
        if (failedDates.isEmpty()) {
            throw new IllegalStateException("Backfill has no failed date points to retry");
        }
        return DateSpec.ofDates(failedDates);
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format(
                "BackfillResult[planned=%d, succeeded=%d, failed=%d, failedDates=%s, dryRun=%s, declined=%s]",
                plannedDates.size(), successCount, failureCount, failedDates, dryRun, declined
        );
    }
}
