package org.neuralchilli.dagrun.domain;

/**
 * Step size when expanding a backfill date range.
 */
public enum Granularity {
    DAY,
    WEEK,
    MONTH;

    /**
     * Parse a granularity name, case-insensitive
     */
    public static Granularity fromString(String value) {
        if (value == null || value.isBlank()) {
            return DAY;
        }
        return switch (value.trim().toLowerCase()) {
            case "day", "daily" -> DAY;
            case "week", "weekly" -> WEEK;
            case "month", "monthly" -> MONTH;
            default -> throw new IllegalArgumentException(
                    "Invalid date granularity: " + value + ". Use: day, week, month"
            );
        };
    }
}
