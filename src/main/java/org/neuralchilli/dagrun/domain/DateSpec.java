package org.neuralchilli.dagrun.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * Which logical dates a backfill covers.
 * Either an explicit list (order preserved) or an inclusive range stepped by a granularity.
 * <p>
 * Dates are kept as ISO {@code yyyy-MM-dd} text so that parsing problems surface from the
 * planner as {@code InvalidDateRangeException}s rather than while building the request.
 */
public sealed interface DateSpec {

    /**
     * Explicit list of dates, used verbatim
     */
    record Explicit(List<String> dates) implements DateSpec {
        public Explicit {
            if (dates == null || dates.isEmpty()) {
                throw new IllegalArgumentException("Explicit date list cannot be empty");
            }
            dates = List.copyOf(dates);
        }
    }

    /**
     * Inclusive range expanded by granularity
     */
    record Range(String start, String end, Granularity granularity) implements DateSpec {
        public Range {
            if (start == null || start.isBlank()) {
                throw new IllegalArgumentException("Range start cannot be null or empty");
            }
            if (end == null || end.isBlank()) {
                throw new IllegalArgumentException("Range end cannot be null or empty");
            }
            if (granularity == null) {
                granularity = Granularity.DAY;
            }
        }
    }

    static DateSpec of(List<String> dates) {
        return new Explicit(dates);
    }

    static DateSpec ofDates(List<LocalDate> dates) {
        return new Explicit(dates.stream().map(LocalDate::toString).toList());
    }

    static DateSpec range(String start, String end, Granularity granularity) {
        return new Range(start, end, granularity);
    }

    static DateSpec daily(String start, String end) {
        return new Range(start, end, Granularity.DAY);
    }
}
