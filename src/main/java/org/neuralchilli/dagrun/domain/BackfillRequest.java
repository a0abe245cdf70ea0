package org.neuralchilli.dagrun.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a backfill needs apart from the graph factory.
 *
 * @param dateParamNames   parameter names that receive the formatted date point
 * @param dateParamFormats optional per-name date format (DateTimeFormatter or strftime style)
 * @param templateParams   workflow-level templates; {@code ${fmt+N}} values are re-evaluated per date
 * @param customParams     overrides applied last
 */
public record BackfillRequest(
        DateSpec dates,
        List<String> dateParamNames,
        Map<String, String> dateParamFormats,
        Map<String, Object> templateParams,
        Map<String, Object> customParams,
        List<String> onlyTasks,
        String startFrom,
        boolean dryRun,
        boolean autoConfirm
) {

    public static final String DEFAULT_DATE_PARAM = "day_id";

    public BackfillRequest {
        if (dates == null) {
            throw new IllegalArgumentException("Backfill date specification cannot be null");
        }

        dateParamNames = dateParamNames != null && !dateParamNames.isEmpty()
                ? List.copyOf(dateParamNames)
                : List.of(DEFAULT_DATE_PARAM);
        if (dateParamFormats != null) {
            dateParamFormats.forEach((name, format) -> {
                if (name == null || format == null) {
                    throw new IllegalArgumentException("Date format for parameter '" + name + "' cannot be null");
                }
            });
        }
        dateParamFormats = dateParamFormats != null ? Map.copyOf(dateParamFormats) : Map.of();
        templateParams = orderedCopy(templateParams);
        customParams = orderedCopy(customParams);
        onlyTasks = onlyTasks != null ? List.copyOf(onlyTasks) : List.of();
    }

    private static Map<String, Object> orderedCopy(Map<String, Object> source) {
        return source != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(source))
                : Map.of();
    }

    public static Builder builder(DateSpec dates) {
        return new Builder(dates);
    }

    public static class Builder {
        private final DateSpec dates;
        private List<String> dateParamNames = List.of();
        private Map<String, String> dateParamFormats = Map.of();
        private Map<String, Object> templateParams = Map.of();
        private Map<String, Object> customParams = Map.of();
        private List<String> onlyTasks = List.of();
        private String startFrom;
        private boolean dryRun = false;
        private boolean autoConfirm = false;

        public Builder(DateSpec dates) {
            this.dates = dates;
        }

        public Builder dateParamNames(List<String> dateParamNames) {
            this.dateParamNames = dateParamNames;
            return this;
        }

        public Builder dateParamFormats(Map<String, String> dateParamFormats) {
            this.dateParamFormats = dateParamFormats;
            return this;
        }

        public Builder templateParams(Map<String, Object> templateParams) {
            this.templateParams = templateParams;
            return this;
        }

        public Builder customParams(Map<String, Object> customParams) {
            this.customParams = customParams;
            return this;
        }

        public Builder onlyTasks(List<String> onlyTasks) {
            this.onlyTasks = onlyTasks;
            return this;
        }

        public Builder startFrom(String startFrom) {
            this.startFrom = startFrom;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder autoConfirm(boolean autoConfirm) {
            this.autoConfirm = autoConfirm;
            return this;
        }

        public BackfillRequest build() {
            return new BackfillRequest(
                    dates, dateParamNames, dateParamFormats, templateParams,
                    customParams, onlyTasks, startFrom, dryRun, autoConfirm
            );
        }
    }
}
