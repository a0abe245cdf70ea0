package org.neuralchilli.dagrun.domain;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One logical date of a backfill together with the date-derived parameters
 * generated for it (one entry per configured name plus its {@code _no_dash} variant).
 */
public record DatePoint(LocalDate date, String value, Map<String, String> params) {

    public DatePoint {
        if (date == null) {
            throw new IllegalArgumentException("Date cannot be null");
        }
        if (value == null) {
            value = date.toString();
        }
        params = params != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(params))
                : Map.of();
    }

    @Override
    public String toString() {
        return value;
    }
}
