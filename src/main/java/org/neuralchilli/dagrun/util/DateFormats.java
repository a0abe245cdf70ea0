package org.neuralchilli.dagrun.util;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.Locale;
import java.util.Map;

/**
 * Builds {@link DateTimeFormatter}s from the two format notations found in workflow
 * configuration: Java patterns ({@code yyyyMMdd}) and strftime directives ({@code %Y%m%d}).
 */
public final class DateFormats {

    public static final String DEFAULT_PATTERN = "yyyy-MM-dd";

    private static final Map<Character, String> STRFTIME = Map.ofEntries(
            Map.entry('Y', "yyyy"),
            Map.entry('y', "yy"),
            Map.entry('m', "MM"),
            Map.entry('d', "dd"),
            Map.entry('H', "HH"),
            Map.entry('M', "mm"),
            Map.entry('S', "ss"),
            Map.entry('j', "DDD"),
            Map.entry('b', "MMM"),
            Map.entry('B', "MMMM"),
            Map.entry('a', "EEE"),
            Map.entry('A', "EEEE")
    );

    private DateFormats() {
    }

    /**
     * Build a formatter for either notation.
     * A format containing {@code %} is read as strftime, anything else as a Java pattern.
     *
     * @throws IllegalArgumentException if the format is not valid in its notation
     */
    public static DateTimeFormatter formatter(String format) {
        if (format == null || format.isBlank()) {
            return DateTimeFormatter.ofPattern(DEFAULT_PATTERN, Locale.ENGLISH);
        }
        if (format.indexOf('%') >= 0) {
            return fromStrftime(format);
        }
        return DateTimeFormatter.ofPattern(format, Locale.ENGLISH);
    }

    /**
     * Translate strftime directives; every other character is copied literally.
     */
    public static DateTimeFormatter fromStrftime(String format) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder();

        for (int i = 0; i < format.length(); i++) {
            char c = format.charAt(i);
            if (c != '%') {
                builder.appendLiteral(c);
                continue;
            }
            if (i + 1 >= format.length()) {
                throw new IllegalArgumentException("Dangling '%' at end of date format: " + format);
            }

            char directive = format.charAt(++i);
            if (directive == '%') {
                builder.appendLiteral('%');
                continue;
            }

            String pattern = STRFTIME.get(directive);
            if (pattern == null) {
                throw new IllegalArgumentException(
                        "Unsupported strftime directive '%" + directive + "' in date format: " + format
                );
            }
            builder.appendPattern(pattern);
        }

        return builder.toFormatter(Locale.ENGLISH);
    }
}
