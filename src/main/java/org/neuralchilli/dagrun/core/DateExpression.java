package org.neuralchilli.dagrun.core;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date-offset expression of the form {@code <format><+|-><days>}, e.g. {@code yyyy-MM-dd-1}
 * or {@code yyyyMMdd+7}.
 * <p>
 * The format token is letters and hyphens only. The tokens {@code yyyy MM dd HH mm ss}
 * map to year, month, day, hour, minute and second; any other character is output as-is.
 */
public final class DateExpression {

    private static final Pattern EXPRESSION = Pattern.compile("^([A-Za-z-]+)([+-])(\\d+)$");

    // Longest tokens first so "yyyy" wins over any shorter prefix
    private static final List<String> TOKENS = List.of("yyyy", "MM", "dd", "HH", "mm", "ss");

    private final String format;
    private final long offsetDays;
    private final DateTimeFormatter formatter;

    private DateExpression(String format, long offsetDays) {
        this.format = format;
        this.offsetDays = offsetDays;
        this.formatter = toFormatter(format);
    }

    /**
     * Parse an expression body (the text between {@code ${} and {@code }}).
     *
     * @return the expression, or empty if the text is not a date expression
     * @throws IllegalArgumentException if the offset does not fit in a {@code long}
     */
    public static Optional<DateExpression> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = EXPRESSION.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }

        long days;
        try {
            days = Long.parseLong(matcher.group(3));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Date offset out of range in '${" + text + "}'", e);
        }
        long offset = "+".equals(matcher.group(2)) ? days : -days;
        return Optional.of(new DateExpression(matcher.group(1), offset));
    }

    public static boolean isDateExpression(String text) {
        return text != null && EXPRESSION.matcher(text).matches();
    }

    /**
     * Format {@code base} shifted by the offset
     *
     * @throws IllegalArgumentException if the shifted date is outside the supported range
     */
    public String apply(LocalDateTime base) {
        try {
            return base.plusDays(offsetDays).format(formatter);
        } catch (DateTimeException | ArithmeticException e) {
            throw new IllegalArgumentException(
                    "Cannot apply date expression '${" + this + "}' to " + base + ": " + e.getMessage(), e);
        }
    }

    /**
     * Format the start of {@code date} shifted by the offset
     */
    public String apply(LocalDate date) {
        return apply(date.atStartOfDay());
    }

    public String format() {
        return format;
    }

    public long offsetDays() {
        return offsetDays;
    }

    private static DateTimeFormatter toFormatter(String format) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder();
        int i = 0;
        outer:
        while (i < format.length()) {
            for (String token : TOKENS) {
                if (format.startsWith(token, i)) {
                    builder.appendPattern(token);
                    i += token.length();
                    continue outer;
                }
            }
            builder.appendLiteral(format.charAt(i));
            i++;
        }
        return builder.toFormatter(Locale.ENGLISH);
    }

    @Override
    public String toString() {
        return format + (offsetDays >= 0 ? "+" : "") + offsetDays;
    }
}
