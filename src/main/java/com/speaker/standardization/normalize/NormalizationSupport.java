package com.speaker.standardization.normalize;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.function.Function;

/**
 * Small conversions shared by the source normalizers.
 */
public final class NormalizationSupport {

    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
            Instant::parse,
            s -> OffsetDateTime.parse(s).toInstant(),
            s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),
            s -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant());

    private NormalizationSupport() {
        // Utility class
    }

    /**
     * Reads a scrape timestamp. Accepts BSON dates, instants and ISO-8601 strings
     * (instant, offset date-time, local date-time or local date; local values are taken as UTC).
     *
     * @return the instant, or null when the value is absent or unparseable
     */
    public static Instant safeDate(Object value) {
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (!(value instanceof String text) || text.isBlank()) {
            return null;
        }
        String s = text.strip();
        for (Function<String, Instant> parser : DATE_PARSERS) {
            Instant parsed = tryParse(parser, s);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private static Instant tryParse(Function<String, Instant> parser, String text) {
        try {
            return parser.apply(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Returns the first argument that is a non-blank string.
     */
    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
