package uk.gegc.dolos.shared.util;

import uk.gegc.dolos.shared.exception.InvalidTimestampException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Parses user-supplied timestamps. Strings without an offset are read as UTC.
 */
public final class TimestampParser {

    private record Format(Pattern shape, Function<String, Instant> parser) {
    }

    private static final List<Format> FORMATS = List.of(
            new Format(Pattern.compile("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}(:\\d{2}(\\.\\d+)?)?(Z|[+-]\\d{2}:\\d{2})"),
                    s -> OffsetDateTime.parse(s).toInstant()),
            localDateTime("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}", "yyyy-MM-dd HH:mm:ss"),
            localDateTime("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}", "yyyy-MM-dd'T'HH:mm:ss"),
            localDateTime("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}", "yyyy-MM-dd HH:mm"),
            localDateTime("\\d{4}/\\d{2}/\\d{2} \\d{2}:\\d{2}:\\d{2}", "yyyy/MM/dd HH:mm:ss"),
            localDate("\\d{4}-\\d{2}-\\d{2}", "yyyy-MM-dd"),
            localDate("\\d{4}/\\d{2}/\\d{2}", "yyyy/MM/dd")
    );

    private TimestampParser() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidTimestampException("Timestamp is required");
        }
        String trimmed = value.trim();
        for (Format format : FORMATS) {
            if (format.shape().matcher(trimmed).matches()) {
                try {
                    return format.parser().apply(trimmed);
                } catch (DateTimeParseException e) {
                    throw new InvalidTimestampException("Invalid timestamp: " + value, e);
                }
            }
        }
        throw new InvalidTimestampException("Could not parse timestamp: " + value);
    }

    /**
     * Like {@link #parse(String)} but returns {@code null} for a blank value.
     */
    public static Instant parseOptional(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return parse(value);
    }

    private static Format localDateTime(String regex, String pattern) {
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(pattern);
        return new Format(Pattern.compile(regex),
                s -> LocalDateTime.parse(s, formatter).toInstant(ZoneOffset.UTC));
    }

    private static Format localDate(String regex, String pattern) {
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(pattern);
        return new Format(Pattern.compile(regex),
                s -> LocalDate.parse(s, formatter).atStartOfDay().toInstant(ZoneOffset.UTC));
    }
}
