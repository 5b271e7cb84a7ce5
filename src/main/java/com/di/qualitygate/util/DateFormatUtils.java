package com.di.qualitygate.util;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Lenient date parsing used by date standardization and type checks.
 * Inputs are tried against {@link #KNOWN_PATTERNS} in order; the first pattern that parses wins.
 */
public final class DateFormatUtils {

    private DateFormatUtils() {}

    static final List<String> KNOWN_PATTERNS = Arrays.asList(
            "yyyy-MM-dd",   // ISO standard
            "dd/MM/yyyy",   // UK / EU
            "MM-dd-yyyy",   // US
            "yyyy/MM/dd",   // Logs
            "dd-MM-yyyy",   // Forms
            "MM/dd/yyyy",   // US alternate
            "dd.MM.yyyy",   // Central Europe
            "yyyy.MM.dd",   // Asia / Legacy systems
            "yyyyMMdd"
    );

    private static final List<DateTimeFormatter> DATE_FORMATTERS = KNOWN_PATTERNS.stream()
            .map(DateTimeFormatter::ofPattern)
            .toList();

    private static final List<DateTimeFormatter> DATE_TIME_FORMATTERS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss")
    );

    /**
     * Parses any supported value into a date.
     * Accepts {@link LocalDate}, {@link LocalDateTime}, {@link java.util.Date} (including the java.sql
     * subclasses), {@link Instant}, offset/zoned date-times, epoch milliseconds as a number, and
     * strings in a known date or date-time format.
     *
     * @return the date, or empty when the value cannot be interpreted
     */
    public static Optional<LocalDate> toLocalDate(Object value) {
        return toLocalDateTime(value).map(LocalDateTime::toLocalDate);
    }

    /**
     * Same as {@link #toLocalDate(Object)} but keeps the time of day (midnight for date-only inputs).
     */
    public static Optional<LocalDateTime> toLocalDateTime(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof LocalDateTime ldt) {
            return Optional.of(ldt);
        }
        if (value instanceof LocalDate ld) {
            return Optional.of(ld.atStartOfDay());
        }
        if (value instanceof java.sql.Date sqlDate) {
            return Optional.of(sqlDate.toLocalDate().atStartOfDay());
        }
        if (value instanceof Timestamp ts) {
            return Optional.of(ts.toLocalDateTime());
        }
        if (value instanceof java.util.Date date) {
            return Optional.of(LocalDateTime.ofInstant(date.toInstant(), ZoneOffset.UTC));
        }
        if (value instanceof Instant instant) {
            return Optional.of(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
        }
        if (value instanceof OffsetDateTime odt) {
            return Optional.of(odt.toLocalDateTime());
        }
        if (value instanceof ZonedDateTime zdt) {
            return Optional.of(zdt.toLocalDateTime());
        }
        if (value instanceof Number n && !(value instanceof Double) && !(value instanceof Float)) {
            return Optional.of(LocalDateTime.ofInstant(Instant.ofEpochMilli(n.longValue()), ZoneOffset.UTC));
        }
        if (value instanceof CharSequence cs) {
            return parseString(cs.toString().trim());
        }
        return Optional.empty();
    }

    private static Optional<LocalDateTime> parseString(String input) {
        if (input.isEmpty()) {
            return Optional.empty();
        }
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return Optional.of(LocalDate.parse(input, formatter).atStartOfDay());
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        for (DateTimeFormatter formatter : DATE_TIME_FORMATTERS) {
            try {
                return Optional.of(LocalDateTime.parse(input, formatter));
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        try {
            return Optional.of(OffsetDateTime.parse(input).toLocalDateTime());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
