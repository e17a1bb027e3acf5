package com.hedgedata.core.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;

/**
 * Date helpers for the yyyy-MM-dd strings used as temporal keys.
 */
public final class DateFormats {

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_LOCAL_DATE;

    // Tried in order after the ISO form
    private static final List<DateTimeFormatter> ACCEPTED = List.of(
        DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT),
        DateTimeFormatter.ofPattern("MM/dd/uuuu").withResolverStyle(ResolverStyle.STRICT),
        DateTimeFormatter.ofPattern("dd-MM-uuuu").withResolverStyle(ResolverStyle.STRICT)
    );

    private DateFormats() {
        // Prevent instantiation
    }

    /**
     * Normalize a date string to yyyy-MM-dd.
     * Accepts yyyy-MM-dd, MM/dd/yyyy and dd-MM-yyyy. Anything else is returned
     * unchanged; callers prefer a best-effort value over a failure.
     */
    public static String normalize(String date) {
        if (date == null) return null;
        String trimmed = date.trim();
        for (DateTimeFormatter format : ACCEPTED) {
            try {
                return LocalDate.parse(trimmed, format).format(ISO);
            } catch (DateTimeParseException e) {
                // try next format
            }
        }
        return date;
    }

    /**
     * Date part of an ISO timestamp such as "2024-01-02T05:00:00Z".
     * Strings that are not timestamps go through {@link #normalize(String)}.
     */
    public static String dateOnly(String timestamp) {
        if (timestamp == null) return null;
        int t = timestamp.indexOf('T');
        if (t == 10) {
            return timestamp.substring(0, 10);
        }
        int space = timestamp.indexOf(' ');
        if (space == 10) {
            return timestamp.substring(0, 10);
        }
        return normalize(timestamp);
    }

    /**
     * UTC calendar date of a unix timestamp in seconds.
     */
    public static String fromEpochSeconds(long epochSeconds) {
        return Instant.ofEpochSecond(epochSeconds).atZone(ZoneOffset.UTC).toLocalDate().format(ISO);
    }

    /**
     * Unix seconds at UTC midnight of an ISO date.
     */
    public static long toEpochSeconds(String isoDate) {
        return parse(isoDate).atStartOfDay().toEpochSecond(ZoneOffset.UTC);
    }

    /**
     * Parse a yyyy-MM-dd date, normalizing the other accepted forms first.
     *
     * @throws IllegalArgumentException if the value is not a recognizable date
     */
    public static LocalDate parse(String date) {
        if (date == null) {
            throw new IllegalArgumentException("Date is required");
        }
        try {
            return LocalDate.parse(normalize(date), ISO);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Not a date: " + date, e);
        }
    }

    public static String format(LocalDate date) {
        return date.format(ISO);
    }

    public static String today() {
        return format(LocalDate.now(ZoneOffset.UTC));
    }
}
