package com.heronix.autograder.store;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Timestamp format written to the record store: ISO-8601, UTC, millisecond precision.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
public final class Timestamps {

    private static final DateTimeFormatter STORE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSXXX");

    private Timestamps() {
    }

    public static String now(Clock clock) {
        return format(OffsetDateTime.now(clock));
    }

    public static String format(OffsetDateTime value) {
        return value.withOffsetSameInstant(ZoneOffset.UTC)
                .truncatedTo(ChronoUnit.MILLIS)
                .format(STORE_FORMAT);
    }

    /**
     * Parse a store timestamp, or return null when the value is not one.
     */
    public static OffsetDateTime parseOrNull(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.toString());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
