package org.rostilos.atlassian.restcore.utils;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;

/**
 * Parses the timestamps Atlassian APIs return, e.g. {@code 2021-01-02T03:04:05.000000+0000}.
 * The fraction may be absent (commit dates); the offset is mandatory.
 */
public final class Timestamps {

    public static final DateTimeFormatter ATLASSIAN_TIMESTAMP = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd'T'HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .appendPattern("[XXX][XX]")
            .toFormatter();

    private Timestamps() {
        // Utility class
    }

    /**
     * @throws java.time.format.DateTimeParseException on malformed input
     */
    public static OffsetDateTime parse(String value) {
        return OffsetDateTime.parse(value, ATLASSIAN_TIMESTAMP);
    }
}
