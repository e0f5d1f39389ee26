package io.github.vishalmysore.loggraph.util;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.OptionalLong;

/**
 * Conversions between RFC 3339 strings and microseconds since the Unix epoch.
 * Printed times are in UTC with second precision.
 */
public final class TimeUtils {
    private static final DateTimeFormatter RFC3339 =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'+00:00'").withZone(ZoneOffset.UTC);

    private TimeUtils() {
    }

    public static String unixMicrosToRfc3339(long unixMicros) {
        return RFC3339.format(Instant.ofEpochSecond(Math.floorDiv(unixMicros, 1_000_000L)));
    }

    /** Parses a time with an explicit offset; empty if the string is not such a time. */
    public static OptionalLong rfc3339ToUnixMicros(String time) {
        if (time == null) {
            return OptionalLong.empty();
        }
        try {
            Instant instant = OffsetDateTime.parse(time, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
            return OptionalLong.of(instant.getEpochSecond() * 1_000_000L + instant.getNano() / 1_000L);
        } catch (DateTimeParseException e) {
            return OptionalLong.empty();
        }
    }
}
