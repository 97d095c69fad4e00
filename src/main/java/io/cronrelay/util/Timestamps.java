package io.cronrelay.util;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Stored timestamps are zone-local wall-clock values at second precision.
 */
public final class Timestamps {
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private Timestamps() {
    }

    public static String format(LocalDateTime value) {
        if (value == null) {
            return null;
        }
        return FORMAT.format(value.truncatedTo(ChronoUnit.SECONDS));
    }

    public static LocalDateTime parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String v = raw.trim().replace(' ', 'T');
        try {
            return LocalDateTime.parse(v);
        } catch (DateTimeParseException e) {
            // date-only values are accepted for start_date
            if (v.length() == 10) {
                return LocalDateTime.parse(v + "T00:00:00");
            }
            throw e;
        }
    }
}
