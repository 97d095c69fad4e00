package io.cronrelay.model;

import java.util.Locale;

public enum Frequency {
    ONCE,
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns {@code null} for values outside the known set; such jobs are never due.
     */
    public static Frequency fromDb(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Frequency.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
