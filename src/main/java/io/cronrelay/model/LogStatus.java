package io.cronrelay.model;

import java.util.Locale;

public enum LogStatus {
    PENDING,
    SUCCESS,
    FAILED,
    WARNING;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean terminal() {
        return this != PENDING;
    }

    public static LogStatus fromDb(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        return LogStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
