package io.cronrelay.model;

import java.util.Locale;

public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromDb(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        return JobStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
