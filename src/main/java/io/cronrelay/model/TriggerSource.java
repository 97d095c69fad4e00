package io.cronrelay.model;

import java.util.Locale;

public enum TriggerSource {
    TIMER,
    MANUAL,
    HTTP;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
