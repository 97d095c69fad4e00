package io.cronrelay.schedule;

public final class ScheduleConfigException extends RuntimeException {
    public ScheduleConfigException(String message) {
        super(message);
    }

    public ScheduleConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
