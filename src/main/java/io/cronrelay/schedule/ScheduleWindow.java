package io.cronrelay.schedule;

import java.time.LocalDateTime;

/**
 * Fixed-size minute buckets within an hour. With a 15 minute bucket the windows are
 * 00-14, 15-29, 30-44 and 45-59; a configured time matches when the hour is equal and
 * both minutes fall in the same bucket.
 */
public final class ScheduleWindow {
    private final int bucketMinutes;

    public ScheduleWindow(int bucketMinutes) {
        if (bucketMinutes <= 0) {
            throw new IllegalArgumentException("bucketMinutes must be positive");
        }
        this.bucketMinutes = bucketMinutes;
    }

    /**
     * Unparseable time strings never match.
     */
    public boolean matches(LocalDateTime now, String hhmm) {
        int[] parsed = parseTime(hhmm);
        if (parsed == null) {
            return false;
        }
        if (now.getHour() != parsed[0]) {
            return false;
        }
        return now.getMinute() / bucketMinutes == parsed[1] / bucketMinutes;
    }

    static int[] parseTime(String hhmm) {
        if (hhmm == null) {
            return null;
        }
        String[] parts = hhmm.trim().split(":");
        if (parts.length != 2) {
            return null;
        }
        try {
            int hour = Integer.parseInt(parts[0].trim());
            int minute = Integer.parseInt(parts[1].trim());
            if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
                return null;
            }
            return new int[]{hour, minute};
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
