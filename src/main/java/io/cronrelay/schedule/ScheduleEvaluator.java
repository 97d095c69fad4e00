package io.cronrelay.schedule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.cronrelay.model.Frequency;
import io.cronrelay.model.ScheduledJob;
import io.cronrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a job is due at a given zone-local time. Pure apart from logging.
 */
public final class ScheduleEvaluator {
    private static final Logger log = LoggerFactory.getLogger(ScheduleEvaluator.class);

    private final ScheduleWindow window;

    public ScheduleEvaluator(int windowMinutes) {
        this.window = new ScheduleWindow(windowMinutes);
    }

    public boolean isDue(ScheduledJob job, LocalDateTime now) {
        return isDue(job, now, true);
    }

    /**
     * @param checkWindow {@code false} relaxes only the time-window match; day, minute-list and
     *                    already-triggered checks still apply
     */
    public boolean isDue(ScheduledJob job, LocalDateTime now, boolean checkWindow) {
        if (job.startDate() != null && job.startDate().isAfter(now)) {
            return false;
        }
        Frequency frequency = job.frequency();
        if (frequency == null) {
            log.warn("Job {} has an unknown frequency, treating as not due", job.label());
            return false;
        }
        if (frequency == Frequency.ONCE) {
            return job.lastTriggeredAt() == null;
        }
        try {
            JsonNode config = parseConfig(job.scheduleConfig());
            return switch (frequency) {
                case DAILY -> dailyDue(config, job.lastTriggeredAt(), now, checkWindow);
                case WEEKLY -> weeklyDue(config, job.lastTriggeredAt(), now, checkWindow);
                case HOURLY -> hourlyDue(config, job.lastTriggeredAt(), now, checkWindow);
                case MONTHLY -> monthlyDue(config, job.lastTriggeredAt(), now, checkWindow);
                case ONCE -> job.lastTriggeredAt() == null;
            };
        } catch (ScheduleConfigException e) {
            log.warn("Invalid schedule_config for job {}: {}", job.label(), e.getMessage());
            return false;
        }
    }

    private boolean dailyDue(JsonNode config, LocalDateTime last, LocalDateTime now, boolean checkWindow) {
        List<String> times = textList(config, "times", List.of("00:00"));
        if (checkWindow && times.stream().noneMatch(t -> window.matches(now, t))) {
            return false;
        }
        return last == null || last.toLocalDate().isBefore(now.toLocalDate());
    }

    private boolean weeklyDue(JsonNode config, LocalDateTime last, LocalDateTime now, boolean checkWindow) {
        List<String> days = textList(config, "days", List.of("monday"));
        String time = text(config, "time", "00:00");
        String today = now.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT);
        boolean listed = days.stream().anyMatch(d -> d.trim().toLowerCase(Locale.ROOT).equals(today));
        if (!listed) {
            return false;
        }
        if (checkWindow && !window.matches(now, time)) {
            return false;
        }
        return last == null || !last.toLocalDate().equals(now.toLocalDate());
    }

    private boolean hourlyDue(JsonNode config, LocalDateTime last, LocalDateTime now, boolean checkWindow) {
        List<Integer> minutes = new ArrayList<>();
        if (config.has("minutes")) {
            JsonNode raw = config.get("minutes");
            if (raw.isArray()) {
                for (JsonNode m : raw) {
                    minutes.add(intOf(m, "minutes"));
                }
            } else {
                minutes.add(intOf(raw, "minutes"));
            }
        } else {
            minutes.add(config.has("minute") ? intOf(config.get("minute"), "minute") : 0);
        }
        if (checkWindow && !minutes.contains(now.getMinute())) {
            return false;
        }
        if (last == null) {
            return true;
        }
        boolean sameHourSameDate = last.getHour() == now.getHour()
                && last.toLocalDate().equals(now.toLocalDate());
        if (sameHourSameDate) {
            return last.getMinute() != now.getMinute();
        }
        return true;
    }

    private boolean monthlyDue(JsonNode config, LocalDateTime last, LocalDateTime now, boolean checkWindow) {
        int day = config.has("day") ? intOf(config.get("day"), "day") : 1;
        String time = text(config, "time", "00:00");
        if (now.getDayOfMonth() != day) {
            return false;
        }
        if (checkWindow && !window.matches(now, time)) {
            return false;
        }
        return last == null || last.getMonthValue() != now.getMonthValue() || last.getYear() != now.getYear();
    }

    private static JsonNode parseConfig(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ScheduleConfigException("schedule_config is empty");
        }
        JsonNode node;
        try {
            node = Jsons.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ScheduleConfigException("schedule_config is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new ScheduleConfigException("schedule_config must be a JSON object");
        }
        return node;
    }

    private static List<String> textList(JsonNode config, String field, List<String> fallback) {
        JsonNode raw = config.get(field);
        if (raw == null || raw.isNull()) {
            return fallback;
        }
        if (!raw.isArray()) {
            throw new ScheduleConfigException("'" + field + "' must be a list");
        }
        List<String> out = new ArrayList<>();
        for (JsonNode item : raw) {
            if (!item.isTextual()) {
                throw new ScheduleConfigException("'" + field + "' entries must be strings");
            }
            out.add(item.asText());
        }
        return out;
    }

    private static String text(JsonNode config, String field, String fallback) {
        JsonNode raw = config.get(field);
        if (raw == null || raw.isNull()) {
            return fallback;
        }
        if (!raw.isTextual()) {
            throw new ScheduleConfigException("'" + field + "' must be a string");
        }
        return raw.asText();
    }

    private static int intOf(JsonNode node, String field) {
        if (node == null || !node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new ScheduleConfigException("'" + field + "' must be an integer");
        }
        return node.asInt();
    }
}
