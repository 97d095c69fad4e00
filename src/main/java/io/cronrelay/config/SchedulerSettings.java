package io.cronrelay.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.cronrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Scheduler tunables, resolved once at process start and handed to every component.
 */
public record SchedulerSettings(
        ZoneId zoneId,
        int windowMinutes,
        int stuckThresholdMinutes,
        long dispatchTimeoutSeconds,
        long pollIntervalMs,
        long pollDeadlineMs,
        int storeMaxRetries,
        long storeRetryDelayMs,
        int responseDetailMaxChars,
        String functionApp,
        int timerIntervalMinutes,
        int httpPort
) {
    private static final Logger log = LoggerFactory.getLogger(SchedulerSettings.class);

    public static final String DEFAULT_ZONE = "America/New_York";
    public static final int DEFAULT_WINDOW_MINUTES = 15;
    public static final int DEFAULT_STUCK_THRESHOLD_MINUTES = 15;
    public static final long DEFAULT_DISPATCH_TIMEOUT_SECONDS = 600L;
    public static final long DEFAULT_POLL_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_POLL_DEADLINE_MS = 0L;
    public static final int DEFAULT_STORE_MAX_RETRIES = 3;
    public static final long DEFAULT_STORE_RETRY_DELAY_MS = 5_000L;
    public static final int DEFAULT_RESPONSE_DETAIL_MAX_CHARS = 4_000;
    public static final String DEFAULT_FUNCTION_APP = "cronrelay";
    public static final int DEFAULT_TIMER_INTERVAL_MINUTES = 15;
    public static final int DEFAULT_HTTP_PORT = 8080;

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(
                ZoneId.of(DEFAULT_ZONE),
                DEFAULT_WINDOW_MINUTES,
                DEFAULT_STUCK_THRESHOLD_MINUTES,
                DEFAULT_DISPATCH_TIMEOUT_SECONDS,
                DEFAULT_POLL_INTERVAL_MS,
                DEFAULT_POLL_DEADLINE_MS,
                DEFAULT_STORE_MAX_RETRIES,
                DEFAULT_STORE_RETRY_DELAY_MS,
                DEFAULT_RESPONSE_DETAIL_MAX_CHARS,
                DEFAULT_FUNCTION_APP,
                DEFAULT_TIMER_INTERVAL_MINUTES,
                DEFAULT_HTTP_PORT
        );
    }

    public static SchedulerSettings load(Path file) {
        SchedulerSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            SchedulerSettings resolved = fromFile(raw, defaults);
            log.info("Loaded scheduler settings from {}", file);
            return resolved;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read scheduler settings: " + file, e);
        }
    }

    static SchedulerSettings fromFile(SettingsFile file, SchedulerSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new SchedulerSettings(
                sanitizeZone(file.zoneId(), defaults.zoneId()),
                sanitizeInt(file.windowMinutes(), defaults.windowMinutes(), 1, 60),
                sanitizeInt(file.stuckThresholdMinutes(), defaults.stuckThresholdMinutes(), 1, Integer.MAX_VALUE),
                sanitizeLong(file.dispatchTimeoutSeconds(), defaults.dispatchTimeoutSeconds(), 1L),
                sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 1L),
                sanitizeLong(file.pollDeadlineMs(), defaults.pollDeadlineMs(), 0L),
                sanitizeInt(file.storeMaxRetries(), defaults.storeMaxRetries(), 0, 20),
                sanitizeLong(file.storeRetryDelayMs(), defaults.storeRetryDelayMs(), 0L),
                sanitizeInt(file.responseDetailMaxChars(), defaults.responseDetailMaxChars(), 1, Integer.MAX_VALUE),
                file.functionApp() == null || file.functionApp().isBlank() ? defaults.functionApp() : file.functionApp().trim(),
                sanitizeInt(file.timerIntervalMinutes(), defaults.timerIntervalMinutes(), 1, 1_440),
                sanitizeInt(file.httpPort(), defaults.httpPort(), 0, 65_535)
        );
    }

    public SchedulerSettings withPolling(long intervalMs, long deadlineMs) {
        return new SchedulerSettings(zoneId, windowMinutes, stuckThresholdMinutes, dispatchTimeoutSeconds,
                intervalMs, deadlineMs, storeMaxRetries, storeRetryDelayMs, responseDetailMaxChars,
                functionApp, timerIntervalMinutes, httpPort);
    }

    public SchedulerSettings withDispatchTimeoutSeconds(long seconds) {
        return new SchedulerSettings(zoneId, windowMinutes, stuckThresholdMinutes, seconds,
                pollIntervalMs, pollDeadlineMs, storeMaxRetries, storeRetryDelayMs, responseDetailMaxChars,
                functionApp, timerIntervalMinutes, httpPort);
    }

    public SchedulerSettings withStoreRetry(int maxRetries, long delayMs) {
        return new SchedulerSettings(zoneId, windowMinutes, stuckThresholdMinutes, dispatchTimeoutSeconds,
                pollIntervalMs, pollDeadlineMs, maxRetries, delayMs, responseDetailMaxChars,
                functionApp, timerIntervalMinutes, httpPort);
    }

    public Duration dispatchTimeout() {
        return Duration.ofSeconds(dispatchTimeoutSeconds);
    }

    public Duration stuckThreshold() {
        return Duration.ofMinutes(stuckThresholdMinutes);
    }

    public boolean hasPollDeadline() {
        return pollDeadlineMs > 0L;
    }

    private static ZoneId sanitizeZone(String raw, ZoneId fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            log.warn("Ignoring unknown zoneId '{}', using {}", raw, fallback);
            return fallback;
        }
    }

    private static int sanitizeInt(Integer value, int fallback, int min, int max) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, Math.min(max, value));
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            String zoneId,
            Integer windowMinutes,
            Integer stuckThresholdMinutes,
            Long dispatchTimeoutSeconds,
            Long pollIntervalMs,
            Long pollDeadlineMs,
            Integer storeMaxRetries,
            Long storeRetryDelayMs,
            Integer responseDetailMaxChars,
            String functionApp,
            Integer timerIntervalMinutes,
            Integer httpPort
    ) {
    }
}
