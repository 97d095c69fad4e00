package io.cronrelay.model;

import java.time.LocalDateTime;

/**
 * One row of {@code scheduled_jobs}, validated once when it leaves the store.
 * {@code frequency} is {@code null} when the stored value is not a known kind.
 */
public record ScheduledJob(
        long id,
        String functionApp,
        String service,
        String triggerUrl,
        String jsonBody,
        LocalDateTime startDate,
        Frequency frequency,
        String scheduleConfig,
        int triggeredCount,
        Integer triggerLimit,
        LocalDateTime lastTriggeredAt,
        JobStatus status,
        int retryCount,
        int maxRetries,
        Integer lastResponseCode,
        String lastResponseDetail,
        String errorMessage,
        Long logId,
        LocalDateTime processedAt,
        boolean active
) {
    public boolean limitReached() {
        return triggerLimit != null && triggeredCount >= triggerLimit;
    }

    /**
     * Status a successful dispatch moves the job to: one-shot jobs and jobs hitting their cap complete.
     */
    public JobStatus statusAfterSuccess() {
        if (frequency == Frequency.ONCE) {
            return JobStatus.COMPLETED;
        }
        if (triggerLimit != null && triggeredCount + 1 >= triggerLimit) {
            return JobStatus.COMPLETED;
        }
        return JobStatus.PENDING;
    }

    public String label() {
        return functionApp + "/" + service + "#" + id;
    }
}
