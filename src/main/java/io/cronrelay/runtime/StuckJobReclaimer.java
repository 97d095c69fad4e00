package io.cronrelay.runtime;

import io.cronrelay.model.ScheduledJob;
import io.cronrelay.storage.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Repairs jobs left in {@code processing} by a crashed or overlapping pass.
 */
public final class StuckJobReclaimer {
    private static final Logger log = LoggerFactory.getLogger(StuckJobReclaimer.class);

    public static final int TIMEOUT_CODE = 408;
    public static final String NULL_TIMESTAMP_MESSAGE =
            "Service execution timeout - stuck in processing status with NULL last_triggered_at";

    private final JobStore jobs;
    private final Duration threshold;

    public StuckJobReclaimer(JobStore jobs, Duration threshold) {
        this.jobs = jobs;
        this.threshold = threshold;
    }

    /**
     * Returns how many jobs were moved to {@code failed}. Never throws; a failed scan counts as zero.
     */
    public int reclaim(LocalDateTime now) {
        List<ScheduledJob> stuck;
        try {
            stuck = jobs.findStuck(now.minus(threshold));
        } catch (RuntimeException e) {
            log.error("Error checking for stuck processing jobs: {}", e.getMessage());
            return 0;
        }
        if (stuck.isEmpty()) {
            return 0;
        }
        log.warn("Found {} jobs stuck in processing", stuck.size());
        int reclaimed = 0;
        for (ScheduledJob job : stuck) {
            String message;
            if (job.lastTriggeredAt() == null) {
                log.warn("Job {} stuck with no last_triggered_at", job.label());
                message = NULL_TIMESTAMP_MESSAGE;
            } else {
                log.warn("Job {} stuck since {}", job.label(), job.lastTriggeredAt());
                message = elapsedMessage();
            }
            try {
                reclaimed += jobs.reclaim(job.id(), now, TIMEOUT_CODE, message);
            } catch (RuntimeException e) {
                log.error("Failed to reclaim job {}: {}", job.label(), e.getMessage());
            }
        }
        log.warn("Marked {} stuck jobs as failed", reclaimed);
        return reclaimed;
    }

    String elapsedMessage() {
        return "Service execution timeout - stuck in processing status for >" + threshold.toMinutes() + " minutes";
    }
}
