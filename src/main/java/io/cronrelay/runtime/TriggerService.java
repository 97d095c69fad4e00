package io.cronrelay.runtime;

import io.cronrelay.ledger.ExecutionLedger;
import io.cronrelay.model.TriggerSource;
import io.cronrelay.security.SensitiveDataMasker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry points for the periodic timer and the on-demand trigger. Each run is recorded as a root
 * ledger entry; the on-demand trigger threads that entry's lineage into every dispatched payload.
 */
public final class TriggerService {
    private static final Logger log = LoggerFactory.getLogger(TriggerService.class);

    public static final String TIMER_SERVICE = "scheduler_timer";
    public static final String MANUAL_SERVICE = "scheduler_http_trigger";
    public static final String MANUAL_ENDPOINT = "/api/scheduler/manual-trigger";

    private final SchedulerRuntime runtime;

    public TriggerService(SchedulerRuntime runtime) {
        this.runtime = runtime;
    }

    /**
     * Runs a standard pass. A ledger entry is written only when at least one job was dispatched.
     * Failures are recorded on the entry when one exists, then rethrown to the timer loop.
     */
    public RunSummary timerTick(boolean pastDue) {
        if (pastDue) {
            log.warn("Timer tick is running late");
        }
        ExecutionLedger ledger = newLedger(TIMER_SERVICE, TriggerSource.TIMER);
        try {
            RunSummary summary = runtime.runPass(RunOverrides.standard(), null);
            if (!summary.executedAny()) {
                log.info("No jobs were dispatched, skipping ledger entry");
                return summary;
            }
            Map<String, Object> request = new LinkedHashMap<>();
            request.put("is_past_due", pastDue);
            ledger.putMetadata("function_type", "timer");
            ledger.putMetadata("interval_minutes", runtime.settings().timerIntervalMinutes());
            ledger.putMetadata("is_past_due", pastDue);
            long logId = ledger.logStart(request);
            log.info("Timer tick recorded as ledger entry {}", logId);
            if (summary.errors().isEmpty()) {
                ledger.logSuccess(summary);
            } else {
                ledger.putMetadata("errors", summary.errors());
                ledger.logWarning("Completed with " + summary.errors().size() + " errors", summary);
            }
            return summary;
        } catch (RuntimeException e) {
            String message = "Scheduler timer failed: " + SensitiveDataMasker.maskText(e.getMessage());
            log.error("{}", message, e);
            recordError(ledger, message, e);
            throw e;
        }
    }

    /**
     * Runs a pass with overrides. Never throws; every failure becomes a {@code success=false} response.
     */
    public ManualTriggerResponse manualTrigger(RunOverrides overrides, Map<String, ?> requestSnapshot) {
        long startedNanos = System.nanoTime();
        RunOverrides effective = overrides == null ? RunOverrides.standard() : overrides;
        String mode = effective.executionMode();
        ExecutionLedger ledger = newLedger(MANUAL_SERVICE, TriggerSource.HTTP);
        try {
            ledger.putMetadata("function_type", "http");
            ledger.putMetadata("endpoint", MANUAL_ENDPOINT);
            ledger.putMetadata("execution_mode", mode);
            long rootLogId = ledger.logStart(requestSnapshot == null ? Map.of() : requestSnapshot);
            log.info("Manual trigger started as ledger entry {} in mode {}", rootLogId, mode);

            RunSummary summary = runtime.runPass(effective, ledger.childContext());
            ManualTriggerResponse response = new ManualTriggerResponse(
                    true,
                    "Scheduler executed successfully",
                    summary,
                    mode,
                    elapsedSeconds(startedNanos),
                    rootLogId,
                    null,
                    null
            );
            if (summary.errors().isEmpty()) {
                ledger.logSuccess(response);
            } else {
                for (String error : summary.errors()) {
                    log.error("Manual trigger error: {}", error);
                }
                ledger.putMetadata("errors", summary.errors());
                ledger.logWarning("Completed with " + summary.errors().size() + " errors", response);
            }
            return response;
        } catch (RuntimeException e) {
            String detail = SensitiveDataMasker.maskText(String.valueOf(e.getMessage()));
            String message = "Manual scheduler trigger failed: " + detail;
            log.error("{}", message, e);
            double elapsed = elapsedSeconds(startedNanos);
            ledger.putMetadata("execution_time_seconds", elapsed);
            ledger.putMetadata("exception_type", e.getClass().getSimpleName());
            recordError(ledger, message, e);
            return new ManualTriggerResponse(
                    false,
                    message,
                    null,
                    mode,
                    elapsed,
                    ledger.logId(),
                    detail,
                    e.getClass().getSimpleName()
            );
        }
    }

    private ExecutionLedger newLedger(String serviceName, TriggerSource source) {
        return new ExecutionLedger(
                runtime.gateway(),
                runtime.clock(),
                runtime.settings().zoneId(),
                runtime.settings().functionApp(),
                serviceName,
                source,
                null
        );
    }

    private static void recordError(ExecutionLedger ledger, String message, RuntimeException cause) {
        if (ledger.logId() == null || ledger.completed()) {
            return;
        }
        try {
            ledger.putMetadata("exception_type", cause.getClass().getSimpleName());
            ledger.logError(message, null);
        } catch (RuntimeException logError) {
            log.error("Failed to record error on ledger entry {}: {}", ledger.logId(), logError.getMessage());
        }
    }

    private static double elapsedSeconds(long startedNanos) {
        double seconds = (System.nanoTime() - startedNanos) / 1_000_000_000.0;
        return Math.round(seconds * 100.0) / 100.0;
    }
}
