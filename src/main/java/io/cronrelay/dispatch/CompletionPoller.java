package io.cronrelay.dispatch;

import io.cronrelay.ledger.LedgerRepository;
import io.cronrelay.model.ExecutionLogEntry;
import io.cronrelay.model.LogStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Waits for a deferred execution to reach a terminal ledger status.
 * <p>
 * A deadline of zero or less polls until the entry is terminal. A query error ends polling
 * immediately with a failure rather than looping on it.
 */
public final class CompletionPoller {
    private static final Logger log = LoggerFactory.getLogger(CompletionPoller.class);

    private final LedgerRepository ledger;
    private final long intervalMs;
    private final long deadlineMs;
    private final Sleeper sleeper;

    public CompletionPoller(LedgerRepository ledger, long intervalMs, long deadlineMs) {
        this(ledger, intervalMs, deadlineMs, Thread::sleep);
    }

    public CompletionPoller(LedgerRepository ledger, long intervalMs, long deadlineMs, Sleeper sleeper) {
        this.ledger = ledger;
        this.intervalMs = Math.max(1L, intervalMs);
        this.deadlineMs = deadlineMs;
        this.sleeper = sleeper;
    }

    public PollResult poll(long logId) {
        long startedNanos = System.nanoTime();
        int polls = 0;
        while (true) {
            polls++;
            Optional<ExecutionLogEntry> entry;
            try {
                entry = ledger.findById(logId);
            } catch (RuntimeException e) {
                log.error("Error polling ledger entry {}: {}", logId, e.getMessage());
                return PollResult.failed(DispatchFailure.POLL_QUERY_ERROR, "Polling error: " + e.getMessage());
            }
            if (entry.isPresent() && entry.get().status().terminal()) {
                return terminal(entry.get());
            }
            long elapsedMs = (System.nanoTime() - startedNanos) / 1_000_000L;
            if (deadlineMs > 0L && elapsedMs + intervalMs > deadlineMs) {
                log.warn("Ledger entry {} still not terminal after {} ms and {} polls", logId, elapsedMs, polls);
                return PollResult.failed(DispatchFailure.POLL_DEADLINE,
                        "Polling deadline exceeded after " + deadlineMs + " ms waiting for log_id " + logId);
            }
            try {
                sleeper.sleep(intervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return PollResult.failed(DispatchFailure.POLL_QUERY_ERROR, "Polling error: interrupted");
            }
        }
    }

    private static PollResult terminal(ExecutionLogEntry entry) {
        LogStatus status = entry.status();
        if (status == LogStatus.SUCCESS) {
            return PollResult.succeeded("Master log status: success");
        }
        if (status == LogStatus.WARNING) {
            return PollResult.failed(DispatchFailure.POLL_WARNING, "Master log status: warning");
        }
        String error = entry.errorMessage();
        String detail = error == null || error.isBlank()
                ? "Master log status: failed"
                : "Master log status: failed - " + error;
        return PollResult.failed(DispatchFailure.POLL_FAILED, detail);
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
