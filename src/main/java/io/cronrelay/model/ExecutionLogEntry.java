package io.cronrelay.model;

import java.time.LocalDateTime;

/**
 * One ledger row. A root entry has no parent; once completed its root id equals its own log id.
 */
public record ExecutionLogEntry(
        long logId,
        Long rootId,
        Long parentId,
        String functionApp,
        String serviceName,
        String invocationId,
        LogStatus status,
        String triggerSource,
        LocalDateTime startedAt,
        LocalDateTime endedAt,
        Long durationMs,
        String request,
        String response,
        String errorMessage,
        String metadata
) {
    public boolean root() {
        return parentId == null;
    }
}
