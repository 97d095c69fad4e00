package io.cronrelay.ledger;

import io.cronrelay.model.LineageContext;
import io.cronrelay.model.LogStatus;
import io.cronrelay.model.TriggerSource;
import io.cronrelay.security.SensitiveDataMasker;
import io.cronrelay.storage.Rows;
import io.cronrelay.storage.StoreGateway;
import io.cronrelay.util.Jsons;
import io.cronrelay.util.Timestamps;
import io.cronrelay.util.Tokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records one execution in {@code execution_log} and threads lineage to whatever it dispatches.
 * <p>
 * The store allocates {@code log_id} as a side effect of the insert, so {@link #logStart} tags the
 * row with a fresh invocation token and reads the id back by that token. The token is 128 random
 * bits and carries a UNIQUE constraint, so a read-back can never resolve another writer's row.
 * <p>
 * One instance covers one entry: started once, completed once.
 */
public final class ExecutionLedger {
    private static final Logger log = LoggerFactory.getLogger(ExecutionLedger.class);

    private final StoreGateway gateway;
    private final Clock clock;
    private final ZoneId zone;
    private final String functionApp;
    private final String serviceName;
    private final TriggerSource triggerSource;
    private final LineageContext parent;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    private Long logId;
    private long rootId;
    private Instant startedAt;
    private boolean completed;

    public ExecutionLedger(StoreGateway gateway, Clock clock, ZoneId zone,
                           String functionApp, String serviceName, TriggerSource triggerSource,
                           LineageContext parent) {
        this.gateway = gateway;
        this.clock = clock;
        this.zone = zone;
        this.functionApp = functionApp;
        this.serviceName = serviceName;
        this.triggerSource = triggerSource;
        this.parent = parent;
    }

    public long logStart(Map<String, ?> request) {
        if (logId != null) {
            throw new LedgerProtocolException("log_start already called for log_id " + logId);
        }
        String token = Tokens.newInvocationToken();
        startedAt = clock.instant();
        String requestJson = request == null ? null : Jsons.toCompactJson(SensitiveDataMasker.masked(request));
        gateway.execute(
                "INSERT INTO execution_log(root_id,parent_id,function_app,service_name,invocation_id,status,"
                        + "trigger_source,started_at,request,metadata) VALUES(?,?,?,?,?,?,?,?,?,?)",
                Arrays.asList(
                        parent == null ? null : parent.rootId(),
                        parent == null ? null : parent.parentServiceId(),
                        functionApp,
                        serviceName,
                        token,
                        LogStatus.PENDING.dbValue(),
                        triggerSource.dbValue(),
                        Timestamps.format(LocalDateTime.ofInstant(startedAt, zone)),
                        requestJson,
                        metadata.isEmpty() ? null : Jsons.toCompactJson(metadata)
                ));
        List<Map<String, Object>> rows = gateway.query(
                "SELECT log_id FROM execution_log WHERE invocation_id=?", List.of(token));
        if (rows.isEmpty()) {
            throw new LedgerProtocolException("Failed to read back log_id for invocation " + token);
        }
        logId = Rows.longValue(rows.get(0), "log_id", -1L);
        rootId = parent == null ? logId : parent.rootId();
        log.debug("Ledger entry {} started for {} (root {})", logId, serviceName, rootId);
        return logId;
    }

    public void logSuccess(Object response) {
        complete(LogStatus.SUCCESS, response, null);
    }

    public void logWarning(String message, Object response) {
        complete(LogStatus.WARNING, response, message);
    }

    public void logError(String message, Object response) {
        complete(LogStatus.FAILED, response, message);
    }

    public void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    /**
     * Lineage for entries this execution dispatches. The root id never changes along a chain.
     */
    public LineageContext childContext() {
        requireStarted("child context");
        return new LineageContext(logId, rootId);
    }

    public Long logId() {
        return logId;
    }

    public boolean completed() {
        return completed;
    }

    private void complete(LogStatus status, Object response, String errorMessage) {
        requireStarted("log_" + status.dbValue());
        if (completed) {
            throw new LedgerProtocolException("Ledger entry " + logId + " already completed");
        }
        Instant end = clock.instant();
        long durationMs = Math.max(0L, Duration.between(startedAt, end).toMillis());
        gateway.execute(
                "UPDATE execution_log SET status=?,ended_at=?,duration_ms=?,response=?,error_message=?,metadata=?,"
                        + "root_id=COALESCE(root_id, ?) WHERE log_id=?",
                Arrays.asList(
                        status.dbValue(),
                        Timestamps.format(LocalDateTime.ofInstant(end, zone)),
                        durationMs,
                        response == null ? null : Jsons.toCompactJson(response),
                        SensitiveDataMasker.maskText(errorMessage),
                        metadata.isEmpty() ? null : Jsons.toCompactJson(metadata),
                        logId,
                        logId
                ));
        completed = true;
    }

    private void requireStarted(String operation) {
        if (logId == null) {
            throw new LedgerProtocolException(operation + " called before log_start");
        }
    }
}
