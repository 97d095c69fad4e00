package io.cronrelay.ledger;

import io.cronrelay.model.ExecutionLogEntry;
import io.cronrelay.model.LogStatus;
import io.cronrelay.storage.Rows;
import io.cronrelay.storage.StoreGateway;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read projection over {@code execution_log}.
 */
public final class LedgerRepository {
    private static final String COLUMNS = "log_id,root_id,parent_id,function_app,service_name,invocation_id,status,"
            + "trigger_source,started_at,ended_at,duration_ms,request,response,error_message,metadata";

    private final StoreGateway gateway;

    public LedgerRepository(StoreGateway gateway) {
        this.gateway = gateway;
    }

    public Optional<ExecutionLogEntry> findById(long logId) {
        List<Map<String, Object>> rows = gateway.query(
                "SELECT " + COLUMNS + " FROM execution_log WHERE log_id=?", List.of(logId));
        return rows.isEmpty() ? Optional.empty() : Optional.of(toEntry(rows.get(0)));
    }

    public List<ExecutionLogEntry> findChildren(long parentId) {
        List<Map<String, Object>> rows = gateway.query(
                "SELECT " + COLUMNS + " FROM execution_log WHERE parent_id=? ORDER BY log_id ASC", List.of(parentId));
        List<ExecutionLogEntry> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            out.add(toEntry(row));
        }
        return out;
    }

    private static ExecutionLogEntry toEntry(Map<String, Object> row) {
        return new ExecutionLogEntry(
                Rows.longValue(row, "log_id", -1L),
                Rows.nullableLong(row, "root_id"),
                Rows.nullableLong(row, "parent_id"),
                Rows.string(row, "function_app"),
                Rows.string(row, "service_name"),
                Rows.string(row, "invocation_id"),
                LogStatus.fromDb(Rows.string(row, "status")),
                Rows.string(row, "trigger_source"),
                Rows.timestamp(row, "started_at"),
                Rows.timestamp(row, "ended_at"),
                Rows.nullableLong(row, "duration_ms"),
                Rows.string(row, "request"),
                Rows.string(row, "response"),
                Rows.string(row, "error_message"),
                Rows.string(row, "metadata")
        );
    }
}
