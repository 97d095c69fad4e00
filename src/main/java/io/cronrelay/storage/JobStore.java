package io.cronrelay.storage;

import io.cronrelay.model.Frequency;
import io.cronrelay.model.JobStatus;
import io.cronrelay.model.ScheduledJob;
import io.cronrelay.util.Timestamps;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to {@code scheduled_jobs}. Every statement is parameterized; each mutation is an
 * independent call with no cross-step transaction.
 */
public final class JobStore {
    private static final String COLUMNS = "id,function_app,service,trigger_url,json_body,start_date,frequency,"
            + "schedule_config,triggered_count,trigger_limit,last_triggered_at,status,retry_count,max_retries,"
            + "last_response_code,last_response_detail,error_message,log_id,processed_at,is_active";

    private final StoreGateway gateway;

    public JobStore(StoreGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * Active jobs in {@code pending} or {@code failed} that are still under their trigger limit.
     */
    public List<ScheduledJob> fetchCandidates() {
        return map(gateway.query(
                "SELECT " + COLUMNS + " FROM scheduled_jobs WHERE is_active=1 AND status IN (?,?) "
                        + "AND (trigger_limit IS NULL OR triggered_count < trigger_limit) "
                        + "ORDER BY start_date ASC, id ASC",
                List.of(JobStatus.PENDING.dbValue(), JobStatus.FAILED.dbValue())));
    }

    public List<ScheduledJob> fetchCandidates(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<Object> params = new ArrayList<>();
        params.add(JobStatus.PENDING.dbValue());
        params.add(JobStatus.FAILED.dbValue());
        params.addAll(ids);
        return map(gateway.query(
                "SELECT " + COLUMNS + " FROM scheduled_jobs WHERE is_active=1 AND status IN (?,?) "
                        + "AND (trigger_limit IS NULL OR triggered_count < trigger_limit) "
                        + "AND id IN (" + placeholders(ids.size()) + ") ORDER BY start_date ASC, id ASC",
                params));
    }

    /**
     * Jobs filtered by the active flag only, whatever their status or trigger count.
     */
    public List<ScheduledJob> fetchActiveByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return map(gateway.query(
                "SELECT " + COLUMNS + " FROM scheduled_jobs WHERE is_active=1 AND id IN ("
                        + placeholders(ids.size()) + ") ORDER BY start_date ASC, id ASC",
                new ArrayList<Object>(ids)));
    }

    public List<ScheduledJob> findStuck(LocalDateTime cutoff) {
        return map(gateway.query(
                "SELECT " + COLUMNS + " FROM scheduled_jobs WHERE status=? "
                        + "AND (last_triggered_at IS NULL OR last_triggered_at < ?) ORDER BY id ASC",
                List.of(JobStatus.PROCESSING.dbValue(), Timestamps.format(cutoff))));
    }

    public Optional<ScheduledJob> findById(long id) {
        List<ScheduledJob> rows = map(gateway.query(
                "SELECT " + COLUMNS + " FROM scheduled_jobs WHERE id=?", List.of(id)));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<ScheduledJob> listAll() {
        return map(gateway.query("SELECT " + COLUMNS + " FROM scheduled_jobs ORDER BY id ASC", List.of()));
    }

    public long insert(NewJob job) {
        List<Map<String, Object>> rows = gateway.query(
                "INSERT INTO scheduled_jobs(function_app,service,trigger_url,json_body,start_date,frequency,"
                        + "schedule_config,trigger_limit,max_retries,status,is_active) VALUES(?,?,?,?,?,?,?,?,?,?,?) RETURNING id",
                Arrays.asList(
                        job.functionApp(),
                        job.service(),
                        job.triggerUrl(),
                        job.jsonBody(),
                        Timestamps.format(job.startDate()),
                        job.frequency(),
                        job.scheduleConfig(),
                        job.triggerLimit(),
                        job.maxRetries(),
                        JobStatus.PENDING.dbValue(),
                        job.active() ? 1 : 0
                ));
        if (rows.isEmpty()) {
            throw new StoreException("Failed to insert job " + job.functionApp() + "/" + job.service(), null);
        }
        return Rows.longValue(rows.get(0), "id", -1L);
    }

    /**
     * Claims the job for this pass and stamps the trigger time. The update only applies while the row
     * still has the status and trigger time it was fetched with, so a pass that fetched it earlier
     * cannot claim it again after another pass has claimed or run it.
     *
     * @return {@code true} when this call claimed the job
     */
    public boolean markProcessing(ScheduledJob job, LocalDateTime now) {
        int updated = gateway.execute(
                "UPDATE scheduled_jobs SET status=?,last_triggered_at=? "
                        + "WHERE id=? AND status=? AND status<>? AND last_triggered_at IS ?",
                Arrays.asList(
                        JobStatus.PROCESSING.dbValue(),
                        Timestamps.format(now),
                        job.id(),
                        job.status().dbValue(),
                        JobStatus.PROCESSING.dbValue(),
                        job.lastTriggeredAt() == null ? null : Timestamps.format(job.lastTriggeredAt())));
        return updated == 1;
    }

    public void markSuccess(long id, JobStatus next, LocalDateTime now, int code, String detail, Long logId) {
        gateway.execute(
                "UPDATE scheduled_jobs SET status=?,triggered_count=triggered_count+1,last_triggered_at=?,"
                        + "last_response_code=?,last_response_detail=?,processed_at=?,error_message=NULL,"
                        + "retry_count=0,log_id=? WHERE id=?",
                Arrays.asList(next.dbValue(), Timestamps.format(now), code, detail, Timestamps.format(now), logId, id));
    }

    public void markFailed(long id, LocalDateTime now, int code, String detail, Long logId) {
        gateway.execute(
                "UPDATE scheduled_jobs SET status=?,processed_at=?,last_response_code=?,last_response_detail=?,"
                        + "error_message=?,log_id=? WHERE id=?",
                Arrays.asList(JobStatus.FAILED.dbValue(), Timestamps.format(now), code, detail,
                        "Service execution failed with HTTP " + code, logId, id));
    }

    public void markFailedFromException(long id, LocalDateTime now, String message) {
        gateway.execute(
                "UPDATE scheduled_jobs SET status=?,processed_at=?,last_response_detail=NULL,error_message=? WHERE id=?",
                Arrays.asList(JobStatus.FAILED.dbValue(), Timestamps.format(now), message, id));
    }

    public void markCompleted(long id, LocalDateTime now) {
        gateway.execute(
                "UPDATE scheduled_jobs SET status=?,processed_at=? WHERE id=?",
                List.of(JobStatus.COMPLETED.dbValue(), Timestamps.format(now), id));
    }

    /**
     * Moves a stuck job to {@code failed}. Only matches rows still in {@code processing}.
     */
    public int reclaim(long id, LocalDateTime now, int code, String message) {
        return gateway.execute(
                "UPDATE scheduled_jobs SET status=?,last_response_code=?,last_response_detail=NULL,error_message=?,"
                        + "processed_at=? WHERE id=? AND status=?",
                Arrays.asList(JobStatus.FAILED.dbValue(), code, message, Timestamps.format(now), id,
                        JobStatus.PROCESSING.dbValue()));
    }

    private static List<ScheduledJob> map(List<Map<String, Object>> rows) {
        List<ScheduledJob> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            out.add(toJob(row));
        }
        return out;
    }

    static ScheduledJob toJob(Map<String, Object> row) {
        return new ScheduledJob(
                Rows.longValue(row, "id", -1L),
                Rows.string(row, "function_app"),
                Rows.string(row, "service"),
                Rows.string(row, "trigger_url"),
                Rows.string(row, "json_body"),
                Rows.timestamp(row, "start_date"),
                Frequency.fromDb(Rows.string(row, "frequency")),
                Rows.string(row, "schedule_config"),
                Rows.intValue(row, "triggered_count", 0),
                Rows.nullableInt(row, "trigger_limit"),
                Rows.timestamp(row, "last_triggered_at"),
                JobStatus.fromDb(Rows.string(row, "status")),
                Rows.intValue(row, "retry_count", 0),
                Rows.intValue(row, "max_retries", 0),
                Rows.nullableInt(row, "last_response_code"),
                Rows.string(row, "last_response_detail"),
                Rows.string(row, "error_message"),
                Rows.nullableLong(row, "log_id"),
                Rows.timestamp(row, "processed_at"),
                Rows.flag(row, "is_active")
        );
    }

    private static String placeholders(int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append('?');
        }
        return sb.toString();
    }

    public record NewJob(
            String functionApp,
            String service,
            String triggerUrl,
            String jsonBody,
            LocalDateTime startDate,
            String frequency,
            String scheduleConfig,
            Integer triggerLimit,
            int maxRetries,
            boolean active
    ) {
    }
}
