package io.cronrelay.support;

import io.cronrelay.config.CronRelayConfig;
import io.cronrelay.config.SchedulerSettings;
import io.cronrelay.storage.Database;
import io.cronrelay.storage.JdbcStoreGateway;
import io.cronrelay.storage.JobStore;
import io.cronrelay.storage.StoreGateway;
import io.cronrelay.util.Timestamps;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * A throwaway SQLite store under a temp directory.
 */
public final class StoreFixture implements AutoCloseable {
    public static final ZoneId ZONE = ZoneId.of("America/New_York");

    private final Path root;
    private final CronRelayConfig config;
    private final StoreGateway gateway;
    private final JobStore jobs;

    private StoreFixture(Path root, SchedulerSettings settings) {
        this.root = root;
        this.config = CronRelayConfig.fromRoot(root.toString(), settings);
        Database db = new Database(config);
        db.init();
        this.gateway = JdbcStoreGateway.forDatabase(db);
        this.jobs = new JobStore(gateway);
    }

    public static StoreFixture create(String prefix) throws IOException {
        return create(prefix, testSettings());
    }

    public static StoreFixture create(String prefix, SchedulerSettings settings) throws IOException {
        return new StoreFixture(Files.createTempDirectory("cronrelay-test-" + prefix + "-"), settings);
    }

    public static SchedulerSettings testSettings() {
        return SchedulerSettings.defaults()
                .withStoreRetry(0, 0L)
                .withPolling(10L, 0L)
                .withDispatchTimeoutSeconds(5L);
    }

    public static Clock clockAt(LocalDateTime localTime) {
        return Clock.fixed(localTime.atZone(ZONE).toInstant(), ZONE);
    }

    public Path root() {
        return root;
    }

    public CronRelayConfig config() {
        return config;
    }

    public StoreGateway gateway() {
        return gateway;
    }

    public JobStore jobs() {
        return jobs;
    }

    public long insertJob(String service, String url, String frequency, String scheduleConfig,
                          LocalDateTime startDate, Integer triggerLimit) {
        return jobs.insert(new JobStore.NewJob(
                "reports-app",
                service,
                url,
                "{\"report\":\"" + service + "\"}",
                startDate,
                frequency,
                scheduleConfig,
                triggerLimit,
                0,
                true
        ));
    }

    public void forceState(long id, String status, LocalDateTime lastTriggeredAt, int triggeredCount) {
        gateway.execute(
                "UPDATE scheduled_jobs SET status=?,last_triggered_at=?,triggered_count=? WHERE id=?",
                Arrays.asList(status, Timestamps.format(lastTriggeredAt), triggeredCount, id));
    }

    public Map<String, Object> jobRow(long id) {
        List<Map<String, Object>> rows = gateway.query("SELECT * FROM scheduled_jobs WHERE id=?", List.of(id));
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<Map<String, Object>> ledgerRows() {
        return gateway.query("SELECT * FROM execution_log ORDER BY log_id ASC", List.of());
    }

    @Override
    public void close() throws IOException {
        deleteRecursively(root);
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
