package io.cronrelay.runtime;

import io.cronrelay.config.CronRelayConfig;
import io.cronrelay.config.SchedulerSettings;
import io.cronrelay.dispatch.CompletionPoller;
import io.cronrelay.dispatch.DispatchResult;
import io.cronrelay.dispatch.HttpJobDispatcher;
import io.cronrelay.dispatch.JobDispatcher;
import io.cronrelay.ledger.LedgerRepository;
import io.cronrelay.model.JobStatus;
import io.cronrelay.model.LineageContext;
import io.cronrelay.model.ScheduledJob;
import io.cronrelay.schedule.ScheduleEvaluator;
import io.cronrelay.security.SensitiveDataMasker;
import io.cronrelay.storage.Database;
import io.cronrelay.storage.JdbcStoreGateway;
import io.cronrelay.storage.JobStore;
import io.cronrelay.storage.StoreGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Runs evaluation passes over the job catalog. Jobs are handled one at a time; a failure on one
 * job is recorded on its row and the pass moves on. Only a failed candidate fetch ends a pass early.
 */
public final class SchedulerRuntime {
    private static final Logger log = LoggerFactory.getLogger(SchedulerRuntime.class);

    private final SchedulerSettings settings;
    private final StoreGateway gateway;
    private final JobStore jobs;
    private final ScheduleEvaluator evaluator;
    private final JobDispatcher dispatcher;
    private final StuckJobReclaimer reclaimer;
    private final Clock clock;

    public SchedulerRuntime(SchedulerSettings settings, StoreGateway gateway, JobDispatcher dispatcher, Clock clock) {
        this.settings = settings;
        this.gateway = gateway;
        this.jobs = new JobStore(gateway);
        this.evaluator = new ScheduleEvaluator(settings.windowMinutes());
        this.dispatcher = dispatcher;
        this.reclaimer = new StuckJobReclaimer(jobs, settings.stuckThreshold());
        this.clock = clock;
    }

    /**
     * Bootstraps the SQLite store under the config root and wires the HTTP dispatcher.
     */
    public static SchedulerRuntime create(CronRelayConfig config, Clock clock) {
        Database database = new Database(config);
        database.init();
        SchedulerSettings settings = config.settings();
        StoreGateway gateway = JdbcStoreGateway.forDatabase(database);
        CompletionPoller poller = new CompletionPoller(
                new LedgerRepository(gateway), settings.pollIntervalMs(), settings.pollDeadlineMs());
        return new SchedulerRuntime(settings, gateway, new HttpJobDispatcher(settings, poller), clock);
    }

    public SchedulerSettings settings() {
        return settings;
    }

    public StoreGateway gateway() {
        return gateway;
    }

    public JobStore jobs() {
        return jobs;
    }

    public Clock clock() {
        return clock;
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock.withZone(settings.zoneId()));
    }

    public RunSummary runPass(RunOverrides overrides, LineageContext parent) {
        RunOverrides effective = overrides == null ? RunOverrides.standard() : overrides;
        Tally tally = new Tally();
        LocalDateTime passTime = now();

        tally.stuckReclaimed = reclaimer.reclaim(passTime);

        List<ScheduledJob> candidates;
        try {
            candidates = fetch(effective);
        } catch (RuntimeException e) {
            String message = "Error fetching or processing scheduled jobs: " + SensitiveDataMasker.maskText(e.getMessage());
            log.error("{}", message, e);
            tally.errors.add(message);
            return tally.summary();
        }
        if (candidates.isEmpty()) {
            log.info("No active jobs to evaluate");
            return tally.summary();
        }
        log.info("Evaluating {} candidate jobs ({})", candidates.size(), effective.executionMode());

        Set<Long> forced = effective.effectiveForceIds();
        for (ScheduledJob job : candidates) {
            tally.processed++;
            try {
                handle(job, forced.contains(job.id()), effective.effectiveBypass(), passTime, parent, tally);
            } catch (RuntimeException e) {
                String message = SensitiveDataMasker.maskText(String.valueOf(e.getMessage()));
                tally.failed++;
                tally.errors.add("Job " + job.id() + " (" + job.functionApp() + "/" + job.service() + "): " + message);
                log.error("Job {} raised during handling: {}", job.label(), message, e);
                try {
                    jobs.markFailedFromException(job.id(), now(), message);
                } catch (RuntimeException markError) {
                    log.error("Failed to record exception on job {}: {}", job.label(), markError.getMessage());
                }
            }
        }

        RunSummary summary = tally.summary();
        log.info("Pass complete: processed={} successful={} failed={} skipped={} stuck={}",
                summary.processed(), summary.successful(), summary.failed(), summary.skipped(),
                summary.stuckReclaimed());
        return summary;
    }

    private List<ScheduledJob> fetch(RunOverrides overrides) {
        Set<Long> forced = overrides.effectiveForceIds();
        if (forced.isEmpty()) {
            return jobs.fetchCandidates();
        }
        if (overrides.effectiveBypass()) {
            return jobs.fetchActiveByIds(forced);
        }
        return jobs.fetchCandidates(forced);
    }

    private void handle(ScheduledJob job, boolean forced, boolean bypassWindow,
                        LocalDateTime passTime, LineageContext parent, Tally tally) {
        boolean due;
        if (forced) {
            log.info("Job {} forced", job.label());
            due = true;
        } else {
            due = evaluator.isDue(job, passTime, !bypassWindow);
        }
        if (!due) {
            log.debug("Job {} not due", job.label());
            tally.skipped++;
            return;
        }
        if (job.limitReached()) {
            log.info("Job {} reached its trigger limit ({}/{})", job.label(), job.triggeredCount(), job.triggerLimit());
            jobs.markCompleted(job.id(), now());
            tally.skipped++;
            return;
        }

        if (!jobs.markProcessing(job, now())) {
            log.info("Job {} was claimed by another pass, skipping", job.label());
            tally.skipped++;
            return;
        }
        tally.triggered.add(new RunSummary.TriggeredService(job.id(), job.functionApp(), job.service()));
        log.info("Dispatching job {}", job.label());

        DispatchResult result = dispatcher.dispatch(job, parent);
        LocalDateTime finished = now();
        if (result.success()) {
            JobStatus next = job.statusAfterSuccess();
            jobs.markSuccess(job.id(), next, finished, result.responseCode(), result.responseDetail(), result.childLogId());
            tally.successful++;
            log.info("Job {} succeeded (HTTP {}), now {}", job.label(), result.responseCode(), next.dbValue());
        } else {
            jobs.markFailed(job.id(), finished, result.responseCode(), result.responseDetail(), result.childLogId());
            tally.failed++;
            log.error("Job {} failed (HTTP {}, {})", job.label(), result.responseCode(), result.failure());
        }
    }

    private static final class Tally {
        private final List<RunSummary.TriggeredService> triggered = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();
        private int processed;
        private int successful;
        private int failed;
        private int skipped;
        private int stuckReclaimed;

        private RunSummary summary() {
            return new RunSummary(List.copyOf(triggered), processed, successful, failed, skipped, stuckReclaimed,
                    List.copyOf(errors));
        }
    }
}
