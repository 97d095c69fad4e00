package io.cronrelay.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.cronrelay.config.CronRelayConfig;
import io.cronrelay.ledger.LedgerRepository;
import io.cronrelay.model.ExecutionLogEntry;
import io.cronrelay.model.ScheduledJob;
import io.cronrelay.runtime.ManualTriggerResponse;
import io.cronrelay.runtime.RunOverrides;
import io.cronrelay.runtime.RunSummary;
import io.cronrelay.runtime.SchedulerRuntime;
import io.cronrelay.runtime.TriggerService;
import io.cronrelay.storage.JobStore;
import io.cronrelay.util.Jsons;
import io.cronrelay.util.Timestamps;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "cronrelay",
        mixinStandardHelpOptions = true,
        version = "cronrelay 0.1.0",
        description = "Periodic HTTP job dispatcher with an execution lineage ledger",
        subcommands = {
                CronRelayCommand.InitCommand.class,
                CronRelayCommand.AddJobCommand.class,
                CronRelayCommand.JobsCommand.class,
                CronRelayCommand.JobCommand.class,
                CronRelayCommand.EntryCommand.class,
                CronRelayCommand.RunCommand.class,
                CronRelayCommand.TickCommand.class,
                CronRelayCommand.ServeCommand.class
        }
)
public final class CronRelayCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | add-job | jobs | job | entry | run | tick | serve");
    }

    CronRelayConfig config() {
        return CronRelayConfig.fromRoot(root);
    }

    SchedulerRuntime runtime() {
        return SchedulerRuntime.create(config(), Clock.systemUTC());
    }

    @Command(name = "init", description = "Initialize the data root and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        CronRelayCommand parent;

        @Override
        public Integer call() {
            parent.runtime();
            System.out.println("Initialized CronRelay at: " + parent.config().rootDir());
            return 0;
        }
    }

    @Command(name = "add-job", description = "Add a scheduled job from a JSON file")
    static final class AddJobCommand implements Callable<Integer> {
        @ParentCommand
        CronRelayCommand parent;

        @Option(names = {"--file"}, required = true, description = "Job definition JSON file path")
        String file;

        @Override
        public Integer call() throws Exception {
            SchedulerRuntime runtime = parent.runtime();
            JobFile jf = Jsons.mapper().readValue(Path.of(file).toFile(), JobFile.class);
            long id = runtime.jobs().insert(jf.toNewJob());
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("id", id);
            out.put("function_app", jf.functionApp());
            out.put("service", jf.service());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "jobs", description = "List scheduled jobs")
    static final class JobsCommand implements Callable<Integer> {
        @ParentCommand
        CronRelayCommand parent;

        @Override
        public Integer call() {
            List<ScheduledJob> jobs = parent.runtime().jobs().listAll();
            System.out.println(Jsons.toJson(jobs));
            return 0;
        }
    }

    @Command(name = "job", description = "Show one scheduled job")
    static final class JobCommand implements Callable<Integer> {
        @ParentCommand
        CronRelayCommand parent;

        @Parameters(index = "0", description = "Job id")
        long id;

        @Override
        public Integer call() {
            Optional<ScheduledJob> job = parent.runtime().jobs().findById(id);
            if (job.isEmpty()) {
                System.out.println(Jsons.toJson(Map.of("error", "job_not_found", "id", id)));
                return 1;
            }
            System.out.println(Jsons.toJson(job.get()));
            return 0;
        }
    }

    @Command(name = "entry", description = "Show a ledger entry and its direct children")
    static final class EntryCommand implements Callable<Integer> {
        @ParentCommand
        CronRelayCommand parent;

        @Parameters(index = "0", description = "Ledger log id")
        long logId;

        @Override
        public Integer call() {
            LedgerRepository ledger = new LedgerRepository(parent.runtime().gateway());
            Optional<ExecutionLogEntry> entry = ledger.findById(logId);
            if (entry.isEmpty()) {
                System.out.println(Jsons.toJson(Map.of("error", "entry_not_found", "log_id", logId)));
                return 1;
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("entry", entry.get());
            out.put("children", ledger.findChildren(logId));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "run", description = "Run one on-demand pass, recorded in the ledger")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        CronRelayCommand parent;

        @Option(names = {"--bypass-window"}, description = "Ignore time windows, keep other due-ness checks")
        boolean bypassWindow;

        @Option(names = {"--force"}, split = ",", description = "Job ids to dispatch without due-ness checks")
        List<Long> force;

        @Option(names = {"--schedule-id"}, description = "Single job to dispatch regardless of all but the active flag")
        Long scheduleId;

        @Override
        public Integer call() {
            TriggerService triggers = new TriggerService(parent.runtime());
            RunOverrides overrides = new RunOverrides(bypassWindow, force, scheduleId);
            Map<String, Object> snapshot = new LinkedHashMap<>();
            snapshot.put("source", "cli");
            snapshot.put("bypass_window_check", bypassWindow);
            snapshot.put("force_service_ids", force == null ? List.of() : force);
            snapshot.put("schedule_id", scheduleId);
            ManualTriggerResponse response = triggers.manualTrigger(overrides, snapshot);
            System.out.println(Jsons.toJson(response));
            return response.success() ? 0 : 1;
        }
    }

    @Command(name = "tick", description = "Run one standard timer pass")
    static final class TickCommand implements Callable<Integer> {
        @ParentCommand
        CronRelayCommand parent;

        @Override
        public Integer call() {
            RunSummary summary = new TriggerService(parent.runtime()).timerTick(false);
            System.out.println(Jsons.toJson(summary));
            return 0;
        }
    }

    @Command(name = "serve", description = "Serve the manual trigger endpoint and run the periodic timer")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        CronRelayCommand parent;

        @Option(names = {"--port"}, description = "HTTP port (defaults to the httpPort setting)")
        Integer port;

        @Option(names = {"--no-timer"}, description = "Serve the trigger endpoint only")
        boolean noTimer;

        @Override
        public Integer call() throws Exception {
            SchedulerRuntime runtime = parent.runtime();
            TriggerService triggers = new TriggerService(runtime);
            int listenPort = port == null ? runtime.settings().httpPort() : port;
            SchedulerServer server = new SchedulerServer(triggers, listenPort);
            Runtime.getRuntime().addShutdownHook(new Thread(server::close));
            server.start();
            if (!noTimer) {
                server.startTimer(runtime.settings().timerIntervalMinutes(), runtime.clock(), runtime.settings().zoneId());
            }
            System.out.println("CronRelay listening on http://127.0.0.1:" + server.port() + TriggerService.MANUAL_ENDPOINT);
            Thread.currentThread().join();
            return 0;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record JobFile(
            @JsonProperty("function_app") String functionApp,
            @JsonProperty("service") String service,
            @JsonProperty("trigger_url") String triggerUrl,
            @JsonProperty("json_body") JsonNode jsonBody,
            @JsonProperty("start_date") String startDate,
            @JsonProperty("frequency") String frequency,
            @JsonProperty("schedule_config") JsonNode scheduleConfig,
            @JsonProperty("trigger_limit") Integer triggerLimit,
            @JsonProperty("max_retries") Integer maxRetries,
            @JsonProperty("is_active") Boolean active
    ) {
        JobStore.NewJob toNewJob() {
            if (functionApp == null || service == null || triggerUrl == null || frequency == null || startDate == null) {
                throw new IllegalArgumentException(
                        "function_app, service, trigger_url, frequency and start_date are required");
            }
            return new JobStore.NewJob(
                    functionApp,
                    service,
                    triggerUrl,
                    asText(jsonBody),
                    Timestamps.parse(startDate),
                    frequency,
                    asText(scheduleConfig),
                    triggerLimit,
                    maxRetries == null ? 0 : maxRetries,
                    active == null || active
            );
        }

        private static String asText(JsonNode node) {
            if (node == null || node.isNull()) {
                return null;
            }
            return node.isTextual() ? node.asText() : Jsons.toCompactJson(node);
        }
    }
}
