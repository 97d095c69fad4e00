package io.cronrelay.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.cronrelay.support.StoreFixture;
import io.cronrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class CronRelayCommandTest {

    @Test
    void addJobThenInspectIt() throws Exception {
        Path root = Files.createTempDirectory("cronrelay-cli-");
        try {
            Path jobFile = root.resolve("job.json");
            Files.writeString(jobFile, """
                    {
                      "function_app": "billing",
                      "service": "invoice-run",
                      "trigger_url": "http://127.0.0.1:1/invoices",
                      "json_body": {"batch": 50},
                      "start_date": "2025-01-01 08:00:00",
                      "frequency": "weekly",
                      "schedule_config": {"days": ["monday"], "time": "08:00"},
                      "trigger_limit": 10
                    }
                    """);

            Result added = execute("--root", root.toString(), "add-job", "--file", jobFile.toString());
            Assertions.assertEquals(0, added.exitCode());
            long id = Jsons.readTree(added.out()).path("id").asLong();
            Assertions.assertTrue(id > 0);

            Result listed = execute("--root", root.toString(), "jobs");
            JsonNode jobs = Jsons.readTree(listed.out());
            Assertions.assertEquals(1, jobs.size());
            Assertions.assertEquals("invoice-run", jobs.get(0).path("service").asText());
            Assertions.assertEquals("{\"batch\":50}", jobs.get(0).path("jsonBody").asText());
            Assertions.assertEquals(10, jobs.get(0).path("triggerLimit").asInt());

            Result shown = execute("--root", root.toString(), "job", String.valueOf(id));
            Assertions.assertEquals(0, shown.exitCode());
            Assertions.assertEquals("2025-01-01T08:00:00", Jsons.readTree(shown.out()).path("startDate").asText());

            Result missing = execute("--root", root.toString(), "job", "999");
            Assertions.assertEquals(1, missing.exitCode());
            Assertions.assertEquals("job_not_found", Jsons.readTree(missing.out()).path("error").asText());
        } finally {
            StoreFixture.deleteRecursively(root);
        }
    }

    @Test
    void entryReportsUnknownLogId() throws Exception {
        Path root = Files.createTempDirectory("cronrelay-cli-entry-");
        try {
            Result result = execute("--root", root.toString(), "entry", "42");
            Assertions.assertEquals(1, result.exitCode());
            Assertions.assertEquals("entry_not_found", Jsons.readTree(result.out()).path("error").asText());
        } finally {
            StoreFixture.deleteRecursively(root);
        }
    }

    private static Result execute(String... args) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            int exitCode = new CommandLine(new CronRelayCommand()).execute(args);
            return new Result(exitCode, buffer.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(original);
        }
    }

    private record Result(int exitCode, String out) {
    }
}
