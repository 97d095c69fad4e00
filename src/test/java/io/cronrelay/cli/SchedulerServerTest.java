package io.cronrelay.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.cronrelay.dispatch.DispatchResult;
import io.cronrelay.dispatch.JobDispatcher;
import io.cronrelay.model.LineageContext;
import io.cronrelay.runtime.SchedulerRuntime;
import io.cronrelay.runtime.TriggerService;
import io.cronrelay.support.StoreFixture;
import io.cronrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

final class SchedulerServerTest {
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 3, 9, 5);

    @Test
    void postRunsAPassWithTheRequestedOverrides() throws Exception {
        try (StoreFixture store = StoreFixture.create("server-post")) {
            long id = store.insertJob("noon", "http://127.0.0.1:1/run", "daily", "{\"times\":[\"12:00\"]}",
                    LocalDateTime.of(2025, 1, 1, 0, 0), null);
            List<LineageContext> parents = new ArrayList<>();
            JobDispatcher dispatcher = (job, parent) -> {
                parents.add(parent);
                return DispatchResult.ok(200, "ok", null);
            };
            try (SchedulerServer server = new SchedulerServer(triggers(store, dispatcher), 0)) {
                server.start();

                HttpResponse<String> response = send(server, HttpRequest.newBuilder(endpoint(server))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString("{\"schedule_id\":" + id + "}")));

                Assertions.assertEquals(200, response.statusCode());
                JsonNode body = Jsons.readTree(response.body());
                Assertions.assertTrue(body.path("success").asBoolean());
                Assertions.assertEquals("FORCE_SCHEDULE_ID (" + id + ")", body.path("execution_mode").asText());
                Assertions.assertEquals(1, body.at("/results/successful").asInt());
                long rootLogId = body.path("root_log_id").asLong();
                Assertions.assertEquals(1, parents.size());
                Assertions.assertEquals(rootLogId, parents.get(0).rootId());
            }
        }
    }

    @Test
    void invalidJsonFallsBackToStandardPass() throws Exception {
        try (StoreFixture store = StoreFixture.create("server-invalid")) {
            try (SchedulerServer server = new SchedulerServer(
                    triggers(store, (job, parent) -> DispatchResult.ok(200, "ok", null)), 0)) {
                server.start();

                HttpResponse<String> response = send(server, HttpRequest.newBuilder(endpoint(server))
                        .POST(HttpRequest.BodyPublishers.ofString("{broken")));

                Assertions.assertEquals(200, response.statusCode());
                Assertions.assertEquals("STANDARD", Jsons.readTree(response.body()).path("execution_mode").asText());
                Assertions.assertEquals(1, store.ledgerRows().size());
            }
        }
    }

    @Test
    void nonPostIsRejected() throws Exception {
        try (StoreFixture store = StoreFixture.create("server-get")) {
            try (SchedulerServer server = new SchedulerServer(
                    triggers(store, (job, parent) -> DispatchResult.ok(200, "ok", null)), 0)) {
                server.start();

                HttpResponse<String> response = send(server, HttpRequest.newBuilder(endpoint(server)).GET());

                Assertions.assertEquals(405, response.statusCode());
                Assertions.assertTrue(store.ledgerRows().isEmpty());
            }
        }
    }

    @Test
    void timerAlignsToIntervalBoundaries() {
        Assertions.assertEquals(Duration.ofMinutes(10),
                SchedulerServer.delayToNextSlot(LocalDateTime.of(2025, 3, 3, 9, 5), 15));
        Assertions.assertEquals(Duration.ofMinutes(15),
                SchedulerServer.delayToNextSlot(LocalDateTime.of(2025, 3, 3, 9, 0), 15));
        Assertions.assertEquals(Duration.ofSeconds(30),
                SchedulerServer.delayToNextSlot(LocalDateTime.of(2025, 3, 3, 9, 59, 30), 15));
    }

    private static TriggerService triggers(StoreFixture store, JobDispatcher dispatcher) {
        return new TriggerService(new SchedulerRuntime(
                store.config().settings(), store.gateway(), dispatcher, StoreFixture.clockAt(NOW)));
    }

    private static URI endpoint(SchedulerServer server) {
        return URI.create("http://127.0.0.1:" + server.port() + TriggerService.MANUAL_ENDPOINT);
    }

    private static HttpResponse<String> send(SchedulerServer server, HttpRequest.Builder request) throws Exception {
        HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
        return client.send(request.timeout(Duration.ofSeconds(10)).build(), HttpResponse.BodyHandlers.ofString());
    }
}
