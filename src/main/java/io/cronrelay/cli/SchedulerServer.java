package io.cronrelay.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.cronrelay.runtime.ManualTriggerResponse;
import io.cronrelay.runtime.RunOverrides;
import io.cronrelay.runtime.TriggerService;
import io.cronrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Hosts the on-demand trigger endpoint and, optionally, the periodic timer.
 */
public final class SchedulerServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SchedulerServer.class);

    private final TriggerService triggers;
    private final HttpServer server;
    private ScheduledExecutorService timer;

    public SchedulerServer(TriggerService triggers, int port) throws IOException {
        this.triggers = triggers;
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.server.createContext(TriggerService.MANUAL_ENDPOINT, this::handleManualTrigger);
        this.server.setExecutor(null);
    }

    public void start() {
        server.start();
        log.info("Manual trigger listening on http://127.0.0.1:{}{}", port(), TriggerService.MANUAL_ENDPOINT);
    }

    /**
     * Runs {@link TriggerService#timerTick} every {@code intervalMinutes}, aligned to multiples of the
     * interval past the hour. A failed tick is logged and the next one still runs.
     */
    public void startTimer(int intervalMinutes, Clock clock, ZoneId zone) {
        long initialDelayMs = delayToNextSlot(LocalDateTime.now(clock.withZone(zone)), intervalMinutes).toMillis();
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cronrelay-timer");
            t.setDaemon(true);
            return t;
        });
        long periodMs = TimeUnit.MINUTES.toMillis(intervalMinutes);
        timer.scheduleAtFixedRate(() -> {
            try {
                triggers.timerTick(false);
            } catch (RuntimeException e) {
                log.error("Timer tick failed: {}", e.getMessage(), e);
            }
        }, initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Timer scheduled every {} minutes, first tick in {} s", intervalMinutes, initialDelayMs / 1000L);
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        if (timer != null) {
            timer.shutdownNow();
        }
        server.stop(0);
    }

    static Duration delayToNextSlot(LocalDateTime now, int intervalMinutes) {
        LocalDateTime hour = now.truncatedTo(ChronoUnit.HOURS);
        long minutesIntoHour = ChronoUnit.MINUTES.between(hour, now);
        long nextSlot = (minutesIntoHour / intervalMinutes + 1) * intervalMinutes;
        return Duration.between(now, hour.plusMinutes(nextSlot));
    }

    private void handleManualTrigger(HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            writeJson(exchange, Map.of("error", "method_not_allowed", "allowed", List.of("POST")), 405);
            return;
        }
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        RunOverrides overrides = RunOverrides.standard();
        if (!body.isBlank()) {
            try {
                JsonNode parsed = Jsons.readTree(body);
                overrides = RunOverrides.fromJson(parsed);
            } catch (JsonProcessingException e) {
                log.warn("Invalid JSON in manual trigger body, running standard pass: {}", e.getOriginalMessage());
            }
        }
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("method", exchange.getRequestMethod());
        snapshot.put("url", exchange.getRequestURI().toString());
        snapshot.put("headers", headers(exchange));
        snapshot.put("body", body.isBlank() ? "empty" : body);

        ManualTriggerResponse response = triggers.manualTrigger(overrides, snapshot);
        writeJson(exchange, response, response.httpStatus());
    }

    private static Map<String, String> headers(HttpExchange exchange) {
        Map<String, String> out = new LinkedHashMap<>();
        exchange.getRequestHeaders().forEach((name, values) -> out.put(name, String.join(",", values)));
        return out;
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
