package io.cronrelay.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import io.cronrelay.config.SchedulerSettings;
import io.cronrelay.model.LineageContext;
import io.cronrelay.model.ScheduledJob;
import io.cronrelay.security.SensitiveDataMasker;
import io.cronrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * One HTTP POST per dispatch. A 202 hands the returned {@code log_id} to the {@link CompletionPoller}.
 */
public final class HttpJobDispatcher implements JobDispatcher {
    private static final Logger log = LoggerFactory.getLogger(HttpJobDispatcher.class);

    private final HttpClient http;
    private final Duration timeout;
    private final int detailMaxChars;
    private final CompletionPoller poller;

    public HttpJobDispatcher(SchedulerSettings settings, CompletionPoller poller) {
        this(HttpClient.newBuilder()
                        .connectTimeout(settings.dispatchTimeout())
                        .build(),
                settings.dispatchTimeout(),
                settings.responseDetailMaxChars(),
                poller);
    }

    HttpJobDispatcher(HttpClient http, Duration timeout, int detailMaxChars, CompletionPoller poller) {
        this.http = http;
        this.timeout = timeout;
        this.detailMaxChars = detailMaxChars;
        this.poller = poller;
    }

    @Override
    public DispatchResult dispatch(ScheduledJob job, LineageContext parent) {
        JsonNode payload;
        try {
            payload = DispatchPayloads.build(job.jsonBody(), parent);
        } catch (DispatchPayloads.InvalidPayloadException e) {
            log.error("Job {} has an invalid payload: {}", job.label(), e.getMessage());
            return DispatchResult.fail(DispatchFailure.MALFORMED_PAYLOAD, e.getMessage(), null);
        }
        if (parent != null) {
            log.info("Job {} carries lineage parent_service_id={} root_id={}",
                    job.label(), parent.parentServiceId(), parent.rootId());
        }

        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(job.triggerUrl()))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(payload), StandardCharsets.UTF_8))
                    .build();
            response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            log.error("Job {} timed out after {} seconds", job.label(), timeout.toSeconds());
            return DispatchResult.fail(DispatchFailure.TIMEOUT,
                    "HTTP request timed out after " + timeout.toSeconds() + " seconds", null);
        } catch (IOException | IllegalArgumentException e) {
            String message = SensitiveDataMasker.maskText(String.valueOf(e.getMessage()));
            log.error("Job {} transport error: {}", job.label(), message);
            return DispatchResult.fail(DispatchFailure.TRANSPORT, "HTTP request error: " + message, null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DispatchResult.fail(DispatchFailure.TRANSPORT, "HTTP request error: interrupted", null);
        }

        int code = response.statusCode();
        String body = response.body();
        String detail = DispatchPayloads.truncate(body, detailMaxChars);
        Long childLogId = DispatchPayloads.extractLogId(body);

        if (code == 202) {
            if (childLogId == null) {
                log.error("Job {} returned 202 without a log_id, cannot track completion", job.label());
                return DispatchResult.fail(DispatchFailure.ACCEPTED_WITHOUT_ID,
                        "202 Accepted but missing log_id for status polling", null);
            }
            log.info("Job {} accepted, polling ledger entry {}", job.label(), childLogId);
            return DispatchResult.fromPoll(poller.poll(childLogId), childLogId);
        }
        if (code >= 200 && code < 300) {
            log.info("Job {} succeeded with HTTP {}{}", job.label(), code,
                    childLogId == null ? "" : " (log_id " + childLogId + ")");
            return DispatchResult.ok(code, detail, childLogId);
        }
        log.error("Job {} failed with HTTP {}", job.label(), code);
        return DispatchResult.httpStatus(code, detail, childLogId);
    }
}
