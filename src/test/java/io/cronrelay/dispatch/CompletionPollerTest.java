package io.cronrelay.dispatch;

import io.cronrelay.ledger.LedgerRepository;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

final class CompletionPollerTest {

    @Test
    void pollsUntilSuccess() {
        FakeLedgerGateway gateway = new FakeLedgerGateway(null, "pending", "pending", "success");
        List<Long> sleeps = new ArrayList<>();
        CompletionPoller poller = new CompletionPoller(new LedgerRepository(gateway), 30_000L, 0L, sleeps::add);

        PollResult result = poller.poll(55L);
        Assertions.assertTrue(result.success());
        Assertions.assertEquals(200, result.code());
        Assertions.assertEquals("Master log status: success", result.detail());
        Assertions.assertEquals(3, gateway.queries());
        Assertions.assertEquals(List.of(30_000L, 30_000L), sleeps);
    }

    @Test
    void warningIsNotSuccessButKeeps200() {
        CompletionPoller poller = new CompletionPoller(
                new LedgerRepository(new FakeLedgerGateway(null, "warning")), 10L, 0L, ms -> { });
        PollResult result = poller.poll(3L);
        Assertions.assertFalse(result.success());
        Assertions.assertEquals(200, result.code());
        Assertions.assertEquals(DispatchFailure.POLL_WARNING, result.failure());
    }

    @Test
    void failedCarriesRecordedError() {
        CompletionPoller poller = new CompletionPoller(
                new LedgerRepository(new FakeLedgerGateway("mailbox full", "failed")), 10L, 0L, ms -> { });
        PollResult result = poller.poll(3L);
        Assertions.assertFalse(result.success());
        Assertions.assertEquals(500, result.code());
        Assertions.assertEquals("Master log status: failed - mailbox full", result.detail());
    }

    @Test
    void queryErrorEndsPollingWithoutRetry() {
        FakeLedgerGateway gateway = new FakeLedgerGateway(null, "pending", null);
        CompletionPoller poller = new CompletionPoller(new LedgerRepository(gateway), 10L, 0L, ms -> { });
        PollResult result = poller.poll(3L);
        Assertions.assertFalse(result.success());
        Assertions.assertEquals(500, result.code());
        Assertions.assertEquals(DispatchFailure.POLL_QUERY_ERROR, result.failure());
        Assertions.assertTrue(result.detail().startsWith("Polling error: "));
        Assertions.assertEquals(2, gateway.queries());
    }

    @Test
    void explicitDeadlineStopsAnEndlessPendingEntry() {
        FakeLedgerGateway gateway = new FakeLedgerGateway(null, "pending");
        CompletionPoller poller = new CompletionPoller(new LedgerRepository(gateway), 20L, 100L);
        PollResult result = poller.poll(9L);
        Assertions.assertFalse(result.success());
        Assertions.assertEquals(408, result.code());
        Assertions.assertEquals(DispatchFailure.POLL_DEADLINE, result.failure());
        Assertions.assertTrue(gateway.queries() >= 2);
    }
}
