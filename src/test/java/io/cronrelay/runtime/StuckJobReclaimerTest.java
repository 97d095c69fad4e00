package io.cronrelay.runtime;

import io.cronrelay.storage.Rows;
import io.cronrelay.support.StoreFixture;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

final class StuckJobReclaimerTest {
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 3, 9, 0);

    @Test
    void reclaimsStaleAndTimestamplessProcessingJobs() throws Exception {
        try (StoreFixture store = StoreFixture.create("reclaim")) {
            long stale = store.insertJob("stale", "http://127.0.0.1:1/run", "daily", "{\"times\":[\"09:00\"]}", NOW.minusDays(5), null);
            long noTimestamp = store.insertJob("no-ts", "http://127.0.0.1:1/run", "daily", "{\"times\":[\"09:00\"]}", NOW.minusDays(5), null);
            long fresh = store.insertJob("fresh", "http://127.0.0.1:1/run", "daily", "{\"times\":[\"09:00\"]}", NOW.minusDays(5), null);
            long idle = store.insertJob("idle", "http://127.0.0.1:1/run", "daily", "{\"times\":[\"09:00\"]}", NOW.minusDays(5), null);
            store.forceState(stale, "processing", NOW.minusMinutes(20), 0);
            store.forceState(noTimestamp, "processing", null, 0);
            store.forceState(fresh, "processing", NOW.minusMinutes(5), 0);
            store.forceState(idle, "pending", NOW.minusMinutes(40), 0);

            StuckJobReclaimer reclaimer = new StuckJobReclaimer(store.jobs(), Duration.ofMinutes(15));
            Assertions.assertEquals(2, reclaimer.reclaim(NOW));

            Map<String, Object> staleRow = store.jobRow(stale);
            Assertions.assertEquals("failed", staleRow.get("status"));
            Assertions.assertEquals(408, Rows.intValue(staleRow, "last_response_code", -1));
            Assertions.assertNull(staleRow.get("last_response_detail"));
            Assertions.assertEquals(
                    "Service execution timeout - stuck in processing status for >15 minutes",
                    staleRow.get("error_message"));

            Map<String, Object> noTsRow = store.jobRow(noTimestamp);
            Assertions.assertEquals("failed", noTsRow.get("status"));
            Assertions.assertEquals(StuckJobReclaimer.NULL_TIMESTAMP_MESSAGE, noTsRow.get("error_message"));

            Assertions.assertEquals("processing", store.jobRow(fresh).get("status"));
            Assertions.assertEquals("pending", store.jobRow(idle).get("status"));

            Assertions.assertEquals(0, reclaimer.reclaim(NOW));
        }
    }

    @Test
    void scanFailureCountsAsNothingReclaimed() throws Exception {
        try (StoreFixture store = StoreFixture.create("reclaim-fail")) {
            store.gateway().execute("DROP TABLE scheduled_jobs", List.of());
            StuckJobReclaimer reclaimer = new StuckJobReclaimer(store.jobs(), Duration.ofMinutes(15));
            Assertions.assertEquals(0, reclaimer.reclaim(NOW));
        }
    }
}
