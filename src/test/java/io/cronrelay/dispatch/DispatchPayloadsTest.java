package io.cronrelay.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import io.cronrelay.model.LineageContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class DispatchPayloadsTest {

    @Test
    void lineageIsMergedIntoTheTemplate() {
        JsonNode body = DispatchPayloads.build("{\"report\":\"sales\",\"root_id\":1}", new LineageContext(12L, 4L));
        Assertions.assertEquals("sales", body.path("report").asText());
        Assertions.assertEquals(12L, body.path("parent_service_id").asLong());
        Assertions.assertEquals(4L, body.path("root_id").asLong());
    }

    @Test
    void templateIsSentAsIsWithoutLineage() {
        Assertions.assertEquals("[1,2]", DispatchPayloads.build("[1,2]", null).toString());
        Assertions.assertTrue(DispatchPayloads.build(null, null).isObject());
        Assertions.assertEquals(0, DispatchPayloads.build("  ", null).size());
    }

    @Test
    void unparseableTemplateIsRejected() {
        DispatchPayloads.InvalidPayloadException e = Assertions.assertThrows(
                DispatchPayloads.InvalidPayloadException.class,
                () -> DispatchPayloads.build("{\"report\":", null));
        Assertions.assertTrue(e.getMessage().startsWith("Invalid JSON body: "));
        Assertions.assertThrows(DispatchPayloads.InvalidPayloadException.class,
                () -> DispatchPayloads.build("[1,2]", new LineageContext(1L, 1L)));
    }

    @Test
    void logIdIsReadFromJsonBodiesOnly() {
        Assertions.assertEquals(55L, DispatchPayloads.extractLogId("{\"log_id\":55}"));
        Assertions.assertEquals(56L, DispatchPayloads.extractLogId("{\"log_id\":\"56\"}"));
        Assertions.assertEquals(57L, DispatchPayloads.extractLogId("{\"log_id\":57.0}"));
        Assertions.assertNull(DispatchPayloads.extractLogId("{\"log_id\":57.5}"));
        Assertions.assertNull(DispatchPayloads.extractLogId("{\"log_id\":\"abc\"}"));
        Assertions.assertNull(DispatchPayloads.extractLogId("{\"status\":\"queued\"}"));
        Assertions.assertNull(DispatchPayloads.extractLogId("accepted"));
        Assertions.assertNull(DispatchPayloads.extractLogId(""));
    }

    @Test
    void truncateKeepsShortValues() {
        Assertions.assertEquals("abc", DispatchPayloads.truncate("abc", 4000));
        Assertions.assertEquals(4000, DispatchPayloads.truncate("x".repeat(5000), 4000).length());
        Assertions.assertNull(DispatchPayloads.truncate(null, 10));
    }
}
