package io.cronrelay.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.cronrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class SensitiveDataMaskerTest {

    @Test
    void masksSensitiveKeysAtAnyDepth() throws Exception {
        JsonNode input = Jsons.readTree("""
                {"headers":{"Authorization":"Bearer abc","X-Api-Key":"k1","Accept":"*/*"},
                 "items":[{"db_password":"p"},{"name":"ok"}],
                 "count":3}
                """);
        JsonNode masked = SensitiveDataMasker.masked(input);
        Assertions.assertEquals("***", masked.at("/headers/Authorization").asText());
        Assertions.assertEquals("***", masked.at("/headers/X-Api-Key").asText());
        Assertions.assertEquals("*/*", masked.at("/headers/Accept").asText());
        Assertions.assertEquals("***", masked.at("/items/0/db_password").asText());
        Assertions.assertEquals("ok", masked.at("/items/1/name").asText());
        Assertions.assertEquals(3, masked.get("count").asInt());
    }

    @Test
    void masksSecretsInsideFreeText() {
        Assertions.assertEquals("call failed: Bearer *** rejected",
                SensitiveDataMasker.maskText("call failed: Bearer eyJ.abc-123 rejected"));
        Assertions.assertEquals("url?token=***&page=2 password=***",
                SensitiveDataMasker.maskText("url?token=s3cr3t&page=2 password=hunter2"));
        Assertions.assertEquals("Service execution failed with HTTP 500",
                SensitiveDataMasker.maskText("Service execution failed with HTTP 500"));
        Assertions.assertNull(SensitiveDataMasker.maskText(null));
    }

    @Test
    void mapInputKeepsOrderAndNonSensitiveValues() {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("method", "POST");
        input.put("cookie", "session=1");
        input.put("body", "{\"schedule_id\":4}");
        input.put("ids", List.of(1, 2));

        Map<String, Object> masked = SensitiveDataMasker.masked(input);

        Assertions.assertEquals(List.of("method", "cookie", "body", "ids"), List.copyOf(masked.keySet()));
        Assertions.assertEquals("***", masked.get("cookie"));
        Assertions.assertEquals("{\"schedule_id\":4}", masked.get("body"));
        Assertions.assertEquals(List.of(1, 2), masked.get("ids"));
    }
}
