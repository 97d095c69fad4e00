package io.cronrelay.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cronrelay.model.LineageContext;
import io.cronrelay.util.Jsons;

public final class DispatchPayloads {
    private DispatchPayloads() {
    }

    /**
     * Parses the job's payload template and merges lineage fields into it when a parent is given.
     * An empty template becomes an empty object.
     *
     * @throws InvalidPayloadException when the template is not JSON, or lineage must be merged into a non-object
     */
    public static JsonNode build(String template, LineageContext parent) {
        JsonNode body;
        if (template == null || template.isBlank()) {
            body = Jsons.mapper().createObjectNode();
        } else {
            try {
                body = Jsons.readTree(template);
            } catch (JsonProcessingException e) {
                throw new InvalidPayloadException("Invalid JSON body: " + e.getOriginalMessage());
            }
        }
        if (parent == null) {
            return body;
        }
        if (!body.isObject()) {
            throw new InvalidPayloadException("Invalid JSON body: lineage requires a JSON object payload");
        }
        ObjectNode merged = ((ObjectNode) body).deepCopy();
        merged.put(LineageContext.PARENT_SERVICE_ID, parent.parentServiceId());
        merged.put(LineageContext.ROOT_ID, parent.rootId());
        return merged;
    }

    /**
     * Reads a top-level {@code log_id} from a response body. Whole-valued floats such as
     * {@code 55.0} count as integers; non-JSON bodies and non-numeric values yield {@code null}.
     */
    public static Long extractLogId(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        JsonNode node;
        try {
            node = Jsons.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode raw = node.get("log_id");
        if (raw == null || raw.isNull()) {
            return null;
        }
        if (raw.isNumber() && raw.canConvertToExactIntegral()) {
            return raw.asLong();
        }
        if (raw.isTextual()) {
            try {
                return Long.parseLong(raw.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static String truncate(String value, int maxChars) {
        if (value == null || value.length() <= maxChars) {
            return value;
        }
        return value.substring(0, maxChars);
    }

    public static final class InvalidPayloadException extends RuntimeException {
        public InvalidPayloadException(String message) {
            super(message);
        }
    }
}
