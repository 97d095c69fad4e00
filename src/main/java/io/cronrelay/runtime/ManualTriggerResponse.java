package io.cronrelay.runtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ManualTriggerResponse(
        boolean success,
        String message,
        RunSummary results,
        @JsonProperty("execution_mode") String executionMode,
        @JsonProperty("execution_time_seconds") double executionTimeSeconds,
        @JsonProperty("root_log_id") Long rootLogId,
        String error,
        @JsonProperty("error_type") String errorType
) {
    public int httpStatus() {
        return success ? 200 : 500;
    }
}
