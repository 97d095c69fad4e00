package io.cronrelay.runtime;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RunSummary(
        @JsonProperty("triggered_services") List<TriggeredService> triggeredServices,
        int processed,
        int successful,
        int failed,
        int skipped,
        @JsonProperty("stuck_services_found") int stuckReclaimed,
        List<String> errors
) {
    public boolean executedAny() {
        return successful > 0 || failed > 0;
    }

    public record TriggeredService(
            @JsonProperty("id") long id,
            @JsonProperty("function_app") String functionApp,
            @JsonProperty("service") String service
    ) {
    }
}
