package io.cronrelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * On-demand adjustments to a pass.
 *
 * @param bypassWindowCheck relax only the time-window sub-condition
 * @param forceIds          jobs dispatched without evaluating due-ness
 * @param scheduleId        a single job forced through every condition except the active flag
 */
public record RunOverrides(boolean bypassWindowCheck, List<Long> forceIds, Long scheduleId) {
    public RunOverrides {
        forceIds = forceIds == null ? List.of() : List.copyOf(forceIds);
    }

    public static RunOverrides standard() {
        return new RunOverrides(false, List.of(), null);
    }

    /**
     * Reads {@code bypass_window_check}, {@code force_service_ids} and {@code schedule_id}.
     * Missing or mistyped fields fall back to the standard pass.
     */
    public static RunOverrides fromJson(JsonNode body) {
        if (body == null || !body.isObject()) {
            return standard();
        }
        boolean bypass = body.path("bypass_window_check").asBoolean(false);
        List<Long> ids = new ArrayList<>();
        JsonNode rawIds = body.get("force_service_ids");
        if (rawIds != null && rawIds.isArray()) {
            for (JsonNode id : rawIds) {
                if (id.canConvertToLong()) {
                    ids.add(id.asLong());
                }
            }
        }
        JsonNode rawSchedule = body.get("schedule_id");
        Long scheduleId = rawSchedule != null && rawSchedule.canConvertToLong() && rawSchedule.asLong() > 0
                ? rawSchedule.asLong()
                : null;
        return new RunOverrides(bypass, ids, scheduleId);
    }

    /**
     * {@code schedule_id} implies a forced single job with the window bypassed.
     */
    public boolean effectiveBypass() {
        return scheduleId != null || bypassWindowCheck;
    }

    public Set<Long> effectiveForceIds() {
        if (scheduleId != null) {
            return Set.of(scheduleId);
        }
        return new LinkedHashSet<>(forceIds);
    }

    public String executionMode() {
        if (scheduleId != null) {
            return "FORCE_SCHEDULE_ID (" + scheduleId + ")";
        }
        if (!forceIds.isEmpty()) {
            return "FORCE_SERVICES (IDs: " + forceIds + ")";
        }
        if (bypassWindowCheck) {
            return "BYPASS_WINDOWS";
        }
        return "STANDARD";
    }
}
