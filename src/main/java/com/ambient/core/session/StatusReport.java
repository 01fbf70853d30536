package com.ambient.core.session;

import com.ambient.core.model.SessionPhase;
import com.ambient.core.model.SessionStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Result summary reported by a running workload. Only these keys are accepted; anything
 * else in the body is ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StatusReport(
    String phase,
    String message,
    String completionTime,
    Double cost,
    String subtype,
    @JsonProperty("duration_ms") Long durationMs,
    @JsonProperty("duration_api_ms") Long durationApiMs,
    @JsonProperty("is_error") Boolean isError,
    @JsonProperty("num_turns") Integer numTurns,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("total_cost_usd") Double totalCostUsd,
    Map<String, Object> usage,
    String result
) {

    /**
     * @throws IllegalArgumentException if {@code phase} is not a known phase
     */
    public SessionStatus toStatus() {
        return new SessionStatus(SessionPhase.fromWire(phase), message, null, completionTime, null,
                subtype, isError, numTurns, sessionId, totalCostUsd, cost, durationMs, durationApiMs, usage, result);
    }
}
