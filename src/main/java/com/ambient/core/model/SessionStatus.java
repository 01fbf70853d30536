package com.ambient.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Observed state of a session. Lifecycle fields are owned by the controller (and the
 * start/stop operations); the result summary is reported by the workload on completion.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionStatus(
    SessionPhase phase,
    String message,
    String startTime,
    String completionTime,
    String jobName,
    String subtype,
    @JsonProperty("isError") Boolean isError,
    Integer numTurns,
    String sessionId,
    Double totalCostUsd,
    Double cost,
    Long durationMs,
    Long durationApiMs,
    Map<String, Object> usage,
    String result
) {

    public static SessionStatus phase(SessionPhase phase, String message) {
        return new SessionStatus(phase, message, null, null, null,
                null, null, null, null, null, null, null, null, null, null);
    }

    public SessionStatus withStartTime(String time) {
        return new SessionStatus(phase, message, time, completionTime, jobName, subtype, isError, numTurns,
                sessionId, totalCostUsd, cost, durationMs, durationApiMs, usage, result);
    }

    public SessionStatus withCompletionTime(String time) {
        return new SessionStatus(phase, message, startTime, time, jobName, subtype, isError, numTurns,
                sessionId, totalCostUsd, cost, durationMs, durationApiMs, usage, result);
    }

    public SessionStatus withJobName(String name) {
        return new SessionStatus(phase, message, startTime, completionTime, name, subtype, isError, numTurns,
                sessionId, totalCostUsd, cost, durationMs, durationApiMs, usage, result);
    }

    /** Returns a copy with every non-null field of {@code update} laid over this status. */
    public SessionStatus merge(SessionStatus update) {
        if (update == null) {
            return this;
        }
        return new SessionStatus(
                pick(update.phase, phase),
                pick(update.message, message),
                pick(update.startTime, startTime),
                pick(update.completionTime, completionTime),
                pick(update.jobName, jobName),
                pick(update.subtype, subtype),
                pick(update.isError, isError),
                pick(update.numTurns, numTurns),
                pick(update.sessionId, sessionId),
                pick(update.totalCostUsd, totalCostUsd),
                pick(update.cost, cost),
                pick(update.durationMs, durationMs),
                pick(update.durationApiMs, durationApiMs),
                pick(update.usage, usage),
                pick(update.result, result));
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
