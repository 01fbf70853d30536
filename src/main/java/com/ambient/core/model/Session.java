package com.ambient.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * An agentic session: the unit of orchestrated work, stored as an
 * {@code AgenticSession} custom object.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Session(
    String apiVersion,
    String kind,
    ResourceMeta metadata,
    SessionSpec spec,
    SessionStatus status
) implements CustomResource {

    public static final String KIND = "AgenticSession";

    public static Session of(ResourceMeta metadata, SessionSpec spec, SessionStatus status) {
        return new Session(ResourceKind.SESSION.apiVersion(), KIND, metadata, spec, status);
    }

    /** Current phase, or {@code null} while the controller has not initialized the status. */
    @JsonIgnore
    public SessionPhase phase() {
        return status == null ? null : status.phase();
    }

    public Session withMetadata(ResourceMeta newMetadata) {
        return new Session(apiVersion, kind, newMetadata, spec, status);
    }

    public Session withSpec(SessionSpec newSpec) {
        return new Session(apiVersion, kind, metadata, newSpec, status);
    }

    public Session withStatus(SessionStatus newStatus) {
        return new Session(apiVersion, kind, metadata, spec, newStatus);
    }

    /** Deterministic name of this session's execution unit. */
    public static String jobNameFor(String sessionName) {
        return sessionName + "-job";
    }
}
