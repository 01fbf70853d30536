package com.ambient.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle phase of a session.
 * <p>
 * Controller-driven edges: {@code Pending -> Creating -> Running -> {Completed, Failed}},
 * plus {@code Creating -> Error} on a scheduling failure. {@code Stopped} is entered from any
 * non-terminal phase by an explicit stop, and a terminal session may be moved back to
 * {@code Creating} by an explicit start.
 */
public enum SessionPhase {
    PENDING("Pending"),
    CREATING("Creating"),
    RUNNING("Running"),
    COMPLETED("Completed"),
    FAILED("Failed"),
    STOPPED("Stopped"),
    ERROR("Error");

    private final String wireName;

    SessionPhase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static SessionPhase fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (SessionPhase phase : values()) {
            if (phase.wireName.equalsIgnoreCase(value.trim())) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown session phase: " + value);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == STOPPED || this == ERROR;
    }

    public boolean canTransitionTo(SessionPhase next) {
        return allowedNext().contains(next);
    }

    public Set<SessionPhase> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(CREATING, STOPPED);
            case CREATING -> EnumSet.of(RUNNING, ERROR, STOPPED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, STOPPED);
            case COMPLETED, FAILED, STOPPED, ERROR -> EnumSet.of(CREATING);
        };
    }

    @Override
    public String toString() {
        return wireName;
    }
}
