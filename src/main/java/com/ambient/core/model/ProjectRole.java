package com.ambient.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The three fixed tenant roles, each backed by a cluster role definition.
 */
public enum ProjectRole {
    ADMIN,
    EDIT,
    VIEW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String clusterRoleName() {
        return "ambient-project-" + wireName();
    }

    @JsonCreator
    public static ProjectRole fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("role is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("role must be one of admin, edit, view");
        }
    }

    /** Lenient parse used for stored settings, where an unknown role degrades to view. */
    public static ProjectRole fromWireOrView(String value) {
        try {
            return fromWire(value);
        } catch (IllegalArgumentException e) {
            return VIEW;
        }
    }
}
