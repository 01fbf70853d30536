package com.ambient.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SubjectType {
    USER("User"),
    GROUP("Group");

    private final String rbacKind;

    SubjectType(String rbacKind) {
        this.rbacKind = rbacKind;
    }

    /** Kind used for the RBAC subject ({@code User} or {@code Group}). */
    public String rbacKind() {
        return rbacKind;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SubjectType fromWire(String value) {
        if (value != null) {
            for (SubjectType type : values()) {
                if (type.name().equalsIgnoreCase(value.trim()) || type.rbacKind.equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("subjectType must be one of user, group");
    }
}
