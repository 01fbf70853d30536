package com.ambient.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Derived workflow phase, computed from which artifacts exist in the workspace.
 */
public enum WorkflowPhase {
    PRE("pre"),
    SPECIFY("specify"),
    PLAN("plan"),
    TASKS("tasks"),
    COMPLETED("completed");

    private final String wireName;

    WorkflowPhase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static WorkflowPhase derive(boolean hasSpec, boolean hasPlan, boolean hasTasks) {
        if (!hasSpec && !hasPlan && !hasTasks) {
            return PRE;
        }
        if (!hasSpec) {
            return SPECIFY;
        }
        if (!hasPlan) {
            return PLAN;
        }
        if (!hasTasks) {
            return TASKS;
        }
        return COMPLETED;
    }
}
