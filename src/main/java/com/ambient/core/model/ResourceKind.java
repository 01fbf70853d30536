package com.ambient.core.model;

/**
 * Custom resource kinds owned by the orchestrator, all in group {@value #GROUP}.
 */
public enum ResourceKind {
    SESSION("AgenticSession", "agenticsessions"),
    WORKFLOW("RFEWorkflow", "rfeworkflows"),
    PROJECT_SETTINGS("ProjectSettings", "projectsettings");

    public static final String GROUP = "vteam.ambient-code";
    public static final String VERSION = "v1alpha1";

    private final String kind;
    private final String plural;

    ResourceKind(String kind, String plural) {
        this.kind = kind;
        this.plural = plural;
    }

    public String kind() {
        return kind;
    }

    public String plural() {
        return plural;
    }

    public String apiVersion() {
        return GROUP + "/" + VERSION;
    }
}
