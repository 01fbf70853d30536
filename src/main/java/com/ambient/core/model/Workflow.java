package com.ambient.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A grouping of session work around a shared workspace, stored as an {@code RFEWorkflow}
 * custom object. Its phase is never stored; see {@code WorkflowSummary}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Workflow(
    String apiVersion,
    String kind,
    ResourceMeta metadata,
    Spec spec
) implements CustomResource {

    public static final String KIND = "RFEWorkflow";

    public static Workflow of(ResourceMeta metadata, Spec spec) {
        return new Workflow(ResourceKind.WORKFLOW.apiVersion(), KIND, metadata, spec);
    }

    public String workspaceRoot() {
        if (spec != null && spec.workspacePath() != null && !spec.workspacePath().isBlank()) {
            return spec.workspacePath();
        }
        return "/rfe-workflows/" + name() + "/workspace";
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Spec(
        String title,
        String description,
        String project,
        String workspacePath,
        List<GitRepository> repositories,
        List<JiraLink> jiraLinks
    ) {
    }

    /** Association of a workspace artifact path with an external issue key. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record JiraLink(String path, String jiraKey) {
    }
}
