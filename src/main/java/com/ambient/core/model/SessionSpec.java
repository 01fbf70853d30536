package com.ambient.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Declared intent of a session. Written by the API; the controller only reads it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionSpec(
    String prompt,
    String displayName,
    String project,
    Boolean interactive,
    LlmSettings llmSettings,
    Integer timeout,
    GitConfig gitConfig,
    ResourceOverrides resourceOverrides,
    UserContext userContext,
    BotAccountRef botAccount,
    SessionPaths paths,
    Map<String, String> environmentVariables,
    WorkflowRef workflowRef
) {

    public boolean isInteractive() {
        return Boolean.TRUE.equals(interactive);
    }

    public SessionSpec withPrompt(String newPrompt) {
        return new SessionSpec(newPrompt, displayName, project, interactive, llmSettings, timeout, gitConfig,
                resourceOverrides, userContext, botAccount, paths, environmentVariables, workflowRef);
    }

    public SessionSpec withDisplayName(String newDisplayName) {
        return new SessionSpec(prompt, newDisplayName, project, interactive, llmSettings, timeout, gitConfig,
                resourceOverrides, userContext, botAccount, paths, environmentVariables, workflowRef);
    }

    public SessionSpec withProject(String newProject) {
        return new SessionSpec(prompt, displayName, newProject, interactive, llmSettings, timeout, gitConfig,
                resourceOverrides, userContext, botAccount, paths, environmentVariables, workflowRef);
    }

    public SessionSpec withLlmSettings(LlmSettings newSettings) {
        return new SessionSpec(prompt, displayName, project, interactive, newSettings, timeout, gitConfig,
                resourceOverrides, userContext, botAccount, paths, environmentVariables, workflowRef);
    }

    public SessionSpec withTimeout(Integer newTimeout) {
        return new SessionSpec(prompt, displayName, project, interactive, llmSettings, newTimeout, gitConfig,
                resourceOverrides, userContext, botAccount, paths, environmentVariables, workflowRef);
    }

    public SessionSpec withWorkflowRef(WorkflowRef newRef) {
        return new SessionSpec(prompt, displayName, project, interactive, llmSettings, timeout, gitConfig,
                resourceOverrides, userContext, botAccount, paths, environmentVariables, newRef);
    }
}
