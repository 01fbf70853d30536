package com.ambient.core.session;

import com.ambient.core.model.BotAccountRef;
import com.ambient.core.model.GitConfig;
import com.ambient.core.model.LlmSettings;
import com.ambient.core.model.ResourceOverrides;
import com.ambient.core.model.UserContext;
import com.ambient.core.model.WorkflowRef;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Body of a session create or update request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionRequest(
    String prompt,
    String displayName,
    Boolean interactive,
    LlmSettings llmSettings,
    Integer timeout,
    GitConfig gitConfig,
    UserContext userContext,
    BotAccountRef botAccount,
    ResourceOverrides resourceOverrides,
    Map<String, String> environmentVariables,
    Map<String, String> labels,
    Map<String, String> annotations,
    String workspacePath,
    WorkflowRef workflowRef
) {
}
