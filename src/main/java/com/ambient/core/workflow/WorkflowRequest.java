package com.ambient.core.workflow;

import com.ambient.core.model.GitRepository;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowRequest(
    String title,
    String description,
    List<GitRepository> repositories,
    String workspacePath
) {
}
