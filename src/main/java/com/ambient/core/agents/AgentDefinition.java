package com.ambient.core.agents;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * A persona definition as read from its YAML file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentDefinition(
    String name,
    String persona,
    String role,
    List<String> expertise,
    String systemMessage,
    List<String> tools
) {

    public List<String> expertiseOrEmpty() {
        return expertise == null ? List.of() : expertise;
    }
}
