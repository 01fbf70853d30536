package com.ambient.core.agents;

import java.util.List;

public record AgentSummary(String persona, String name, String role, List<String> expertise) {

    static AgentSummary of(AgentDefinition definition) {
        return new AgentSummary(definition.persona(), definition.name(), definition.role(),
                definition.expertiseOrEmpty());
    }
}
