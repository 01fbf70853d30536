package com.ambient.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LlmSettings(
    String model,
    Double temperature,
    Integer maxTokens
) {

    /** Fills unset fields from {@code defaults}. */
    public LlmSettings withDefaults(LlmSettings defaults) {
        return new LlmSettings(
                model != null && !model.isBlank() ? model : defaults.model(),
                temperature != null ? temperature : defaults.temperature(),
                maxTokens != null && maxTokens > 0 ? maxTokens : defaults.maxTokens());
    }
}
