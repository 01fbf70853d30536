package com.ambient.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Reference from a session to the workflow it contributes to. Validated against the
 * workflow's existence whenever it is written.
 *
 * @param name  workflow id in the same namespace
 * @param phase optional workflow phase this session works on (e.g. "specify")
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowRef(String name, String phase) {
}
