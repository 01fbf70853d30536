package com.ambient.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * A tenant boundary: one managed namespace plus its display metadata.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Project(
    String name,
    String displayName,
    String description,
    Map<String, String> labels,
    Map<String, String> annotations,
    String creationTimestamp,
    String status
) {
}
