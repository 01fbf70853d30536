package com.ambient.core.tenant;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SecretSummary(String name, String createdAt, String type) {
}
