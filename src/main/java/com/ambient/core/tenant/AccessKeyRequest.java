package com.ambient.core.tenant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AccessKeyRequest(String name, String description, String role) {
}
