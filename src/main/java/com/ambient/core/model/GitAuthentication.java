package com.ambient.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Names of secrets holding source-control credentials. The secrets themselves never
 * pass through the orchestrator.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitAuthentication(String sshKeySecret, String tokenSecret) {
}
