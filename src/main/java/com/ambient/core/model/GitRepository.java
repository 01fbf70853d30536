package com.ambient.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitRepository(String url, String branch, String clonePath) {

    public GitRepository(String url, String branch) {
        this(url, branch, null);
    }

    /** Directory a clone of this repository lands in, relative to a workspace root. */
    public String cloneDirectory() {
        if (clonePath != null && !clonePath.isBlank()) {
            return clonePath.trim();
        }
        String trimmed = url == null ? "" : url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.endsWith(".git")) {
            trimmed = trimmed.substring(0, trimmed.length() - 4);
        }
        int slash = trimmed.lastIndexOf('/');
        return "repos/" + (slash >= 0 ? trimmed.substring(slash + 1) : trimmed);
    }
}
