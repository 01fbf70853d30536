package com.ambient.core.security;

import java.util.List;

/**
 * Identity of the caller of one API request.
 *
 * @param token the caller's bearer token; every cluster and content call made for the
 *              request uses it
 */
public record CallerContext(
    String userId,
    String username,
    String email,
    List<String> groups,
    String token
) {

    /** Request attribute under which the caller context is stored. */
    public static final String ATTRIBUTE = "ambient.caller";

    public String displayName() {
        if (username != null && !username.isBlank()) {
            return username;
        }
        return userId;
    }
}
