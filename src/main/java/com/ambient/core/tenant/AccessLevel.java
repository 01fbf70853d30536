package com.ambient.core.tenant;

import com.ambient.core.model.ProjectRole;

/**
 * The caller's effective role in a tenant.
 *
 * @param allowed whether the caller may manage role bindings (the admin check)
 */
public record AccessLevel(String project, boolean allowed, ProjectRole userRole) {
}
