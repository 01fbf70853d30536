package com.ambient.core.model;

/**
 * A (subject, role) grant within one tenant.
 */
public record PermissionAssignment(
    SubjectType subjectType,
    String subjectName,
    ProjectRole role
) {
}
