package com.ambient.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A named machine identity bound to one tenant role.
 *
 * @param id         backing service account name
 * @param token      minted token, present only in the creation response
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccessKey(
    String id,
    String name,
    String description,
    ProjectRole role,
    String createdAt,
    String lastUsedAt,
    String token
) {
}
