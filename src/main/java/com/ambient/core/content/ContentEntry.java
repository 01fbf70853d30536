package com.ambient.core.content;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a content listing.
 *
 * @param modifiedAt RFC 3339 timestamp in UTC
 */
public record ContentEntry(
    String name,
    String path,
    @JsonProperty("isDir") boolean isDir,
    long size,
    String modifiedAt
) {
}
