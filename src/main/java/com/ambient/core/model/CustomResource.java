package com.ambient.core.model;

/**
 * A namespaced custom object persisted by the cluster's object store.
 */
public interface CustomResource {

    ResourceMeta metadata();

    default String name() {
        return metadata() == null ? null : metadata().name();
    }

    default String namespace() {
        return metadata() == null ? null : metadata().namespace();
    }
}
