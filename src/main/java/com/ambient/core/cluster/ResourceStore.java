package com.ambient.core.cluster;

import com.ambient.core.model.CustomResource;

import java.util.List;
import java.util.Optional;

/**
 * Typed access to one custom resource kind.
 */
public interface ResourceStore<T extends CustomResource> {

    Optional<T> find(String namespace, String name);

    /**
     * @throws NotFoundException if the object does not exist
     */
    default T get(String namespace, String name) {
        return find(namespace, name)
                .orElseThrow(() -> new NotFoundException(kindName() + " " + namespace + "/" + name + " not found"));
    }

    List<T> list(String namespace);

    /**
     * @throws AlreadyExistsException if an object with the same name exists
     */
    T create(String namespace, T resource);

    /**
     * Replaces spec and metadata. The resource's {@code resourceVersion} guards against lost updates.
     *
     * @throws ConflictException on a stale resourceVersion
     */
    T replace(T resource);

    /** Replaces the status sub-resource. */
    T replaceStatus(T resource);

    /**
     * @throws NotFoundException if the object does not exist
     */
    void delete(String namespace, String name);

    /** Opens a cluster-wide watch over this kind. */
    WatchStream<T> watch();

    String kindName();
}
