package com.ambient.core.resource;

import com.ambient.core.model.CustomResource;
import com.ambient.core.model.ResourceKind;
import io.kubernetes.client.openapi.models.V1OwnerReference;

import java.util.List;

/**
 * Owner references that tie dependent objects to a custom resource, so deleting the
 * resource garbage-collects them.
 */
public final class OwnerReferences {

    private OwnerReferences() {}

    public static List<V1OwnerReference> controlledBy(ResourceKind kind, CustomResource owner) {
        return List.of(new V1OwnerReference()
                .apiVersion(kind.apiVersion())
                .kind(kind.kind())
                .name(owner.name())
                .uid(owner.metadata().uid())
                .controller(true));
    }
}
