package com.ambient.core.cluster;

import com.ambient.core.resource.MetadataKeys;
import io.kubernetes.client.openapi.models.V1Namespace;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface NamespaceGateway {

    /** Namespaces carrying the managed-tenant marker. */
    List<V1Namespace> listManaged();

    Optional<V1Namespace> find(String name);

    V1Namespace create(V1Namespace namespace);

    V1Namespace replace(V1Namespace namespace);

    void delete(String name);

    /** Watches namespaces carrying the managed-tenant marker. */
    WatchStream<V1Namespace> watchManaged();

    default boolean isManaged(String name) {
        return find(name).map(NamespaceGateway::hasManagedMarker).orElse(false);
    }

    static boolean hasManagedMarker(V1Namespace namespace) {
        if (namespace == null || namespace.getMetadata() == null) {
            return false;
        }
        Map<String, String> labels = namespace.getMetadata().getLabels();
        return labels != null && "true".equals(labels.get(MetadataKeys.MANAGED_LABEL));
    }
}
