package com.ambient.core.operator;

import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.WatchEvent;
import io.kubernetes.client.openapi.models.V1Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bootstraps namespaces as they become managed. The watch is already filtered to the managed
 * label, so every {@code ADDED} event is a new tenant (or one seen again after a restart).
 */
@Component
public class NamespaceWatcher {

    private static final Logger log = LoggerFactory.getLogger(NamespaceWatcher.class);

    private final TenantBootstrapper bootstrapper;

    public NamespaceWatcher(TenantBootstrapper bootstrapper) {
        this.bootstrapper = bootstrapper;
    }

    public void handle(ClusterClients clients, WatchEvent<V1Namespace> event) {
        if (event.type() != WatchEvent.Type.ADDED) {
            return;
        }
        V1Namespace namespace = event.object();
        if (namespace == null || namespace.getMetadata() == null || namespace.getMetadata().getName() == null) {
            return;
        }
        String name = namespace.getMetadata().getName();
        log.info("Detected managed namespace {}", name);
        bootstrapper.bootstrap(clients, name);
    }
}
