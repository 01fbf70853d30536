package com.ambient.core.operator;

import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.WatchEvent;
import com.ambient.core.config.AmbientProperties;
import com.ambient.core.model.Session;
import com.ambient.core.model.SessionPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes session watch events: additions and updates in managed tenants are reconciled,
 * deletions cancel the session's supervision immediately.
 */
@Component
public class SessionWatcher {

    private static final Logger log = LoggerFactory.getLogger(SessionWatcher.class);

    private final SessionReconciler reconciler;
    private final SupervisionRegistry registry;
    private final AmbientProperties properties;

    public SessionWatcher(SessionReconciler reconciler, SupervisionRegistry registry, AmbientProperties properties) {
        this.reconciler = reconciler;
        this.registry = registry;
        this.properties = properties;
    }

    public void handle(ClusterClients clients, WatchEvent<Session> event) {
        Session session = event.object();
        if (session == null || session.namespace() == null || session.namespace().isEmpty()) {
            return;
        }
        String namespace = session.namespace();
        String name = session.name();

        switch (event.type()) {
            case DELETED -> {
                log.info("Session {}/{} deleted", namespace, name);
                registry.cancel(namespace, name);
            }
            case ADDED, MODIFIED -> {
                if (!clients.namespaces().isManaged(namespace)) {
                    return;
                }
                settle();
                if (session.phase() == SessionPhase.RUNNING && !registry.isSupervising(namespace, name)) {
                    clients.sessions().find(namespace, name).ifPresent(fresh -> {
                        if (reconciler.resume(clients, fresh)) {
                            log.info("Resumed supervision of running session {}/{}", namespace, name);
                        }
                    });
                    return;
                }
                SessionReconciler.Outcome outcome = reconciler.reconcile(clients, namespace, name);
                log.debug("Reconciled {}/{}: {}", namespace, name, outcome);
            }
            default -> {
            }
        }
    }

    /** Absorbs rapid create/delete cycles before the fresh read. */
    private void settle() {
        long delay = properties.getOperator().getEventSettleDelayMs();
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
