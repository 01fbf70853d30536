package com.ambient.core.operator;

import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.WatchEvent;
import com.ambient.core.config.AmbientProperties;
import com.ambient.core.logging.MdcContext;
import com.ambient.core.model.ProjectSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ProjectSettingsWatcher {

    private static final Logger log = LoggerFactory.getLogger(ProjectSettingsWatcher.class);

    private final ProjectSettingsReconciler reconciler;
    private final AmbientProperties properties;

    public ProjectSettingsWatcher(ProjectSettingsReconciler reconciler, AmbientProperties properties) {
        this.reconciler = reconciler;
        this.properties = properties;
    }

    public void handle(ClusterClients clients, WatchEvent<ProjectSettings> event) {
        if (event.type() != WatchEvent.Type.ADDED && event.type() != WatchEvent.Type.MODIFIED) {
            return;
        }
        ProjectSettings settings = event.object();
        if (settings == null || settings.namespace() == null || settings.namespace().isEmpty()) {
            return;
        }
        String namespace = settings.namespace();
        MdcContext.setNamespace(namespace);
        try {
            pause(properties.getOperator().getEventSettleDelayMs());
            reconciler.reconcile(clients, namespace, settings.name())
                    .ifPresent(count -> log.debug("ProjectSettings {}/{} has {} group bindings",
                            namespace, settings.name(), count));
        } finally {
            MdcContext.clear();
        }
    }

    private static void pause(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
