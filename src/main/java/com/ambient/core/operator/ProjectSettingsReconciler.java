package com.ambient.core.operator;

import com.ambient.core.cluster.AlreadyExistsException;
import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.ClusterException;
import com.ambient.core.cluster.ConflictException;
import com.ambient.core.cluster.NotFoundException;
import com.ambient.core.model.ProjectRole;
import com.ambient.core.model.ProjectSettings;
import com.ambient.core.resource.MetadataKeys;
import io.kubernetes.client.openapi.models.RbacV1Subject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1RoleBinding;
import io.kubernetes.client.openapi.models.V1RoleRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Materializes {@code spec.groupAccess} into role bindings and records how many exist.
 * Bindings are only ever added here; removing an entry does not revoke access.
 */
@Component
public class ProjectSettingsReconciler {

    private static final Logger log = LoggerFactory.getLogger(ProjectSettingsReconciler.class);

    /**
     * @return the number of group bindings in place, or empty if the settings no longer exist
     */
    public Optional<Integer> reconcile(ClusterClients clients, String namespace, String name) {
        Optional<ProjectSettings> fresh = clients.projectSettings().find(namespace, name);
        if (fresh.isEmpty()) {
            log.debug("ProjectSettings {}/{} no longer exists, skipping", namespace, name);
            return Optional.empty();
        }
        log.info("Reconciling ProjectSettings {}/{}", namespace, name);
        ProjectSettings settings = fresh.get();

        int created = 0;
        List<ProjectSettings.GroupAccess> entries = settings.spec() == null || settings.spec().groupAccess() == null
                ? List.of() : settings.spec().groupAccess();
        for (ProjectSettings.GroupAccess access : entries) {
            if (isBlank(access.groupName()) || isBlank(access.role())) {
                continue;
            }
            try {
                ensureGroupBinding(clients, namespace, access);
                created++;
            } catch (ClusterException e) {
                log.warn("Error creating RoleBinding for group {} in namespace {}: {}",
                        access.groupName(), namespace, e.getMessage());
            }
        }

        writeStatus(clients, settings, created);
        return Optional.of(created);
    }

    static String bindingName(ProjectSettings.GroupAccess access) {
        return access.groupName() + "-" + access.role();
    }

    private void ensureGroupBinding(ClusterClients clients, String namespace, ProjectSettings.GroupAccess access) {
        String bindingName = bindingName(access);
        if (clients.rbac().findRoleBinding(namespace, bindingName).isPresent()) {
            log.debug("RoleBinding {} already exists in namespace {}", bindingName, namespace);
            return;
        }
        var binding = new V1RoleBinding()
                .metadata(new V1ObjectMeta()
                        .name(bindingName)
                        .namespace(namespace)
                        .labels(Map.of(MetadataKeys.MANAGED_LABEL, "true")))
                .roleRef(new V1RoleRef()
                        .apiGroup(MetadataKeys.RBAC_API_GROUP)
                        .kind("ClusterRole")
                        .name(ProjectRole.fromWireOrView(access.role()).clusterRoleName()))
                .subjects(List.of(new RbacV1Subject()
                        .kind("Group")
                        .apiGroup(MetadataKeys.RBAC_API_GROUP)
                        .name(access.groupName())));
        try {
            clients.rbac().createRoleBinding(namespace, binding);
            log.info("Created RoleBinding {} for group {} in namespace {}", bindingName, access.groupName(), namespace);
        } catch (AlreadyExistsException e) {
            log.debug("RoleBinding {} appeared concurrently", bindingName);
        }
    }

    private void writeStatus(ClusterClients clients, ProjectSettings settings, int created) {
        ProjectSettings.Status status = settings.status();
        if (status != null && status.groupBindingsCreated() != null && status.groupBindingsCreated() == created) {
            return;
        }
        try {
            clients.projectSettings().replaceStatus(settings.withStatus(new ProjectSettings.Status(created)));
        } catch (NotFoundException e) {
            log.debug("ProjectSettings {}/{} deleted during status update", settings.namespace(), settings.name());
        } catch (ConflictException e) {
            log.debug("ProjectSettings {}/{} changed during status update; the next event re-reconciles",
                    settings.namespace(), settings.name());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
