package com.ambient.core.tenant;

import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.ClusterException;
import com.ambient.core.model.ProjectRole;
import com.ambient.core.model.ResourceKind;
import com.ambient.core.resource.MetadataKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Infers the caller's role from access reviews: managing role bindings means admin, creating
 * sessions means edit, anything else is view.
 */
@Service
public class AccessResolver {

    private static final Logger log = LoggerFactory.getLogger(AccessResolver.class);

    public AccessLevel resolve(ClusterClients clients, String namespace) {
        boolean admin = clients.access().isAllowed(namespace, MetadataKeys.RBAC_API_GROUP, "rolebindings", "create");
        if (admin) {
            return new AccessLevel(namespace, true, ProjectRole.ADMIN);
        }
        boolean edit;
        try {
            edit = clients.access().isAllowed(namespace, ResourceKind.GROUP,
                    ResourceKind.SESSION.plural(), "create");
        } catch (ClusterException e) {
            log.warn("Edit access review failed for {}: {}", namespace, e.getMessage());
            edit = false;
        }
        return new AccessLevel(namespace, false, edit ? ProjectRole.EDIT : ProjectRole.VIEW);
    }
}
