package com.ambient.core.cluster;

import com.ambient.core.model.ProjectSettings;
import com.ambient.core.model.Session;
import com.ambient.core.model.Workflow;

/**
 * Every cluster handle a component needs, all bound to one identity.
 * <p>
 * The API builds one per request from the caller's own token; the controller builds one
 * at startup from its service identity. Components receive it by parameter and never
 * reach for a process-wide client.
 */
public record ClusterClients(
    ResourceStore<Session> sessions,
    ResourceStore<Workflow> workflows,
    ResourceStore<ProjectSettings> projectSettings,
    WorkloadGateway workloads,
    RbacGateway rbac,
    ConfigGateway configs,
    NamespaceGateway namespaces,
    AccessReviewer access
) {

    /** Request attribute under which the caller-scoped clients are stored. */
    public static final String REQUEST_ATTRIBUTE = "ambient.clusterClients";
}
