package com.ambient.support;

import com.ambient.core.cluster.AccessReviewer;
import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.ConfigGateway;
import com.ambient.core.cluster.NamespaceGateway;
import com.ambient.core.cluster.RbacGateway;
import com.ambient.core.cluster.ResourceStore;
import com.ambient.core.cluster.WorkloadGateway;
import com.ambient.core.model.ProjectSettings;
import com.ambient.core.model.Session;
import com.ambient.core.model.Workflow;

import java.util.Optional;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * A {@link ClusterClients} whose every handle is a Mockito mock.
 */
public final class ClusterMocks {

    public final ResourceStore<Session> sessions = mockStore();
    public final ResourceStore<Workflow> workflows = mockStore();
    public final ResourceStore<ProjectSettings> projectSettings = mockStore();
    public final WorkloadGateway workloads = mock(WorkloadGateway.class);
    public final RbacGateway rbac = mock(RbacGateway.class);
    public final ConfigGateway configs = mock(ConfigGateway.class);
    public final NamespaceGateway namespaces = mock(NamespaceGateway.class);
    public final AccessReviewer access = mock(AccessReviewer.class);

    public ClusterClients clients() {
        return new ClusterClients(sessions, workflows, projectSettings, workloads, rbac, configs, namespaces, access);
    }

    /** Makes {@code session} visible through both {@code find} and {@code get}. */
    public Session givenSession(Session session) {
        when(sessions.find(session.namespace(), session.name())).thenReturn(Optional.of(session));
        when(sessions.get(session.namespace(), session.name())).thenReturn(session);
        return session;
    }

    public Workflow givenWorkflow(Workflow workflow) {
        when(workflows.find(workflow.namespace(), workflow.name())).thenReturn(Optional.of(workflow));
        when(workflows.get(workflow.namespace(), workflow.name())).thenReturn(workflow);
        return workflow;
    }

    @SuppressWarnings("unchecked")
    private static <T extends com.ambient.core.model.CustomResource> ResourceStore<T> mockStore() {
        return mock(ResourceStore.class);
    }
}
