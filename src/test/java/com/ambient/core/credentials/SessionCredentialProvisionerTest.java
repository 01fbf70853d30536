package com.ambient.core.credentials;

import com.ambient.core.cluster.AlreadyExistsException;
import com.ambient.core.cluster.ConflictException;
import com.ambient.core.cluster.ForbiddenException;
import com.ambient.core.config.AmbientProperties;
import com.ambient.core.metrics.AmbientMetrics;
import com.ambient.core.model.Session;
import com.ambient.core.model.SessionPhase;
import com.ambient.core.resource.MetadataKeys;
import com.ambient.support.ClusterMocks;
import com.ambient.support.Fixtures;
import io.kubernetes.client.openapi.models.V1Role;
import io.kubernetes.client.openapi.models.V1RoleBinding;
import io.kubernetes.client.openapi.models.V1Secret;
import io.kubernetes.client.openapi.models.V1ServiceAccount;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SessionCredentialProvisionerTest {

    private ClusterMocks cluster;
    private SessionCredentialProvisioner provisioner;
    private Session session;

    @BeforeEach
    void setUp() {
        cluster = new ClusterMocks();
        provisioner = new SessionCredentialProvisioner(new AmbientProperties(),
                new AmbientMetrics(new SimpleMeterRegistry()));
        session = Fixtures.session("team-a", "s1", SessionPhase.PENDING);
        when(cluster.sessions.find("team-a", "s1")).thenReturn(Optional.of(session));
        when(cluster.sessions.get("team-a", "s1")).thenReturn(session);
        when(cluster.rbac.mintToken(eq("team-a"), eq("ambient-session-s1"), any())).thenReturn("tok-123");
    }

    @Test
    @DisplayName("creates identity, role, binding and token secret owned by the session")
    void provisionsAllObjects() {
        assertTrue(provisioner.provision(cluster.clients(), "team-a", "s1"));

        var sa = ArgumentCaptor.forClass(V1ServiceAccount.class);
        verify(cluster.rbac).createServiceAccount(eq("team-a"), sa.capture());
        assertEquals("ambient-session-s1", sa.getValue().getMetadata().getName());
        assertEquals("uid-s1", sa.getValue().getMetadata().getOwnerReferences().get(0).getUid());
        assertTrue(sa.getValue().getMetadata().getOwnerReferences().get(0).getController());

        var role = ArgumentCaptor.forClass(V1Role.class);
        verify(cluster.rbac).createRole(eq("team-a"), role.capture());
        var rule = role.getValue().getRules().get(0);
        assertEquals(List.of("s1"), rule.getResourceNames());
        assertEquals(List.of("get", "update", "patch"), rule.getVerbs());
        assertEquals(List.of("agenticsessions", "agenticsessions/status"), rule.getResources());
        assertEquals(1, role.getValue().getRules().size());

        var binding = ArgumentCaptor.forClass(V1RoleBinding.class);
        verify(cluster.rbac).createRoleBinding(eq("team-a"), binding.capture());
        assertEquals("ambient-session-s1-role", binding.getValue().getRoleRef().getName());
        assertEquals("ambient-session-s1", binding.getValue().getSubjects().get(0).getName());

        var secret = ArgumentCaptor.forClass(V1Secret.class);
        verify(cluster.configs).createSecret(eq("team-a"), secret.capture());
        assertEquals("ambient-runner-token-s1", secret.getValue().getMetadata().getName());
        assertEquals("tok-123", secret.getValue().getStringData().get("token"));
    }

    @Test
    @DisplayName("annotates the session with the secret and identity names")
    void annotatesSession() {
        provisioner.provision(cluster.clients(), "team-a", "s1");

        var captor = ArgumentCaptor.forClass(Session.class);
        verify(cluster.sessions).replace(captor.capture());
        var meta = captor.getValue().metadata();
        assertEquals("ambient-runner-token-s1", meta.annotation(MetadataKeys.RUNNER_TOKEN_SECRET_ANNOTATION));
        assertEquals("ambient-session-s1", meta.annotation(MetadataKeys.RUNNER_SA_ANNOTATION));
    }

    @Test
    @DisplayName("tolerates objects that already exist")
    void toleratesExisting() {
        when(cluster.rbac.createServiceAccount(any(), any())).thenThrow(new AlreadyExistsException("exists"));
        when(cluster.rbac.createRole(any(), any())).thenThrow(new AlreadyExistsException("exists"));

        assertTrue(provisioner.provision(cluster.clients(), "team-a", "s1"));
        verify(cluster.configs).createSecret(eq("team-a"), any());
    }

    @Test
    @DisplayName("a failing step is reported, not thrown")
    void failureIsNonFatal() {
        when(cluster.rbac.mintToken(any(), any(), any())).thenThrow(new ForbiddenException("no"));

        assertFalse(provisioner.provision(cluster.clients(), "team-a", "s1"));
        verify(cluster.configs, never()).createSecret(any(), any());
        verify(cluster.sessions, never()).replace(any());
    }

    @Test
    @DisplayName("retries the annotation write on a conflict")
    void retriesAnnotationOnConflict() {
        when(cluster.sessions.replace(any()))
                .thenThrow(new ConflictException("stale"))
                .thenReturn(session);

        assertTrue(provisioner.provision(cluster.clients(), "team-a", "s1"));
        verify(cluster.sessions, times(2)).replace(any());
    }
}
