package com.ambient.core.operator;

import com.ambient.core.cluster.AlreadyExistsException;
import com.ambient.core.cluster.ClusterException;
import com.ambient.core.config.AmbientProperties;
import com.ambient.core.model.ProjectSettings;
import com.ambient.support.ClusterMocks;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1Service;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TenantBootstrapperTest {

    private ClusterMocks cluster;
    private TenantBootstrapper bootstrapper;

    @BeforeEach
    void setUp() {
        cluster = new ClusterMocks();
        AmbientProperties properties = new AmbientProperties();
        properties.getOperator().setContentServiceImage("content:test");
        bootstrapper = new TenantBootstrapper(properties);
    }

    @Test
    @DisplayName("creates default settings, the workspace claim and the content service")
    void bootstrapsEverything() {
        bootstrapper.bootstrap(cluster.clients(), "team-a");

        ArgumentCaptor<ProjectSettings> settings = ArgumentCaptor.forClass(ProjectSettings.class);
        verify(cluster.projectSettings).create(eq("team-a"), settings.capture());
        assertEquals("projectsettings", settings.getValue().name());
        assertEquals(List.of(), settings.getValue().spec().groupAccess());

        ArgumentCaptor<V1PersistentVolumeClaim> claim = ArgumentCaptor.forClass(V1PersistentVolumeClaim.class);
        verify(cluster.workloads).createPersistentVolumeClaim(eq("team-a"), claim.capture());
        assertEquals("ambient-workspace", claim.getValue().getMetadata().getName());
        assertEquals(List.of("ReadWriteOnce"), claim.getValue().getSpec().getAccessModes());
        assertEquals(Quantity.fromString("5Gi"), claim.getValue().getSpec().getResources().getRequests().get("storage"));

        ArgumentCaptor<V1Deployment> deployment = ArgumentCaptor.forClass(V1Deployment.class);
        verify(cluster.workloads).createDeployment(eq("team-a"), deployment.capture());
        var container = deployment.getValue().getSpec().getTemplate().getSpec().getContainers().get(0);
        assertEquals("content:test", container.getImage());
        assertEquals("/data", container.getVolumeMounts().get(0).getMountPath());
        assertTrue(container.getEnv().stream().map(V1EnvVar::getName).toList().contains("CONTENT_SERVICE_MODE"));

        ArgumentCaptor<V1Service> service = ArgumentCaptor.forClass(V1Service.class);
        verify(cluster.workloads).createService(eq("team-a"), service.capture());
        assertEquals("ambient-content", service.getValue().getMetadata().getName());
        assertEquals("ClusterIP", service.getValue().getSpec().getType());
        assertEquals(8080, service.getValue().getSpec().getPorts().get(0).getPort());
    }

    @Test
    @DisplayName("existing pieces are left untouched")
    void idempotent() {
        when(cluster.projectSettings.find("team-a", "projectsettings"))
                .thenReturn(Optional.of(ProjectSettings.defaults("team-a")));
        when(cluster.workloads.findPersistentVolumeClaim("team-a", "ambient-workspace"))
                .thenReturn(Optional.of(new V1PersistentVolumeClaim()));
        when(cluster.workloads.findService("team-a", "ambient-content")).thenReturn(Optional.of(new V1Service()));

        bootstrapper.bootstrap(cluster.clients(), "team-a");

        verify(cluster.projectSettings, never()).create(any(), any());
        verify(cluster.workloads, never()).createPersistentVolumeClaim(any(), any());
        verify(cluster.workloads, never()).createDeployment(any(), any());
    }

    @Test
    @DisplayName("one failing step does not stop the others")
    void stepsAreIndependent() {
        when(cluster.projectSettings.create(eq("team-a"), any())).thenThrow(new ClusterException("forbidden", 403));
        when(cluster.workloads.createDeployment(eq("team-a"), any())).thenThrow(new AlreadyExistsException("exists"));

        assertDoesNotThrow(() -> bootstrapper.bootstrap(cluster.clients(), "team-a"));

        verify(cluster.workloads).createPersistentVolumeClaim(eq("team-a"), any());
        verify(cluster.workloads).createService(eq("team-a"), any());
    }
}
