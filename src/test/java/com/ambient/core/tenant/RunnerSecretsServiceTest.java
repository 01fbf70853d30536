package com.ambient.core.tenant;

import com.ambient.core.cluster.NotFoundException;
import com.ambient.core.model.ProjectSettings;
import com.ambient.core.model.ResourceKind;
import com.ambient.core.model.ResourceMeta;
import com.ambient.core.resource.MetadataKeys;
import com.ambient.support.ClusterMocks;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Secret;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RunnerSecretsServiceTest {

    private ClusterMocks cluster;
    private RunnerSecretsService service;

    @BeforeEach
    void setUp() {
        cluster = new ClusterMocks();
        service = new RunnerSecretsService();
    }

    private void givenSettings(String secretName) {
        var settings = new ProjectSettings(ResourceKind.PROJECT_SETTINGS.apiVersion(), ProjectSettings.KIND,
                ResourceMeta.named("team-a", "projectsettings"), new ProjectSettings.Spec(List.of(), secretName), null);
        when(cluster.projectSettings.find("team-a", "projectsettings")).thenReturn(Optional.of(settings));
    }

    @Test
    @DisplayName("creates the default secret when none is configured")
    void createsDefaultSecret() {
        service.write(cluster.clients(), "team-a", Map.of("ANTHROPIC_API_KEY", "sk-1"));

        var captor = ArgumentCaptor.forClass(V1Secret.class);
        verify(cluster.configs).createSecret(eq("team-a"), captor.capture());
        V1Secret secret = captor.getValue();
        assertEquals("ambient-runner-secrets", secret.getMetadata().getName());
        assertEquals("true", secret.getMetadata().getAnnotations().get(MetadataKeys.RUNNER_SECRET_ANNOTATION));
        assertEquals("Opaque", secret.getType());
        assertEquals("sk-1", secret.getStringData().get("ANTHROPIC_API_KEY"));
    }

    @Test
    @DisplayName("replaces the data of the configured secret")
    void replacesConfiguredSecret() {
        givenSettings("my-keys");
        var existing = new V1Secret().metadata(new V1ObjectMeta().name("my-keys"))
                .data(Map.of("OLD", "x".getBytes(StandardCharsets.UTF_8)));
        when(cluster.configs.findSecret("team-a", "my-keys")).thenReturn(Optional.of(existing));

        service.write(cluster.clients(), "team-a", Map.of("NEW", "y"));

        var captor = ArgumentCaptor.forClass(V1Secret.class);
        verify(cluster.configs).replaceSecret(eq("team-a"), captor.capture());
        assertEquals(List.of("NEW"), List.copyOf(captor.getValue().getData().keySet()));
    }

    @Test
    @DisplayName("reads nothing when no secret is configured")
    void readsEmpty() {
        assertEquals(Map.of(), service.read(cluster.clients(), "team-a"));
    }

    @Test
    @DisplayName("reads decoded values of the configured secret")
    void readsValues() {
        givenSettings("my-keys");
        when(cluster.configs.findSecret("team-a", "my-keys")).thenReturn(Optional.of(new V1Secret()
                .data(Map.of("K", "v".getBytes(StandardCharsets.UTF_8)))));

        assertEquals(Map.of("K", "v"), service.read(cluster.clients(), "team-a"));
    }

    @Test
    @DisplayName("configuring a name needs existing settings")
    void updateNeedsSettings() {
        assertThrows(NotFoundException.class,
                () -> service.updateSecretName(cluster.clients(), "team-a", "keys"));
    }

    @Test
    @DisplayName("stores the configured name in the settings")
    void updatesName() {
        givenSettings(null);

        service.updateSecretName(cluster.clients(), "team-a", " keys ");

        var captor = ArgumentCaptor.forClass(ProjectSettings.class);
        verify(cluster.projectSettings).replace(captor.capture());
        assertEquals("keys", captor.getValue().runnerSecretsName());
    }

    @Test
    @DisplayName("lists only annotated opaque secrets")
    void listsRunnerSecrets() {
        when(cluster.configs.listSecrets("team-a")).thenReturn(List.of(
                new V1Secret().type("Opaque").metadata(new V1ObjectMeta().name("a")
                        .annotations(Map.of(MetadataKeys.RUNNER_SECRET_ANNOTATION, "true"))),
                new V1Secret().type("Opaque").metadata(new V1ObjectMeta().name("b")),
                new V1Secret().type("kubernetes.io/tls").metadata(new V1ObjectMeta().name("c")
                        .annotations(Map.of(MetadataKeys.RUNNER_SECRET_ANNOTATION, "true")))));

        assertEquals(List.of("a"), service.listRunnerSecrets(cluster.clients(), "team-a").stream()
                .map(SecretSummary::name).toList());
    }
}
