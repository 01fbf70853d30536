package com.ambient.core.tenant;

import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.NotFoundException;
import com.ambient.core.model.InvalidRequestException;
import com.ambient.core.model.ProjectSettings;
import com.ambient.core.resource.MetadataKeys;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Secret;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The tenant's runner secret: model provider keys and similar values handed to every session
 * workload. Which secret is used is recorded in the tenant's settings.
 */
@Service
public class RunnerSecretsService {

    private static final Logger log = LoggerFactory.getLogger(RunnerSecretsService.class);

    public static final String DEFAULT_SECRET_NAME = "ambient-runner-secrets";

    static final String OPAQUE = "Opaque";

    /** Configured secret name, or {@code null} when none is set. */
    public String configuredSecretName(ClusterClients clients, String namespace) {
        return settings(clients, namespace).map(ProjectSettings::runnerSecretsName).orElse(null);
    }

    /**
     * @throws NotFoundException if the tenant's settings have not been created yet
     */
    public String updateSecretName(ClusterClients clients, String namespace, String secretName) {
        if (secretName == null || secretName.isBlank()) {
            throw new InvalidRequestException("secretName is required");
        }
        ProjectSettings current = settings(clients, namespace).orElseThrow(() -> new NotFoundException(
                "ProjectSettings not found. Ensure the namespace is labeled "
                        + MetadataKeys.MANAGED_SELECTOR + " and wait for the controller."));
        ProjectSettings.Spec spec = current.spec() == null ? new ProjectSettings.Spec(List.of(), null) : current.spec();
        clients.projectSettings().replace(current.withSpec(spec.withRunnerSecretsName(secretName.trim())));
        log.info("Runner secret for {} set to {}", namespace, secretName.trim());
        return secretName.trim();
    }

    /** Decoded values of the configured secret; empty when none is configured or it does not exist. */
    public Map<String, String> read(ClusterClients clients, String namespace) {
        String name = configuredSecretName(clients, namespace);
        if (name == null) {
            return Map.of();
        }
        return clients.configs().findSecret(namespace, name)
                .map(RunnerSecretsService::decode)
                .orElse(Map.of());
    }

    /**
     * Replaces the secret's values, creating the secret (under the configured or default name)
     * when it does not exist.
     */
    public void write(ClusterClients clients, String namespace, Map<String, String> data) {
        if (data == null) {
            throw new InvalidRequestException("data is required");
        }
        String configured = configuredSecretName(clients, namespace);
        String name = configured == null ? DEFAULT_SECRET_NAME : configured;

        Optional<V1Secret> existing = clients.configs().findSecret(namespace, name);
        if (existing.isEmpty()) {
            var secret = new V1Secret()
                    .metadata(new V1ObjectMeta()
                            .name(name)
                            .namespace(namespace)
                            .labels(Map.of(MetadataKeys.APP_LABEL, MetadataKeys.RUNNER_SECRETS_APP))
                            .annotations(Map.of(MetadataKeys.RUNNER_SECRET_ANNOTATION, "true")))
                    .type(OPAQUE)
                    .stringData(new LinkedHashMap<>(data));
            clients.configs().createSecret(namespace, secret);
            log.info("Created runner secret {}/{}", namespace, name);
            return;
        }
        V1Secret secret = existing.get();
        Map<String, byte[]> encoded = new LinkedHashMap<>();
        data.forEach((k, v) -> encoded.put(k, v == null ? new byte[0] : v.getBytes(StandardCharsets.UTF_8)));
        secret.setType(OPAQUE);
        secret.setData(encoded);
        secret.setStringData(null);
        clients.configs().replaceSecret(namespace, secret);
        log.info("Updated runner secret {}/{} ({} keys)", namespace, name, encoded.size());
    }

    /** Opaque secrets marked as runner secrets. */
    public List<SecretSummary> listRunnerSecrets(ClusterClients clients, String namespace) {
        return clients.configs().listSecrets(namespace).stream()
                .filter(s -> OPAQUE.equals(s.getType()))
                .filter(s -> s.getMetadata().getAnnotations() != null
                        && "true".equals(s.getMetadata().getAnnotations().get(MetadataKeys.RUNNER_SECRET_ANNOTATION)))
                .map(s -> new SecretSummary(
                        s.getMetadata().getName(),
                        s.getMetadata().getCreationTimestamp() == null ? null
                                : s.getMetadata().getCreationTimestamp().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                        s.getType()))
                .toList();
    }

    private static Optional<ProjectSettings> settings(ClusterClients clients, String namespace) {
        return clients.projectSettings().find(namespace, ProjectSettings.SINGLETON_NAME);
    }

    private static Map<String, String> decode(V1Secret secret) {
        Map<String, String> out = new TreeMap<>();
        if (secret.getData() != null) {
            secret.getData().forEach((k, v) -> out.put(k, new String(v, StandardCharsets.UTF_8)));
        }
        return out;
    }
}
