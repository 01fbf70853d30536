package com.ambient.core.cluster.kube;

import com.ambient.core.cluster.ClusterClientFactory;
import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.ClusterException;
import com.ambient.core.config.AmbientProperties;
import com.ambient.core.model.ProjectSettings;
import com.ambient.core.model.ResourceKind;
import com.ambient.core.model.Session;
import com.ambient.core.model.Workflow;
import com.ambient.core.resource.ResourceCodec;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.ClientBuilder;
import io.kubernetes.client.util.credentials.AccessTokenAuthentication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Builds {@link ClusterClients} on client-java.
 * <p>
 * Caller clients are built per request against the configured API server using only the
 * caller's bearer token. The service identity comes from the in-cluster service account
 * (or the local kubeconfig) and is built once.
 */
@Component
public class KubeClusterClientFactory implements ClusterClientFactory {

    private static final Logger log = LoggerFactory.getLogger(KubeClusterClientFactory.class);

    private final AmbientProperties properties;
    private final ResourceCodec codec;
    private final byte[] caCertificate;

    private volatile ClusterClients serviceClients;

    public KubeClusterClientFactory(AmbientProperties properties) {
        this.properties = properties;
        this.codec = new ResourceCodec();
        this.caCertificate = readCaCertificate(properties.getCluster().getCaCertPath());
    }

    @Override
    public ClusterClients forToken(String bearerToken) {
        if (bearerToken == null || bearerToken.isBlank()) {
            throw new IllegalArgumentException("A bearer token is required to build caller-scoped clients");
        }
        ClientBuilder builder = new ClientBuilder()
                .setBasePath(properties.getCluster().getApiServerUrl())
                .setVerifyingSsl(properties.getCluster().isVerifySsl())
                .setAuthentication(new AccessTokenAuthentication(bearerToken.trim()));
        if (caCertificate != null) {
            builder.setCertificateAuthority(caCertificate);
        }
        ApiClient client = builder.build();
        return assemble(client, client);
    }

    @Override
    public ClusterClients serviceIdentity() {
        ClusterClients clients = serviceClients;
        if (clients == null) {
            synchronized (this) {
                clients = serviceClients;
                if (clients == null) {
                    clients = buildServiceIdentity();
                    serviceClients = clients;
                }
            }
        }
        return clients;
    }

    private ClusterClients buildServiceIdentity() {
        try {
            ApiClient client = ClientBuilder.standard().build();
            ApiClient watchClient = ClientBuilder.standard().build();
            watchClient.setHttpClient(watchClient.getHttpClient().newBuilder()
                    .readTimeout(0, TimeUnit.SECONDS)
                    .build());
            log.info("Service identity clients initialized against {}", client.getBasePath());
            return assemble(client, watchClient);
        } catch (IOException e) {
            throw new ClusterException("Cannot initialize service identity client: " + e.getMessage(), 500, e);
        }
    }

    private ClusterClients assemble(ApiClient client, ApiClient watchClient) {
        return new ClusterClients(
                new KubeResourceStore<>(client, watchClient, ResourceKind.SESSION, Session.class, codec),
                new KubeResourceStore<>(client, watchClient, ResourceKind.WORKFLOW, Workflow.class, codec),
                new KubeResourceStore<>(client, watchClient, ResourceKind.PROJECT_SETTINGS, ProjectSettings.class, codec),
                new KubeWorkloadGateway(client),
                new KubeRbacGateway(client),
                new KubeConfigGateway(client),
                new KubeNamespaceGateway(client, watchClient),
                new KubeAccessReviewer(client));
    }

    private static byte[] readCaCertificate(String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        Path caPath = Path.of(path);
        if (!Files.isReadable(caPath)) {
            log.debug("No cluster CA certificate at {}; using the JVM trust store", path);
            return null;
        }
        try {
            return Files.readAllBytes(caPath);
        } catch (IOException e) {
            log.warn("Failed to read cluster CA certificate {}: {}", path, e.getMessage());
            return null;
        }
    }
}
