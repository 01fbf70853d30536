package com.ambient.core.tenant;

import com.ambient.core.cluster.ClusterClientFactory;
import com.ambient.core.cluster.NotFoundException;
import com.ambient.core.resource.MetadataKeys;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kubernetes.client.openapi.models.V1ServiceAccount;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Stamps the last-used time on access keys. The caller's token is only decoded, never
 * verified; the write is made with the service identity and only touches accounts labelled
 * as access keys. Failures are logged and dropped.
 */
@Component
public class AccessKeyUsageTracker {

    private static final Logger log = LoggerFactory.getLogger(AccessKeyUsageTracker.class);

    static final String SERVICE_ACCOUNT_PREFIX = "system:serviceaccount:";

    private final ClusterClientFactory clientFactory;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "access-key-usage");
        t.setDaemon(true);
        return t;
    });

    public AccessKeyUsageTracker(ClusterClientFactory clientFactory, Clock clock) {
        this.clientFactory = clientFactory;
        this.clock = clock;
    }

    /** Queues a last-used update if {@code bearerToken} belongs to a service account. */
    public void recordUse(String bearerToken) {
        Optional<ServiceAccountRef> ref = serviceAccountOf(bearerToken);
        if (ref.isEmpty()) {
            return;
        }
        try {
            executor.execute(() -> touch(ref.get()));
        } catch (RejectedExecutionException e) {
            log.debug("Usage tracker stopped, dropping update for {}", ref.get());
        }
    }

    void touch(ServiceAccountRef ref) {
        try {
            var rbac = clientFactory.serviceIdentity().rbac();
            Optional<V1ServiceAccount> found = rbac.findServiceAccount(ref.namespace(), ref.name());
            if (found.isEmpty()) {
                return;
            }
            V1ServiceAccount account = found.get();
            Map<String, String> labels = account.getMetadata().getLabels();
            if (labels == null || !MetadataKeys.ACCESS_KEY_APP.equals(labels.get(MetadataKeys.APP_LABEL))) {
                return;
            }
            Map<String, String> annotations = new HashMap<>();
            if (account.getMetadata().getAnnotations() != null) {
                annotations.putAll(account.getMetadata().getAnnotations());
            }
            annotations.put(MetadataKeys.KEY_LAST_USED_ANNOTATION,
                    Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString());
            account.getMetadata().setAnnotations(annotations);
            rbac.replaceServiceAccount(ref.namespace(), account);
        } catch (NotFoundException e) {
            log.debug("Access key {} vanished before its last-used time was written", ref);
        } catch (RuntimeException e) {
            log.warn("Failed to update last-used time for {}: {}", ref, e.getMessage());
        }
    }

    /**
     * Namespace and name from the {@code sub} claim of a service account token, e.g.
     * {@code system:serviceaccount:team-a:ambient-key-ci-1700000000}.
     */
    Optional<ServiceAccountRef> serviceAccountOf(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String[] segments = token.trim().split("\\.");
        if (segments.length < 2) {
            return Optional.empty();
        }
        try {
            byte[] payload = Base64.getUrlDecoder().decode(segments[1]);
            JsonNode claims = objectMapper.readTree(payload);
            String sub = claims.path("sub").asText("");
            if (!sub.startsWith(SERVICE_ACCOUNT_PREFIX)) {
                return Optional.empty();
            }
            String[] parts = sub.substring(SERVICE_ACCOUNT_PREFIX.length()).split(":", 2);
            if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new ServiceAccountRef(parts[0], parts[1]));
        } catch (IllegalArgumentException | IOException e) {
            log.debug("Bearer token is not a decodable JWT: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    record ServiceAccountRef(String namespace, String name) {

        @Override
        public String toString() {
            return namespace + "/" + name;
        }
    }
}
