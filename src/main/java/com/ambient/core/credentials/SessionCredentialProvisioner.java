package com.ambient.core.credentials;

import com.ambient.core.cluster.AlreadyExistsException;
import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.ConflictException;
import com.ambient.core.config.AmbientProperties;
import com.ambient.core.metrics.AmbientMetrics;
import com.ambient.core.model.ResourceKind;
import com.ambient.core.model.Session;
import com.ambient.core.resource.MetadataKeys;
import com.ambient.core.resource.OwnerReferences;
import io.kubernetes.client.openapi.models.RbacV1Subject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1OwnerReference;
import io.kubernetes.client.openapi.models.V1PolicyRule;
import io.kubernetes.client.openapi.models.V1Role;
import io.kubernetes.client.openapi.models.V1RoleBinding;
import io.kubernetes.client.openapi.models.V1RoleRef;
import io.kubernetes.client.openapi.models.V1Secret;
import io.kubernetes.client.openapi.models.V1ServiceAccount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Gives each session its own least-privilege identity: a service account, a role limited to
 * reading and updating that one session object, a binding, and a short-lived token stored in
 * a secret. Every object is owned by the session so deleting the session removes them.
 * <p>
 * Provisioning is best-effort. Failures are logged and reported through the return value;
 * they never fail session creation.
 */
@Service
public class SessionCredentialProvisioner {

    private static final Logger log = LoggerFactory.getLogger(SessionCredentialProvisioner.class);

    private static final int ANNOTATE_ATTEMPTS = 3;

    private final AmbientProperties properties;
    private final AmbientMetrics metrics;

    public SessionCredentialProvisioner(AmbientProperties properties, AmbientMetrics metrics) {
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Provisions the runner identity for {@code sessionName} using the caller's clients.
     *
     * @return {@code true} if every step succeeded
     */
    public boolean provision(ClusterClients clients, String namespace, String sessionName) {
        String step = "load-session";
        try {
            Session session = clients.sessions().get(namespace, sessionName);
            List<V1OwnerReference> owners = OwnerReferences.controlledBy(ResourceKind.SESSION, session);
            RunnerCredentials names = RunnerCredentials.forSession(sessionName);

            step = "service-account";
            tolerateExisting(() -> clients.rbac().createServiceAccount(namespace,
                    serviceAccount(namespace, names, owners)));

            step = "role";
            tolerateExisting(() -> clients.rbac().createRole(namespace,
                    sessionRole(namespace, sessionName, names, owners)));

            step = "role-binding";
            tolerateExisting(() -> clients.rbac().createRoleBinding(namespace,
                    roleBinding(namespace, names, owners)));

            step = "token";
            String token = clients.rbac().mintToken(namespace, names.serviceAccountName(),
                    properties.getSessions().getRunnerTokenExpirationSeconds());

            step = "token-secret";
            tolerateExisting(() -> clients.configs().createSecret(namespace,
                    tokenSecret(namespace, names, token, owners)));

            step = "annotate";
            annotate(clients, namespace, sessionName, names);

            log.info("Provisioned runner identity {} for session {}/{}",
                    names.serviceAccountName(), namespace, sessionName);
            return true;
        } catch (RuntimeException e) {
            metrics.recordProvisioningFailure(step);
            log.warn("Runner credential provisioning for {}/{} failed at step {}: {}",
                    namespace, sessionName, step, e.getMessage());
            return false;
        }
    }

    private void annotate(ClusterClients clients, String namespace, String sessionName, RunnerCredentials names) {
        for (int attempt = 1; ; attempt++) {
            Session current = clients.sessions().get(namespace, sessionName);
            Session annotated = current.withMetadata(current.metadata()
                    .withAnnotation(MetadataKeys.RUNNER_TOKEN_SECRET_ANNOTATION, names.tokenSecretName())
                    .withAnnotation(MetadataKeys.RUNNER_SA_ANNOTATION, names.serviceAccountName()));
            try {
                clients.sessions().replace(annotated);
                return;
            } catch (ConflictException e) {
                if (attempt >= ANNOTATE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Conflict annotating session {}/{}, retrying", namespace, sessionName);
            }
        }
    }

    private static void tolerateExisting(Supplier<?> create) {
        try {
            create.get();
        } catch (AlreadyExistsException e) {
            log.debug("Reusing existing object: {}", e.getMessage());
        }
    }

    static V1ServiceAccount serviceAccount(String namespace, RunnerCredentials names, List<V1OwnerReference> owners) {
        return new V1ServiceAccount()
                .metadata(new V1ObjectMeta()
                        .name(names.serviceAccountName())
                        .namespace(namespace)
                        .labels(Map.of(MetadataKeys.APP_LABEL, MetadataKeys.RUNNER_IDENTITY_APP))
                        .ownerReferences(owners));
    }

    static V1Role sessionRole(String namespace, String sessionName, RunnerCredentials names,
                              List<V1OwnerReference> owners) {
        return new V1Role()
                .metadata(new V1ObjectMeta()
                        .name(names.roleName())
                        .namespace(namespace)
                        .ownerReferences(owners))
                .rules(List.of(new V1PolicyRule()
                        .apiGroups(List.of(ResourceKind.GROUP))
                        .resources(List.of(ResourceKind.SESSION.plural(), ResourceKind.SESSION.plural() + "/status"))
                        .resourceNames(List.of(sessionName))
                        .verbs(List.of("get", "update", "patch"))));
    }

    static V1RoleBinding roleBinding(String namespace, RunnerCredentials names, List<V1OwnerReference> owners) {
        return new V1RoleBinding()
                .metadata(new V1ObjectMeta()
                        .name(names.roleBindingName())
                        .namespace(namespace)
                        .ownerReferences(owners))
                .roleRef(new V1RoleRef()
                        .apiGroup(MetadataKeys.RBAC_API_GROUP)
                        .kind("Role")
                        .name(names.roleName()))
                .subjects(List.of(new RbacV1Subject()
                        .kind("ServiceAccount")
                        .name(names.serviceAccountName())
                        .namespace(namespace)));
    }

    static V1Secret tokenSecret(String namespace, RunnerCredentials names, String token,
                                List<V1OwnerReference> owners) {
        return new V1Secret()
                .metadata(new V1ObjectMeta()
                        .name(names.tokenSecretName())
                        .namespace(namespace)
                        .labels(Map.of(MetadataKeys.APP_LABEL, MetadataKeys.RUNNER_TOKEN_APP))
                        .ownerReferences(owners))
                .type("Opaque")
                .stringData(Map.of(RunnerCredentials.TOKEN_KEY, token));
    }
}
