package com.ambient.core.tenant;

import com.ambient.core.cluster.AlreadyExistsException;
import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.NotFoundException;
import com.ambient.core.model.AccessKey;
import com.ambient.core.model.InvalidRequestException;
import com.ambient.core.model.ProjectRole;
import com.ambient.core.resource.MetadataKeys;
import io.kubernetes.client.openapi.models.RbacV1Subject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1RoleBinding;
import io.kubernetes.client.openapi.models.V1RoleRef;
import io.kubernetes.client.openapi.models.V1ServiceAccount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Access keys are service accounts bound to one tenant role. The token is minted once at
 * creation and never stored.
 */
@Service
public class AccessKeyService {

    private static final Logger log = LoggerFactory.getLogger(AccessKeyService.class);

    static final String SELECTOR = MetadataKeys.APP_LABEL + "=" + MetadataKeys.ACCESS_KEY_APP;

    private final Clock clock;

    public AccessKeyService(Clock clock) {
        this.clock = clock;
    }

    public List<AccessKey> list(ClusterClients clients, String namespace) {
        Map<String, ProjectRole> roleByAccount = new HashMap<>();
        for (V1RoleBinding binding : clients.rbac().listRoleBindings(namespace, SELECTOR)) {
            ProjectRole role = PermissionService.roleOf(binding);
            if (binding.getSubjects() == null) {
                continue;
            }
            for (RbacV1Subject subject : binding.getSubjects()) {
                if ("ServiceAccount".equalsIgnoreCase(subject.getKind())) {
                    roleByAccount.put(subject.getName(), role);
                }
            }
        }
        return clients.rbac().listServiceAccounts(namespace, SELECTOR).stream()
                .map(sa -> toKey(sa, roleByAccount.get(sa.getMetadata().getName())))
                .toList();
    }

    /**
     * Creates the key's identity and binding and mints its token.
     *
     * @return the key including its token; later reads never include it
     */
    public AccessKey create(ClusterClients clients, String namespace, AccessKeyRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw new InvalidRequestException("name is required");
        }
        ProjectRole role = request.role() == null || request.role().isBlank()
                ? ProjectRole.EDIT : parseRole(request.role());
        Instant now = clock.instant();
        long seconds = now.getEpochSecond();
        String sanitized = NameSanitizer.sanitize(request.name());
        String accountName = "ambient-key-" + sanitized + "-" + seconds;
        String bindingName = "ambient-key-" + role.wireName() + "-" + sanitized + "-" + seconds;
        String createdAt = now.truncatedTo(ChronoUnit.SECONDS).toString();
        String description = request.description() == null ? "" : request.description();

        var account = new V1ServiceAccount().metadata(new V1ObjectMeta()
                .name(accountName)
                .namespace(namespace)
                .labels(Map.of(MetadataKeys.APP_LABEL, MetadataKeys.ACCESS_KEY_APP))
                .annotations(Map.of(
                        MetadataKeys.KEY_NAME_ANNOTATION, request.name(),
                        MetadataKeys.KEY_DESCRIPTION_ANNOTATION, description,
                        MetadataKeys.KEY_CREATED_AT_ANNOTATION, createdAt,
                        MetadataKeys.ROLE_ANNOTATION, role.wireName())));
        try {
            clients.rbac().createServiceAccount(namespace, account);
        } catch (AlreadyExistsException e) {
            log.debug("Service account {}/{} already exists", namespace, accountName);
        }

        var binding = new V1RoleBinding()
                .metadata(new V1ObjectMeta()
                        .name(bindingName)
                        .namespace(namespace)
                        .labels(Map.of(MetadataKeys.APP_LABEL, MetadataKeys.ACCESS_KEY_APP))
                        .annotations(Map.of(
                                MetadataKeys.KEY_NAME_ANNOTATION, request.name(),
                                MetadataKeys.KEY_SA_NAME_ANNOTATION, accountName,
                                MetadataKeys.ROLE_ANNOTATION, role.wireName())))
                .roleRef(new V1RoleRef()
                        .apiGroup(MetadataKeys.RBAC_API_GROUP)
                        .kind("ClusterRole")
                        .name(role.clusterRoleName()))
                .subjects(List.of(new RbacV1Subject()
                        .kind("ServiceAccount")
                        .name(accountName)
                        .namespace(namespace)));
        try {
            clients.rbac().createRoleBinding(namespace, binding);
        } catch (AlreadyExistsException e) {
            log.debug("Role binding {}/{} already exists", namespace, bindingName);
        }

        String token = clients.rbac().mintToken(namespace, accountName, null);
        log.info("Created access key {} ({}) in {}", accountName, role.wireName(), namespace);
        return new AccessKey(accountName, request.name(), emptyToNull(description), role, createdAt, null, token);
    }

    /** Removes the key's bindings, then its identity. */
    public void delete(ClusterClients clients, String namespace, String keyId) {
        for (V1RoleBinding binding : clients.rbac().listRoleBindings(namespace, SELECTOR)) {
            Map<String, String> annotations = binding.getMetadata().getAnnotations();
            if (annotations != null && keyId.equals(annotations.get(MetadataKeys.KEY_SA_NAME_ANNOTATION))) {
                try {
                    clients.rbac().deleteRoleBinding(namespace, binding.getMetadata().getName());
                } catch (NotFoundException e) {
                    log.debug("Role binding {} already gone", binding.getMetadata().getName());
                }
            }
        }
        try {
            clients.rbac().deleteServiceAccount(namespace, keyId);
        } catch (NotFoundException e) {
            log.debug("Access key {}/{} already gone", namespace, keyId);
        }
        log.info("Deleted access key {} in {}", keyId, namespace);
    }

    private static AccessKey toKey(V1ServiceAccount account, ProjectRole role) {
        V1ObjectMeta meta = account.getMetadata();
        Map<String, String> annotations = meta.getAnnotations() == null ? Map.of() : meta.getAnnotations();
        String createdAt = meta.getCreationTimestamp() == null
                ? annotations.get(MetadataKeys.KEY_CREATED_AT_ANNOTATION)
                : meta.getCreationTimestamp().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        return new AccessKey(
                meta.getName(),
                annotations.get(MetadataKeys.KEY_NAME_ANNOTATION),
                emptyToNull(annotations.get(MetadataKeys.KEY_DESCRIPTION_ANNOTATION)),
                role,
                createdAt,
                annotations.get(MetadataKeys.KEY_LAST_USED_ANNOTATION),
                null);
    }

    private static ProjectRole parseRole(String value) {
        try {
            return ProjectRole.fromWire(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage());
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
