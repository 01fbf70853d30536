package com.ambient.core.tenant;

import com.ambient.core.cluster.AlreadyExistsException;
import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.NotFoundException;
import com.ambient.core.metrics.AmbientMetrics;
import com.ambient.core.model.InvalidRequestException;
import com.ambient.core.model.PermissionAssignment;
import com.ambient.core.model.ProjectRole;
import com.ambient.core.model.SubjectType;
import com.ambient.core.resource.MetadataKeys;
import io.kubernetes.client.openapi.models.RbacV1Subject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1RoleBinding;
import io.kubernetes.client.openapi.models.V1RoleRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * User and group grants, each materialized as one role binding to a fixed tenant role.
 */
@Service
public class PermissionService {

    private static final Logger log = LoggerFactory.getLogger(PermissionService.class);

    private static final String CLUSTER_ROLE_KIND = "ClusterRole";
    private static final String LEGACY_GROUP_ANNOTATION = "ambient-code.io/groupName";

    private final AmbientMetrics metrics;

    public PermissionService(AmbientMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Grants from current and legacy bindings, de-duplicated by subject and role.
     */
    public List<PermissionAssignment> list(ClusterClients clients, String namespace) {
        Set<PermissionAssignment> seen = new LinkedHashSet<>();
        for (V1RoleBinding binding : clients.rbac().listRoleBindings(namespace, null)) {
            Map<String, String> labels = binding.getMetadata().getLabels() == null
                    ? Map.of() : binding.getMetadata().getLabels();
            String app = labels.get(MetadataKeys.APP_LABEL);
            if (!MetadataKeys.PERMISSION_APP.equals(app) && !MetadataKeys.LEGACY_GROUP_ACCESS_APP.equals(app)) {
                continue;
            }
            ProjectRole role = roleOf(binding);
            if (role == null || binding.getSubjects() == null) {
                continue;
            }
            Map<String, String> annotations = binding.getMetadata().getAnnotations() == null
                    ? Map.of() : binding.getMetadata().getAnnotations();
            for (RbacV1Subject subject : binding.getSubjects()) {
                SubjectType type;
                try {
                    type = SubjectType.fromWire(subject.getKind());
                } catch (IllegalArgumentException e) {
                    continue;
                }
                String name = subject.getName();
                if (notBlank(annotations.get(MetadataKeys.SUBJECT_NAME_ANNOTATION))) {
                    name = annotations.get(MetadataKeys.SUBJECT_NAME_ANNOTATION);
                }
                if (type == SubjectType.GROUP && notBlank(annotations.get(LEGACY_GROUP_ANNOTATION))) {
                    name = annotations.get(LEGACY_GROUP_ANNOTATION);
                }
                seen.add(new PermissionAssignment(type, name, role));
            }
        }
        return new ArrayList<>(seen);
    }

    /**
     * @throws AlreadyExistsException if the subject already holds the role
     */
    public PermissionAssignment grant(ClusterClients clients, String namespace, PermissionAssignment grant) {
        if (grant == null || grant.subjectType() == null || grant.role() == null
                || grant.subjectName() == null || grant.subjectName().isBlank()) {
            throw new InvalidRequestException("subjectType, subjectName and role are required");
        }
        V1RoleBinding binding = bindingFor(namespace, grant);
        try {
            clients.rbac().createRoleBinding(namespace, binding);
        } catch (AlreadyExistsException e) {
            throw new AlreadyExistsException("permission already exists for this subject and role", e);
        }
        metrics.recordPermissionChange("grant");
        log.info("Granted {} to {} {} in {}", grant.role().wireName(), grant.subjectType().wireName(),
                grant.subjectName(), namespace);
        return grant;
    }

    /**
     * Removes every grant binding for the subject, whatever role it carries. Revoking a
     * subject that holds nothing is not an error.
     */
    public void revoke(ClusterClients clients, String namespace, SubjectType type, String subjectName) {
        if (subjectName == null || subjectName.isBlank()) {
            throw new InvalidRequestException("subjectName is required");
        }
        String selector = MetadataKeys.APP_LABEL + "=" + MetadataKeys.PERMISSION_APP;
        for (V1RoleBinding binding : clients.rbac().listRoleBindings(namespace, selector)) {
            if (binding.getSubjects() == null) {
                continue;
            }
            boolean matches = binding.getSubjects().stream().anyMatch(s ->
                    type.rbacKind().equalsIgnoreCase(s.getKind()) && subjectName.equals(s.getName()));
            if (!matches) {
                continue;
            }
            String bindingName = binding.getMetadata().getName();
            try {
                clients.rbac().deleteRoleBinding(namespace, bindingName);
                metrics.recordPermissionChange("revoke");
                log.info("Revoked {} from {} {} in {}", bindingName, type.wireName(), subjectName, namespace);
            } catch (NotFoundException e) {
                log.debug("Role binding {}/{} already gone", namespace, bindingName);
            }
        }
    }

    static String bindingName(PermissionAssignment grant) {
        return "ambient-permission-" + grant.role().wireName() + "-"
                + NameSanitizer.sanitize(grant.subjectName()) + "-" + grant.subjectType().wireName();
    }

    static V1RoleBinding bindingFor(String namespace, PermissionAssignment grant) {
        String kind = grant.subjectType().rbacKind();
        return new V1RoleBinding()
                .metadata(new V1ObjectMeta()
                        .name(bindingName(grant))
                        .namespace(namespace)
                        .labels(Map.of(MetadataKeys.APP_LABEL, MetadataKeys.PERMISSION_APP))
                        .annotations(Map.of(
                                MetadataKeys.SUBJECT_KIND_ANNOTATION, kind,
                                MetadataKeys.SUBJECT_NAME_ANNOTATION, grant.subjectName(),
                                MetadataKeys.ROLE_ANNOTATION, grant.role().wireName())))
                .roleRef(new V1RoleRef()
                        .apiGroup(MetadataKeys.RBAC_API_GROUP)
                        .kind(CLUSTER_ROLE_KIND)
                        .name(grant.role().clusterRoleName()))
                .subjects(List.of(new RbacV1Subject()
                        .kind(kind)
                        .apiGroup(MetadataKeys.RBAC_API_GROUP)
                        .name(grant.subjectName())));
    }

    /** Role from the annotation when present, else from a reference to one of the fixed roles. */
    static ProjectRole roleOf(V1RoleBinding binding) {
        Map<String, String> annotations = binding.getMetadata().getAnnotations();
        if (annotations != null && notBlank(annotations.get(MetadataKeys.ROLE_ANNOTATION))) {
            return ProjectRole.fromWireOrView(annotations.get(MetadataKeys.ROLE_ANNOTATION));
        }
        V1RoleRef ref = binding.getRoleRef();
        if (ref == null || !CLUSTER_ROLE_KIND.equals(ref.getKind())) {
            return null;
        }
        for (ProjectRole role : ProjectRole.values()) {
            if (role.clusterRoleName().equals(ref.getName())) {
                return role;
            }
        }
        return null;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
