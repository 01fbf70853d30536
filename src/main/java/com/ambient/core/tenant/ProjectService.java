package com.ambient.core.tenant;

import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.NamespaceGateway;
import com.ambient.core.cluster.NotFoundException;
import com.ambient.core.model.InvalidRequestException;
import com.ambient.core.model.Project;
import com.ambient.core.resource.MetadataKeys;
import com.ambient.core.security.CallerContext;
import io.kubernetes.client.openapi.models.V1Namespace;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Tenants are namespaces carrying the managed marker. Namespaces without it are invisible here:
 * reading, updating or deleting one is reported as not found.
 */
@Service
public class ProjectService {

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    private static final Pattern DNS_LABEL = Pattern.compile("[a-z0-9]([-a-z0-9]{0,61}[a-z0-9])?");

    public List<Project> list(ClusterClients clients) {
        return clients.namespaces().listManaged().stream()
                .filter(NamespaceGateway::hasManagedMarker)
                .map(ProjectService::toProject)
                .toList();
    }

    public Project get(ClusterClients clients, String name) {
        return toProject(managed(clients, name));
    }

    /**
     * Creates the namespace with the managed marker. Its default settings, workspace and content
     * service are laid down by the controller once it sees the marker.
     */
    public Project create(ClusterClients clients, CallerContext caller, ProjectRequest request) {
        if (request == null || request.name() == null || !DNS_LABEL.matcher(request.name()).matches()) {
            throw new InvalidRequestException("name must be a lowercase DNS label");
        }
        Map<String, String> annotations = new HashMap<>();
        String displayName = request.displayName() == null || request.displayName().isBlank()
                ? request.name() : request.displayName();
        annotations.put(MetadataKeys.DISPLAY_NAME_ANNOTATION, displayName);
        if (request.description() != null && !request.description().isBlank()) {
            annotations.put(MetadataKeys.DESCRIPTION_ANNOTATION, request.description());
        }
        if (caller != null && caller.displayName() != null && !caller.displayName().isBlank()) {
            annotations.put(MetadataKeys.REQUESTER_ANNOTATION, caller.displayName());
        }
        var namespace = new V1Namespace().metadata(new V1ObjectMeta()
                .name(request.name())
                .labels(Map.of(MetadataKeys.MANAGED_LABEL, "true"))
                .annotations(annotations));

        V1Namespace created = clients.namespaces().create(namespace);
        log.info("Created project {}", request.name());
        return toProject(created);
    }

    /**
     * Updates display name and description; blank values leave the current ones in place.
     */
    public Project update(ClusterClients clients, String name, ProjectRequest request) {
        if (request == null) {
            throw new InvalidRequestException("request body is required");
        }
        if (request.name() != null && !request.name().isBlank() && !request.name().equals(name)) {
            throw new InvalidRequestException("project name in URL does not match request body");
        }
        V1Namespace namespace = managed(clients, name);
        Map<String, String> annotations = new HashMap<>();
        if (namespace.getMetadata().getAnnotations() != null) {
            annotations.putAll(namespace.getMetadata().getAnnotations());
        }
        if (request.displayName() != null && !request.displayName().isBlank()) {
            annotations.put(MetadataKeys.DISPLAY_NAME_ANNOTATION, request.displayName());
        }
        if (request.description() != null && !request.description().isBlank()) {
            annotations.put(MetadataKeys.DESCRIPTION_ANNOTATION, request.description());
        }
        namespace.getMetadata().setAnnotations(annotations);
        return toProject(clients.namespaces().replace(namespace));
    }

    public void delete(ClusterClients clients, String name) {
        managed(clients, name);
        clients.namespaces().delete(name);
        log.info("Deleted project {}", name);
    }

    private static V1Namespace managed(ClusterClients clients, String name) {
        return clients.namespaces().find(name)
                .filter(NamespaceGateway::hasManagedMarker)
                .orElseThrow(() -> new NotFoundException("Project not found"));
    }

    static Project toProject(V1Namespace namespace) {
        V1ObjectMeta meta = namespace.getMetadata();
        Map<String, String> labels = meta.getLabels() == null ? Map.of() : meta.getLabels();
        Map<String, String> annotations = meta.getAnnotations() == null ? Map.of() : meta.getAnnotations();
        return new Project(
                meta.getName(),
                annotations.get(MetadataKeys.DISPLAY_NAME_ANNOTATION),
                annotations.get(MetadataKeys.DESCRIPTION_ANNOTATION),
                labels,
                annotations,
                meta.getCreationTimestamp() == null
                        ? null : meta.getCreationTimestamp().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                namespace.getStatus() == null ? null : namespace.getStatus().getPhase());
    }
}
