package com.ambient.core.operator;

import com.ambient.core.cluster.AlreadyExistsException;
import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.config.AmbientProperties;
import com.ambient.core.model.ProjectSettings;
import com.ambient.core.resource.MetadataKeys;
import io.kubernetes.client.custom.IntOrString;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1ContainerPort;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1DeploymentSpec;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1EnvVarSource;
import io.kubernetes.client.openapi.models.V1LabelSelector;
import io.kubernetes.client.openapi.models.V1ObjectFieldSelector;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimSpec;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimVolumeSource;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.kubernetes.client.openapi.models.V1PodTemplateSpec;
import io.kubernetes.client.openapi.models.V1Service;
import io.kubernetes.client.openapi.models.V1ServicePort;
import io.kubernetes.client.openapi.models.V1ServiceSpec;
import io.kubernetes.client.openapi.models.V1Volume;
import io.kubernetes.client.openapi.models.V1VolumeMount;
import io.kubernetes.client.openapi.models.V1VolumeResourceRequirements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Lays down what every managed tenant needs: default settings, the shared workspace claim and
 * the content service that serves it. Each step is best-effort and independent of the others.
 */
@Component
public class TenantBootstrapper {

    private static final Logger log = LoggerFactory.getLogger(TenantBootstrapper.class);

    static final String CONTENT_SERVICE_NAME = MetadataKeys.CONTENT_APP;
    static final int CONTENT_PORT = 8080;

    private final AmbientProperties properties;

    public TenantBootstrapper(AmbientProperties properties) {
        this.properties = properties;
    }

    public void bootstrap(ClusterClients clients, String namespace) {
        log.info("Bootstrapping managed namespace {}", namespace);
        try {
            ensureProjectSettings(clients, namespace);
        } catch (RuntimeException e) {
            log.warn("Error creating default ProjectSettings for namespace {}: {}", namespace, e.getMessage());
        }
        try {
            ensureWorkspaceClaim(clients, namespace);
        } catch (RuntimeException e) {
            log.warn("Failed to ensure workspace PVC in {}: {}", namespace, e.getMessage());
        }
        try {
            ensureContentService(clients, namespace);
        } catch (RuntimeException e) {
            log.warn("Failed to ensure content service in {}: {}", namespace, e.getMessage());
        }
    }

    void ensureProjectSettings(ClusterClients clients, String namespace) {
        if (clients.projectSettings().find(namespace, ProjectSettings.SINGLETON_NAME).isPresent()) {
            log.debug("ProjectSettings already exists in namespace {}", namespace);
            return;
        }
        try {
            clients.projectSettings().create(namespace, ProjectSettings.defaults(namespace));
            log.info("Created default ProjectSettings for namespace {}", namespace);
        } catch (AlreadyExistsException e) {
            log.debug("ProjectSettings appeared concurrently in {}", namespace);
        }
    }

    void ensureWorkspaceClaim(ClusterClients clients, String namespace) {
        if (clients.workloads().findPersistentVolumeClaim(namespace, RunnerJobFactory.WORKSPACE_CLAIM).isPresent()) {
            return;
        }
        var claim = new V1PersistentVolumeClaim()
                .metadata(new V1ObjectMeta()
                        .name(RunnerJobFactory.WORKSPACE_CLAIM)
                        .namespace(namespace)
                        .labels(Map.of(MetadataKeys.APP_LABEL, MetadataKeys.WORKSPACE_APP)))
                .spec(new V1PersistentVolumeClaimSpec()
                        .accessModes(List.of("ReadWriteOnce"))
                        .resources(new V1VolumeResourceRequirements()
                                .requests(Map.of("storage",
                                        Quantity.fromString(properties.getOperator().getWorkspaceClaimSize())))));
        try {
            clients.workloads().createPersistentVolumeClaim(namespace, claim);
            log.info("Created workspace PVC in {}", namespace);
        } catch (AlreadyExistsException e) {
            log.debug("Workspace PVC appeared concurrently in {}", namespace);
        }
    }

    void ensureContentService(ClusterClients clients, String namespace) {
        if (clients.workloads().findService(namespace, CONTENT_SERVICE_NAME).isPresent()) {
            return;
        }
        Map<String, String> labels = Map.of(MetadataKeys.APP_LABEL, MetadataKeys.CONTENT_APP);
        try {
            clients.workloads().createDeployment(namespace, contentDeployment(namespace, labels));
        } catch (AlreadyExistsException e) {
            log.debug("Content deployment already exists in {}", namespace);
        }
        var service = new V1Service()
                .metadata(new V1ObjectMeta().name(CONTENT_SERVICE_NAME).namespace(namespace).labels(labels))
                .spec(new V1ServiceSpec()
                        .selector(labels)
                        .ports(List.of(new V1ServicePort()
                                .name("http")
                                .port(CONTENT_PORT)
                                .targetPort(new IntOrString("http"))))
                        .type("ClusterIP"));
        try {
            clients.workloads().createService(namespace, service);
            log.info("Created content service in {}", namespace);
        } catch (AlreadyExistsException e) {
            log.debug("Content service already exists in {}", namespace);
        }
    }

    private V1Deployment contentDeployment(String namespace, Map<String, String> labels) {
        var container = new V1Container()
                .name("content")
                .image(properties.getOperator().getContentServiceImage())
                .imagePullPolicy(properties.getOperator().getImagePullPolicy())
                .env(List.of(
                        new V1EnvVar().name("NAMESPACE").valueFrom(new V1EnvVarSource()
                                .fieldRef(new V1ObjectFieldSelector().fieldPath("metadata.namespace"))),
                        new V1EnvVar().name("CONTENT_SERVICE_MODE").value("true"),
                        new V1EnvVar().name("STATE_BASE_DIR").value("/data")))
                .ports(List.of(new V1ContainerPort().containerPort(CONTENT_PORT).name("http")))
                .volumeMounts(List.of(new V1VolumeMount().name("workspace").mountPath("/data")));
        return new V1Deployment()
                .metadata(new V1ObjectMeta().name(CONTENT_SERVICE_NAME).namespace(namespace).labels(labels))
                .spec(new V1DeploymentSpec()
                        .replicas(1)
                        .selector(new V1LabelSelector().matchLabels(labels))
                        .template(new V1PodTemplateSpec()
                                .metadata(new V1ObjectMeta().labels(labels))
                                .spec(new V1PodSpec()
                                        .containers(List.of(container))
                                        .volumes(List.of(new V1Volume()
                                                .name("workspace")
                                                .persistentVolumeClaim(new V1PersistentVolumeClaimVolumeSource()
                                                        .claimName(RunnerJobFactory.WORKSPACE_CLAIM)))))));
    }
}
