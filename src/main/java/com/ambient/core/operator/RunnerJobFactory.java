package com.ambient.core.operator;

import com.ambient.core.config.AmbientProperties;
import com.ambient.core.credentials.RunnerCredentials;
import com.ambient.core.model.GitAuthentication;
import com.ambient.core.model.GitConfig;
import com.ambient.core.model.GitUser;
import com.ambient.core.model.LlmSettings;
import com.ambient.core.model.ResourceKind;
import com.ambient.core.model.ResourceOverrides;
import com.ambient.core.model.Session;
import com.ambient.core.model.SessionPaths;
import com.ambient.core.model.SessionSpec;
import com.ambient.core.model.WorkflowRef;
import com.ambient.core.resource.MetadataKeys;
import com.ambient.core.resource.OwnerReferences;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.V1Affinity;
import io.kubernetes.client.openapi.models.V1Capabilities;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1EmptyDirVolumeSource;
import io.kubernetes.client.openapi.models.V1EnvFromSource;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1EnvVarSource;
import io.kubernetes.client.openapi.models.V1Job;
import io.kubernetes.client.openapi.models.V1JobSpec;
import io.kubernetes.client.openapi.models.V1LabelSelector;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimVolumeSource;
import io.kubernetes.client.openapi.models.V1PodAffinity;
import io.kubernetes.client.openapi.models.V1PodAffinityTerm;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.kubernetes.client.openapi.models.V1PodTemplateSpec;
import io.kubernetes.client.openapi.models.V1ResourceRequirements;
import io.kubernetes.client.openapi.models.V1SecretEnvSource;
import io.kubernetes.client.openapi.models.V1SecretKeySelector;
import io.kubernetes.client.openapi.models.V1SecretVolumeSource;
import io.kubernetes.client.openapi.models.V1SecurityContext;
import io.kubernetes.client.openapi.models.V1Volume;
import io.kubernetes.client.openapi.models.V1VolumeMount;
import io.kubernetes.client.openapi.models.V1WeightedPodAffinityTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Translates a session into its execution unit: a Kubernetes Job running the runner image
 * under a restrictive profile.
 * <p>
 * The job carries its own active deadline so a session still ends if the supervising
 * controller dies.
 */
@Component
public class RunnerJobFactory {

    private static final Logger log = LoggerFactory.getLogger(RunnerJobFactory.class);

    static final String CONTAINER_NAME = "ambient-code-runner";
    static final String WORKSPACE_CLAIM = "ambient-workspace";
    static final String WORKSPACE_MOUNT = "/workspace";
    static final String SCRATCH_MOUNT = "/tmp";
    static final String RUNNER_SECRETS_MOUNT = "/var/run/runner-secrets";

    private final AmbientProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public RunnerJobFactory(AmbientProperties properties) {
        this.properties = properties;
    }

    /**
     * Builds the job for {@code session}.
     *
     * @param runnerSecretName tenant runner secret to import, or {@code null}
     */
    public V1Job build(Session session, String runnerSecretName) {
        String name = session.name();
        String namespace = session.namespace();
        String jobName = Session.jobNameFor(name);
        AmbientProperties.Operator operator = properties.getOperator();

        Map<String, String> labels = Map.of(
                MetadataKeys.SESSION_LABEL, name,
                MetadataKeys.APP_LABEL, MetadataKeys.RUNNER_APP);

        List<V1Volume> volumes = new ArrayList<>();
        volumes.add(new V1Volume()
                .name("workspace")
                .persistentVolumeClaim(new V1PersistentVolumeClaimVolumeSource()
                        .claimName(WORKSPACE_CLAIM)
                        .readOnly(true)));
        volumes.add(new V1Volume()
                .name("scratch")
                .emptyDir(new V1EmptyDirVolumeSource()
                        .medium("Memory")
                        .sizeLimit(Quantity.fromString(operator.getScratchSize()))));

        List<V1VolumeMount> mounts = new ArrayList<>();
        mounts.add(new V1VolumeMount().name("workspace").mountPath(WORKSPACE_MOUNT).readOnly(true));
        mounts.add(new V1VolumeMount().name("scratch").mountPath(SCRATCH_MOUNT));

        V1Container container = new V1Container()
                .name(CONTAINER_NAME)
                .image(operator.getRunnerImage())
                .imagePullPolicy(operator.getImagePullPolicy())
                .securityContext(new V1SecurityContext()
                        .allowPrivilegeEscalation(false)
                        .readOnlyRootFilesystem(false)
                        .capabilities(new V1Capabilities().drop(List.of("ALL"))))
                .env(environment(session))
                .resources(resources(session.spec().resourceOverrides()));

        if (runnerSecretName != null && !runnerSecretName.isBlank()) {
            container.envFrom(List.of(new V1EnvFromSource()
                    .secretRef(new V1SecretEnvSource().name(runnerSecretName))));
            volumes.add(new V1Volume()
                    .name("runner-secrets")
                    .secret(new V1SecretVolumeSource().secretName(runnerSecretName)));
            mounts.add(new V1VolumeMount().name("runner-secrets").mountPath(RUNNER_SECRETS_MOUNT).readOnly(true));
        }
        container.volumeMounts(mounts);

        V1PodSpec podSpec = new V1PodSpec()
                .restartPolicy("Never")
                .affinity(contentServiceAffinity(namespace))
                .volumes(volumes)
                .containers(List.of(container));
        ResourceOverrides overrides = session.spec().resourceOverrides();
        if (overrides != null && notBlank(overrides.priorityClass())) {
            podSpec.priorityClassName(overrides.priorityClass());
        }

        return new V1Job()
                .metadata(new V1ObjectMeta()
                        .name(jobName)
                        .namespace(namespace)
                        .labels(labels)
                        .ownerReferences(OwnerReferences.controlledBy(ResourceKind.SESSION, session)))
                .spec(new V1JobSpec()
                        .backoffLimit(operator.getJobBackoffLimit())
                        .activeDeadlineSeconds(operator.getJobActiveDeadlineSeconds())
                        .template(new V1PodTemplateSpec()
                                .metadata(new V1ObjectMeta().labels(labels))
                                .spec(podSpec)));
    }

    /**
     * The runner's environment contract. Entries from {@code spec.environmentVariables} replace
     * base entries of the same name and are appended otherwise.
     */
    List<V1EnvVar> environment(Session session) {
        SessionSpec spec = session.spec();
        String name = session.name();
        String namespace = session.namespace();
        LlmSettings llm = spec.llmSettings() == null ? new LlmSettings(null, null, null) : spec.llmSettings();
        GitConfig git = spec.gitConfig();
        GitUser gitUser = git == null ? null : git.user();
        GitAuthentication gitAuth = git == null ? null : git.authentication();

        List<V1EnvVar> env = new ArrayList<>();
        env.add(value("DEBUG", "false"));
        env.add(value("INTERACTIVE", String.valueOf(spec.isInteractive())));
        env.add(value("AGENTIC_SESSION_NAME", name));
        env.add(value("AGENTIC_SESSION_NAMESPACE", namespace));
        env.add(value("PROMPT", nullToEmpty(spec.prompt())));
        env.add(value("LLM_MODEL", nullToEmpty(llm.model())));
        env.add(value("LLM_TEMPERATURE", String.format(Locale.ROOT, "%.2f",
                llm.temperature() == null ? 0.0 : llm.temperature())));
        env.add(value("LLM_MAX_TOKENS", String.valueOf(llm.maxTokens() == null ? 0 : llm.maxTokens())));
        env.add(value("TIMEOUT", String.valueOf(spec.timeout() == null ? 0 : spec.timeout())));
        env.add(value("BACKEND_API_URL", "http://backend-service.%s.svc.cluster.local:8080/api"
                .formatted(properties.getOperator().getBackendNamespace())));
        env.add(value("PVC_PROXY_API_URL", properties.getContent().serviceUrlFor(namespace)));
        env.add(value("WORKSPACE_STORE_PATH", SessionPaths.workspaceOf(spec.paths(), name)));
        env.add(value("MESSAGE_STORE_PATH", SessionPaths.messagesOf(spec.paths(), name)));
        env.add(value("GIT_USER_NAME", gitUser == null ? "" : nullToEmpty(gitUser.name())));
        env.add(value("GIT_USER_EMAIL", gitUser == null ? "" : nullToEmpty(gitUser.email())));
        env.add(value("GIT_SSH_KEY_SECRET", gitAuth == null ? "" : nullToEmpty(gitAuth.sshKeySecret())));
        env.add(value("GIT_TOKEN_SECRET", gitAuth == null ? "" : nullToEmpty(gitAuth.tokenSecret())));
        env.add(value("GIT_REPOSITORIES", repositoriesJson(git)));

        WorkflowRef workflow = spec.workflowRef();
        if (workflow != null && notBlank(workflow.name())) {
            env.add(value("WORKFLOW_NAME", workflow.name()));
            if (notBlank(workflow.phase())) {
                env.add(value("WORKFLOW_PHASE", workflow.phase()));
            }
        }

        String tokenSecret = session.metadata().annotation(MetadataKeys.RUNNER_TOKEN_SECRET_ANNOTATION);
        if (notBlank(tokenSecret)) {
            env.add(value("AUTH_MODE", "bot_token"));
            env.add(new V1EnvVar()
                    .name("BOT_TOKEN")
                    .valueFrom(new V1EnvVarSource().secretKeyRef(new V1SecretKeySelector()
                            .name(tokenSecret.trim())
                            .key(RunnerCredentials.TOKEN_KEY))));
        }

        if (spec.environmentVariables() != null) {
            Map<String, V1EnvVar> byName = new LinkedHashMap<>();
            env.forEach(e -> byName.put(e.getName(), e));
            spec.environmentVariables().forEach((key, val) -> byName.put(key, value(key, val)));
            return new ArrayList<>(byName.values());
        }
        return env;
    }

    String repositoriesJson(GitConfig git) {
        if (git == null || git.repositories() == null || git.repositories().isEmpty()) {
            return "[]";
        }
        try {
            return objectMapper.writeValueAsString(git.repositories());
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize git repositories: {}", e.getMessage());
            return "[]";
        }
    }

    private static V1ResourceRequirements resources(ResourceOverrides overrides) {
        V1ResourceRequirements requirements = new V1ResourceRequirements();
        if (overrides == null) {
            return requirements;
        }
        Map<String, Quantity> amounts = new LinkedHashMap<>();
        if (notBlank(overrides.cpu())) {
            amounts.put("cpu", Quantity.fromString(overrides.cpu()));
        }
        if (notBlank(overrides.memory())) {
            amounts.put("memory", Quantity.fromString(overrides.memory()));
        }
        if (!amounts.isEmpty()) {
            requirements.requests(amounts).limits(new LinkedHashMap<>(amounts));
        }
        return requirements;
    }

    /** Prefer the node running the tenant's content service, which holds the RWO workspace claim. */
    private static V1Affinity contentServiceAffinity(String namespace) {
        return new V1Affinity().podAffinity(new V1PodAffinity()
                .preferredDuringSchedulingIgnoredDuringExecution(List.of(new V1WeightedPodAffinityTerm()
                        .weight(100)
                        .podAffinityTerm(new V1PodAffinityTerm()
                                .labelSelector(new V1LabelSelector()
                                        .matchLabels(Map.of(MetadataKeys.APP_LABEL, MetadataKeys.CONTENT_APP)))
                                .namespaces(List.of(namespace))
                                .topologyKey("kubernetes.io/hostname")))));
    }

    private static V1EnvVar value(String name, String value) {
        return new V1EnvVar().name(name).value(value);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
