package com.ambient.core.operator;

import com.ambient.core.config.AmbientProperties;
import com.ambient.core.model.GitConfig;
import com.ambient.core.model.GitRepository;
import com.ambient.core.model.GitUser;
import com.ambient.core.model.LlmSettings;
import com.ambient.core.model.ResourceOverrides;
import com.ambient.core.model.Session;
import com.ambient.core.model.SessionPhase;
import com.ambient.core.model.SessionSpec;
import com.ambient.core.model.WorkflowRef;
import com.ambient.core.resource.MetadataKeys;
import com.ambient.support.Fixtures;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1Job;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RunnerJobFactoryTest {

    private AmbientProperties properties;
    private RunnerJobFactory factory;

    @BeforeEach
    void setUp() {
        properties = new AmbientProperties();
        properties.getOperator().setRunnerImage("runner:test");
        factory = new RunnerJobFactory(properties);
    }

    private static Session sessionWith(SessionSpec spec) {
        Session base = Fixtures.session("team-a", "s1", SessionPhase.PENDING);
        return base.withSpec(spec);
    }

    private static SessionSpec spec(GitConfig git, ResourceOverrides overrides, Map<String, String> env,
                                    WorkflowRef workflow) {
        return new SessionSpec("fix the build", null, null, true, new LlmSettings("sonnet", 0.7, 4000), 300,
                git, overrides, null, null, null, env, workflow);
    }

    private static Map<String, String> envOf(List<V1EnvVar> env) {
        return env.stream()
                .filter(e -> e.getValue() != null)
                .collect(Collectors.toMap(V1EnvVar::getName, V1EnvVar::getValue));
    }

    @Nested
    @DisplayName("job shape")
    class JobShape {

        @Test
        @DisplayName("names, labels and owns the job")
        void namesAndOwns() {
            V1Job job = factory.build(Fixtures.session("team-a", "s1", SessionPhase.PENDING), null);

            assertEquals("s1-job", job.getMetadata().getName());
            assertEquals("team-a", job.getMetadata().getNamespace());
            assertEquals("s1", job.getMetadata().getLabels().get(MetadataKeys.SESSION_LABEL));
            assertEquals(MetadataKeys.RUNNER_APP, job.getMetadata().getLabels().get(MetadataKeys.APP_LABEL));

            var owner = job.getMetadata().getOwnerReferences().get(0);
            assertEquals("AgenticSession", owner.getKind());
            assertEquals("s1", owner.getName());
            assertEquals("uid-s1", owner.getUid());
            assertTrue(owner.getController());
        }

        @Test
        @DisplayName("applies retry budget, deadline and never restarts pods")
        void retryBudget() {
            V1Job job = factory.build(Fixtures.session("team-a", "s1", SessionPhase.PENDING), null);

            assertEquals(3, job.getSpec().getBackoffLimit());
            assertEquals(1800L, job.getSpec().getActiveDeadlineSeconds());
            assertEquals("Never", job.getSpec().getTemplate().getSpec().getRestartPolicy());
        }

        @Test
        @DisplayName("mounts the workspace read-only and scratch in memory")
        void volumes() {
            V1Job job = factory.build(Fixtures.session("team-a", "s1", SessionPhase.PENDING), null);
            var pod = job.getSpec().getTemplate().getSpec();

            var workspace = pod.getVolumes().get(0);
            assertEquals("ambient-workspace", workspace.getPersistentVolumeClaim().getClaimName());
            assertTrue(workspace.getPersistentVolumeClaim().getReadOnly());
            var scratch = pod.getVolumes().get(1);
            assertEquals("Memory", scratch.getEmptyDir().getMedium());
            assertEquals(Quantity.fromString("1Gi"), scratch.getEmptyDir().getSizeLimit());

            V1Container container = pod.getContainers().get(0);
            assertEquals("runner:test", container.getImage());
            assertEquals("/workspace", container.getVolumeMounts().get(0).getMountPath());
            assertTrue(container.getVolumeMounts().get(0).getReadOnly());
            assertEquals("/tmp", container.getVolumeMounts().get(1).getMountPath());
        }

        @Test
        @DisplayName("runs without privilege escalation and with all capabilities dropped")
        void securityProfile() {
            V1Job job = factory.build(Fixtures.session("team-a", "s1", SessionPhase.PENDING), null);
            var security = job.getSpec().getTemplate().getSpec().getContainers().get(0).getSecurityContext();

            assertFalse(security.getAllowPrivilegeEscalation());
            assertFalse(security.getReadOnlyRootFilesystem());
            assertEquals(List.of("ALL"), security.getCapabilities().getDrop());
        }

        @Test
        @DisplayName("prefers the node of the tenant's content service")
        void affinity() {
            V1Job job = factory.build(Fixtures.session("team-a", "s1", SessionPhase.PENDING), null);
            var term = job.getSpec().getTemplate().getSpec().getAffinity().getPodAffinity()
                    .getPreferredDuringSchedulingIgnoredDuringExecution().get(0);

            assertEquals(100, term.getWeight());
            assertEquals("kubernetes.io/hostname", term.getPodAffinityTerm().getTopologyKey());
            assertEquals(Map.of("app", "ambient-content"),
                    term.getPodAffinityTerm().getLabelSelector().getMatchLabels());
        }

        @Test
        @DisplayName("imports the tenant runner secret as env and as a file mount")
        void runnerSecret() {
            V1Job job = factory.build(Fixtures.session("team-a", "s1", SessionPhase.PENDING), "runner-secrets");
            var pod = job.getSpec().getTemplate().getSpec();
            V1Container container = pod.getContainers().get(0);

            assertEquals("runner-secrets", container.getEnvFrom().get(0).getSecretRef().getName());
            assertTrue(pod.getVolumes().stream()
                    .anyMatch(v -> v.getSecret() != null && "runner-secrets".equals(v.getSecret().getSecretName())));
            assertTrue(container.getVolumeMounts().stream()
                    .anyMatch(m -> "/var/run/runner-secrets".equals(m.getMountPath())));
        }

        @Test
        @DisplayName("without a runner secret nothing is imported")
        void noRunnerSecret() {
            V1Job job = factory.build(Fixtures.session("team-a", "s1", SessionPhase.PENDING), null);
            assertNull(job.getSpec().getTemplate().getSpec().getContainers().get(0).getEnvFrom());
        }

        @Test
        @DisplayName("applies cpu, memory and priority class overrides")
        void overrides() {
            Session session = sessionWith(spec(null, new ResourceOverrides("2", "4Gi", "fast", "high"), null, null));
            V1Job job = factory.build(session, null);
            var pod = job.getSpec().getTemplate().getSpec();
            var resources = pod.getContainers().get(0).getResources();

            assertEquals(Quantity.fromString("2"), resources.getRequests().get("cpu"));
            assertEquals(Quantity.fromString("4Gi"), resources.getLimits().get("memory"));
            assertEquals("high", pod.getPriorityClassName());
        }
    }

    @Nested
    @DisplayName("runner environment")
    class Environment {

        @Test
        @DisplayName("carries identity, prompt and model settings")
        void basics() {
            Map<String, String> env = envOf(factory.environment(sessionWith(spec(null, null, null, null))));

            assertEquals("s1", env.get("AGENTIC_SESSION_NAME"));
            assertEquals("team-a", env.get("AGENTIC_SESSION_NAMESPACE"));
            assertEquals("fix the build", env.get("PROMPT"));
            assertEquals("true", env.get("INTERACTIVE"));
            assertEquals("sonnet", env.get("LLM_MODEL"));
            assertEquals("0.70", env.get("LLM_TEMPERATURE"));
            assertEquals("4000", env.get("LLM_MAX_TOKENS"));
            assertEquals("300", env.get("TIMEOUT"));
            assertEquals("http://ambient-content.team-a.svc:8080", env.get("PVC_PROXY_API_URL"));
            assertEquals("/sessions/s1/workspace", env.get("WORKSPACE_STORE_PATH"));
            assertEquals("/sessions/s1/messages.json", env.get("MESSAGE_STORE_PATH"));
            assertEquals("[]", env.get("GIT_REPOSITORIES"));
        }

        @Test
        @DisplayName("serializes repositories and git identity")
        void repositories() {
            GitConfig git = new GitConfig(new GitUser("Dev", "dev@example.com"), null,
                    List.of(new GitRepository("https://github.com/org/repo.git", "main")));
            Map<String, String> env = envOf(factory.environment(sessionWith(spec(git, null, null, null))));

            assertEquals("Dev", env.get("GIT_USER_NAME"));
            assertEquals("dev@example.com", env.get("GIT_USER_EMAIL"));
            assertEquals("[{\"url\":\"https://github.com/org/repo.git\",\"branch\":\"main\"}]",
                    env.get("GIT_REPOSITORIES"));
        }

        @Test
        @DisplayName("names the workflow and phase when the session belongs to one")
        void workflow() {
            Map<String, String> env = envOf(factory.environment(
                    sessionWith(spec(null, null, null, new WorkflowRef("wf-1", "specify")))));

            assertEquals("wf-1", env.get("WORKFLOW_NAME"));
            assertEquals("specify", env.get("WORKFLOW_PHASE"));
        }

        @Test
        @DisplayName("reads the bot token from the provisioned secret")
        void botToken() {
            Session base = sessionWith(spec(null, null, null, null));
            Session session = base.withMetadata(base.metadata()
                    .withAnnotation(MetadataKeys.RUNNER_TOKEN_SECRET_ANNOTATION, "ambient-runner-token-s1"));

            List<V1EnvVar> env = factory.environment(session);

            assertEquals("bot_token", envOf(env).get("AUTH_MODE"));
            V1EnvVar token = env.stream().filter(e -> "BOT_TOKEN".equals(e.getName())).findFirst().orElseThrow();
            assertEquals("ambient-runner-token-s1", token.getValueFrom().getSecretKeyRef().getName());
            assertEquals("token", token.getValueFrom().getSecretKeyRef().getKey());
        }

        @Test
        @DisplayName("caller variables replace base entries of the same name")
        void overridesBaseEntries() {
            List<V1EnvVar> env = factory.environment(sessionWith(spec(null, null,
                    Map.of("DEBUG", "true", "EXTRA", "1"), null)));

            assertEquals("true", envOf(env).get("DEBUG"));
            assertEquals("1", envOf(env).get("EXTRA"));
            assertEquals(1, env.stream().filter(e -> "DEBUG".equals(e.getName())).count());
            assertEquals("DEBUG", env.get(0).getName());
        }
    }
}
