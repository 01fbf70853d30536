package com.ambient.core.session;

import com.ambient.core.agents.PersonaSeeder;
import com.ambient.core.cluster.AlreadyExistsException;
import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.ClusterException;
import com.ambient.core.cluster.ConflictException;
import com.ambient.core.cluster.NamespaceGateway;
import com.ambient.core.cluster.NotFoundException;
import com.ambient.core.config.AmbientProperties;
import com.ambient.core.content.ContentServiceClient;
import com.ambient.core.credentials.SessionCredentialProvisioner;
import com.ambient.core.logging.MdcContext;
import com.ambient.core.metrics.AmbientMetrics;
import com.ambient.core.model.GitConfig;
import com.ambient.core.model.InvalidRequestException;
import com.ambient.core.model.LlmSettings;
import com.ambient.core.model.ResourceMeta;
import com.ambient.core.model.ResourceOverrides;
import com.ambient.core.model.Session;
import com.ambient.core.model.SessionPaths;
import com.ambient.core.model.SessionPhase;
import com.ambient.core.model.SessionSpec;
import com.ambient.core.model.SessionStatus;
import com.ambient.core.model.UserContext;
import com.ambient.core.model.WorkflowRef;
import com.ambient.core.security.CallerContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.custom.QuantityFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Session lifecycle operations. Every method acts through the caller's own
 * {@link ClusterClients}; nothing here falls back to a service identity.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    static final String NAME_PREFIX = "agentic-session-";

    private final AmbientProperties properties;
    private final GitConfigResolver gitConfigResolver;
    private final SessionCredentialProvisioner provisioner;
    private final PersonaSeeder personaSeeder;
    private final SessionStatusWriter statusWriter;
    private final ContentServiceClient content;
    private final AmbientMetrics metrics;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SessionService(AmbientProperties properties,
                          GitConfigResolver gitConfigResolver,
                          SessionCredentialProvisioner provisioner,
                          PersonaSeeder personaSeeder,
                          SessionStatusWriter statusWriter,
                          ContentServiceClient content,
                          AmbientMetrics metrics,
                          Clock clock) {
        this.properties = properties;
        this.gitConfigResolver = gitConfigResolver;
        this.provisioner = provisioner;
        this.personaSeeder = personaSeeder;
        this.statusWriter = statusWriter;
        this.content = content;
        this.metrics = metrics;
        this.clock = clock;
    }

    public List<Session> list(ClusterClients clients, String namespace) {
        return clients.sessions().list(namespace);
    }

    public Session get(ClusterClients clients, String namespace, String name) {
        return clients.sessions().get(namespace, name);
    }

    /**
     * Creates a session in {@code Pending}, then seeds requested personas into its workspace and
     * provisions its runner identity. The last two steps are best-effort.
     */
    public Session create(ClusterClients clients, CallerContext caller, String namespace, SessionRequest request) {
        if (request == null || request.prompt() == null || request.prompt().isBlank()) {
            throw new InvalidRequestException("prompt is required");
        }
        validateWorkflowRef(clients, namespace, request.workflowRef());
        validateResourceOverrides(request.resourceOverrides());

        String name = NAME_PREFIX + clock.instant().getEpochSecond();
        MdcContext.setSession(namespace, name);
        try {
            LlmSettings llm = request.llmSettings() == null
                    ? defaultLlmSettings() : request.llmSettings().withDefaults(defaultLlmSettings());
            int timeout = request.timeout() != null
                    ? request.timeout() : properties.getSessions().getDefaultTimeoutSeconds();

            GitConfig defaults = gitConfigResolver.tenantDefaults(clients, namespace).orElse(null);
            GitConfig git = request.gitConfig() == null ? defaults : request.gitConfig().mergedOver(defaults);
            if (git != null && git.isEmpty()) {
                git = null;
            }

            SessionPaths paths = request.workspacePath() == null || request.workspacePath().isBlank()
                    ? null : new SessionPaths(request.workspacePath().trim(), null, null);

            var spec = new SessionSpec(
                    request.prompt(),
                    request.displayName(),
                    namespace,
                    request.interactive(),
                    llm,
                    timeout,
                    git,
                    request.resourceOverrides(),
                    userContext(request, caller),
                    request.botAccount(),
                    paths,
                    request.environmentVariables() == null || request.environmentVariables().isEmpty()
                            ? null : request.environmentVariables(),
                    request.workflowRef());
            var meta = new ResourceMeta(name, namespace, null, null, null,
                    orEmpty(request.labels()), orEmpty(request.annotations()));

            Session created = clients.sessions().create(namespace,
                    Session.of(meta, spec, SessionStatus.phase(SessionPhase.PENDING, null)));
            metrics.recordSessionCreated();
            log.info("Created session {}/{}", namespace, name);

            List<String> personas = PersonaSeeder.requestedPersonas(request.environmentVariables());
            if (!personas.isEmpty()) {
                personaSeeder.seed(namespace, caller.token(), SessionPaths.workspaceOf(paths, name), personas);
            }
            provisioner.provision(clients, namespace, name);
            return created;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Replaces prompt and display name, and model settings and timeout when given. The read is
     * retried briefly on not-found so an update racing a fresh create still lands.
     */
    public Session update(ClusterClients clients, String namespace, String name, SessionRequest request) {
        if (request == null) {
            throw new InvalidRequestException("request body is required");
        }
        Session current = findWithRetry(clients, namespace, name);
        SessionSpec spec = current.spec() == null ? emptySpec(namespace) : current.spec();
        spec = spec.withPrompt(request.prompt()).withDisplayName(request.displayName());
        if (request.llmSettings() != null) {
            LlmSettings given = request.llmSettings();
            spec = spec.withLlmSettings(new LlmSettings(
                    given.model() == null || given.model().isEmpty() ? null : given.model(),
                    given.temperature() == null || given.temperature() == 0 ? null : given.temperature(),
                    given.maxTokens() == null || given.maxTokens() == 0 ? null : given.maxTokens()));
        }
        if (request.timeout() != null) {
            spec = spec.withTimeout(request.timeout());
        }
        return clients.sessions().replace(current.withSpec(spec));
    }

    public Session updateDisplayName(ClusterClients clients, String namespace, String name, String displayName) {
        if (displayName == null || displayName.isBlank()) {
            throw new InvalidRequestException("displayName is required");
        }
        Session current = clients.sessions().get(namespace, name);
        SessionSpec spec = current.spec() == null ? emptySpec(namespace) : current.spec();
        return clients.sessions().replace(current.withSpec(spec.withDisplayName(displayName)));
    }

    /**
     * Deletes the session. Its runner identity, role, binding, token secret and job are owned
     * by it and removed by the cluster's garbage collector.
     */
    public void delete(ClusterClients clients, String namespace, String name) {
        clients.sessions().delete(namespace, name);
        log.info("Deleted session {}/{}", namespace, name);
    }

    /**
     * Copies the spec of {@code name} into {@code targetProject}. A taken name is retried as
     * {@code {name}-duplicate}, then {@code {name}-duplicate-2} and so on, up to the configured
     * attempt cap; the copy's display name is then marked as a duplicate.
     *
     * @throws NotFoundException      if the source or the target tenant does not exist, or the
     *                                target is not a managed tenant
     * @throws AlreadyExistsException if every candidate name is taken
     */
    public Session clone(ClusterClients clients, String namespace, String name,
                         String targetProject, String newSessionName) {
        if (targetProject == null || targetProject.isBlank()) {
            throw new InvalidRequestException("targetProject is required");
        }
        Session source = clients.sessions().get(namespace, name);
        boolean managed = clients.namespaces().find(targetProject)
                .map(NamespaceGateway::hasManagedMarker)
                .orElse(false);
        if (!managed) {
            throw new NotFoundException("Target project not found");
        }

        String baseName = newSessionName == null || newSessionName.isBlank() ? name : newSessionName.trim();
        int cap = properties.getSessions().getDuplicateNameAttempts();
        SessionSpec sourceSpec = source.spec() == null ? emptySpec(namespace) : source.spec();
        if (!targetProject.equals(namespace)) {
            // workflow references are namespace-local
            sourceSpec = sourceSpec.withWorkflowRef(null);
        }

        for (int attempt = 0; attempt < cap; attempt++) {
            String candidate = duplicateName(baseName, attempt);
            SessionSpec spec = sourceSpec.withProject(targetProject);
            if (attempt > 0) {
                String shown = spec.displayName() != null && !spec.displayName().isBlank()
                        ? spec.displayName() : candidate;
                spec = spec.withDisplayName(shown + " (Duplicate)");
            }
            Session copy = Session.of(ResourceMeta.named(targetProject, candidate), spec,
                    SessionStatus.phase(SessionPhase.PENDING, null));
            try {
                Session created = clients.sessions().create(targetProject, copy);
                metrics.recordSessionCreated();
                log.info("Cloned session {}/{} to {}/{}", namespace, name, targetProject, candidate);
                provisioner.provision(clients, targetProject, candidate);
                return created;
            } catch (AlreadyExistsException e) {
                log.debug("Clone name {}/{} taken", targetProject, candidate);
            }
        }
        throw new AlreadyExistsException("No free session name for %s in %s after %d attempts"
                .formatted(baseName, targetProject, cap));
    }

    static String duplicateName(String baseName, int attempt) {
        if (attempt == 0) {
            return baseName;
        }
        if (attempt == 1) {
            return baseName + "-duplicate";
        }
        return baseName + "-duplicate-" + attempt;
    }

    /**
     * Moves the session back to {@code Creating} for an externally triggered restart.
     *
     * @throws SessionStateException if the session is currently running or being created
     */
    public Session start(ClusterClients clients, String namespace, String name) {
        return statusWriter.transition(clients.sessions(), namespace, name, SessionPhase.CREATING,
                        "Session start requested", status -> status.withStartTime(now()))
                .orElseThrow(() -> new NotFoundException("Session not found"));
    }

    /**
     * Deletes the session's job if present and sets {@code Stopped}.
     *
     * @return the stopped session, or empty if it was deleted while stopping
     * @throws SessionStateException if the session is already terminal; nothing is changed
     */
    public Optional<Session> stop(ClusterClients clients, String namespace, String name) {
        Session current = clients.sessions().get(namespace, name);
        SessionPhase phase = SessionStatusWriter.effectivePhase(current);
        if (phase.isTerminal()) {
            throw new SessionStateException("Cannot stop session in %s state".formatted(phase),
                    phase, SessionPhase.STOPPED);
        }
        log.info("Stopping session {}/{} (current phase: {})", namespace, name, phase);

        String jobName = current.status() != null && current.status().jobName() != null
                ? current.status().jobName() : Session.jobNameFor(name);
        try {
            clients.workloads().deleteJob(namespace, jobName);
            log.info("Deleted job {} for session {}/{}", jobName, namespace, name);
        } catch (NotFoundException e) {
            log.debug("No job {} to delete for session {}/{}", jobName, namespace, name);
        } catch (ClusterException e) {
            log.warn("Failed to delete job {} for session {}/{}, continuing with status update: {}",
                    jobName, namespace, name, e.getMessage());
        }

        return statusWriter.transition(clients.sessions(), namespace, name, SessionPhase.STOPPED,
                "Session stopped by user", status -> status.withCompletionTime(now()));
    }

    /**
     * Merges a workload's result summary into the status.
     *
     * @throws InvalidRequestException if the report names an unknown phase
     */
    public Session reportStatus(ClusterClients clients, String namespace, String name, StatusReport report) {
        SessionStatus update;
        try {
            update = report.toStatus();
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage());
        }
        return statusWriter.report(clients.sessions(), namespace, name, update)
                .orElseThrow(() -> new NotFoundException("Session not found"));
    }

    /** Raw {@code messages.json} of the session. */
    public byte[] readMessages(ClusterClients clients, CallerContext caller, String namespace, String name) {
        Session session = clients.sessions().get(namespace, name);
        String path = SessionPaths.messagesOf(pathsOf(session), name);
        return content.read(namespace, caller.token(), path);
    }

    /** Appends a user message line to the session's {@code inbox.jsonl}. */
    public void appendInbox(ClusterClients clients, CallerContext caller, String namespace, String name,
                            String message) {
        if (message == null || message.isBlank()) {
            throw new InvalidRequestException("content is required");
        }
        Session session = clients.sessions().get(namespace, name);
        String path = SessionPaths.inboxOf(pathsOf(session), name);

        String existing = "";
        try {
            existing = new String(content.read(namespace, caller.token(), path), StandardCharsets.UTF_8);
        } catch (NotFoundException e) {
            log.debug("Starting new inbox at {}", path);
        }
        if (!existing.isEmpty() && !existing.endsWith("\n")) {
            existing += "\n";
        }
        ObjectNode entry = objectMapper.createObjectNode();
        entry.put("type", "user_message");
        entry.put("content", message);
        entry.put("timestamp", now());
        try {
            content.write(namespace, caller.token(), path,
                    existing + objectMapper.writeValueAsString(entry) + "\n");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize inbox entry", e);
        }
    }

    /** Absolute workspace root of a session. */
    public String workspaceRoot(ClusterClients clients, String namespace, String name) {
        Session session = clients.sessions().get(namespace, name);
        return SessionPaths.workspaceOf(pathsOf(session), name);
    }

    /**
     * Sets or clears the session's workflow reference. A non-null reference must point at an
     * existing workflow in the same namespace.
     */
    public Session setWorkflowRef(ClusterClients clients, String namespace, String name, WorkflowRef ref) {
        validateWorkflowRef(clients, namespace, ref);
        for (int attempt = 1; ; attempt++) {
            Session current = clients.sessions().get(namespace, name);
            SessionSpec spec = current.spec() == null ? emptySpec(namespace) : current.spec();
            try {
                return clients.sessions().replace(current.withSpec(spec.withWorkflowRef(ref)));
            } catch (ConflictException e) {
                if (attempt >= SessionStatusWriter.CONFLICT_ATTEMPTS) {
                    throw e;
                }
            }
        }
    }

    static void validateResourceOverrides(ResourceOverrides overrides) {
        if (overrides == null) {
            return;
        }
        validateQuantity("resourceOverrides.cpu", overrides.cpu());
        validateQuantity("resourceOverrides.memory", overrides.memory());
    }

    private static void validateQuantity(String field, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        try {
            Quantity.fromString(value);
        } catch (QuantityFormatException e) {
            throw new InvalidRequestException(field + " is not a valid quantity: " + value);
        }
    }

    void validateWorkflowRef(ClusterClients clients, String namespace, WorkflowRef ref) {
        if (ref == null) {
            return;
        }
        if (ref.name() == null || ref.name().isBlank()) {
            throw new InvalidRequestException("workflowRef.name is required");
        }
        if (clients.workflows().find(namespace, ref.name()).isEmpty()) {
            throw new InvalidRequestException("workflow " + ref.name() + " does not exist in " + namespace);
        }
    }

    private Session findWithRetry(ClusterClients clients, String namespace, String name) {
        int attempts = Math.max(1, properties.getSessions().getUpdateRetryAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            Optional<Session> found = clients.sessions().find(namespace, name);
            if (found.isPresent()) {
                return found.get();
            }
            if (attempt < attempts) {
                sleep(properties.getSessions().getUpdateRetryDelayMs());
            }
        }
        throw new NotFoundException("Session not found");
    }

    private LlmSettings defaultLlmSettings() {
        var sessions = properties.getSessions();
        return new LlmSettings(sessions.getDefaultModel(), sessions.getDefaultTemperature(),
                sessions.getDefaultMaxTokens());
    }

    private static UserContext userContext(SessionRequest request, CallerContext caller) {
        if (request.userContext() != null) {
            return request.userContext();
        }
        if (caller != null && caller.userId() != null && !caller.userId().isBlank()) {
            return new UserContext(caller.userId(), caller.displayName(), caller.groups());
        }
        return null;
    }

    private static SessionPaths pathsOf(Session session) {
        return session.spec() == null ? null : session.spec().paths();
    }

    private static SessionSpec emptySpec(String namespace) {
        return new SessionSpec(null, null, namespace, null, null, null, null, null, null, null, null, null, null);
    }

    private static Map<String, String> orEmpty(Map<String, String> map) {
        return map == null ? Map.of() : map;
    }

    private String now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString();
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for session to become visible", e);
        }
    }
}
