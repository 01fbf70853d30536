package com.ambient.core.workflow;

import com.ambient.core.agents.AgentCatalog;
import com.ambient.core.agents.AgentSummary;
import com.ambient.core.agents.PersonaSeeder;
import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.NotFoundException;
import com.ambient.core.content.ContentEntry;
import com.ambient.core.content.ContentServiceClient;
import com.ambient.core.content.ContentServiceException;
import com.ambient.core.content.WorkspaceBrowser;
import com.ambient.core.content.WorkspaceView;
import com.ambient.core.logging.MdcContext;
import com.ambient.core.model.GitRepository;
import com.ambient.core.model.InvalidRequestException;
import com.ambient.core.model.ResourceMeta;
import com.ambient.core.model.Session;
import com.ambient.core.model.SessionPhase;
import com.ambient.core.model.Workflow;
import com.ambient.core.model.WorkflowPhase;
import com.ambient.core.model.WorkflowRef;
import com.ambient.core.security.CallerContext;
import com.ambient.core.session.SessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Workflows group sessions around one shared workspace. The workflow object only holds
 * intent; its phase and status are derived on read from the workspace and linked sessions.
 */
@Service
public class WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    static final String ID_PREFIX = "rfe-";

    private static final Set<SessionPhase> ACTIVE = Set.of(SessionPhase.PENDING, SessionPhase.CREATING,
            SessionPhase.RUNNING);
    private static final Set<SessionPhase> FAILED = Set.of(SessionPhase.FAILED, SessionPhase.ERROR);

    private final SessionService sessions;
    private final ContentServiceClient content;
    private final WorkspaceBrowser workspace;
    private final AgentCatalog catalog;
    private final PersonaSeeder personaSeeder;
    private final Clock clock;

    public WorkflowService(SessionService sessions,
                           ContentServiceClient content,
                           WorkspaceBrowser workspace,
                           AgentCatalog catalog,
                           PersonaSeeder personaSeeder,
                           Clock clock) {
        this.sessions = sessions;
        this.content = content;
        this.workspace = workspace;
        this.catalog = catalog;
        this.personaSeeder = personaSeeder;
        this.clock = clock;
    }

    public List<Workflow> list(ClusterClients clients, String namespace) {
        return clients.workflows().list(namespace);
    }

    public Workflow get(ClusterClients clients, String namespace, String id) {
        return clients.workflows().get(namespace, id);
    }

    /**
     * Creates the workflow and lays out its workspace: persona files under
     * {@code .claude/agents} and an empty marker in each repository's clone directory.
     * Workspace seeding is best-effort.
     */
    public Workflow create(ClusterClients clients, CallerContext caller, String namespace, WorkflowRequest request) {
        if (request == null || request.title() == null || request.title().isBlank()) {
            throw new InvalidRequestException("title is required");
        }
        String id = ID_PREFIX + clock.instant().getEpochSecond();
        MdcContext.setWorkflow(namespace, id);
        try {
            var spec = new Workflow.Spec(request.title().trim(), request.description(), namespace,
                    blankToNull(request.workspacePath()), request.repositories(), null);
            Workflow created = clients.workflows().create(namespace, Workflow.of(ResourceMeta.named(namespace, id), spec));
            log.info("Created workflow {}/{}", namespace, id);

            seedWorkspace(namespace, caller.token(), created);
            return created;
        } finally {
            MdcContext.clear();
        }
    }

    public void delete(ClusterClients clients, String namespace, String id) {
        clients.workflows().delete(namespace, id);
        log.info("Deleted workflow {}/{}", namespace, id);
    }

    /**
     * Derives phase, status and progress. Artifacts are looked up in {@code specs/} and, when
     * none are there, in its first sub-directory.
     */
    public WorkflowSummary summary(ClusterClients clients, CallerContext caller, String namespace, String id) {
        Workflow workflow = clients.workflows().get(namespace, id);
        WorkflowSummary.Files files = scanArtifacts(namespace, caller.token(), workflow.workspaceRoot() + "/specs");

        boolean anyActive = false;
        boolean anyFailed = false;
        for (Session session : linkedSessions(clients, namespace, id)) {
            SessionPhase phase = session.phase();
            anyActive |= phase != null && ACTIVE.contains(phase);
            anyFailed |= phase != null && FAILED.contains(phase);
        }
        return new WorkflowSummary(
                WorkflowPhase.derive(files.spec(), files.plan(), files.tasks()),
                deriveStatus(files, anyActive, anyFailed),
                files.count() / 3.0 * 100.0,
                files);
    }

    static String deriveStatus(WorkflowSummary.Files files, boolean anyActive, boolean anyFailed) {
        String status = "not started";
        if (anyActive) {
            status = "running";
        } else if (files.any()) {
            status = "in progress";
        }
        if (files.all() && !anyActive) {
            status = "completed";
        }
        if (anyFailed && !anyActive) {
            status = "attention";
        }
        return status;
    }

    /** Sessions whose workflow reference names this workflow. */
    public List<Session> linkedSessions(ClusterClients clients, String namespace, String id) {
        return clients.sessions().list(namespace).stream()
                .filter(s -> s.spec() != null && s.spec().workflowRef() != null
                        && id.equals(s.spec().workflowRef().name()))
                .toList();
    }

    public Session link(ClusterClients clients, String namespace, String id, String sessionName, String phase) {
        if (sessionName == null || sessionName.isBlank()) {
            throw new InvalidRequestException("existingName is required");
        }
        clients.workflows().get(namespace, id);
        Session linked = sessions.setWorkflowRef(clients, namespace, sessionName.trim(),
                new WorkflowRef(id, blankToNull(phase)));
        log.info("Linked session {}/{} to workflow {}", namespace, sessionName, id);
        return linked;
    }

    /**
     * Clears the session's workflow reference.
     *
     * @throws NotFoundException if the session is not linked to this workflow
     */
    public Session unlink(ClusterClients clients, String namespace, String id, String sessionName) {
        Session session = clients.sessions().get(namespace, sessionName);
        WorkflowRef ref = session.spec() == null ? null : session.spec().workflowRef();
        if (ref == null || !id.equals(ref.name())) {
            throw new NotFoundException("Session " + sessionName + " is not linked to " + id);
        }
        Session unlinked = sessions.setWorkflowRef(clients, namespace, sessionName, null);
        log.info("Unlinked session {}/{} from workflow {}", namespace, sessionName, id);
        return unlinked;
    }

    public WorkspaceView openWorkspace(ClusterClients clients, CallerContext caller, String namespace, String id,
                                       String path) {
        Workflow workflow = clients.workflows().get(namespace, id);
        return workspace.open(namespace, caller.token(), workflow.workspaceRoot(), path);
    }

    public void writeWorkspace(ClusterClients clients, CallerContext caller, String namespace, String id,
                               String path, byte[] data) {
        Workflow workflow = clients.workflows().get(namespace, id);
        workspace.write(namespace, caller.token(), workflow.workspaceRoot(), path, data);
    }

    private void seedWorkspace(String namespace, String token, Workflow workflow) {
        String root = workflow.workspaceRoot();
        try {
            List<String> personas = catalog.summaries().stream().map(AgentSummary::persona).toList();
            personaSeeder.seed(namespace, token, root, personas);
        } catch (RuntimeException e) {
            log.warn("Persona seeding skipped for workflow {}/{}: {}", namespace, workflow.name(), e.getMessage());
        }
        List<GitRepository> repositories = workflow.spec() == null || workflow.spec().repositories() == null
                ? List.of() : workflow.spec().repositories();
        for (GitRepository repository : repositories) {
            String marker = WorkspaceBrowser.resolveUnder(root, repository.cloneDirectory()) + "/.keep";
            try {
                content.write(namespace, token, marker, new byte[0]);
            } catch (RuntimeException e) {
                log.warn("Failed to create {} for workflow {}/{}: {}", marker, namespace, workflow.name(),
                        e.getMessage());
            }
        }
    }

    private WorkflowSummary.Files scanArtifacts(String namespace, String token, String specsPath) {
        List<ContentEntry> items = listQuietly(namespace, token, specsPath);
        WorkflowSummary.Files found = scan(items);
        if (!found.any()) {
            for (ContentEntry item : items) {
                if (item.isDir()) {
                    found = scan(listQuietly(namespace, token, specsPath + "/" + item.name()));
                    break;
                }
            }
        }
        return found;
    }

    private static WorkflowSummary.Files scan(List<ContentEntry> items) {
        boolean spec = false;
        boolean plan = false;
        boolean tasks = false;
        for (ContentEntry item : items) {
            if (item.isDir()) {
                continue;
            }
            switch (item.name().toLowerCase(Locale.ROOT)) {
                case "spec.md" -> spec = true;
                case "plan.md" -> plan = true;
                case "tasks.md" -> tasks = true;
                default -> { }
            }
        }
        return new WorkflowSummary.Files(spec, plan, tasks);
    }

    private List<ContentEntry> listQuietly(String namespace, String token, String path) {
        try {
            return content.list(namespace, token, path);
        } catch (NotFoundException e) {
            return List.of();
        } catch (ContentServiceException e) {
            log.warn("Cannot list {} in {}: {}", path, namespace, e.getMessage());
            return List.of();
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
