package com.ambient.dispatch.api;

import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.content.WorkspaceBrowser;
import com.ambient.core.content.WorkspaceView;
import com.ambient.core.model.Session;
import com.ambient.core.security.CallerContext;
import com.ambient.core.session.SessionRequest;
import com.ambient.core.session.SessionService;
import com.ambient.core.session.StatusReport;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Session lifecycle, messages and workspace. {@code /sessions} is an alias of
 * {@code /agentic-sessions}.
 */
@RestController
@RequestMapping({"/api/projects/{projectName}/agentic-sessions", "/api/projects/{projectName}/sessions"})
@ConditionalOnProperty(name = "ambient.mode", havingValue = "serve", matchIfMissing = true)
public class SessionController {

    private final SessionService sessions;
    private final WorkspaceBrowser workspace;

    public SessionController(SessionService sessions, WorkspaceBrowser workspace) {
        this.sessions = sessions;
        this.workspace = workspace;
    }

    @GetMapping
    public Map<String, List<Session>> list(@PathVariable String projectName,
                                           @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return Map.of("items", sessions.list(clients, projectName));
    }

    @PostMapping
    public ResponseEntity<Map<String, String>> create(@PathVariable String projectName,
                                                      @RequestBody SessionRequest request,
                                                      @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients,
                                                      @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
        Session created = sessions.create(clients, caller, projectName, request);
        Map<String, String> body = new LinkedHashMap<>();
        body.put("message", "Agentic session created successfully");
        body.put("name", created.name());
        body.put("uid", created.metadata() == null ? null : created.metadata().uid());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @GetMapping("/{sessionName}")
    public Session get(@PathVariable String projectName, @PathVariable String sessionName,
                       @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return sessions.get(clients, projectName, sessionName);
    }

    @PutMapping("/{sessionName}")
    public Session update(@PathVariable String projectName, @PathVariable String sessionName,
                          @RequestBody SessionRequest request,
                          @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return sessions.update(clients, projectName, sessionName, request);
    }

    @PutMapping("/{sessionName}/displayname")
    public Session rename(@PathVariable String projectName, @PathVariable String sessionName,
                          @RequestBody Map<String, String> body,
                          @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return sessions.updateDisplayName(clients, projectName, sessionName, body.get("displayName"));
    }

    @DeleteMapping("/{sessionName}")
    public ResponseEntity<Void> delete(@PathVariable String projectName, @PathVariable String sessionName,
                                       @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        sessions.delete(clients, projectName, sessionName);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{sessionName}/clone")
    public ResponseEntity<Session> cloneSession(@PathVariable String projectName, @PathVariable String sessionName,
                                                @RequestBody CloneRequest request,
                                                @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        Session copy = sessions.clone(clients, projectName, sessionName,
                request.targetProject(), request.newSessionName());
        return ResponseEntity.status(HttpStatus.CREATED).body(copy);
    }

    @PostMapping("/{sessionName}/start")
    public ResponseEntity<Session> start(@PathVariable String projectName, @PathVariable String sessionName,
                                         @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return ResponseEntity.accepted().body(sessions.start(clients, projectName, sessionName));
    }

    @PostMapping("/{sessionName}/stop")
    public ResponseEntity<?> stop(@PathVariable String projectName, @PathVariable String sessionName,
                                  @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        Optional<Session> stopped = sessions.stop(clients, projectName, sessionName);
        if (stopped.isEmpty()) {
            return ResponseEntity.accepted().body(Map.of("message", "Session was deleted while stopping"));
        }
        return ResponseEntity.accepted().body(stopped.get());
    }

    @PutMapping("/{sessionName}/status")
    public Map<String, String> reportStatus(@PathVariable String projectName, @PathVariable String sessionName,
                                            @RequestBody StatusReport report,
                                            @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        sessions.reportStatus(clients, projectName, sessionName, report);
        return Map.of("message", "Agentic session status updated");
    }

    @GetMapping(value = "/{sessionName}/messages", produces = MediaType.APPLICATION_JSON_VALUE)
    public byte[] messages(@PathVariable String projectName, @PathVariable String sessionName,
                           @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients,
                           @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
        return sessions.readMessages(clients, caller, projectName, sessionName);
    }

    @PostMapping("/{sessionName}/messages")
    public ResponseEntity<Map<String, String>> postMessage(@PathVariable String projectName,
                                                           @PathVariable String sessionName,
                                                           @RequestBody Map<String, String> body,
                                                           @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients,
                                                           @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
        sessions.appendInbox(clients, caller, projectName, sessionName, body.get("content"));
        return ResponseEntity.accepted().body(Map.of("message", "Message queued"));
    }

    @GetMapping({"/{sessionName}/workspace", "/{sessionName}/workspace/**"})
    public ResponseEntity<?> readWorkspace(@PathVariable String projectName, @PathVariable String sessionName,
                                           HttpServletRequest request,
                                           @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients,
                                           @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
        String root = sessions.workspaceRoot(clients, projectName, sessionName);
        WorkspaceView view = workspace.open(projectName, caller.token(), root,
                WorkspacePaths.remainder(request, "/" + sessionName + "/workspace"));
        return WorkspacePaths.respond(view);
    }

    @PutMapping("/{sessionName}/workspace/**")
    public Map<String, String> writeWorkspace(@PathVariable String projectName, @PathVariable String sessionName,
                                              HttpServletRequest request, @RequestBody(required = false) byte[] body,
                                              @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients,
                                              @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
        String root = sessions.workspaceRoot(clients, projectName, sessionName);
        String path = WorkspacePaths.remainder(request, "/" + sessionName + "/workspace");
        workspace.write(projectName, caller.token(), root, path, body == null ? new byte[0] : body);
        return Map.of("message", "ok");
    }

    public record CloneRequest(String targetProject, String newSessionName) {
    }
}
