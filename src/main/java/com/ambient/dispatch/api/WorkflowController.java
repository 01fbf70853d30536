package com.ambient.dispatch.api;

import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.model.Session;
import com.ambient.core.model.Workflow;
import com.ambient.core.security.CallerContext;
import com.ambient.core.workflow.WorkflowRequest;
import com.ambient.core.workflow.WorkflowService;
import com.ambient.core.workflow.WorkflowSummary;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Workflows and their linked sessions. {@code /workflows} is an alias of {@code /rfe-workflows}.
 */
@RestController
@RequestMapping({"/api/projects/{projectName}/rfe-workflows", "/api/projects/{projectName}/workflows"})
@ConditionalOnProperty(name = "ambient.mode", havingValue = "serve", matchIfMissing = true)
public class WorkflowController {

    private final WorkflowService workflows;

    public WorkflowController(WorkflowService workflows) {
        this.workflows = workflows;
    }

    @GetMapping
    public Map<String, List<Workflow>> list(@PathVariable String projectName,
                                            @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return Map.of("items", workflows.list(clients, projectName));
    }

    @PostMapping
    public ResponseEntity<Workflow> create(@PathVariable String projectName, @RequestBody WorkflowRequest request,
                                           @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients,
                                           @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
        return ResponseEntity.status(HttpStatus.CREATED).body(workflows.create(clients, caller, projectName, request));
    }

    @GetMapping("/{id}")
    public Workflow get(@PathVariable String projectName, @PathVariable String id,
                        @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return workflows.get(clients, projectName, id);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String projectName, @PathVariable String id,
                                       @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        workflows.delete(clients, projectName, id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/summary")
    public WorkflowSummary summary(@PathVariable String projectName, @PathVariable String id,
                                   @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients,
                                   @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
        return workflows.summary(clients, caller, projectName, id);
    }

    @GetMapping("/{id}/sessions")
    public Map<String, List<Session>> sessions(@PathVariable String projectName, @PathVariable String id,
                                               @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return Map.of("items", workflows.linkedSessions(clients, projectName, id));
    }

    @PostMapping("/{id}/sessions")
    public Session link(@PathVariable String projectName, @PathVariable String id, @RequestBody LinkRequest request,
                        @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return workflows.link(clients, projectName, id, request.existingName(), request.phase());
    }

    @DeleteMapping("/{id}/sessions/{sessionName}")
    public Map<String, String> unlink(@PathVariable String projectName, @PathVariable String id,
                                      @PathVariable String sessionName,
                                      @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        workflows.unlink(clients, projectName, id, sessionName);
        return Map.of("message", "Session unlinked");
    }

    @GetMapping({"/{id}/workspace", "/{id}/workspace/**"})
    public ResponseEntity<?> readWorkspace(@PathVariable String projectName, @PathVariable String id,
                                           HttpServletRequest request,
                                           @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients,
                                           @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
        String path = WorkspacePaths.remainder(request, "/" + id + "/workspace");
        return WorkspacePaths.respond(workflows.openWorkspace(clients, caller, projectName, id, path));
    }

    @PutMapping("/{id}/workspace/**")
    public Map<String, String> writeWorkspace(@PathVariable String projectName, @PathVariable String id,
                                              HttpServletRequest request, @RequestBody(required = false) byte[] body,
                                              @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients,
                                              @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
        String path = WorkspacePaths.remainder(request, "/" + id + "/workspace");
        workflows.writeWorkspace(clients, caller, projectName, id, path, body == null ? new byte[0] : body);
        return Map.of("message", "ok");
    }

    public record LinkRequest(String existingName, String phase) {
    }
}
