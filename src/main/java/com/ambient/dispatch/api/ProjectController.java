package com.ambient.dispatch.api;

import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.model.Project;
import com.ambient.core.security.CallerContext;
import com.ambient.core.tenant.AccessLevel;
import com.ambient.core.tenant.AccessResolver;
import com.ambient.core.tenant.ProjectRequest;
import com.ambient.core.tenant.ProjectService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/projects")
@ConditionalOnProperty(name = "ambient.mode", havingValue = "serve", matchIfMissing = true)
public class ProjectController {

    private final ProjectService projects;
    private final AccessResolver accessResolver;

    public ProjectController(ProjectService projects, AccessResolver accessResolver) {
        this.projects = projects;
        this.accessResolver = accessResolver;
    }

    @GetMapping
    public Map<String, List<Project>> list(@RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return Map.of("items", projects.list(clients));
    }

    @PostMapping
    public ResponseEntity<Project> create(@RequestBody ProjectRequest request,
                                          @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients,
                                          @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
        return ResponseEntity.status(HttpStatus.CREATED).body(projects.create(clients, caller, request));
    }

    @GetMapping("/{projectName}")
    public Project get(@PathVariable String projectName,
                       @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return projects.get(clients, projectName);
    }

    @PutMapping("/{projectName}")
    public Project update(@PathVariable String projectName, @RequestBody ProjectRequest request,
                          @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return projects.update(clients, projectName, request);
    }

    @DeleteMapping("/{projectName}")
    public ResponseEntity<Void> delete(@PathVariable String projectName,
                                       @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        projects.delete(clients, projectName);
        return ResponseEntity.noContent().build();
    }

    /** The caller's effective role in the project. */
    @GetMapping("/{projectName}/access")
    public AccessLevel access(@PathVariable String projectName,
                              @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return accessResolver.resolve(clients, projectName);
    }
}
