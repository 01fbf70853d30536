package com.ambient.dispatch.api;

import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.model.InvalidRequestException;
import com.ambient.core.model.PermissionAssignment;
import com.ambient.core.model.SubjectType;
import com.ambient.core.tenant.PermissionService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/projects/{projectName}/permissions")
@ConditionalOnProperty(name = "ambient.mode", havingValue = "serve", matchIfMissing = true)
public class PermissionController {

    private final PermissionService permissions;

    public PermissionController(PermissionService permissions) {
        this.permissions = permissions;
    }

    @GetMapping
    public Map<String, List<PermissionAssignment>> list(@PathVariable String projectName,
                                                        @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return Map.of("items", permissions.list(clients, projectName));
    }

    @PostMapping
    public ResponseEntity<PermissionAssignment> grant(@PathVariable String projectName,
                                                      @RequestBody PermissionAssignment grant,
                                                      @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return ResponseEntity.status(HttpStatus.CREATED).body(permissions.grant(clients, projectName, grant));
    }

    @DeleteMapping("/{subjectType}/{subjectName}")
    public ResponseEntity<Void> revoke(@PathVariable String projectName, @PathVariable String subjectType,
                                       @PathVariable String subjectName,
                                       @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        SubjectType type;
        try {
            type = SubjectType.fromWire(subjectType);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage());
        }
        permissions.revoke(clients, projectName, type, subjectName);
        return ResponseEntity.noContent().build();
    }
}
