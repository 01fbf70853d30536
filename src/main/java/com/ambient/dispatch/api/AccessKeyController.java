package com.ambient.dispatch.api;

import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.model.AccessKey;
import com.ambient.core.tenant.AccessKeyRequest;
import com.ambient.core.tenant.AccessKeyService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Machine access keys. The token is only ever returned by the create call.
 */
@RestController
@RequestMapping("/api/projects/{projectName}/keys")
@ConditionalOnProperty(name = "ambient.mode", havingValue = "serve", matchIfMissing = true)
public class AccessKeyController {

    private final AccessKeyService keys;

    public AccessKeyController(AccessKeyService keys) {
        this.keys = keys;
    }

    @GetMapping
    public Map<String, List<AccessKey>> list(@PathVariable String projectName,
                                             @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return Map.of("items", keys.list(clients, projectName));
    }

    @PostMapping
    public ResponseEntity<AccessKey> create(@PathVariable String projectName, @RequestBody AccessKeyRequest request,
                                            @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return ResponseEntity.status(HttpStatus.CREATED).body(keys.create(clients, projectName, request));
    }

    @DeleteMapping("/{keyId}")
    public ResponseEntity<Void> delete(@PathVariable String projectName, @PathVariable String keyId,
                                       @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        keys.delete(clients, projectName, keyId);
        return ResponseEntity.noContent().build();
    }
}
