package com.ambient.dispatch.api;

import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.tenant.RunnerSecretsService;
import com.ambient.core.tenant.SecretSummary;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The tenant's runner secret: which secret jobs import, and its values.
 */
@RestController
@RequestMapping("/api/projects/{projectName}")
@ConditionalOnProperty(name = "ambient.mode", havingValue = "serve", matchIfMissing = true)
public class RunnerSecretsController {

    private final RunnerSecretsService runnerSecrets;

    public RunnerSecretsController(RunnerSecretsService runnerSecrets) {
        this.runnerSecrets = runnerSecrets;
    }

    @GetMapping("/runner-secrets/config")
    public Map<String, String> config(@PathVariable String projectName,
                                      @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        String name = runnerSecrets.configuredSecretName(clients, projectName);
        Map<String, String> body = new HashMap<>();
        body.put("secretName", name == null ? "" : name);
        return body;
    }

    @PutMapping("/runner-secrets/config")
    public Map<String, String> updateConfig(@PathVariable String projectName, @RequestBody Map<String, String> body,
                                            @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return Map.of("secretName", runnerSecrets.updateSecretName(clients, projectName, body.get("secretName")));
    }

    @GetMapping("/runner-secrets")
    public Map<String, Map<String, String>> read(@PathVariable String projectName,
                                                 @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return Map.of("data", runnerSecrets.read(clients, projectName));
    }

    @PutMapping("/runner-secrets")
    public Map<String, String> write(@PathVariable String projectName, @RequestBody DataRequest request,
                                     @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        runnerSecrets.write(clients, projectName, request.data());
        return Map.of("message", "runner secrets updated");
    }

    @GetMapping("/secrets")
    public Map<String, List<SecretSummary>> list(@PathVariable String projectName,
                                                 @RequestAttribute(ClusterClients.REQUEST_ATTRIBUTE) ClusterClients clients) {
        return Map.of("items", runnerSecrets.listRunnerSecrets(clients, projectName));
    }

    public record DataRequest(Map<String, String> data) {
    }
}
