package com.ambient.core.session;

import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.ClusterException;
import com.ambient.core.config.AmbientProperties;
import com.ambient.core.model.GitAuthentication;
import com.ambient.core.model.GitConfig;
import com.ambient.core.model.GitRepository;
import com.ambient.core.model.GitUser;
import io.kubernetes.client.openapi.models.V1ConfigMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads a tenant's default source-control settings from its {@code git-config} ConfigMap.
 * <p>
 * Keys: {@code git-user-name}, {@code git-user-email}, {@code git-ssh-key-secret},
 * {@code git-token-secret} and {@code git-repositories} (one URL per line, {@code #} starts a
 * comment, branch {@code main}).
 */
@Service
public class GitConfigResolver {

    private static final Logger log = LoggerFactory.getLogger(GitConfigResolver.class);

    static final String DEFAULT_BRANCH = "main";

    private final AmbientProperties properties;

    public GitConfigResolver(AmbientProperties properties) {
        this.properties = properties;
    }

    /**
     * Tenant defaults, or empty when the ConfigMap is absent, empty or unreadable. A read
     * failure is logged and treated as "no defaults".
     */
    public Optional<GitConfig> tenantDefaults(ClusterClients clients, String namespace) {
        String mapName = properties.getSessions().getGitConfigMapName();
        try {
            return clients.configs().findConfigMap(namespace, mapName)
                    .map(GitConfigResolver::parse)
                    .filter(config -> !config.isEmpty());
        } catch (ClusterException e) {
            log.warn("Failed to load git defaults from {}/{}: {}", namespace, mapName, e.getMessage());
            return Optional.empty();
        }
    }

    static GitConfig parse(V1ConfigMap configMap) {
        Map<String, String> data = configMap.getData() == null ? Map.of() : configMap.getData();

        String userName = blankToNull(data.get("git-user-name"));
        String userEmail = blankToNull(data.get("git-user-email"));
        GitUser user = userName == null && userEmail == null ? null : new GitUser(userName, userEmail);

        String sshKeySecret = blankToNull(data.get("git-ssh-key-secret"));
        String tokenSecret = blankToNull(data.get("git-token-secret"));
        GitAuthentication auth = sshKeySecret == null && tokenSecret == null
                ? null : new GitAuthentication(sshKeySecret, tokenSecret);

        List<GitRepository> repositories = new ArrayList<>();
        String repoList = data.get("git-repositories");
        if (repoList != null) {
            for (String line : repoList.split("\n")) {
                String url = line.trim();
                if (!url.isEmpty() && !url.startsWith("#")) {
                    repositories.add(new GitRepository(url, DEFAULT_BRANCH));
                }
            }
        }
        return new GitConfig(user, auth, repositories.isEmpty() ? null : repositories);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
