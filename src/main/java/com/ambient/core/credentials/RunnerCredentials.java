package com.ambient.core.credentials;

/**
 * Names of the objects provisioned for one session's workload identity.
 */
public record RunnerCredentials(
    String serviceAccountName,
    String roleName,
    String roleBindingName,
    String tokenSecretName
) {

    public static final String TOKEN_KEY = "token";

    public static RunnerCredentials forSession(String sessionName) {
        String sa = "ambient-session-" + sessionName;
        return new RunnerCredentials(sa, sa + "-role", sa + "-rb", "ambient-runner-token-" + sessionName);
    }
}
