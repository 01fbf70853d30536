package com.ambient.core.resource;

/**
 * Label and annotation keys shared between the API and the controller.
 */
public final class MetadataKeys {

    private MetadataKeys() {}

    public static final String MANAGED_LABEL = "ambient-code.io/managed";
    public static final String MANAGED_SELECTOR = MANAGED_LABEL + "=true";

    public static final String DISPLAY_NAME_ANNOTATION = "openshift.io/display-name";
    public static final String DESCRIPTION_ANNOTATION = "openshift.io/description";
    public static final String REQUESTER_ANNOTATION = "openshift.io/requester";

    public static final String RUNNER_TOKEN_SECRET_ANNOTATION = "ambient-code.io/runner-token-secret";
    public static final String RUNNER_SA_ANNOTATION = "ambient-code.io/runner-sa";
    public static final String RUNNER_SECRET_ANNOTATION = "ambient-code.io/runner-secret";

    public static final String SUBJECT_KIND_ANNOTATION = "ambient-code.io/subject-kind";
    public static final String SUBJECT_NAME_ANNOTATION = "ambient-code.io/subject-name";
    public static final String ROLE_ANNOTATION = "ambient-code.io/role";

    public static final String KEY_NAME_ANNOTATION = "ambient-code.io/key-name";
    public static final String KEY_DESCRIPTION_ANNOTATION = "ambient-code.io/description";
    public static final String KEY_CREATED_AT_ANNOTATION = "ambient-code.io/created-at";
    public static final String KEY_LAST_USED_ANNOTATION = "ambient-code.io/last-used-at";
    public static final String KEY_SA_NAME_ANNOTATION = "ambient-code.io/sa-name";

    public static final String APP_LABEL = "app";
    public static final String SESSION_LABEL = "agentic-session";
    public static final String JOB_NAME_LABEL = "job-name";

    public static final String RUNNER_APP = "ambient-code-runner";
    public static final String RUNNER_IDENTITY_APP = "ambient-runner";
    public static final String RUNNER_TOKEN_APP = "ambient-runner-token";
    public static final String RUNNER_SECRETS_APP = "ambient-runner-secrets";
    public static final String PERMISSION_APP = "ambient-permission";
    public static final String LEGACY_GROUP_ACCESS_APP = "ambient-group-access";
    public static final String ACCESS_KEY_APP = "ambient-access-key";
    public static final String CONTENT_APP = "ambient-content";
    public static final String WORKSPACE_APP = "ambient-workspace";

    public static final String RBAC_API_GROUP = "rbac.authorization.k8s.io";
}
