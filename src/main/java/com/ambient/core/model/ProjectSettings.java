package com.ambient.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Per-tenant settings singleton (object name {@value #SINGLETON_NAME}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectSettings(
    String apiVersion,
    String kind,
    ResourceMeta metadata,
    Spec spec,
    Status status
) implements CustomResource {

    public static final String KIND = "ProjectSettings";
    public static final String SINGLETON_NAME = "projectsettings";

    public static ProjectSettings defaults(String namespace) {
        return new ProjectSettings(ResourceKind.PROJECT_SETTINGS.apiVersion(), KIND,
                ResourceMeta.named(namespace, SINGLETON_NAME), new Spec(List.of(), null), null);
    }

    public String runnerSecretsName() {
        return spec == null || spec.runnerSecretsName() == null || spec.runnerSecretsName().isBlank()
                ? null : spec.runnerSecretsName().trim();
    }

    public ProjectSettings withSpec(Spec newSpec) {
        return new ProjectSettings(apiVersion, kind, metadata, newSpec, status);
    }

    public ProjectSettings withStatus(Status newStatus) {
        return new ProjectSettings(apiVersion, kind, metadata, spec, newStatus);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Spec(List<GroupAccess> groupAccess, String runnerSecretsName) {

        public Spec withRunnerSecretsName(String name) {
            return new Spec(groupAccess, name);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GroupAccess(String groupName, String role) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Status(Integer groupBindingsCreated) {
    }
}
