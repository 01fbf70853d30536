package com.ambient.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "ambient")
public class AmbientProperties {

    private String mode = "serve";
    private Cluster cluster = new Cluster();
    private Operator operator = new Operator();
    private Content content = new Content();
    private Sessions sessions = new Sessions();
    private Agents agents = new Agents();

    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }
    public Cluster getCluster() { return cluster; }
    public void setCluster(Cluster cluster) { this.cluster = cluster; }
    public Operator getOperator() { return operator; }
    public void setOperator(Operator operator) { this.operator = operator; }
    public Content getContent() { return content; }
    public void setContent(Content content) { this.content = content; }
    public Sessions getSessions() { return sessions; }
    public void setSessions(Sessions sessions) { this.sessions = sessions; }
    public Agents getAgents() { return agents; }
    public void setAgents(Agents agents) { this.agents = agents; }

    /**
     * Connection settings used to build caller-scoped clients. The controller's own
     * identity comes from the in-cluster service account or kubeconfig instead.
     */
    public static class Cluster {
        private String apiServerUrl = "https://kubernetes.default.svc";
        private String caCertPath = "/var/run/secrets/kubernetes.io/serviceaccount/ca.crt";
        private boolean verifySsl = true;

        public String getApiServerUrl() { return apiServerUrl; }
        public void setApiServerUrl(String apiServerUrl) { this.apiServerUrl = apiServerUrl; }
        public String getCaCertPath() { return caCertPath; }
        public void setCaCertPath(String caCertPath) { this.caCertPath = caCertPath; }
        public boolean isVerifySsl() { return verifySsl; }
        public void setVerifySsl(boolean verifySsl) { this.verifySsl = verifySsl; }
    }

    public static class Operator {
        private String runnerImage = "quay.io/ambient_code/vteam_claude_runner:latest";
        private String contentServiceImage = "quay.io/ambient_code/vteam_backend:latest";
        private String imagePullPolicy = "Always";
        private String backendNamespace = "default";
        private int jobBackoffLimit = 3;
        private long jobActiveDeadlineSeconds = 1800;
        private String scratchSize = "1Gi";
        private String workspaceClaimSize = "5Gi";
        private int pollIntervalSeconds = 10;
        private int supervisionThreads = 4;
        private long watchRetryDelayMs = 5000;
        private long watchRestartDelayMs = 2000;
        private long eventSettleDelayMs = 100;
        private int failureMessageLimit = 500;

        public String getRunnerImage() { return runnerImage; }
        public void setRunnerImage(String runnerImage) { this.runnerImage = runnerImage; }
        public String getContentServiceImage() { return contentServiceImage; }
        public void setContentServiceImage(String contentServiceImage) { this.contentServiceImage = contentServiceImage; }
        public String getImagePullPolicy() { return imagePullPolicy; }
        public void setImagePullPolicy(String imagePullPolicy) { this.imagePullPolicy = imagePullPolicy; }
        public String getBackendNamespace() { return backendNamespace; }
        public void setBackendNamespace(String backendNamespace) { this.backendNamespace = backendNamespace; }
        public int getJobBackoffLimit() { return jobBackoffLimit; }
        public void setJobBackoffLimit(int jobBackoffLimit) { this.jobBackoffLimit = jobBackoffLimit; }
        public long getJobActiveDeadlineSeconds() { return jobActiveDeadlineSeconds; }
        public void setJobActiveDeadlineSeconds(long jobActiveDeadlineSeconds) { this.jobActiveDeadlineSeconds = jobActiveDeadlineSeconds; }
        public String getScratchSize() { return scratchSize; }
        public void setScratchSize(String scratchSize) { this.scratchSize = scratchSize; }
        public String getWorkspaceClaimSize() { return workspaceClaimSize; }
        public void setWorkspaceClaimSize(String workspaceClaimSize) { this.workspaceClaimSize = workspaceClaimSize; }
        public int getPollIntervalSeconds() { return pollIntervalSeconds; }
        public void setPollIntervalSeconds(int pollIntervalSeconds) {
            if (pollIntervalSeconds < 1) {
                throw new IllegalArgumentException("ambient.operator.poll-interval-seconds must be at least 1, got "
                        + pollIntervalSeconds);
            }
            this.pollIntervalSeconds = pollIntervalSeconds;
        }
        public int getSupervisionThreads() { return supervisionThreads; }
        public void setSupervisionThreads(int supervisionThreads) { this.supervisionThreads = supervisionThreads; }
        public long getWatchRetryDelayMs() { return watchRetryDelayMs; }
        public void setWatchRetryDelayMs(long watchRetryDelayMs) { this.watchRetryDelayMs = watchRetryDelayMs; }
        public long getWatchRestartDelayMs() { return watchRestartDelayMs; }
        public void setWatchRestartDelayMs(long watchRestartDelayMs) { this.watchRestartDelayMs = watchRestartDelayMs; }
        public long getEventSettleDelayMs() { return eventSettleDelayMs; }
        public void setEventSettleDelayMs(long eventSettleDelayMs) { this.eventSettleDelayMs = eventSettleDelayMs; }
        public int getFailureMessageLimit() { return failureMessageLimit; }
        public void setFailureMessageLimit(int failureMessageLimit) { this.failureMessageLimit = failureMessageLimit; }
    }

    public static class Content {
        /** Per-tenant content service URL; {@code %s} is replaced with the namespace. */
        private String serviceUrlTemplate = "http://ambient-content.%s.svc:8080";
        private int timeoutSeconds = 10;
        private String stateBaseDir = "/data";

        public String getServiceUrlTemplate() { return serviceUrlTemplate; }
        public void setServiceUrlTemplate(String serviceUrlTemplate) { this.serviceUrlTemplate = serviceUrlTemplate; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public String getStateBaseDir() { return stateBaseDir; }
        public void setStateBaseDir(String stateBaseDir) { this.stateBaseDir = stateBaseDir; }

        public String serviceUrlFor(String namespace) {
            return serviceUrlTemplate.contains("%s") ? serviceUrlTemplate.formatted(namespace) : serviceUrlTemplate;
        }
    }

    public static class Sessions {
        private String defaultModel = "sonnet";
        private double defaultTemperature = 0.7;
        private int defaultMaxTokens = 4000;
        private int defaultTimeoutSeconds = 300;
        private int updateRetryAttempts = 5;
        private long updateRetryDelayMs = 300;
        private int duplicateNameAttempts = 50;
        private String gitConfigMapName = "git-config";
        private long runnerTokenExpirationSeconds = 3600;

        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }
        public double getDefaultTemperature() { return defaultTemperature; }
        public void setDefaultTemperature(double defaultTemperature) { this.defaultTemperature = defaultTemperature; }
        public int getDefaultMaxTokens() { return defaultMaxTokens; }
        public void setDefaultMaxTokens(int defaultMaxTokens) { this.defaultMaxTokens = defaultMaxTokens; }
        public int getDefaultTimeoutSeconds() { return defaultTimeoutSeconds; }
        public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) { this.defaultTimeoutSeconds = defaultTimeoutSeconds; }
        public int getUpdateRetryAttempts() { return updateRetryAttempts; }
        public void setUpdateRetryAttempts(int updateRetryAttempts) { this.updateRetryAttempts = updateRetryAttempts; }
        public long getUpdateRetryDelayMs() { return updateRetryDelayMs; }
        public void setUpdateRetryDelayMs(long updateRetryDelayMs) { this.updateRetryDelayMs = updateRetryDelayMs; }
        public int getDuplicateNameAttempts() { return duplicateNameAttempts; }
        public void setDuplicateNameAttempts(int duplicateNameAttempts) { this.duplicateNameAttempts = duplicateNameAttempts; }
        public String getGitConfigMapName() { return gitConfigMapName; }
        public void setGitConfigMapName(String gitConfigMapName) { this.gitConfigMapName = gitConfigMapName; }
        public long getRunnerTokenExpirationSeconds() { return runnerTokenExpirationSeconds; }
        public void setRunnerTokenExpirationSeconds(long runnerTokenExpirationSeconds) { this.runnerTokenExpirationSeconds = runnerTokenExpirationSeconds; }
    }

    public static class Agents {
        private String dir = "/app/agents";

        public String getDir() { return dir; }
        public void setDir(String dir) { this.dir = dir; }
    }
}
