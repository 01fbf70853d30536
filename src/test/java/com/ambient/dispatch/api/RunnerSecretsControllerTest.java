package com.ambient.dispatch.api;

import com.ambient.core.cluster.ClusterClientFactory;
import com.ambient.core.tenant.AccessKeyUsageTracker;
import com.ambient.core.tenant.RunnerSecretsService;
import com.ambient.core.tenant.SecretSummary;
import com.ambient.support.ClusterMocks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RunnerSecretsController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class RunnerSecretsControllerTest {

    private static final String BASE = "/api/projects/team-a";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RunnerSecretsService runnerSecretsService;

    @MockitoBean
    private ClusterClientFactory clientFactory;

    @MockitoBean
    private AccessKeyUsageTracker usageTracker;

    private final ClusterMocks cluster = new ClusterMocks();

    @BeforeEach
    void setUp() {
        when(clientFactory.forToken("t")).thenReturn(cluster.clients());
        when(cluster.access.isAllowed(any(), any(), any(), any())).thenReturn(true);
    }

    @Test
    @DisplayName("an unconfigured secret name reads as empty")
    void configUnset() throws Exception {
        when(runnerSecretsService.configuredSecretName(any(), eq("team-a"))).thenReturn(null);

        mockMvc.perform(get(BASE + "/runner-secrets/config").header("Authorization", "Bearer t"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.secretName").value(""));
    }

    @Test
    @DisplayName("PUT config stores the secret name")
    void updateConfig() throws Exception {
        when(runnerSecretsService.updateSecretName(any(), eq("team-a"), eq("my-secrets"))).thenReturn("my-secrets");

        mockMvc.perform(put(BASE + "/runner-secrets/config")
                        .header("Authorization", "Bearer t")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"secretName\":\"my-secrets\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.secretName").value("my-secrets"));
    }

    @Test
    @DisplayName("values are wrapped in data both ways")
    void readAndWrite() throws Exception {
        when(runnerSecretsService.read(any(), eq("team-a"))).thenReturn(Map.of("ANTHROPIC_API_KEY", "sk-1"));

        mockMvc.perform(get(BASE + "/runner-secrets").header("Authorization", "Bearer t"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.ANTHROPIC_API_KEY").value("sk-1"));

        mockMvc.perform(put(BASE + "/runner-secrets")
                        .header("Authorization", "Bearer t")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":{\"GITHUB_TOKEN\":\"gh-1\"}}"))
                .andExpect(status().isOk());

        verify(runnerSecretsService).write(any(), eq("team-a"), eq(Map.of("GITHUB_TOKEN", "gh-1")));
    }

    @Test
    @DisplayName("GET /secrets lists runner secrets")
    void listSecrets() throws Exception {
        when(runnerSecretsService.listRunnerSecrets(any(), eq("team-a")))
                .thenReturn(List.of(new SecretSummary("ambient-runner-secrets", "2025-01-01T00:00:00Z", "Opaque")));

        mockMvc.perform(get(BASE + "/secrets").header("Authorization", "Bearer t"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].name").value("ambient-runner-secrets"));
    }
}
