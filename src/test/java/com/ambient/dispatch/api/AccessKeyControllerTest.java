package com.ambient.dispatch.api;

import com.ambient.core.cluster.ClusterClientFactory;
import com.ambient.core.model.AccessKey;
import com.ambient.core.model.ProjectRole;
import com.ambient.core.tenant.AccessKeyRequest;
import com.ambient.core.tenant.AccessKeyService;
import com.ambient.core.tenant.AccessKeyUsageTracker;
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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AccessKeyController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class AccessKeyControllerTest {

    private static final String BASE = "/api/projects/team-a/keys";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AccessKeyService accessKeyService;

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
    @DisplayName("the minted token appears only in the create response")
    void createReturnsToken() throws Exception {
        when(accessKeyService.create(any(), eq("team-a"), eq(new AccessKeyRequest("ci", "pipeline", null))))
                .thenReturn(new AccessKey("ambient-key-ci-1700000000", "ci", "pipeline", ProjectRole.EDIT,
                        "2023-11-14T22:13:20Z", null, "secret-token"));

        mockMvc.perform(post(BASE)
                        .header("Authorization", "Bearer t")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"ci\",\"description\":\"pipeline\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("ambient-key-ci-1700000000"))
                .andExpect(jsonPath("$.role").value("edit"))
                .andExpect(jsonPath("$.token").value("secret-token"));
    }

    @Test
    @DisplayName("listing shows last use and no token")
    void list() throws Exception {
        when(accessKeyService.list(any(), eq("team-a"))).thenReturn(List.of(
                new AccessKey("ambient-key-ci-1700000000", "ci", null, ProjectRole.VIEW,
                        "2023-11-14T22:13:20Z", "2023-11-15T08:00:00Z", null)));

        mockMvc.perform(get(BASE).header("Authorization", "Bearer t"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].lastUsedAt").value("2023-11-15T08:00:00Z"))
                .andExpect(jsonPath("$.items[0].token").doesNotExist());
    }

    @Test
    @DisplayName("DELETE answers 204")
    void deleteKey() throws Exception {
        mockMvc.perform(delete(BASE + "/ambient-key-ci-1700000000").header("Authorization", "Bearer t"))
                .andExpect(status().isNoContent());

        verify(accessKeyService).delete(any(), eq("team-a"), eq("ambient-key-ci-1700000000"));
    }
}
