package com.ambient.core.security;

import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.NotFoundException;
import com.ambient.support.ClusterMocks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ProjectAccessInterceptorTest {

    private final ProjectAccessInterceptor interceptor = new ProjectAccessInterceptor();
    private ClusterMocks cluster;
    private MockHttpServletRequest request;

    @BeforeEach
    void setUp() {
        cluster = new ClusterMocks();
        request = new MockHttpServletRequest("GET", "/api/projects/team-a/agentic-sessions");
        request.setAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE,
                Map.of(ProjectAccessInterceptor.PROJECT_VARIABLE, "team-a"));
    }

    private boolean preHandle() {
        return interceptor.preHandle(request, new MockHttpServletResponse(), new Object());
    }

    @Test
    @DisplayName("routes outside a project pass straight through")
    void noProject() {
        request.removeAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);

        assertTrue(preHandle());
    }

    @Test
    @DisplayName("a project route without a bound caller identity is refused")
    void noIdentity() {
        var error = assertThrows(UnauthenticatedException.class, this::preHandle);
        assertEquals("User token required", error.getMessage());
    }

    @Test
    @DisplayName("a caller who may list sessions is let through")
    void visible() {
        when(cluster.access.isAllowed(eq("team-a"), any(), any(), eq("list"))).thenReturn(true);
        request.setAttribute(ClusterClients.REQUEST_ATTRIBUTE, cluster.clients());

        assertTrue(preHandle());
    }

    @Test
    @DisplayName("a project the caller cannot see is reported as missing")
    void invisible() {
        request.setAttribute(ClusterClients.REQUEST_ATTRIBUTE, cluster.clients());

        assertThrows(NotFoundException.class, this::preHandle);
    }
}
