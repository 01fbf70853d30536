package com.ambient.core.security;

import com.ambient.core.cluster.ClusterClientFactory;
import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.tenant.AccessKeyUsageTracker;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

/**
 * Resolves the caller of every {@code /api/} request and binds cluster clients to the caller's
 * own token. A request without a token is rejected; there is no fallback identity.
 */
@Component
@Order(1)
@ConditionalOnProperty(name = "ambient.mode", havingValue = "serve", matchIfMissing = true)
public class CallerIdentityFilter implements Filter {

    static final String FORWARDED_TOKEN = "X-Forwarded-Access-Token";
    static final String FORWARDED_USER = "X-Forwarded-User";
    static final String FORWARDED_USERNAME = "X-Forwarded-Preferred-Username";
    static final String FORWARDED_EMAIL = "X-Forwarded-Email";
    static final String FORWARDED_GROUPS = "X-Forwarded-Groups";

    private static final String BEARER_PREFIX = "Bearer ";

    private final ClusterClientFactory clientFactory;
    private final AccessKeyUsageTracker usageTracker;

    public CallerIdentityFilter(ClusterClientFactory clientFactory, AccessKeyUsageTracker usageTracker) {
        this.clientFactory = clientFactory;
        this.usageTracker = usageTracker;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        if (!httpRequest.getRequestURI().startsWith("/api/")) {
            chain.doFilter(request, response);
            return;
        }

        String token = tokenOf(httpRequest);
        if (token == null) {
            httpResponse.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            httpResponse.setContentType("application/json");
            httpResponse.getWriter().write("{\"error\":\"User token required\"}");
            return;
        }

        CallerContext caller = new CallerContext(
                header(httpRequest, FORWARDED_USER),
                header(httpRequest, FORWARDED_USERNAME),
                header(httpRequest, FORWARDED_EMAIL),
                groupsOf(header(httpRequest, FORWARDED_GROUPS)),
                token);
        ClusterClients clients = clientFactory.forToken(token);
        httpRequest.setAttribute(CallerContext.ATTRIBUTE, caller);
        httpRequest.setAttribute(ClusterClients.REQUEST_ATTRIBUTE, clients);
        usageTracker.recordUse(token);

        chain.doFilter(request, response);
    }

    /** Bearer token from {@code Authorization}, else the forwarded access token. */
    static String tokenOf(HttpServletRequest request) {
        String authorization = header(request, "Authorization");
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }
        return header(request, FORWARDED_TOKEN);
    }

    static List<String> groupsOf(String header) {
        if (header == null) {
            return List.of();
        }
        return Arrays.stream(header.split(","))
                .map(String::trim)
                .filter(g -> !g.isEmpty())
                .toList();
    }

    private static String header(HttpServletRequest request, String name) {
        String value = request.getHeader(name);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
