package com.ambient.core.security;

import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.NotFoundException;
import com.ambient.core.logging.MdcContext;
import com.ambient.core.model.ResourceKind;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;

/**
 * Gate for every route under a project. A caller who may not list sessions in the project is
 * told it does not exist, so tenants a caller cannot see are indistinguishable from missing ones.
 */
public class ProjectAccessInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(ProjectAccessInterceptor.class);

    public static final String PROJECT_VARIABLE = "projectName";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String project = projectOf(request);
        if (project == null) {
            return true;
        }
        Object clients = request.getAttribute(ClusterClients.REQUEST_ATTRIBUTE);
        if (!(clients instanceof ClusterClients scoped)) {
            log.warn("No caller identity bound for {} {}, refusing", request.getMethod(), request.getRequestURI());
            throw new UnauthenticatedException("User token required");
        }
        MdcContext.setNamespace(project);
        boolean visible = scoped.access().isAllowed(project, ResourceKind.GROUP,
                ResourceKind.SESSION.plural(), "list");
        if (!visible) {
            log.debug("Caller may not list sessions in {}, answering not found", project);
            throw new NotFoundException("Project " + project + " not found");
        }
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler,
                                Exception ex) {
        MdcContext.clear();
    }

    @SuppressWarnings("unchecked")
    private static String projectOf(HttpServletRequest request) {
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (!(variables instanceof Map<?, ?> map)) {
            return null;
        }
        Object project = ((Map<String, Object>) map).get(PROJECT_VARIABLE);
        return project == null ? null : project.toString();
    }
}
