package com.ambient.dispatch.api;

import com.ambient.core.content.WorkspaceView;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/** Helpers shared by the session and workflow workspace routes. */
final class WorkspacePaths {

    private WorkspacePaths() {}

    /** The part of the request path after {@code marker}, decoded; {@code marker} ends with the workspace segment. */
    static String remainder(HttpServletRequest request, String marker) {
        String uri = request.getRequestURI();
        int index = uri.indexOf(marker);
        if (index < 0) {
            return "";
        }
        String rest = uri.substring(index + marker.length());
        return UriUtils.decode(rest, StandardCharsets.UTF_8);
    }

    static ResponseEntity<?> respond(WorkspaceView view) {
        if (view.isFile()) {
            return ResponseEntity.ok().contentType(MediaType.APPLICATION_OCTET_STREAM).body(view.file());
        }
        return ResponseEntity.ok(Map.of("items", view.entries()));
    }
}
