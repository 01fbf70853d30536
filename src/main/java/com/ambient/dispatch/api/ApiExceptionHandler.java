package com.ambient.dispatch.api;

import com.ambient.core.cluster.ClusterException;
import com.ambient.core.content.ContentPathException;
import com.ambient.core.content.ContentServiceException;
import com.ambient.core.model.InvalidRequestException;
import com.ambient.core.security.UnauthenticatedException;
import com.ambient.core.session.SessionStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps domain and cluster failures to {@code {"error": "..."}} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, String>> invalidRequest(InvalidRequestException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(ContentPathException.class)
    public ResponseEntity<Map<String, String>> invalidPath(ContentPathException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadableBody(HttpMessageNotReadableException e) {
        Throwable cause = e.getMostSpecificCause();
        String detail = cause instanceof IllegalArgumentException && cause.getMessage() != null
                ? cause.getMessage() : "Invalid request body";
        return error(HttpStatus.BAD_REQUEST, detail);
    }

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<Map<String, String>> unauthenticated(UnauthenticatedException e) {
        return error(HttpStatus.UNAUTHORIZED, e.getMessage());
    }

    @ExceptionHandler(SessionStateException.class)
    public ResponseEntity<Map<String, String>> illegalTransition(SessionStateException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(ClusterException.class)
    public ResponseEntity<Map<String, String>> cluster(ClusterException e) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode());
        if (status == null || !(status.is4xxClientError() || status.is5xxServerError())) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (status.is5xxServerError()) {
            log.error("Cluster call failed: {}", e.getMessage(), e);
        }
        return error(status, e.getMessage());
    }

    @ExceptionHandler(ContentServiceException.class)
    public ResponseEntity<Map<String, String>> contentService(ContentServiceException e) {
        log.warn("Content service call failed: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> unexpected(Exception e) {
        if (e instanceof ErrorResponse framework) {
            return error(HttpStatus.valueOf(framework.getStatusCode().value()), framework.getBody().getDetail());
        }
        log.error("Unhandled error", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
