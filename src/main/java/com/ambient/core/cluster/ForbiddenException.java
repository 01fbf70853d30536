package com.ambient.core.cluster;

public class ForbiddenException extends ClusterException {

    public ForbiddenException(String message) {
        super(message, 403);
    }

    public ForbiddenException(String message, Throwable cause) {
        super(message, 403, cause);
    }
}
