package com.ambient.core.cluster;

public class NotFoundException extends ClusterException {

    public NotFoundException(String message) {
        super(message, 404);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, 404, cause);
    }
}
