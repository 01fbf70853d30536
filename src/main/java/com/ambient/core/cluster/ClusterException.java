package com.ambient.core.cluster;

/**
 * Failure reported by the cluster API, carrying the HTTP status the API returned.
 */
public class ClusterException extends RuntimeException {

    private final int statusCode;

    public ClusterException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public ClusterException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public int getStatusCode() {
        return statusCode;
    }
}
