package com.ambient.core.cluster;

/**
 * An update lost an optimistic-concurrency race (stale resourceVersion). Retryable.
 */
public class ConflictException extends ClusterException {

    public ConflictException(String message) {
        super(message, 409);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, 409, cause);
    }
}
