package com.ambient.core.cluster;

/**
 * A create was rejected because an object with the same name already exists.
 */
public class AlreadyExistsException extends ClusterException {

    public AlreadyExistsException(String message) {
        super(message, 409);
    }

    public AlreadyExistsException(String message, Throwable cause) {
        super(message, 409, cause);
    }
}
