package com.ambient.core.resource;

/**
 * Thrown when a stored object does not match the typed schema.
 */
public class ResourceDecodingException extends RuntimeException {

    public ResourceDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
