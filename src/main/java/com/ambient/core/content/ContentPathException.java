package com.ambient.core.content;

/**
 * A content path was empty, pointed at the tenant root, or tried to escape it.
 */
public class ContentPathException extends RuntimeException {

    public ContentPathException(String message) {
        super(message);
    }
}
