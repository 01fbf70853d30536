package com.ambient.core.model;

/**
 * A request was rejected before any mutation: a required field is missing or a value is malformed.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
