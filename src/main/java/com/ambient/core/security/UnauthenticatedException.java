package com.ambient.core.security;

/**
 * A project route was reached without caller-scoped cluster clients bound to the request.
 */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException(String message) {
        super(message);
    }
}
