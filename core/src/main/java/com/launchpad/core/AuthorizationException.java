package com.launchpad.core;

/**
 * Raised when an operation that needs a caller identity is attempted anonymously.
 */
public class AuthorizationException extends RuntimeException {
    public AuthorizationException(String message) {
        super(message);
    }
}
