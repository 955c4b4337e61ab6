package com.piiguard.infrastructure.security;

/**
 * Thrown when a principal acts on a record outside its scope or without the required
 * permission. The boundary layer maps it to its own status code.
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
