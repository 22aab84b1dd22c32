package com.prudhvi.event_stream.auth;

/**
 * The permission service could not answer: non-auth HTTP failure, I/O error, or open circuit breaker.
 */
public class PermissionServiceException extends RuntimeException {

    public PermissionServiceException(String message) {
        super(message);
    }

    public PermissionServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
