package com.prudhvi.event_stream.auth;

/**
 * The identity behind a stream is not (or no longer) authorized.
 *
 * On open this rejects the stream; on refresh it ends the stream with an error frame.
 */
public class AuthorizationException extends RuntimeException {

    public AuthorizationException(String message) {
        super(message);
    }
}
