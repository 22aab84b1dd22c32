package com.prudhvi.event_stream.auth;

/**
 * Fetches the current permission state for a stream's identity.
 *
 * Implementations throw {@link AuthorizationException} when the identity itself is no longer
 * acceptable (expired token, revoked access). Anything else they throw is treated as an outage
 * or a bug by the caller.
 */
public interface AuthorizationProvider {

    AuthSnapshot fetch(AuthContext context);
}
