package com.prudhvi.event_stream.auth;

import java.util.Objects;

/**
 * Identity context captured from the HTTP request that opened a stream.
 * Kept for the lifetime of the connection so the snapshot can be re-fetched on refresh.
 */
public record AuthContext(String tenantId, String actorToken) {

    public AuthContext {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(actorToken, "actorToken");
    }

    @Override
    public String toString() {
        return "AuthContext[tenantId=" + tenantId + ", actorToken=***]";
    }
}
