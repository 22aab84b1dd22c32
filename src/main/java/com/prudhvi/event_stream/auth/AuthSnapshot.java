package com.prudhvi.event_stream.auth;

import com.prudhvi.event_stream.capability.CapabilityMatcher;

import java.util.Objects;

/**
 * Permission state of a principal at the time it was fetched.
 *
 * Immutable: a refresh produces a new snapshot which replaces the old one whole.
 */
public record AuthSnapshot(String principalId, String tenantId, CapabilityMatcher capabilities) {

    public AuthSnapshot {
        Objects.requireNonNull(principalId, "principalId");
        Objects.requireNonNull(tenantId, "tenantId");
        capabilities = capabilities == null ? CapabilityMatcher.none() : capabilities;
    }
}
