package com.prudhvi.event_stream.capability;

import com.prudhvi.event_stream.event.EventName;
import com.prudhvi.event_stream.event.ScopeType;

import java.util.Objects;

/**
 * "May this principal receive {@code action} events of {@code subject}, under these conditions?"
 *
 * Used both for the subscriptions a client registers when opening a stream and for the
 * grants carried in an authorization snapshot.
 */
public record CapabilityRule(ScopeType subject, EventName action, RuleConditions conditions) {

    public CapabilityRule {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(action, "action");
    }

    public static CapabilityRule of(ScopeType subject, EventName action) {
        return new CapabilityRule(subject, action, null);
    }
}
