package com.prudhvi.event_stream.stream;

import com.prudhvi.event_stream.auth.AuthContext;
import com.prudhvi.event_stream.capability.CapabilityRule;
import com.prudhvi.event_stream.event.ScopeType;

import java.util.List;
import java.util.Objects;

/**
 * Everything needed to open a stream: who is asking, which stream class, and which events.
 */
public record SubscribeRequest(AuthContext context, ScopeType scopeType, List<CapabilityRule> subscriptions) {

    public SubscribeRequest {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(scopeType, "scopeType");
        subscriptions = subscriptions == null ? List.of() : List.copyOf(subscriptions);
        for (CapabilityRule rule : subscriptions) {
            if (rule.subject() != scopeType) {
                throw new IllegalArgumentException("Subscription for " + rule.subject().wireName()
                        + " does not belong to a " + scopeType.wireName() + " stream");
            }
        }
    }
}
