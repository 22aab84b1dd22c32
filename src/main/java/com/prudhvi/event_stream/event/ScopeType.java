package com.prudhvi.event_stream.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The stream classes a client can attach to.
 *
 * A connection is opened for exactly one scope type and only ever receives
 * bus events of that type. The wire name is what clients send in the
 * subscribe request and what appears in the event envelope.
 */
public enum ScopeType {

    SECRETS("secrets"),
    PKI("pki");

    private final String wireName;

    ScopeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ScopeType fromWireName(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown scope type: " + value));
    }
}
