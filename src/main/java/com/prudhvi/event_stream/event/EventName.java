package com.prudhvi.event_stream.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Public event names written to the {@code event:} line of a frame.
 *
 * Several internal {@link DomainEventType}s collapse onto one of these,
 * e.g. single and bulk secret creation are both {@code secret:created}.
 */
public enum EventName {

    SECRET_CREATED("secret:created"),
    SECRET_UPDATED("secret:updated"),
    SECRET_DELETED("secret:deleted"),
    SECRET_IMPORT_MUTATION("secret:import-mutation"),
    CERTIFICATE_ISSUED("certificate:issued"),
    CERTIFICATE_REVOKED("certificate:revoked");

    private final String wireName;

    EventName(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EventName fromWireName(String value) {
        return Arrays.stream(values())
                .filter(name -> name.wireName.equalsIgnoreCase(value) || name.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event name: " + value));
    }
}
