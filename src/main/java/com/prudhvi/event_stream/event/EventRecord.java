package com.prudhvi.event_stream.event;

import java.util.Map;

/**
 * One record inside a bus event payload.
 *
 * environment — exact-match qualifier (e.g. "prod")
 * secretPath  — folder path the record lives under, matched against subscription globs
 * attributes  — domain fields passed through to the client untouched (secret keys, certificate ids, ...)
 */
public record EventRecord(
        String environment,
        String secretPath,
        Map<String, Object> attributes
) {

    public EventRecord {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static EventRecord of(String environment, String secretPath) {
        return new EventRecord(environment, secretPath, Map.of());
    }
}
