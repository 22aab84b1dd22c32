package com.prudhvi.event_stream.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * An event as it travels over the bus.
 *
 * The payload is never empty. When {@code batch} is false it holds exactly
 * one record and is written to clients as a single JSON object; otherwise it
 * is written as an array. {@code time} becomes the frame id.
 */
public record BusEvent(
        String tenantId,
        DomainEventType type,
        List<EventRecord> payload,
        boolean batch,
        Instant time
) {

    public BusEvent {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(type, "type");
        if (payload == null || payload.isEmpty()) {
            throw new IllegalArgumentException("Bus event payload must not be empty");
        }
        if (!batch && payload.size() != 1) {
            throw new IllegalArgumentException("A single-record event must carry exactly one record");
        }
        payload = List.copyOf(payload);
    }

    public static BusEvent single(String tenantId, DomainEventType type, EventRecord record, Instant time) {
        return new BusEvent(tenantId, type, List.of(record), false, time);
    }

    public static BusEvent batch(String tenantId, DomainEventType type, List<EventRecord> records, Instant time) {
        return new BusEvent(tenantId, type, records, true, time);
    }

    @JsonIgnore
    public ScopeType scopeType() {
        return type.scopeType();
    }

    @JsonIgnore
    public EventName eventName() {
        return type.eventName();
    }

    /**
     * Returns a copy of this event carrying only the given records.
     * The batch flag is preserved so a filtered batch stays an array on the wire.
     */
    public BusEvent withPayload(List<EventRecord> records) {
        return new BusEvent(tenantId, type, records, batch, time);
    }
}
