package com.prudhvi.event_stream.stream;

import com.prudhvi.event_stream.event.BusEvent;
import com.prudhvi.event_stream.event.EventName;
import com.prudhvi.event_stream.event.ScopeType;

/**
 * JSON body of a frame's {@code data:} line.
 *
 * data is the single record object for a single-record event and an array of records for a batch.
 * time is epoch milliseconds, the same value written to the frame's {@code id:} line.
 */
public record EventEnvelope(String tenantId, ScopeType scopeType, EventName event, Long time, Object data) {

    static EventEnvelope of(BusEvent event) {
        Object data = event.batch() ? event.payload() : event.payload().get(0);
        Long time = event.time() == null ? null : event.time().toEpochMilli();
        return new EventEnvelope(event.tenantId(), event.scopeType(), event.eventName(), time, data);
    }
}
