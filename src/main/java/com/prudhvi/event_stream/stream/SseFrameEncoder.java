package com.prudhvi.event_stream.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prudhvi.event_stream.event.BusEvent;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns events into Server-Sent Event text frames.
 *
 * One frame per event, blank line terminated:
 * <pre>
 * id: 1718000000000
 * event: secret:created
 * data: {"tenantId":"t1","scopeType":"secrets","event":"secret:created","time":1718000000000,"data":{...}}
 *
 * </pre>
 * Lines are omitted when their value is absent. A keep-alive is just {@code event: ping}.
 */
@Component
public class SseFrameEncoder {

    static final String PING = "event: ping\n\n";

    private final ObjectMapper objectMapper;

    public SseFrameEncoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String event(BusEvent event) {
        String id = event.time() == null ? null : String.valueOf(event.time().toEpochMilli());
        return frame(id, event.eventName().wireName(), toJson(EventEnvelope.of(event)));
    }

    public String ping() {
        return PING;
    }

    /**
     * A terminal error notice. Clients see {@code event: error} followed by the stream ending.
     */
    public String error(String code, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("code", code);
        body.put("message", message);
        return frame(null, "error", toJson(body));
    }

    /**
     * An SSE comment. EventSource ignores it, but writing it commits the response headers.
     */
    public String comment(String text) {
        return ": " + text + "\n\n";
    }

    static String frame(String id, String event, String data) {
        StringBuilder frame = new StringBuilder();
        if (id != null) {
            frame.append("id: ").append(id).append('\n');
        }
        if (event != null) {
            frame.append("event: ").append(event).append('\n');
        }
        if (data != null) {
            // A newline inside data would end the field early; each line gets its own data: prefix.
            for (String line : data.split("\n", -1)) {
                frame.append("data: ").append(line).append('\n');
            }
        }
        return frame.append('\n').toString();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize event frame", e);
        }
    }
}
