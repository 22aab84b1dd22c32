package com.prudhvi.event_stream.stream;

import com.prudhvi.event_stream.auth.AuthContext;
import com.prudhvi.event_stream.auth.AuthorizationException;
import com.prudhvi.event_stream.capability.CapabilityRule;
import com.prudhvi.event_stream.config.EventStreamProperties;
import com.prudhvi.event_stream.event.ScopeType;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP entry point for event streams.
 *
 * POST /api/v1/events/subscribe opens a stream. The body names the stream class and the
 * events wanted:
 *
 *   { "scopeType": "secrets",
 *     "subscriptions": [ { "subject": "secrets", "action": "secret:created",
 *                          "conditions": { "secretPath": "/app/**", "environment": "prod" } } ] }
 *
 * The response is held open (Spring MVC async) and frames flow into it through an
 * {@link EmitterChannel}. Caching and proxy buffering are disabled on the response so frames
 * reach the client as they are written.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventStreamController {

    static final String TENANT_HEADER = "X-Tenant-Id";
    private static final String BEARER_PREFIX = "Bearer ";

    private final EventDistributionService distributionService;
    private final TaskExecutor emitterWriter;
    private final EventStreamProperties properties;

    public EventStreamController(EventDistributionService distributionService,
                                 @Qualifier("emitterWriter") TaskExecutor emitterWriter,
                                 EventStreamProperties properties) {
        this.distributionService = distributionService;
        this.emitterWriter = emitterWriter;
        this.properties = properties;
    }

    @PostMapping("/subscribe")
    public ResponseEntity<ResponseBodyEmitter> subscribe(@RequestHeader(TENANT_HEADER) String tenantId,
                                                         @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
                                                         @RequestBody SubscribeBody body) {
        if (body.scopeType() == null) {
            throw new IllegalArgumentException("scopeType is required");
        }
        SubscribeRequest request = new SubscribeRequest(
                new AuthContext(tenantId, bearerToken(authorization)), body.scopeType(), body.subscriptions());

        ResponseBodyEmitter emitter = new ResponseBodyEmitter(properties.getEmitterTimeout().toMillis());
        EmitterChannel channel = new EmitterChannel(emitter, emitterWriter, properties.getChannelCapacity());
        distributionService.subscribe(request, channel);

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, "text/event-stream")
                .header(HttpHeaders.CACHE_CONTROL, "no-cache")
                .header(HttpHeaders.CONNECTION, "keep-alive")
                .header("X-Accel-Buffering", "no")
                .body(emitter);
    }

    /**
     * GET /api/v1/events/connections/count?principalId=...
     * How many streams the principal has open across all instances.
     */
    @GetMapping("/connections/count")
    public Map<String, Object> activeConnections(@RequestHeader(TENANT_HEADER) String tenantId,
                                                 @RequestParam String principalId) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("tenantId", tenantId);
        result.put("principalId", principalId);
        result.put("active", distributionService.getActiveConnectionsCount(tenantId, principalId));
        return result;
    }

    static String bearerToken(String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw new AuthorizationException("Bearer token required");
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new AuthorizationException("Bearer token required");
        }
        return token;
    }

    public record SubscribeBody(ScopeType scopeType, List<CapabilityRule> subscriptions) {}
}
