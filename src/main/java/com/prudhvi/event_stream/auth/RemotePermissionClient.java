package com.prudhvi.event_stream.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prudhvi.event_stream.capability.CapabilityMatcher;
import com.prudhvi.event_stream.capability.CapabilityRule;
import com.prudhvi.event_stream.config.EventStreamProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Fetches authorization snapshots from the platform's permission service.
 *
 * GET {base-url}/v1/permissions?tenantId=...  with the stream's bearer token.
 * The response lists the principal's event grants in the same shape clients use
 * for their subscriptions:
 *
 *   { "principalId": "...", "tenantId": "...",
 *     "grants": [ { "subject": "secrets", "action": "secret:created",
 *                   "conditions": { "secretPath": "/app/**", "environment": "prod" } } ] }
 *
 * 401 / 403 / 404 mean the identity is no longer acceptable and map to
 * {@link AuthorizationException}. Everything else is an outage.
 *
 * Calls go through the "permission-service" circuit breaker (config in application.yaml).
 * AuthorizationException is configured as ignored there, so revocations never trip it.
 */
@Service
public class RemotePermissionClient implements AuthorizationProvider {

    private static final Logger log = LoggerFactory.getLogger(RemotePermissionClient.class);

    static final String BREAKER_NAME = "permission-service";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final String baseUrl;
    private final Duration timeout;

    public RemotePermissionClient(HttpClient httpClient, ObjectMapper objectMapper,
                                  CircuitBreakerRegistry circuitBreakers, EventStreamProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.circuitBreaker = circuitBreakers.circuitBreaker(BREAKER_NAME);
        this.baseUrl = properties.getPermissionService().getBaseUrl();
        this.timeout = properties.getPermissionService().getTimeout();
    }

    @Override
    public AuthSnapshot fetch(AuthContext context) {
        try {
            return circuitBreaker.executeSupplier(() -> call(context));
        } catch (CallNotPermittedException e) {
            throw new PermissionServiceException("Permission service circuit breaker is open", e);
        }
    }

    private AuthSnapshot call(AuthContext context) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/v1/permissions?tenantId="
                        + URLEncoder.encode(context.tenantId(), StandardCharsets.UTF_8)))
                .header("Authorization", "Bearer " + context.actorToken())
                .header("Accept", "application/json")
                .timeout(timeout)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PermissionServiceException("Permission lookup interrupted", e);
        } catch (IOException e) {
            throw new PermissionServiceException("Permission service unreachable: " + e.getMessage(), e);
        }

        int status = response.statusCode();
        if (status == 401 || status == 403 || status == 404) {
            log.debug("Permission service rejected identity for tenant={} with status {}", context.tenantId(), status);
            throw new AuthorizationException("Access to tenant " + context.tenantId() + " denied (" + status + ")");
        }
        if (status / 100 != 2) {
            throw new PermissionServiceException("Permission service returned status " + status);
        }

        try {
            PermissionResponse body = objectMapper.readValue(response.body(), PermissionResponse.class);
            return new AuthSnapshot(body.principalId(), body.tenantId(), CapabilityMatcher.compile(body.grants()));
        } catch (JsonProcessingException | RuntimeException e) {
            throw new PermissionServiceException("Malformed permission service response", e);
        }
    }

    record PermissionResponse(String principalId, String tenantId, List<CapabilityRule> grants) {}
}
