package com.prudhvi.event_stream.stream;

import com.prudhvi.event_stream.auth.AuthSnapshot;
import com.prudhvi.event_stream.auth.AuthorizationProvider;
import com.prudhvi.event_stream.capability.CapabilityMatcher;
import com.prudhvi.event_stream.config.EventStreamProperties;
import com.prudhvi.event_stream.event.BusEvent;
import com.prudhvi.event_stream.event.EventBus;
import com.prudhvi.event_stream.event.EventRecord;
import com.prudhvi.event_stream.registry.ConnectionRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Bridges the event bus to the client streams held by this process.
 *
 * Fan-out: the service holds one bus subscription. Each bus event is filtered for every local
 * connection on the listener thread, against that connection's subscriptions and live
 * permissions, and then queued on its channel. Queuing never waits on a client socket, so one
 * thread keeps up with every connection and each connection sees events in bus order.
 *
 * Authorization is checked per record, per event, per connection. Grants and revocations take
 * effect on the next event without any cache to invalidate; the periodic refresh covers the
 * case where permissions shrink and no event arrives to notice it.
 *
 * Maintenance: a heartbeat sweep pings every open connection (keep-alive frame + registry TTL
 * renewal) and a slower sweep refreshes every connection's authorization snapshot. A failure on
 * one connection is logged and the sweep moves on.
 *
 * Cleanup: a connection can end because the client left, because its authorization was revoked,
 * or because the service is shutting down. All three paths end in cleanup(), where removal from
 * the local map decides who does the work, so the registry record is removed exactly once.
 */
@Service
public class EventDistributionService {

    private static final Logger log = LoggerFactory.getLogger(EventDistributionService.class);

    private final EventBus eventBus;
    private final AuthorizationProvider authorizationProvider;
    private final ConnectionRegistry registry;
    private final SseFrameEncoder frames;
    private final TaskScheduler scheduler;
    private final EventStreamProperties properties;

    // connectionId -> connection, for streams whose socket lives in this process
    private final Map<String, SseConnection> connections = new ConcurrentHashMap<>();

    private EventBus.Subscription busSubscription;
    private ScheduledFuture<?> heartbeatTask;
    private ScheduledFuture<?> refreshTask;

    public EventDistributionService(EventBus eventBus,
                                    AuthorizationProvider authorizationProvider,
                                    ConnectionRegistry registry,
                                    SseFrameEncoder frames,
                                    @Qualifier("maintenanceScheduler") TaskScheduler scheduler,
                                    EventStreamProperties properties) {
        this.eventBus = eventBus;
        this.authorizationProvider = authorizationProvider;
        this.registry = registry;
        this.frames = frames;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    /**
     * Subscribes to the bus and starts both sweeps. Each sweep first runs one full
     * interval after startup.
     */
    @PostConstruct
    public synchronized void start() {
        if (busSubscription != null) {
            return;
        }
        busSubscription = eventBus.subscribe(this::fanOut);
        Instant now = Instant.now();
        heartbeatTask = scheduler.scheduleAtFixedRate(this::heartbeat,
                now.plus(properties.getHeartbeatInterval()), properties.getHeartbeatInterval());
        refreshTask = scheduler.scheduleAtFixedRate(this::refreshAll,
                now.plus(properties.getRefreshInterval()), properties.getRefreshInterval());
        log.info("Event distribution started (heartbeat every {}, auth refresh every {})",
                properties.getHeartbeatInterval(), properties.getRefreshInterval());
    }

    /**
     * Opens a stream on the given channel and starts delivering to it.
     *
     * @throws com.prudhvi.event_stream.auth.AuthorizationException if the identity is not authorized;
     *         the channel is closed and nothing was registered
     * @throws TooManyConnectionsException if the principal is over its stream limit
     */
    public SseConnection subscribe(SubscribeRequest request, OutboundChannel channel) {
        SseConnection connection = new SseConnection(
                request.scopeType(),
                request.context(),
                CapabilityMatcher.compile(request.subscriptions()),
                channel,
                authorizationProvider,
                registry,
                frames);

        try {
            connection.open();
        } catch (RuntimeException e) {
            connection.close();
            throw e;
        }

        connections.put(connection.id(), connection);
        connection.onClosed(() -> cleanup(connection));

        int limit = properties.getMaxConnectionsPerPrincipal();
        long active = getActiveConnectionsCount(connection.tenantId(), connection.principalId());
        if (limit > 0 && active > limit) {
            cleanup(connection);
            connection.close();
            throw new TooManyConnectionsException(connection.tenantId(), connection.principalId(), limit);
        }

        log.info("Stream {} opened: tenant={} principal={} scope={} subscriptions={}",
                connection.id(), connection.tenantId(), connection.principalId(),
                connection.scopeType().wireName(), connection.subscriptions().size());
        return connection;
    }

    /**
     * Bus listener. Queues the permitted part of the event on every local connection.
     */
    void fanOut(BusEvent event) {
        for (SseConnection connection : connections.values()) {
            deliver(connection, event);
        }
    }

    private void deliver(SseConnection connection, BusEvent event) {
        try {
            filterEventsForClient(connection, event).ifPresent(connection::send);
        } catch (RuntimeException e) {
            log.warn("Delivery of {} to stream {} failed: {}", event.type(), connection.id(), e.getMessage(), e);
        }
    }

    /**
     * Decides what, if anything, of this event the connection may see.
     *
     * The event must be for the connection's tenant and scope type. Each record must then be
     * allowed both by the connection's own subscriptions and by its current permissions.
     * Records that fail are removed; if none are left the result is empty.
     */
    Optional<BusEvent> filterEventsForClient(SseConnection connection, BusEvent event) {
        if (!connection.isOpen()) {
            return Optional.empty();
        }
        if (event.scopeType() != connection.scopeType()) {
            return Optional.empty();
        }
        if (!event.tenantId().equals(connection.tenantId())) {
            return Optional.empty();
        }

        AuthSnapshot auth = connection.auth();
        List<EventRecord> subscribed = connection.subscriptions()
                .filter(event.scopeType(), event.eventName(), event.payload());
        List<EventRecord> allowed = auth.capabilities()
                .filter(event.scopeType(), event.eventName(), subscribed);
        if (allowed.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(allowed.size() == event.payload().size() ? event : event.withPayload(allowed));
    }

    void heartbeat() {
        for (SseConnection connection : connections.values()) {
            if (connection.isClosed()) {
                continue;
            }
            try {
                connection.ping();
            } catch (RuntimeException e) {
                log.warn("Heartbeat failed for stream {}: {}", connection.id(), e.getMessage());
            }
        }
    }

    void refreshAll() {
        for (SseConnection connection : connections.values()) {
            if (connection.isClosed()) {
                continue;
            }
            try {
                connection.refresh();
            } catch (RuntimeException e) {
                log.warn("Auth refresh failed for stream {}: {}", connection.id(), e.getMessage());
            }
        }
    }

    /**
     * Streams of this principal alive anywhere in the fleet. Prunes expired entries as it goes.
     */
    public long getActiveConnectionsCount(String tenantId, String principalId) {
        return registry.countActive(tenantId, principalId);
    }

    public int localConnectionCount() {
        return connections.size();
    }

    private void cleanup(SseConnection connection) {
        if (!connections.remove(connection.id(), connection)) {
            return;
        }
        try {
            registry.remove(connection.tenantId(), connection.principalId(), connection.id());
        } catch (RuntimeException e) {
            // The marker expires on its own once heartbeats stop.
            log.warn("Could not remove stream {} from registry: {}", connection.id(), e.getMessage());
        }
        log.info("Stream {} closed: tenant={} principal={} dropped={}",
                connection.id(), connection.tenantId(), connection.principalId(), connection.droppedFrames());
    }

    /**
     * Stops the sweeps, leaves the bus and closes every local stream. For process shutdown.
     */
    @PreDestroy
    public synchronized void close() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
        if (refreshTask != null) {
            refreshTask.cancel(false);
            refreshTask = null;
        }
        if (busSubscription != null) {
            busSubscription.close();
            busSubscription = null;
        }
        List<SseConnection> open = new ArrayList<>(connections.values());
        for (SseConnection connection : open) {
            connection.close();
            cleanup(connection);
        }
        log.info("Event distribution stopped, {} stream(s) closed", open.size());
    }
}
