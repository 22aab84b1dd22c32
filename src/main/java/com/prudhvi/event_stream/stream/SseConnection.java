package com.prudhvi.event_stream.stream;

import com.prudhvi.event_stream.auth.AuthContext;
import com.prudhvi.event_stream.auth.AuthSnapshot;
import com.prudhvi.event_stream.auth.AuthorizationException;
import com.prudhvi.event_stream.auth.AuthorizationProvider;
import com.prudhvi.event_stream.capability.CapabilityMatcher;
import com.prudhvi.event_stream.event.BusEvent;
import com.prudhvi.event_stream.event.ScopeType;
import com.prudhvi.event_stream.registry.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One client event stream.
 *
 * Lifecycle: CREATED → OPEN → CLOSED. open() must succeed before anything is sent; CLOSED is
 * terminal and every operation after it is a no-op. A refresh in progress does not hold up
 * send() or ping(); they keep using the previous snapshot until the new one is swapped in.
 *
 * The subscriptions are compiled once here and never change. The authorization snapshot is
 * replaced whole by every successful refresh.
 */
public class SseConnection {

    private static final Logger log = LoggerFactory.getLogger(SseConnection.class);

    enum State { CREATED, OPEN, CLOSED }

    private final String id = UUID.randomUUID().toString();
    private final ScopeType scopeType;
    private final AuthContext context;
    private final CapabilityMatcher subscriptions;
    private final OutboundChannel channel;
    private final AuthorizationProvider authorizationProvider;
    private final ConnectionRegistry registry;
    private final SseFrameEncoder frames;

    private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);
    private final AtomicLong droppedFrames = new AtomicLong();

    // Null until open() succeeds.
    private volatile AuthSnapshot auth;

    // Registry identity, fixed by the snapshot fetched in open().
    private volatile String tenantId;
    private volatile String principalId;

    public SseConnection(ScopeType scopeType,
                         AuthContext context,
                         CapabilityMatcher subscriptions,
                         OutboundChannel channel,
                         AuthorizationProvider authorizationProvider,
                         ConnectionRegistry registry,
                         SseFrameEncoder frames) {
        this.scopeType = scopeType;
        this.context = context;
        this.subscriptions = subscriptions;
        this.channel = channel;
        this.authorizationProvider = authorizationProvider;
        this.registry = registry;
        this.frames = frames;
        channel.onClosed(() -> state.set(State.CLOSED));
    }

    /**
     * Fetches the first snapshot, records this stream in the registry and starts accepting frames.
     * Authorization and registry failures propagate; the connection then stays unopened.
     */
    public void open() {
        if (state.get() != State.CREATED) {
            throw new IllegalStateException("Connection " + id + " was already opened");
        }
        AuthSnapshot snapshot = authorizationProvider.fetch(context);
        this.tenantId = snapshot.tenantId();
        this.principalId = snapshot.principalId();
        this.auth = snapshot;
        registry.register(tenantId, principalId, id);

        if (!state.compareAndSet(State.CREATED, State.OPEN)) {
            // Closed while we were opening.
            return;
        }
        channel.offer(frames.comment("connected"));
        log.debug("Connection {} opened for tenant={} principal={} scope={}",
                id, tenantId, principalId, scopeType.wireName());
    }

    /**
     * Queues the event for writing. Never blocks: if the outbound buffer is full the frame is
     * dropped, counted and logged at DEBUG.
     *
     * @return true if the frame was queued
     */
    public boolean send(BusEvent event) {
        if (state.get() != State.OPEN) {
            return false;
        }
        if (!channel.offer(frames.event(event))) {
            long dropped = droppedFrames.incrementAndGet();
            log.debug("Dropped {} frame for connection {} (outbound buffer full or closing, {} dropped so far)",
                    event.eventName().wireName(), id, dropped);
            return false;
        }
        return true;
    }

    /**
     * Writes a keep-alive frame and renews this stream's liveness marker.
     * A registry failure propagates to the caller after the frame has been queued.
     */
    public void ping() {
        if (state.get() != State.OPEN) {
            return;
        }
        if (!channel.offer(frames.ping())) {
            droppedFrames.incrementAndGet();
        }
        registry.renew(tenantId, principalId, id);
    }

    /**
     * Re-fetches the authorization snapshot and swaps it in.
     *
     * AuthorizationException: the identity lost access. Pending frames are discarded, one error
     * frame is written even when the buffer is full, and the stream is closed gracefully.
     * Anything else: the stream is torn down with a transport error. Nothing is rethrown.
     */
    public void refresh() {
        if (state.get() != State.OPEN) {
            return;
        }
        try {
            this.auth = authorizationProvider.fetch(context);
        } catch (AuthorizationException e) {
            log.info("Connection {} lost authorization for tenant={} principal={}: {}",
                    id, tenantId, principalId, e.getMessage());
            if (state.getAndSet(State.CLOSED) != State.CLOSED) {
                channel.completeWith(frames.error("unauthorized", e.getMessage()));
            }
        } catch (RuntimeException e) {
            log.error("Connection {} failed to refresh authorization, terminating stream", id, e);
            if (state.getAndSet(State.CLOSED) != State.CLOSED) {
                channel.completeWithError(e);
            }
        }
    }

    /**
     * Ends the stream after any queued frames are written. Safe to call repeatedly and
     * concurrently with send().
     */
    public void close() {
        if (state.getAndSet(State.CLOSED) == State.CLOSED) {
            return;
        }
        channel.complete();
    }

    /**
     * The current authorization snapshot.
     *
     * @throws IllegalStateException if open() has not completed
     */
    public AuthSnapshot auth() {
        AuthSnapshot current = auth;
        if (current == null) {
            throw new IllegalStateException("Connection " + id + " has no authorization before open()");
        }
        return current;
    }

    public boolean isOpen() {
        return state.get() == State.OPEN && !channel.isClosed();
    }

    public boolean isClosed() {
        return state.get() == State.CLOSED || channel.isClosed();
    }

    /** Runs once when the underlying channel closes, whichever path closed it. */
    public void onClosed(Runnable callback) {
        channel.onClosed(callback);
    }

    public String id() {
        return id;
    }

    public ScopeType scopeType() {
        return scopeType;
    }

    public CapabilityMatcher subscriptions() {
        return subscriptions;
    }

    public String tenantId() {
        return tenantId;
    }

    public String principalId() {
        return principalId;
    }

    public long droppedFrames() {
        return droppedFrames.get();
    }

    State state() {
        return state.get();
    }
}
