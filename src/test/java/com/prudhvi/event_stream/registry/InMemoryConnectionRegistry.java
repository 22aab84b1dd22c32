package com.prudhvi.event_stream.registry;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry with Redis-like TTL semantics and a clock the test moves by hand.
 */
public class InMemoryConnectionRegistry implements ConnectionRegistry {

    private final Duration ttl;
    private volatile Instant now = Instant.parse("2024-01-01T00:00:00Z");

    private final Map<String, Set<String>> sets = new ConcurrentHashMap<>();
    private final Map<String, Instant> expiries = new ConcurrentHashMap<>();
    private final Set<String> failingPrincipals = ConcurrentHashMap.newKeySet();
    private final AtomicInteger removals = new AtomicInteger();

    public InMemoryConnectionRegistry(Duration ttl) {
        this.ttl = ttl;
    }

    @Override
    public void register(String tenantId, String principalId, String connectionId) {
        mark(tenantId, principalId, connectionId);
    }

    @Override
    public void renew(String tenantId, String principalId, String connectionId) {
        if (failingPrincipals.contains(principalId)) {
            throw new IllegalStateException("registry unavailable");
        }
        mark(tenantId, principalId, connectionId);
    }

    @Override
    public void remove(String tenantId, String principalId, String connectionId) {
        removals.incrementAndGet();
        Set<String> ids = sets.get(setKey(tenantId, principalId));
        if (ids != null) {
            ids.remove(connectionId);
        }
        expiries.remove(recordKey(tenantId, principalId, connectionId));
    }

    @Override
    public long countActive(String tenantId, String principalId) {
        Set<String> ids = sets.get(setKey(tenantId, principalId));
        if (ids == null) {
            return 0;
        }
        long alive = 0;
        for (String id : new HashSet<>(ids)) {
            Instant expiry = expiries.get(recordKey(tenantId, principalId, id));
            if (expiry == null || !expiry.isAfter(now)) {
                ids.remove(id);
            } else {
                alive++;
            }
        }
        return alive;
    }

    public void advance(Duration duration) {
        now = now.plus(duration);
    }

    public boolean listed(String tenantId, String principalId, String connectionId) {
        Set<String> ids = sets.get(setKey(tenantId, principalId));
        return ids != null && ids.contains(connectionId);
    }

    public void failRenewalsFor(String principalId) {
        failingPrincipals.add(principalId);
    }

    public int removals() {
        return removals.get();
    }

    private void mark(String tenantId, String principalId, String connectionId) {
        sets.computeIfAbsent(setKey(tenantId, principalId), k -> ConcurrentHashMap.newKeySet()).add(connectionId);
        expiries.put(recordKey(tenantId, principalId, connectionId), now.plus(ttl));
    }

    private static String setKey(String tenantId, String principalId) {
        return tenantId + ":" + principalId;
    }

    private static String recordKey(String tenantId, String principalId, String connectionId) {
        return tenantId + ":" + principalId + ":" + connectionId;
    }
}
