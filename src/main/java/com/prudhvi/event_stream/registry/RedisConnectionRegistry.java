package com.prudhvi.event_stream.registry;

import com.prudhvi.event_stream.config.EventStreamProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Connection registry backed by Redis.
 *
 * Two kinds of keys per (tenant, principal):
 *   sse:active-set:{tenant}:{principal}                 — Set of connection ids
 *   sse:active:{tenant}:{principal}:{connectionId}      — marker String with a TTL
 *
 * The set lets us list a principal's streams without asking every process. The markers
 * prove liveness: an id in the set whose marker has expired belongs to a dead stream and is
 * removed the next time somebody counts.
 *
 * Every operation is a single Redis command (or a sequence whose partial failure is harmless),
 * so no client-side locking is needed even with many processes writing to the same keys.
 */
@Component
public class RedisConnectionRegistry implements ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(RedisConnectionRegistry.class);

    static final String SET_PREFIX = "sse:active-set:";
    static final String RECORD_PREFIX = "sse:active:";

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;

    public RedisConnectionRegistry(StringRedisTemplate redisTemplate, EventStreamProperties properties) {
        this.redisTemplate = redisTemplate;
        this.ttl = properties.getRegistryTtl();
    }

    @Override
    public void register(String tenantId, String principalId, String connectionId) {
        mark(tenantId, principalId, connectionId);
        log.debug("Registered connection {} for tenant={} principal={}", connectionId, tenantId, principalId);
    }

    /**
     * Re-adds the id to the set as well as refreshing the marker, so an id that a concurrent
     * count pruned during a brief outage comes back on the next heartbeat.
     */
    @Override
    public void renew(String tenantId, String principalId, String connectionId) {
        mark(tenantId, principalId, connectionId);
    }

    @Override
    public void remove(String tenantId, String principalId, String connectionId) {
        redisTemplate.opsForSet().remove(setKey(tenantId, principalId), connectionId);
        redisTemplate.delete(recordKey(tenantId, principalId, connectionId));
        log.debug("Removed connection {} for tenant={} principal={}", connectionId, tenantId, principalId);
    }

    /**
     * Returns 0 when Redis is unavailable (fail-open): liveness accounting degrades,
     * the caller keeps working.
     */
    @Override
    public long countActive(String tenantId, String principalId) {
        String setKey = setKey(tenantId, principalId);
        try {
            Set<String> members = redisTemplate.opsForSet().members(setKey);
            if (members == null || members.isEmpty()) {
                return 0;
            }

            List<String> ids = new ArrayList<>(members);
            List<String> recordKeys = ids.stream()
                    .map(id -> recordKey(tenantId, principalId, id))
                    .toList();
            List<String> markers = redisTemplate.opsForValue().multiGet(recordKeys);

            List<String> stale = new ArrayList<>();
            for (int i = 0; i < ids.size(); i++) {
                if (markers == null || markers.get(i) == null) {
                    stale.add(ids.get(i));
                }
            }
            if (!stale.isEmpty()) {
                // SREM of an id already removed by a concurrent caller is a no-op.
                redisTemplate.opsForSet().remove(setKey, stale.toArray());
                log.debug("Evicted {} stale connection(s) for tenant={} principal={}",
                        stale.size(), tenantId, principalId);
            }
            return ids.size() - stale.size();

        } catch (DataAccessException e) {
            log.warn("Connection registry unavailable while counting tenant={} principal={}: {}",
                    tenantId, principalId, e.getMessage());
            return 0;
        }
    }

    private void mark(String tenantId, String principalId, String connectionId) {
        String setKey = setKey(tenantId, principalId);
        redisTemplate.opsForSet().add(setKey, connectionId);
        // The set outlives its members by one TTL so an abandoned principal's set cleans itself up.
        redisTemplate.expire(setKey, ttl.multipliedBy(2));
        redisTemplate.opsForValue().set(recordKey(tenantId, principalId, connectionId), "1", ttl);
    }

    static String setKey(String tenantId, String principalId) {
        return SET_PREFIX + tenantId + ":" + principalId;
    }

    static String recordKey(String tenantId, String principalId, String connectionId) {
        return RECORD_PREFIX + tenantId + ":" + principalId + ":" + connectionId;
    }
}
