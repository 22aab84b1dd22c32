package com.prudhvi.event_stream.registry;

/**
 * Fleet-wide record of which streams are alive for a (tenant, principal) pair.
 *
 * Entries are liveness markers with a TTL. A stream that stops renewing its marker
 * (process died, heartbeats stopped) disappears on its own once the TTL passes.
 */
public interface ConnectionRegistry {

    void register(String tenantId, String principalId, String connectionId);

    void renew(String tenantId, String principalId, String connectionId);

    void remove(String tenantId, String principalId, String connectionId);

    /**
     * Counts the streams of this principal that are still alive anywhere in the fleet.
     * Ids whose marker has expired are pruned from the listing as a side effect.
     */
    long countActive(String tenantId, String principalId);
}
