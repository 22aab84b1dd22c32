package com.prudhvi.event_stream.stream;

public class TooManyConnectionsException extends RuntimeException {

    public TooManyConnectionsException(String tenantId, String principalId, int limit) {
        super("Principal " + principalId + " already has " + limit
                + " open event streams for tenant " + tenantId);
    }
}
