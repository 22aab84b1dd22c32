package com.prudhvi.event_stream.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables under the {@code events.*} prefix in application.yaml.
 *
 * Lombok's @Getter / @Setter give Spring the JavaBean accessors it binds through.
 */
@ConfigurationProperties(prefix = "events")
@Getter
@Setter
public class EventStreamProperties {

    // How often every open stream gets a keep-alive frame and a registry TTL renewal.
    private Duration heartbeatInterval = Duration.ofSeconds(15);

    // How often every open stream re-fetches its authorization snapshot.
    private Duration refreshInterval = Duration.ofSeconds(60);

    // Lifetime of a liveness marker in Redis. Keep it a comfortable multiple of heartbeatInterval.
    private Duration registryTtl = Duration.ofSeconds(60);

    // Frames buffered per connection before new frames are dropped.
    private int channelCapacity = 256;

    // Servlet async timeout for a stream. Zero means no server-side timeout.
    private Duration emitterTimeout = Duration.ZERO;

    private int maxConnectionsPerPrincipal = 10;

    private Bus bus = new Bus();

    private PermissionService permissionService = new PermissionService();

    @Getter
    @Setter
    public static class Bus {
        private String topic = "platform.events";
    }

    @Getter
    @Setter
    public static class PermissionService {
        private String baseUrl = "http://localhost:8080";
        private Duration timeout = Duration.ofSeconds(5);
    }
}
