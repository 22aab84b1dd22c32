package com.prudhvi.event_stream.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.net.http.HttpClient;

/**
 * Threads and clients shared by the stream service.
 *
 * emitterWriter: drains each connection's outbound queue into the servlet response.
 * maintenanceScheduler: drives the heartbeat and auth-refresh sweeps.
 */
@Configuration
@EnableConfigurationProperties(EventStreamProperties.class)
public class StreamConfig {

    @Bean
    public ThreadPoolTaskExecutor emitterWriter() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("sse-writer-");
        return executor;
    }

    @Bean
    public ThreadPoolTaskScheduler maintenanceScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("sse-maintenance-");
        return scheduler;
    }

    // A single HttpClient is created once and reused. It manages its own
    // internal connection pool.
    @Bean
    public HttpClient permissionHttpClient() {
        return HttpClient.newHttpClient();
    }
}
