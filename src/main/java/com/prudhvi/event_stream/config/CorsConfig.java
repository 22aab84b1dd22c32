package com.prudhvi.event_stream.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Lets the admin UI open event streams from its own origin.
 *
 * The allowed origin is read from an environment variable so deployments can inject
 * the production frontend URL without a code change or rebuild.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    // Set CORS_ALLOWED_ORIGIN in production. Falls back to localhost:5173 for local development.
    @Value("${cors.allowed-origin:http://localhost:5173}")
    private String allowedOrigin;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/v1/events/**")
                .allowedOrigins(allowedOrigin)
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowCredentials(true);
    }
}
