package com.example.console.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.lang.NonNull;

import java.time.Duration;

/**
 * Connection settings for the identity gateway that owns roles, permissions and
 * ABAC policy state.
 */
@ConfigurationProperties(prefix = "app.identity-gateway")
public record IdentityGatewayProperties(
        @NonNull String baseUrl,
        @NonNull Duration timeout,
        @NonNull Duration connectTimeout,
        int maxConnections,
        int maxInMemorySizeKb,
        @NonNull String healthPath
) {
    public IdentityGatewayProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "http://localhost:8080";
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(10);
        }
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(5);
        }
        if (maxConnections <= 0) {
            maxConnections = 50;
        }
        if (maxInMemorySizeKb <= 0) {
            maxInMemorySizeKb = 1024;
        }
        if (healthPath == null || healthPath.isBlank()) {
            healthPath = "/health";
        }
    }
}
