package com.example.console.observability.health;

import com.example.console.config.properties.IdentityGatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reports whether the identity gateway answers its unauthenticated health endpoint.
 */
@Slf4j
@Component
public class IdentityGatewayHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final WebClient webClient;
    private final String healthUrl;

    public IdentityGatewayHealthIndicator(WebClient.Builder webClientBuilder, IdentityGatewayProperties properties) {
        this.webClient = webClientBuilder.build();
        this.healthUrl = properties.baseUrl() + properties.healthPath();
    }

    @Override
    public Mono<Health> health() {
        return webClient.get()
                .uri(healthUrl)
                .retrieve()
                .toBodilessEntity()
                .timeout(TIMEOUT)
                .map(response -> Health.up()
                        .withDetail("url", healthUrl)
                        .build())
                .onErrorResume(error -> {
                    log.warn("Identity gateway health check failed: {}", error.getMessage());
                    return Mono.just(Health.down()
                            .withDetail("url", healthUrl)
                            .withDetail("error", String.valueOf(error.getMessage()))
                            .build());
                });
    }
}
