package com.example.console.gateway;

import com.example.console.common.AdminOperation;
import com.example.console.common.exception.ConsoleException;
import com.example.console.common.exception.GatewayException;
import com.example.console.config.IdentityGatewayWebClientConfig;
import com.example.console.config.properties.IdentityGatewayProperties;
import com.example.console.observability.filter.CorrelationIdFilter;
import com.example.console.observability.metrics.ConsoleMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Single round-trip calls to the identity gateway.
 *
 * <p>Every call is bounded by {@code app.identity-gateway.timeout}, forwards the
 * request correlation id and is never retried. Non-2xx responses become
 * {@link GatewayException}s carrying the gateway's own message and the console
 * operation that issued the call.
 */
@Slf4j
@Component
public class IdentityGatewayClient {

    private static final int MAX_RAW_MESSAGE_LENGTH = 200;

    private final WebClient webClient;
    private final IdentityGatewayProperties properties;
    private final ConsoleMetrics metrics;
    private final ObjectMapper objectMapper;

    public IdentityGatewayClient(
            @Qualifier(IdentityGatewayWebClientConfig.IDENTITY_GATEWAY_WEBCLIENT) WebClient webClient,
            IdentityGatewayProperties properties,
            ConsoleMetrics metrics,
            ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.properties = properties;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    /**
     * GET returning the unwrapped {@code data} payload. Completes empty when the
     * gateway sends {@code data: null}.
     */
    @NonNull
    public <T> Mono<T> get(@NonNull AdminOperation operation,
                           @NonNull ParameterizedTypeReference<GatewayEnvelope<T>> type,
                           @NonNull String uri, Object... uriVariables) {
        return send(operation, HttpMethod.GET, null, type, uri, uriVariables);
    }

    /**
     * Any method with an optional JSON body, returning the unwrapped {@code data} payload.
     */
    @NonNull
    public <T> Mono<T> send(@NonNull AdminOperation operation, @NonNull HttpMethod method, @Nullable Object body,
                            @NonNull ParameterizedTypeReference<GatewayEnvelope<T>> type,
                            @NonNull String uri, Object... uriVariables) {
        return call(operation, method, body, uri, uriVariables,
                response -> response.bodyToMono(type).flatMap(envelope -> Mono.justOrEmpty(envelope.data())));
    }

    /**
     * Any method whose response body (usually {@code {"message": ...}}) is not needed.
     */
    @NonNull
    public Mono<Void> execute(@NonNull AdminOperation operation, @NonNull HttpMethod method, @Nullable Object body,
                              @NonNull String uri, Object... uriVariables) {
        return call(operation, method, body, uri, uriVariables, response -> response.toBodilessEntity().then());
    }

    private <R> Mono<R> call(AdminOperation operation, HttpMethod method, @Nullable Object body,
                             String uri, Object[] uriVariables,
                             Function<WebClient.ResponseSpec, Mono<R>> extractor) {
        Duration timeout = properties.timeout();

        return Mono.deferContextual(context -> {
            long started = System.nanoTime();
            log.debug("{} -> {} {}", operation, method, uri);

            WebClient.RequestBodySpec request = webClient.method(method).uri(uri, uriVariables);
            CorrelationIdFilter.correlationId(context)
                    .ifPresent(id -> request.header(CorrelationIdFilter.CORRELATION_ID_HEADER, id));
            WebClient.RequestHeadersSpec<?> spec = body != null ? request.bodyValue(body) : request;

            WebClient.ResponseSpec response = spec.retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(),
                            clientResponse -> clientResponse.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(raw -> toGatewayError(operation, clientResponse.statusCode(), raw)));

            return extractor.apply(response)
                    .timeout(timeout)
                    .onErrorMap(error -> translate(operation, timeout, error))
                    .doOnSuccess(result -> metrics.recordGatewayCall(operation, true, elapsedSince(started)))
                    .doOnError(error -> {
                        metrics.recordGatewayCall(operation, false, elapsedSince(started));
                        log.warn("{} -> {} {} failed: {}", operation, method, uri, error.getMessage());
                    });
        });
    }

    @NonNull
    GatewayException toGatewayError(AdminOperation operation, HttpStatusCode status, String rawBody) {
        return GatewayException.fromResponse(operation, status, extractMessage(status, rawBody), rawBody);
    }

    private String extractMessage(HttpStatusCode status, String rawBody) {
        if (!rawBody.isBlank()) {
            try {
                GatewayErrorBody error = objectMapper.readValue(rawBody, GatewayErrorBody.class);
                if (error != null && error.message() != null && !error.message().isBlank()) {
                    return error.message();
                }
                if (error != null && error.error() != null && !error.error().isBlank()) {
                    return error.error();
                }
            } catch (JsonProcessingException e) {
                log.debug("Gateway error body is not JSON: {}", e.getOriginalMessage());
                return rawBody.length() > MAX_RAW_MESSAGE_LENGTH
                        ? rawBody.substring(0, MAX_RAW_MESSAGE_LENGTH)
                        : rawBody;
            }
        }
        return "Identity gateway returned HTTP " + status.value();
    }

    private Throwable translate(AdminOperation operation, Duration timeout, Throwable error) {
        if (error instanceof ConsoleException) {
            return error;
        }
        if (error instanceof TimeoutException || error.getCause() instanceof io.netty.handler.timeout.TimeoutException) {
            return GatewayException.timeout(operation, timeout, error);
        }
        if (error instanceof WebClientRequestException) {
            return GatewayException.unavailable(operation, error);
        }
        if (error instanceof CodecException) {
            return GatewayException.malformedResponse(operation, error);
        }
        return error;
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
