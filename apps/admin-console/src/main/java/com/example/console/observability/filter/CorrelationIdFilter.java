package com.example.console.observability.filter;

import com.example.console.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;
import reactor.util.context.ContextView;

import java.util.Optional;
import java.util.UUID;

/**
 * Gives every console request a correlation id.
 *
 * The id is taken from X-Correlation-Id (or X-Request-Id), generated when absent,
 * echoed on the response, put in MDC for logging and in the Reactor context so
 * gateway calls can forward it.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CORRELATION_ID_KEY = "correlationId";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String correlationId = extractOrGenerateCorrelationId(exchange.getRequest());
        String requestPath = exchange.getRequest().getPath().value();
        String requestMethod = exchange.getRequest().getMethod().name();

        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        return chain.filter(exchange)
                .contextWrite(Context.of(CORRELATION_ID_KEY, correlationId))
                .doFirst(() -> {
                    MDC.put(CORRELATION_ID_KEY, correlationId);
                    log.debug("Request started: {} {}", requestMethod, requestPath);
                })
                .doFinally(signalType -> {
                    log.debug("Request completed: {} {} - {}", requestMethod, requestPath, signalType);
                    MDC.remove(CORRELATION_ID_KEY);
                });
    }

    private String extractOrGenerateCorrelationId(ServerHttpRequest request) {
        String correlationId = StringSanitizer.headerValue(request.getHeaders().getFirst(CORRELATION_ID_HEADER));
        if (StringSanitizer.isValidSafeId(correlationId)) {
            return correlationId;
        }

        String requestId = StringSanitizer.headerValue(request.getHeaders().getFirst(REQUEST_ID_HEADER));
        if (StringSanitizer.isValidSafeId(requestId)) {
            return requestId;
        }

        return UUID.randomUUID().toString();
    }

    @NonNull
    public static Optional<String> correlationId(@NonNull ContextView context) {
        return context.getOrEmpty(CORRELATION_ID_KEY);
    }
}
