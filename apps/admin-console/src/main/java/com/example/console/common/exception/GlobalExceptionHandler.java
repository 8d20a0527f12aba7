package com.example.console.common.exception;

import com.example.console.common.dto.ErrorResponse;
import com.example.console.common.util.StringSanitizer;
import com.example.console.observability.filter.CorrelationIdFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;
import java.util.Map;

/**
 * Renders every failure as an {@link ErrorResponse}.
 *
 * <p>Console exceptions keep their message, since gateway messages are shown to
 * operators verbatim. Anything unexpected is logged in full and answered with a
 * generic body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final int MAX_LOG_MESSAGE_LENGTH = 200;
    private static final int MAX_RESPONSE_MESSAGE_LENGTH = 100;

    @ExceptionHandler(ConsoleException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleConsoleException(@NonNull ConsoleException ex,
                                                                @NonNull ServerWebExchange exchange) {
        ErrorCategory category = ex.getCategory();
        if (category == ErrorCategory.UNAVAILABLE || category == ErrorCategory.TIMEOUT) {
            LOG.error("{} failed: {} ({})", ex.getOperation(),
                    StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH), ex.getCode());
        } else {
            LOG.warn("{} rejected: {} ({})", ex.getOperation(),
                    StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH), ex.getCode());
        }

        return ResponseEntity.status(category.httpStatus())
                .body(ErrorResponse.of(
                        category.error(),
                        ex.getCode(),
                        ex.getMessage(),
                        ex.getOperation().label(),
                        correlationId(exchange),
                        exchange.getRequest().getPath().value(),
                        ex.getDetails()));
    }

    /**
     * Handles validation errors from {@code @Valid} request bodies.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleValidationErrors(@NonNull WebExchangeBindException ex,
                                                                @NonNull ServerWebExchange exchange) {
        LOG.warn("Validation error: {} field errors", ex.getBindingResult().getFieldErrorCount());

        List<Map<String, String>> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", error.getField(),
                        "message", sanitizeResponseMessage(error.getDefaultMessage())))
                .toList();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(
                        ErrorResponse.Categories.VALIDATION_ERROR,
                        InvalidInputException.MISSING_FIELD,
                        "Request validation failed",
                        null,
                        correlationId(exchange),
                        exchange.getRequest().getPath().value(),
                        Map.of("fields", fieldErrors)));
    }

    /**
     * Handles malformed request bodies and type conversion errors.
     */
    @ExceptionHandler(ServerWebInputException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleInputException(@NonNull ServerWebInputException ex,
                                                              @NonNull ServerWebExchange exchange) {
        LOG.warn("Input error: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH));

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(
                        ErrorResponse.Categories.INVALID_REQUEST,
                        InvalidInputException.INVALID_VALUE,
                        "Invalid request format",
                        null,
                        correlationId(exchange),
                        exchange.getRequest().getPath().value(),
                        null));
    }

    @ExceptionHandler(Exception.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleGeneral(@NonNull Exception ex, @NonNull ServerWebExchange exchange) {
        LOG.error("Unhandled exception: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(
                        ErrorResponse.Categories.INTERNAL_ERROR,
                        "INTERNAL_ERROR",
                        "An unexpected error occurred",
                        null,
                        correlationId(exchange),
                        exchange.getRequest().getPath().value(),
                        null));
    }

    @Nullable
    private String correlationId(@NonNull ServerWebExchange exchange) {
        return exchange.getResponse().getHeaders().getFirst(CorrelationIdFilter.CORRELATION_ID_HEADER);
    }

    @NonNull
    private String sanitizeResponseMessage(@Nullable String message) {
        if (message == null || message.isBlank()) {
            return "Invalid value";
        }
        String sanitized = message
                .replace("\n", " ")
                .replace("\r", " ")
                .replace("\t", " ");

        if (sanitized.length() > MAX_RESPONSE_MESSAGE_LENGTH) {
            return sanitized.substring(0, MAX_RESPONSE_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }
}
