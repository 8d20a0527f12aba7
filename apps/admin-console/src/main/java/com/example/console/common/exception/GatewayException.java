package com.example.console.common.exception;

import com.example.console.common.AdminOperation;
import org.springframework.http.HttpStatusCode;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Map;

/**
 * Failure reported by, or while reaching, the identity gateway.
 */
public class GatewayException extends ConsoleException {

    private static final String SERVICE_NAME = "IdentityGateway";

    private final HttpStatusCode statusCode;
    private final String responseBody;

    private GatewayException(ErrorCategory category, AdminOperation operation, String code, String message,
                             HttpStatusCode statusCode, String responseBody, Throwable cause) {
        super(category, operation, code, message, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * Maps a non-2xx gateway response onto the console taxonomy, keeping the
     * gateway's message as-is.
     */
    @NonNull
    public static GatewayException fromResponse(@NonNull AdminOperation operation, @NonNull HttpStatusCode status,
                                                @NonNull String message, @Nullable String responseBody) {
        return new GatewayException(categoryFor(status), operation, "GATEWAY_" + status.value(),
                message, status, responseBody, null);
    }

    @NonNull
    public static GatewayException timeout(@NonNull AdminOperation operation, @NonNull Duration timeout,
                                           @Nullable Throwable cause) {
        return new GatewayException(ErrorCategory.TIMEOUT, operation, "GATEWAY_TIMEOUT",
                SERVICE_NAME + " did not respond within " + timeout.toMillis() + "ms",
                null, null, cause);
    }

    @NonNull
    public static GatewayException unavailable(@NonNull AdminOperation operation, @Nullable Throwable cause) {
        return new GatewayException(ErrorCategory.UNAVAILABLE, operation, "GATEWAY_UNREACHABLE",
                SERVICE_NAME + " is unreachable", null, null, cause);
    }

    @NonNull
    public static GatewayException malformedResponse(@NonNull AdminOperation operation, @Nullable Throwable cause) {
        return new GatewayException(ErrorCategory.UNAVAILABLE, operation, "GATEWAY_BAD_RESPONSE",
                SERVICE_NAME + " returned a response the console could not read", null, null, cause);
    }

    @NonNull
    static ErrorCategory categoryFor(@NonNull HttpStatusCode status) {
        return switch (status.value()) {
            case 404 -> ErrorCategory.NOT_FOUND;
            case 409 -> ErrorCategory.CONFLICT;
            case 401, 403 -> ErrorCategory.UNAVAILABLE;
            default -> status.is5xxServerError() ? ErrorCategory.UNAVAILABLE : ErrorCategory.INVALID_INPUT;
        };
    }

    @Nullable
    public HttpStatusCode getStatusCode() {
        return statusCode;
    }

    @Nullable
    public String getResponseBody() {
        return responseBody;
    }

    @Override
    public Map<String, Object> getDetails() {
        return statusCode != null ? Map.of("gateway_status", statusCode.value()) : null;
    }
}
