package com.example.console.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every console endpoint.
 *
 * <pre>{@code
 * {
 *   "error": "invalid_parent",
 *   "code": "CYCLE",
 *   "message": "Role r-2 is an ancestor of r-7",
 *   "operation": "rbac.set_parent",
 *   "correlation_id": "550e8400-e29b-41d4-a716-446655440000",
 *   "timestamp": "2026-10-19T10:30:00Z",
 *   "path": "/api/v1/services/svc-1/roles/r-2/parent",
 *   "details": {"role_id": "r-2", "parent_role_id": "r-7"}
 * }
 * }</pre>
 *
 * @param error         stable category for client error handling
 * @param code          specific reason code
 * @param message       human-readable message, gateway messages verbatim
 * @param operation     console action that failed, e.g. {@code abac.publish}
 * @param correlationId request correlation id
 * @param timestamp     when the error was rendered
 * @param path          request path
 * @param details       extra context
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String code,
        String message,
        String operation,
        @JsonProperty("correlation_id") String correlationId,
        Instant timestamp,
        String path,
        Map<String, Object> details
) {
    public static ErrorResponse of(
            String error,
            String code,
            String message,
            String operation,
            String correlationId,
            String path,
            Map<String, Object> details
    ) {
        return new ErrorResponse(error, code, message, operation, correlationId, Instant.now(), path, details);
    }

    public static final class Categories {
        public static final String VALIDATION_ERROR = "validation_error";
        public static final String INVALID_REQUEST = "invalid_request";
        public static final String INTERNAL_ERROR = "internal_error";

        private Categories() {
        }
    }
}
