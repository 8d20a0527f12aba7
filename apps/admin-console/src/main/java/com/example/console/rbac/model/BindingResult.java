package com.example.console.rbac.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of an idempotent bind or unbind.
 */
public record BindingResult(
        @JsonProperty("role_id") String roleId,
        @JsonProperty("permission_id") String permissionId,
        Outcome outcome
) {
    public enum Outcome {
        GRANTED,
        REVOKED,
        UNCHANGED
    }
}
