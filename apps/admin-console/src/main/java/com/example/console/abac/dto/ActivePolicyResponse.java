package com.example.console.abac.dto;

import com.example.console.abac.model.PolicyMode;
import com.example.console.abac.model.PolicyVersion;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code version} and {@code mode} are null when the tenant has no active version.
 */
public record ActivePolicyResponse(
        @JsonProperty("tenant_id") String tenantId,
        PolicyVersion version,
        PolicyMode mode
) {
}
