package com.example.console.abac.dto;

import com.example.console.abac.model.PolicyMode;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Publish or rollback body. Mode defaults to enforce.
 */
public record ActivationRequest(
        PolicyMode mode,
        @JsonProperty("expected_active_version_id") String expectedActiveVersionId
) {
}
