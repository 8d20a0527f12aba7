package com.example.console.abac.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A tenant's policy set and version history, newest first.
 *
 * @param anomalies invariant violations found in the fetched state; reported, never repaired
 */
public record PolicyListing(
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("policy_set") PolicySet policySet,
        List<PolicyVersion> versions,
        @JsonProperty("active_version_id") String activeVersionId,
        List<String> anomalies
) {
}
