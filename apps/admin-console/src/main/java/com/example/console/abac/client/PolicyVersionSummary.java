package com.example.console.abac.client;

import com.example.console.abac.model.PolicyDocument;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Version row as the gateway stores it. {@code status} is the raw stored value
 * ({@code draft}, {@code published} or {@code archived}); {@code policy} is only
 * present on single-version reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PolicyVersionSummary(
        String id,
        @JsonProperty("policy_set_id") String policySetId,
        @JsonProperty("version_no") int versionNo,
        String status,
        @JsonProperty("change_note") String changeNote,
        @JsonProperty("created_by") String createdBy,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("published_at") String publishedAt,
        PolicyDocument policy
) {
}
