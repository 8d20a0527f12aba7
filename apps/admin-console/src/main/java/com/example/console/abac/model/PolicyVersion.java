package com.example.console.abac.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One immutable-once-published version of a tenant's policy, with its status
 * derived from the policy set's pointer and mode.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PolicyVersion(
        String id,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("policy_set_id") String policySetId,
        @JsonProperty("version_no") int versionNo,
        PolicyVersionStatus status,
        @JsonProperty("change_note") String changeNote,
        @JsonProperty("created_by") String createdBy,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("published_at") String publishedAt
) {
    public PolicyVersion withStatus(PolicyVersionStatus newStatus) {
        return new PolicyVersion(id, tenantId, policySetId, versionNo, newStatus, changeNote, createdBy,
                createdAt, publishedAt);
    }
}
