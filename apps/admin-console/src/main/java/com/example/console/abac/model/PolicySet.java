package com.example.console.abac.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A tenant's policy set: the enforcement mode and the pointer to the active version.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PolicySet(
        @JsonProperty("policy_set_id") String policySetId,
        @JsonProperty("tenant_id") String tenantId,
        PolicyMode mode,
        @JsonProperty("published_version_id") String publishedVersionId,
        @JsonProperty("published_version_no") Integer publishedVersionNo
) {
    public PolicySet {
        mode = mode == null ? PolicyMode.DISABLED : mode;
    }

    public PolicySet activate(String versionId, int versionNo, PolicyMode newMode) {
        return new PolicySet(policySetId, tenantId, newMode, versionId, versionNo);
    }
}
