package com.example.console.abac.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DraftCreated(
        String id,
        @JsonProperty("policy_set_id") String policySetId,
        @JsonProperty("version_no") int versionNo,
        String status
) {
}
