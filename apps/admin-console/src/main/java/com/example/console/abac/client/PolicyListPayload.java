package com.example.console.abac.client;

import com.example.console.abac.model.PolicySet;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PolicyListPayload(
        @JsonProperty("policy_set") PolicySet policySet,
        List<PolicyVersionSummary> versions
) {
    public PolicyListPayload {
        versions = versions == null ? List.of() : versions;
    }
}
