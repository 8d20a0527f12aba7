package com.example.console.abac.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SimulationResult(
        Decision decision,
        @JsonProperty("matched_allow_rule_ids") List<String> matchedAllowRuleIds,
        @JsonProperty("matched_deny_rule_ids") List<String> matchedDenyRuleIds
) {
    public SimulationResult {
        matchedAllowRuleIds = matchedAllowRuleIds == null ? List.of() : matchedAllowRuleIds;
        matchedDenyRuleIds = matchedDenyRuleIds == null ? List.of() : matchedDenyRuleIds;
    }
}
