package com.example.console.abac.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Size;

/**
 * Draft body. The document is given either as {@code policy} (a JSON object) or as
 * {@code policy_json} (the editor's raw text).
 */
public record DraftRequest(
        JsonNode policy,
        @JsonProperty("policy_json") String policyJson,
        @JsonProperty("change_note") @Size(max = 500) String changeNote
) {
}
