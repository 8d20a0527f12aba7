package com.example.console.abac.dto;

import com.example.console.abac.model.SimulationInput;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record SimulateRequest(
        JsonNode policy,
        @JsonProperty("policy_json") String policyJson,
        SimulationInput simulation
) {
}
