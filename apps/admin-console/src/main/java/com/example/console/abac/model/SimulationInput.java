package com.example.console.abac.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Hypothetical request to evaluate. Missing context objects are sent as {@code {}}.
 */
public record SimulationInput(
        String action,
        @JsonProperty("resource_type") String resourceType,
        Map<String, Object> subject,
        Map<String, Object> resource,
        Map<String, Object> request,
        Map<String, Object> env
) {
    public SimulationInput {
        subject = subject == null ? Map.of() : subject;
        resource = resource == null ? Map.of() : resource;
        request = request == null ? Map.of() : request;
        env = env == null ? Map.of() : env;
    }
}
