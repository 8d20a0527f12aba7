package com.example.console.rbac.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A {@code resource:action} capability in a service's catalog.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Permission(
        String id,
        @JsonProperty("service_id") String serviceId,
        String code,
        String name,
        String description
) {
}
