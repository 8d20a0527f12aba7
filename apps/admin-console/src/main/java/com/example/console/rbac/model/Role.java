package com.example.console.rbac.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named role in one service, optionally inheriting from a single parent role.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Role(
        String id,
        @JsonProperty("service_id") String serviceId,
        String name,
        String description,
        @JsonProperty("parent_role_id") String parentRoleId
) {
    @JsonIgnore
    public boolean hasParent() {
        return parentRoleId != null && !parentRoleId.isBlank();
    }
}
