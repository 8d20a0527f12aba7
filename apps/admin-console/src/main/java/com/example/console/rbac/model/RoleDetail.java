package com.example.console.rbac.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A role together with its directly bound permissions, as the gateway returns it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoleDetail(
        String id,
        @JsonProperty("service_id") String serviceId,
        String name,
        String description,
        @JsonProperty("parent_role_id") String parentRoleId,
        List<Permission> permissions
) {
    public RoleDetail {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    public Role toRole() {
        return new Role(id, serviceId, name, description, parentRoleId);
    }

    public boolean grants(String permissionId) {
        return permissions.stream().anyMatch(permission -> permissionId.equals(permission.id()));
    }
}
