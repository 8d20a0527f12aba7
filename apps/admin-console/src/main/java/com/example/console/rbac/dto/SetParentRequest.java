package com.example.console.rbac.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A null or blank parent detaches the role.
 */
public record SetParentRequest(@JsonProperty("parent_role_id") String parentRoleId) {
}
