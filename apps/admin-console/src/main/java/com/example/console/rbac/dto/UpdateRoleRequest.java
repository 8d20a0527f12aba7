package com.example.console.rbac.dto;

import jakarta.validation.constraints.Size;

/**
 * Label changes only; the parent is changed through the parent endpoint.
 */
public record UpdateRoleRequest(
        @Size(min = 1, max = 100) String name,
        @Size(max = 500) String description
) {
}
