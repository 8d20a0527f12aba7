package com.example.console.rbac.hierarchy;

import com.example.console.rbac.model.Role;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inconsistencies found in a service's role graph. Reported, never repaired.
 *
 * @param orphaned     roles whose parent id does not resolve to any known role
 * @param cyclic       roles whose ancestor walk revisits a role
 * @param crossService roles whose parent belongs to another service
 */
public record HierarchyAnomalies(
        @JsonProperty("service_id") String serviceId,
        List<Role> orphaned,
        List<Role> cyclic,
        @JsonProperty("cross_service") List<Role> crossService
) {
    public HierarchyAnomalies {
        orphaned = List.copyOf(orphaned);
        cyclic = List.copyOf(cyclic);
        crossService = List.copyOf(crossService);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return orphaned.isEmpty() && cyclic.isEmpty() && crossService.isEmpty();
    }

    /** Role ids per kind, for log lines. */
    @JsonIgnore
    public String summary() {
        return "orphaned=" + ids(orphaned) + ", cyclic=" + ids(cyclic) + ", cross_service=" + ids(crossService);
    }

    private static List<String> ids(List<Role> roles) {
        return roles.stream().map(Role::id).toList();
    }
}
