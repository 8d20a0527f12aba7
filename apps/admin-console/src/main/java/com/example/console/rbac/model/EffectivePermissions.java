package com.example.console.rbac.model;

import com.example.console.rbac.hierarchy.AncestorWalk;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Permissions a role holds directly or through its ancestors.
 *
 * @param roleId      role the permissions were computed for
 * @param grants      one entry per distinct permission, attributed to the nearest role granting it
 * @param ancestorIds ancestor chain that was walked, nearest first
 * @param chainEnd    how the ancestor walk ended; anything but {@code ROOT} means the set may be partial
 * @param stoppedAt   revisited or missing role id that cut the walk short
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EffectivePermissions(
        @JsonProperty("role_id") String roleId,
        List<Grant> grants,
        @JsonProperty("ancestor_ids") List<String> ancestorIds,
        @JsonProperty("chain_end") AncestorWalk.Termination chainEnd,
        @JsonProperty("stopped_at") String stoppedAt
) {

    public record Grant(
            Permission permission,
            @JsonProperty("granted_by") String grantedBy,
            boolean inherited
    ) {
    }

    /**
     * @param chain the role itself followed by its ancestors, nearest first
     */
    public static EffectivePermissions collect(String roleId, List<RoleDetail> chain, AncestorWalk walk) {
        Map<String, Grant> byPermission = new LinkedHashMap<>();
        for (RoleDetail role : chain) {
            boolean inherited = !role.id().equals(roleId);
            for (Permission permission : role.permissions()) {
                byPermission.putIfAbsent(permission.id(), new Grant(permission, role.id(), inherited));
            }
        }
        List<String> ancestorIds = walk.ancestors().stream().map(Role::id).toList();
        return new EffectivePermissions(roleId, new ArrayList<>(byPermission.values()), ancestorIds,
                walk.termination(), walk.stoppedAt());
    }

    @JsonIgnore
    public List<Permission> permissions() {
        return grants.stream().map(Grant::permission).toList();
    }

    @JsonIgnore
    public boolean isComplete() {
        return chainEnd == AncestorWalk.Termination.ROOT;
    }
}
