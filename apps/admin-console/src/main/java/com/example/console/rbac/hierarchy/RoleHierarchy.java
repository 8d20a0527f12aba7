package com.example.console.rbac.hierarchy;

import com.example.console.rbac.hierarchy.AncestorWalk.Termination;
import com.example.console.rbac.hierarchy.ParentCheck.Violation;
import com.example.console.rbac.model.Role;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of one service's role graph.
 *
 * <p>Built from a freshly fetched role list for every check. Tolerates whatever
 * the gateway returns: roles without an id are ignored, the first role wins on a
 * duplicate id, and roles of other services are kept aside only to tell a
 * cross-service parent from a missing one. Every walk carries a visited set, so
 * nothing here loops on a cyclic graph or throws on malformed data.
 */
public final class RoleHierarchy {

    private final String serviceId;
    private final Map<String, Role> roles;
    private final Map<String, Role> foreignRoles;

    private RoleHierarchy(String serviceId, Map<String, Role> roles, Map<String, Role> foreignRoles) {
        this.serviceId = serviceId;
        this.roles = roles;
        this.foreignRoles = foreignRoles;
    }

    @NonNull
    public static RoleHierarchy of(@NonNull String serviceId, @NonNull Collection<Role> roles) {
        Map<String, Role> own = new LinkedHashMap<>();
        Map<String, Role> foreign = new LinkedHashMap<>();
        for (Role role : roles) {
            if (role == null || role.id() == null || role.id().isBlank()) {
                continue;
            }
            if (role.serviceId() == null || serviceId.equals(role.serviceId())) {
                own.putIfAbsent(role.id(), role);
            } else {
                foreign.putIfAbsent(role.id(), role);
            }
        }
        return new RoleHierarchy(serviceId, own, foreign);
    }

    @NonNull
    public String serviceId() {
        return serviceId;
    }

    @NonNull
    public List<Role> roles() {
        return List.copyOf(roles.values());
    }

    @NonNull
    public Optional<Role> find(@Nullable String roleId) {
        return roleId == null ? Optional.empty() : Optional.ofNullable(roles.get(roleId));
    }

    /**
     * Walks parent pointers upward from {@code roleId}. An unknown start role
     * yields an empty walk that ends on {@link Termination#MISSING_PARENT}.
     */
    @NonNull
    public AncestorWalk ancestorsOf(@NonNull String roleId) {
        Role current = roles.get(roleId);
        if (current == null) {
            return new AncestorWalk(List.of(), Termination.MISSING_PARENT, roleId);
        }

        List<Role> ancestors = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(roleId);

        while (current.hasParent()) {
            String parentId = current.parentRoleId();
            if (!visited.add(parentId)) {
                return new AncestorWalk(ancestors, Termination.CYCLE, parentId);
            }
            Role parent = roles.get(parentId);
            if (parent == null) {
                return new AncestorWalk(ancestors, Termination.MISSING_PARENT, parentId);
            }
            ancestors.add(parent);
            current = parent;
        }
        return new AncestorWalk(ancestors, Termination.ROOT, null);
    }

    /**
     * Validates {@code parentId} as the parent of {@code roleId}. A null role id
     * checks a parent for a role that does not exist yet; a null parent id is
     * always valid.
     */
    @NonNull
    public ParentCheck checkParent(@Nullable String roleId, @Nullable String parentId, int maxDepth) {
        if (parentId == null) {
            return ParentCheck.ok();
        }
        if (parentId.equals(roleId)) {
            return ParentCheck.rejected(Violation.SELF_REFERENCE, "A role cannot be its own parent");
        }
        if (!roles.containsKey(parentId)) {
            String reason = foreignRoles.containsKey(parentId)
                    ? "Parent role " + parentId + " belongs to a different service"
                    : "Parent role " + parentId + " does not exist in service " + serviceId;
            return ParentCheck.rejected(Violation.UNKNOWN_PARENT, reason);
        }

        AncestorWalk walk = ancestorsOf(parentId);
        if (roleId != null && walk.contains(roleId)) {
            return ParentCheck.rejected(Violation.CYCLE,
                    "Role " + roleId + " is an ancestor of " + parentId + "; the assignment would create a cycle");
        }
        if (walk.termination() == Termination.CYCLE) {
            return ParentCheck.rejected(Violation.CYCLE,
                    "The ancestor chain of " + parentId + " already loops at " + walk.stoppedAt());
        }
        if (walk.termination() == Termination.MISSING_PARENT) {
            return ParentCheck.rejected(Violation.BROKEN_CHAIN,
                    "The ancestor chain of " + parentId + " references missing role " + walk.stoppedAt());
        }

        // the role, its new parent, then the parent's ancestors
        int depth = walk.ancestors().size() + 2;
        if (depth > maxDepth) {
            return ParentCheck.rejected(Violation.DEPTH_EXCEEDED,
                    "Inheritance chain would be " + depth + " levels deep; the limit is " + maxDepth);
        }
        return ParentCheck.ok();
    }

    @NonNull
    public HierarchyAnomalies detectAnomalies() {
        List<Role> orphaned = new ArrayList<>();
        List<Role> cyclic = new ArrayList<>();
        List<Role> crossService = new ArrayList<>();

        for (Role role : roles.values()) {
            if (role.hasParent() && !roles.containsKey(role.parentRoleId())) {
                if (foreignRoles.containsKey(role.parentRoleId())) {
                    crossService.add(role);
                } else {
                    orphaned.add(role);
                }
            }
            if (ancestorsOf(role.id()).termination() == Termination.CYCLE) {
                cyclic.add(role);
            }
        }
        return new HierarchyAnomalies(serviceId, orphaned, cyclic, crossService);
    }
}
