package com.example.console.rbac.hierarchy;

import com.example.console.rbac.model.Role;

import java.util.List;

/**
 * Ancestors of a role, nearest first, and why the walk stopped.
 *
 * @param ancestors   roles above the start role, nearest first
 * @param termination what ended the walk
 * @param stoppedAt   the id that ended a non-root walk: the revisited role or the missing parent
 */
public record AncestorWalk(List<Role> ancestors, Termination termination, String stoppedAt) {

    public enum Termination {
        /** Reached a role without a parent. */
        ROOT,
        /** Revisited a role already on the path. */
        CYCLE,
        /** A parent id did not resolve to a role of the service. */
        MISSING_PARENT
    }

    public AncestorWalk {
        ancestors = List.copyOf(ancestors);
    }

    public boolean isComplete() {
        return termination == Termination.ROOT;
    }

    public boolean contains(String roleId) {
        return ancestors.stream().anyMatch(role -> role.id().equals(roleId));
    }
}
