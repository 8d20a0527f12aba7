package com.example.console.common.exception;

import com.example.console.common.AdminOperation;
import com.example.console.rbac.hierarchy.ParentCheck;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Rejected parent assignment: unknown parent, self reference, cycle or too deep a chain.
 */
public class InvalidParentException extends ConsoleException {

    private final String roleId;
    private final String parentRoleId;

    public InvalidParentException(@NonNull AdminOperation operation, @Nullable String roleId,
                                  @NonNull String parentRoleId, @NonNull ParentCheck.Violation violation,
                                  @NonNull String message) {
        super(ErrorCategory.INVALID_PARENT, operation, violation.name(), message);
        this.roleId = roleId;
        this.parentRoleId = parentRoleId;
    }

    @Nullable
    public String getRoleId() {
        return roleId;
    }

    @NonNull
    public String getParentRoleId() {
        return parentRoleId;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new HashMap<>();
        if (roleId != null) {
            details.put("role_id", roleId);
        }
        details.put("parent_role_id", parentRoleId);
        return details;
    }
}
