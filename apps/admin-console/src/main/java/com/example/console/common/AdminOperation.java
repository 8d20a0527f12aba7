package com.example.console.common;

import org.springframework.lang.NonNull;

/**
 * Console actions an operator can attempt.
 *
 * <p>Every error raised while serving an action carries its label so the UI can
 * attribute the failure to the specific operation. The label doubles as the
 * {@code operation} tag on gateway metrics.
 */
public enum AdminOperation {

    LIST_ROLES("rbac.list_roles"),
    CREATE_ROLE("rbac.create_role"),
    UPDATE_ROLE("rbac.update_role"),
    DELETE_ROLE("rbac.delete_role"),
    SET_PARENT("rbac.set_parent"),
    EFFECTIVE_PERMISSIONS("rbac.effective_permissions"),
    DETECT_ANOMALIES("rbac.detect_anomalies"),
    LIST_PERMISSIONS("rbac.list_permissions"),
    CREATE_PERMISSION("rbac.create_permission"),
    DELETE_PERMISSION("rbac.delete_permission"),
    LIST_ROLE_PERMISSIONS("rbac.list_role_permissions"),
    BIND_PERMISSION("rbac.bind_permission"),
    UNBIND_PERMISSION("rbac.unbind_permission"),

    LIST_POLICIES("abac.list_policies"),
    GET_POLICY_VERSION("abac.get_policy_version"),
    CREATE_DRAFT("abac.create_draft"),
    UPDATE_DRAFT("abac.update_draft"),
    PUBLISH("abac.publish"),
    ROLLBACK("abac.rollback"),
    GET_ACTIVE("abac.get_active"),
    SIMULATE("abac.simulate");

    private final String label;

    AdminOperation(String label) {
        this.label = label;
    }

    @NonNull
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
