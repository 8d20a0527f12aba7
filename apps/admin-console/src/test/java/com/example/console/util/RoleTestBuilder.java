package com.example.console.util;

import com.example.console.rbac.model.Permission;
import com.example.console.rbac.model.Role;
import com.example.console.rbac.model.RoleDetail;

import java.util.ArrayList;
import java.util.List;

/**
 * Test builder for roles.
 *
 * <pre>{@code
 * Role editor = RoleTestBuilder.aRole("editor").withParent("viewer").build();
 * RoleDetail detail = RoleTestBuilder.aRole("editor").withPermission(read).buildDetail();
 * }</pre>
 */
public class RoleTestBuilder {

    public static final String SERVICE_ID = "svc-portal";

    private String id;
    private String serviceId = SERVICE_ID;
    private String name;
    private String description;
    private String parentRoleId;
    private final List<Permission> permissions = new ArrayList<>();

    private RoleTestBuilder(String id) {
        this.id = id;
        this.name = id;
    }

    public static RoleTestBuilder aRole(String id) {
        return new RoleTestBuilder(id);
    }

    public static Permission permission(String id, String code) {
        return new Permission(id, SERVICE_ID, code, code, null);
    }

    public RoleTestBuilder withServiceId(String serviceId) {
        this.serviceId = serviceId;
        return this;
    }

    public RoleTestBuilder withName(String name) {
        this.name = name;
        return this;
    }

    public RoleTestBuilder withDescription(String description) {
        this.description = description;
        return this;
    }

    public RoleTestBuilder withParent(String parentRoleId) {
        this.parentRoleId = parentRoleId;
        return this;
    }

    public RoleTestBuilder withPermission(Permission permission) {
        this.permissions.add(permission);
        return this;
    }

    public Role build() {
        return new Role(id, serviceId, name, description, parentRoleId);
    }

    public RoleDetail buildDetail() {
        return new RoleDetail(id, serviceId, name, description, parentRoleId, permissions);
    }
}
