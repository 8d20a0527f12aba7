package com.example.console.rbac.client;

import com.example.console.common.AdminOperation;
import com.example.console.common.exception.ResourceNotFoundException;
import com.example.console.gateway.GatewayEnvelope;
import com.example.console.gateway.IdentityGatewayClient;
import com.example.console.rbac.model.Permission;
import com.example.console.rbac.model.Role;
import com.example.console.rbac.model.RoleDetail;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Role and permission endpoints of the identity gateway.
 */
@Component
@RequiredArgsConstructor
public class RbacApiClient {

    private static final ParameterizedTypeReference<GatewayEnvelope<List<Role>>> ROLE_LIST =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<GatewayEnvelope<Role>> ROLE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<GatewayEnvelope<RoleDetail>> ROLE_DETAIL =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<GatewayEnvelope<List<Permission>>> PERMISSION_LIST =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<GatewayEnvelope<Permission>> PERMISSION =
            new ParameterizedTypeReference<>() {};

    private final IdentityGatewayClient gateway;

    @NonNull
    public Mono<List<Role>> listRoles(@NonNull AdminOperation operation, @NonNull String serviceId) {
        return gateway.get(operation, ROLE_LIST, "/api/v1/services/{serviceId}/roles", serviceId)
                .defaultIfEmpty(List.of());
    }

    @NonNull
    public Mono<RoleDetail> getRole(@NonNull AdminOperation operation, @NonNull String roleId) {
        return gateway.get(operation, ROLE_DETAIL, "/api/v1/roles/{roleId}", roleId);
    }

    /**
     * Fetches a role and checks it belongs to {@code serviceId}. A missing role and a
     * role of another service both complete with {@link ResourceNotFoundException}.
     */
    @NonNull
    public Mono<RoleDetail> getRoleInService(@NonNull AdminOperation operation, @NonNull String serviceId,
                                             @NonNull String roleId) {
        return getRole(operation, roleId)
                .filter(role -> role.serviceId() == null || serviceId.equals(role.serviceId()))
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException(
                        operation, "Role", roleId, "service " + serviceId)));
    }

    @NonNull
    public Mono<Role> createRole(@NonNull AdminOperation operation, @NonNull CreateRolePayload payload) {
        return gateway.send(operation, HttpMethod.POST, payload, ROLE, "/api/v1/roles");
    }

    /**
     * Partial update. A present {@code parent_role_id} key with a null value clears
     * the parent; an absent key leaves it untouched.
     */
    @NonNull
    public Mono<Role> updateRole(@NonNull AdminOperation operation, @NonNull String roleId,
                                 @NonNull RoleUpdate update) {
        return gateway.send(operation, HttpMethod.PUT, update.toBody(), ROLE, "/api/v1/roles/{roleId}", roleId);
    }

    @NonNull
    public Mono<Void> deleteRole(@NonNull AdminOperation operation, @NonNull String roleId) {
        return gateway.execute(operation, HttpMethod.DELETE, null, "/api/v1/roles/{roleId}", roleId);
    }

    @NonNull
    public Mono<List<Permission>> listPermissions(@NonNull AdminOperation operation, @NonNull String serviceId) {
        return gateway.get(operation, PERMISSION_LIST, "/api/v1/services/{serviceId}/permissions", serviceId)
                .defaultIfEmpty(List.of());
    }

    @NonNull
    public Mono<Permission> createPermission(@NonNull AdminOperation operation,
                                             @NonNull CreatePermissionPayload payload) {
        return gateway.send(operation, HttpMethod.POST, payload, PERMISSION, "/api/v1/permissions");
    }

    @NonNull
    public Mono<Void> deletePermission(@NonNull AdminOperation operation, @NonNull String permissionId) {
        return gateway.execute(operation, HttpMethod.DELETE, null, "/api/v1/permissions/{permissionId}", permissionId);
    }

    @NonNull
    public Mono<Void> assignPermission(@NonNull AdminOperation operation, @NonNull String roleId,
                                       @NonNull String permissionId) {
        return gateway.execute(operation, HttpMethod.POST, new AssignPermissionPayload(permissionId),
                "/api/v1/roles/{roleId}/permissions", roleId);
    }

    @NonNull
    public Mono<Void> removePermission(@NonNull AdminOperation operation, @NonNull String roleId,
                                       @NonNull String permissionId) {
        return gateway.execute(operation, HttpMethod.DELETE, null,
                "/api/v1/roles/{roleId}/permissions/{permissionId}", roleId, permissionId);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CreateRolePayload(
            @JsonProperty("service_id") String serviceId,
            String name,
            String description,
            @JsonProperty("parent_role_id") String parentRoleId
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CreatePermissionPayload(
            @JsonProperty("service_id") String serviceId,
            String code,
            String name,
            String description
    ) {
    }

    public record AssignPermissionPayload(@JsonProperty("permission_id") String permissionId) {
    }

    /**
     * Fields to change on a role. {@code parentChanged} distinguishes "clear the
     * parent" from "leave the parent alone".
     */
    public record RoleUpdate(
            @Nullable String name,
            @Nullable String description,
            boolean parentChanged,
            @Nullable String parentRoleId
    ) {
        public static RoleUpdate labels(@Nullable String name, @Nullable String description) {
            return new RoleUpdate(name, description, false, null);
        }

        public static RoleUpdate parent(@Nullable String parentRoleId) {
            return new RoleUpdate(null, null, true, parentRoleId);
        }

        Map<String, Object> toBody() {
            Map<String, Object> body = new LinkedHashMap<>();
            if (name != null) {
                body.put("name", name);
            }
            if (description != null) {
                body.put("description", description);
            }
            if (parentChanged) {
                body.put("parent_role_id", parentRoleId);
            }
            return body;
        }
    }
}
