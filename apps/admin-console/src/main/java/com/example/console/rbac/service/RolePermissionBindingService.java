package com.example.console.rbac.service;

import com.example.console.common.AdminOperation;
import com.example.console.common.exception.ConflictException;
import com.example.console.common.exception.ConsoleException;
import com.example.console.common.exception.ErrorCategory;
import com.example.console.common.exception.InvalidInputException;
import com.example.console.common.util.Identifiers;
import com.example.console.common.util.StringSanitizer;
import com.example.console.config.properties.RbacProperties;
import com.example.console.observability.metrics.ConsoleMetrics;
import com.example.console.rbac.client.RbacApiClient;
import com.example.console.rbac.model.BindingResult;
import com.example.console.rbac.model.BindingResult.Outcome;
import com.example.console.rbac.model.Permission;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Direct grants between roles and permissions.
 *
 * <p>Bind and unbind are idempotent: granting a bound pair or revoking an absent
 * one succeeds with {@link Outcome#UNCHANGED}. Revocation is confirmed by reading
 * the role back, because the gateway's acknowledgement alone is not trusted to
 * mean the edge is gone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RolePermissionBindingService {

    private final RbacApiClient rbacApiClient;
    private final RbacProperties rbacProperties;
    private final ConsoleMetrics metrics;

    /**
     * Direct bindings only; see {@link RoleHierarchyService#effectivePermissions} for inherited ones.
     */
    @NonNull
    public Mono<List<Permission>> listForRole(@NonNull String serviceId, @NonNull String roleId) {
        AdminOperation operation = AdminOperation.LIST_ROLE_PERMISSIONS;
        return Mono.defer(() -> rbacApiClient.getRoleInService(operation,
                        Identifiers.require(operation, "service_id", serviceId),
                        Identifiers.require(operation, "role_id", roleId))
                .map(role -> role.permissions()));
    }

    @NonNull
    public Mono<BindingResult> bind(@NonNull String serviceId, @NonNull String roleId, @NonNull String permissionId) {
        AdminOperation operation = AdminOperation.BIND_PERMISSION;
        return Mono.defer(() -> {
            String service = Identifiers.require(operation, "service_id", serviceId);
            String role = Identifiers.require(operation, "role_id", roleId);
            String permission = Identifiers.require(operation, "permission_id", permissionId);

            return rbacApiClient.getRoleInService(operation, service, role).flatMap(detail -> {
                if (detail.grants(permission)) {
                    log.debug("Permission {} already bound to role {}", permission, role);
                    return Mono.just(new BindingResult(role, permission, Outcome.UNCHANGED));
                }
                return rbacApiClient.listPermissions(operation, service)
                        .flatMap(catalog -> {
                            if (catalog.stream().noneMatch(p -> permission.equals(p.id()))) {
                                return Mono.error(InvalidInputException.invalidValue(operation, "permission_id",
                                        "Permission " + permission + " is not part of service " + service));
                            }
                            return rbacApiClient.assignPermission(operation, role, permission)
                                    .thenReturn(new BindingResult(role, permission, Outcome.GRANTED));
                        })
                        .onErrorResume(RolePermissionBindingService::isGatewayConflict,
                                error -> Mono.just(new BindingResult(role, permission, Outcome.UNCHANGED)));
            }).doOnNext(result -> log.info("Bind {} -> {} in service {}: {}",
                    role, permission, StringSanitizer.forLog(service), result.outcome()));
        });
    }

    @NonNull
    public Mono<BindingResult> unbind(@NonNull String serviceId, @NonNull String roleId, @NonNull String permissionId) {
        AdminOperation operation = AdminOperation.UNBIND_PERMISSION;
        return Mono.defer(() -> {
            String service = Identifiers.require(operation, "service_id", serviceId);
            String role = Identifiers.require(operation, "role_id", roleId);
            String permission = Identifiers.require(operation, "permission_id", permissionId);

            return rbacApiClient.getRoleInService(operation, service, role).flatMap(detail -> {
                if (!detail.grants(permission)) {
                    log.debug("Permission {} not bound to role {}", permission, role);
                    return Mono.just(new BindingResult(role, permission, Outcome.UNCHANGED));
                }
                return rbacApiClient.removePermission(operation, role, permission)
                        .onErrorResume(RolePermissionBindingService::isGatewayNotFound, error -> Mono.empty())
                        .then(Mono.defer(() -> confirmRevoked(operation, service, role, permission)))
                        .thenReturn(new BindingResult(role, permission, Outcome.REVOKED));
            }).doOnNext(result -> log.info("Unbind {} -> {} in service {}: {}",
                    role, permission, StringSanitizer.forLog(service), result.outcome()));
        });
    }

    private Mono<Void> confirmRevoked(AdminOperation operation, String serviceId, String roleId, String permissionId) {
        if (!rbacProperties.verifyRevocation()) {
            return Mono.empty();
        }
        return rbacApiClient.getRoleInService(operation, serviceId, roleId)
                .flatMap(after -> {
                    if (!after.grants(permissionId)) {
                        return Mono.empty();
                    }
                    metrics.recordRevocationMismatch();
                    log.error("Gateway acknowledged revoking {} from role {} but still reports the binding",
                            permissionId, roleId);
                    return Mono.error(new ConflictException(operation, ConflictException.REVOCATION_NOT_APPLIED,
                            "The identity gateway did not remove permission " + permissionId
                                    + " from role " + roleId));
                });
    }

    private static boolean isGatewayConflict(Throwable error) {
        return error instanceof ConsoleException console && console.getCategory() == ErrorCategory.CONFLICT;
    }

    private static boolean isGatewayNotFound(Throwable error) {
        return error instanceof ConsoleException console && console.getCategory() == ErrorCategory.NOT_FOUND;
    }
}
