package com.example.console.rbac.service;

import com.example.console.common.AdminOperation;
import com.example.console.common.exception.InvalidInputException;
import com.example.console.common.exception.InvalidParentException;
import com.example.console.common.exception.ResourceNotFoundException;
import com.example.console.common.util.Identifiers;
import com.example.console.common.util.StringSanitizer;
import com.example.console.config.properties.RbacProperties;
import com.example.console.observability.metrics.ConsoleMetrics;
import com.example.console.rbac.client.RbacApiClient;
import com.example.console.rbac.client.RbacApiClient.CreateRolePayload;
import com.example.console.rbac.client.RbacApiClient.RoleUpdate;
import com.example.console.rbac.hierarchy.AncestorWalk;
import com.example.console.rbac.hierarchy.HierarchyAnomalies;
import com.example.console.rbac.hierarchy.ParentCheck;
import com.example.console.rbac.hierarchy.RoleHierarchy;
import com.example.console.rbac.model.EffectivePermissions;
import com.example.console.rbac.model.Role;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Role CRUD and parent/child maintenance for one service at a time.
 *
 * <p>Every check runs against a role list fetched for that call; nothing is cached
 * between requests. Validation failures are raised before the gateway is asked to
 * change anything.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoleHierarchyService {

    private final RbacApiClient rbacApiClient;
    private final RbacProperties rbacProperties;
    private final ConsoleMetrics metrics;

    @NonNull
    public Mono<List<Role>> listRoles(@NonNull String serviceId) {
        AdminOperation operation = AdminOperation.LIST_ROLES;
        return Mono.defer(() -> rbacApiClient.listRoles(operation,
                Identifiers.require(operation, "service_id", serviceId)));
    }

    @NonNull
    public Mono<Role> createRole(@NonNull String serviceId, @Nullable String name,
                                 @Nullable String description, @Nullable String parentRoleId) {
        AdminOperation operation = AdminOperation.CREATE_ROLE;
        return Mono.defer(() -> {
            String service = Identifiers.require(operation, "service_id", serviceId);
            String roleName = StringSanitizer.trimToNull(name);
            if (roleName == null) {
                throw InvalidInputException.missingField(operation, "name");
            }
            String parentId = Identifiers.optional(operation, "parent_role_id", parentRoleId);

            Mono<Void> parentValidation = parentId == null
                    ? Mono.empty()
                    : loadHierarchy(operation, service)
                            .flatMap(hierarchy -> requireValidParent(operation, hierarchy, null, parentId));

            return parentValidation.then(Mono.defer(() -> rbacApiClient.createRole(operation,
                            new CreateRolePayload(service, roleName, StringSanitizer.trimToNull(description), parentId))))
                    .doOnNext(role -> log.info("Created role {} '{}' in service {}",
                            role.id(), StringSanitizer.forLog(roleName), StringSanitizer.forLog(service)));
        });
    }

    @NonNull
    public Mono<Role> updateRole(@NonNull String serviceId, @NonNull String roleId,
                                 @Nullable String name, @Nullable String description) {
        AdminOperation operation = AdminOperation.UPDATE_ROLE;
        return Mono.defer(() -> {
            String service = Identifiers.require(operation, "service_id", serviceId);
            String role = Identifiers.require(operation, "role_id", roleId);
            if (name != null && name.isBlank()) {
                throw InvalidInputException.missingField(operation, "name");
            }
            if (name == null && description == null) {
                throw InvalidInputException.missingField(operation, "name");
            }

            return rbacApiClient.getRoleInService(operation, service, role)
                    .flatMap(existing -> rbacApiClient.updateRole(operation, role,
                            RoleUpdate.labels(StringSanitizer.trimToNull(name), description)));
        });
    }

    /**
     * Deletes a role. The gateway detaches any children, which become roots.
     */
    @NonNull
    public Mono<Void> deleteRole(@NonNull String serviceId, @NonNull String roleId) {
        AdminOperation operation = AdminOperation.DELETE_ROLE;
        return Mono.defer(() -> {
            String service = Identifiers.require(operation, "service_id", serviceId);
            String role = Identifiers.require(operation, "role_id", roleId);

            return rbacApiClient.getRoleInService(operation, service, role)
                    .flatMap(existing -> rbacApiClient.deleteRole(operation, role))
                    .doOnSuccess(ignored -> log.info("Deleted role {} in service {}",
                            StringSanitizer.forLog(role), StringSanitizer.forLog(service)));
        });
    }

    /**
     * Re-parents a role, or detaches it when {@code newParentId} is null or blank.
     * Setting the parent a role already has is a no-op.
     */
    @NonNull
    public Mono<Role> setParent(@NonNull String serviceId, @NonNull String roleId, @Nullable String newParentId) {
        AdminOperation operation = AdminOperation.SET_PARENT;
        return Mono.defer(() -> {
            String service = Identifiers.require(operation, "service_id", serviceId);
            String role = Identifiers.require(operation, "role_id", roleId);
            String parentId = Identifiers.optional(operation, "parent_role_id", newParentId);

            return loadHierarchy(operation, service).flatMap(hierarchy -> {
                Role current = hierarchy.find(role).orElse(null);
                if (current == null) {
                    return Mono.error(new ResourceNotFoundException(operation, "Role", role, "service " + service));
                }
                if (Objects.equals(StringSanitizer.trimToNull(current.parentRoleId()), parentId)) {
                    log.debug("Role {} already has parent {}", role, parentId);
                    return Mono.just(current);
                }
                return requireValidParent(operation, hierarchy, role, parentId)
                        .then(Mono.defer(() -> rbacApiClient.updateRole(operation, role, RoleUpdate.parent(parentId))))
                        .doOnNext(updated -> log.info("Role {} parent changed from {} to {}",
                                role, current.parentRoleId(), parentId));
            });
        });
    }

    /**
     * Direct permissions of the role united with those of every ancestor. A cycle
     * or missing ancestor ends the walk early; the result then says where.
     */
    @NonNull
    public Mono<EffectivePermissions> effectivePermissions(@NonNull String serviceId, @NonNull String roleId) {
        AdminOperation operation = AdminOperation.EFFECTIVE_PERMISSIONS;
        return Mono.defer(() -> {
            String service = Identifiers.require(operation, "service_id", serviceId);
            String role = Identifiers.require(operation, "role_id", roleId);

            return loadHierarchy(operation, service).flatMap(hierarchy -> {
                Role start = hierarchy.find(role).orElse(null);
                if (start == null) {
                    return Mono.error(new ResourceNotFoundException(operation, "Role", role, "service " + service));
                }
                AncestorWalk walk = hierarchy.ancestorsOf(role);
                if (!walk.isComplete()) {
                    log.warn("Ancestor walk for role {} in service {} ended on {} at {}",
                            role, StringSanitizer.forLog(service), walk.termination(), walk.stoppedAt());
                }

                List<Role> chain = new ArrayList<>();
                chain.add(start);
                chain.addAll(walk.ancestors());

                return Flux.fromIterable(chain)
                        .concatMap(member -> rbacApiClient.getRoleInService(operation, service, member.id()))
                        .collectList()
                        .map(details -> EffectivePermissions.collect(role, details, walk));
            });
        });
    }

    /**
     * Reports orphaned, cyclic and cross-service roles. Gateway failures still
     * propagate; the graph analysis itself never fails.
     */
    @NonNull
    public Mono<HierarchyAnomalies> detectAnomalies(@NonNull String serviceId) {
        AdminOperation operation = AdminOperation.DETECT_ANOMALIES;
        return Mono.defer(() -> loadHierarchy(operation, Identifiers.require(operation, "service_id", serviceId))
                .map(RoleHierarchy::detectAnomalies)
                .doOnNext(anomalies -> {
                    if (!anomalies.isEmpty()) {
                        log.warn("Role hierarchy anomalies in service {}: {}",
                                StringSanitizer.forLog(serviceId), anomalies.summary());
                    }
                    metrics.recordHierarchyAnomalies(anomalies.orphaned().size(), anomalies.cyclic().size(),
                            anomalies.crossService().size());
                }));
    }

    private Mono<RoleHierarchy> loadHierarchy(AdminOperation operation, String serviceId) {
        return rbacApiClient.listRoles(operation, serviceId)
                .map(roles -> RoleHierarchy.of(serviceId, roles));
    }

    private Mono<Void> requireValidParent(AdminOperation operation, RoleHierarchy hierarchy,
                                          @Nullable String roleId, String parentId) {
        ParentCheck check = hierarchy.checkParent(roleId, parentId, rbacProperties.maxInheritanceDepth());
        if (check.isValid()) {
            return Mono.empty();
        }
        return Mono.error(new InvalidParentException(operation, roleId, parentId, check.violation(), check.reason()));
    }
}
