package com.example.console.rbac.service;

import com.example.console.common.AdminOperation;
import com.example.console.common.exception.ConsoleException;
import com.example.console.common.exception.ErrorCategory;
import com.example.console.common.exception.InvalidInputException;
import com.example.console.common.exception.ResourceNotFoundException;
import com.example.console.common.util.Identifiers;
import com.example.console.common.util.StringSanitizer;
import com.example.console.rbac.client.RbacApiClient;
import com.example.console.rbac.client.RbacApiClient.CreatePermissionPayload;
import com.example.console.rbac.model.Permission;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Per-service permission catalog.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PermissionRegistryService {

    /** {@code resource:action}, optionally with further segments such as {@code report:export:pdf}. */
    private static final Pattern PERMISSION_CODE = Pattern.compile("^[a-z][a-z0-9]*(?::[a-z][a-z0-9]*)+$");
    private static final int MAX_CODE_LENGTH = 100;

    private final RbacApiClient rbacApiClient;

    @NonNull
    public Mono<List<Permission>> list(@NonNull String serviceId) {
        AdminOperation operation = AdminOperation.LIST_PERMISSIONS;
        return Mono.defer(() -> rbacApiClient.listPermissions(operation,
                Identifiers.require(operation, "service_id", serviceId)));
    }

    /**
     * Registers a permission after checking the code is well formed and not yet
     * used in the service's current catalog.
     */
    @NonNull
    public Mono<Permission> create(@NonNull String serviceId, @Nullable String code,
                                   @Nullable String name, @Nullable String description) {
        AdminOperation operation = AdminOperation.CREATE_PERMISSION;
        return Mono.defer(() -> {
            String service = Identifiers.require(operation, "service_id", serviceId);
            String permissionCode = StringSanitizer.trimToNull(code);
            if (permissionCode == null) {
                throw InvalidInputException.missingField(operation, "code");
            }
            String permissionName = StringSanitizer.trimToNull(name);
            if (permissionName == null) {
                throw InvalidInputException.missingField(operation, "name");
            }
            if (permissionCode.length() > MAX_CODE_LENGTH || !PERMISSION_CODE.matcher(permissionCode).matches()) {
                throw InvalidInputException.invalidValue(operation, "code",
                        "Permission code must look like resource:action using lowercase letters and digits");
            }

            return rbacApiClient.listPermissions(operation, service)
                    .flatMap(existing -> {
                        boolean taken = existing.stream().anyMatch(p -> permissionCode.equals(p.code()));
                        if (taken) {
                            return Mono.error(InvalidInputException.duplicateCode(operation, permissionCode));
                        }
                        return rbacApiClient.createPermission(operation, new CreatePermissionPayload(
                                service, permissionCode, permissionName, StringSanitizer.trimToNull(description)));
                    })
                    .onErrorMap(error -> isGatewayConflict(error),
                            error -> InvalidInputException.duplicateCode(operation, permissionCode))
                    .doOnNext(permission -> log.info("Registered permission {} ({}) in service {}",
                            permission.id(), permissionCode, StringSanitizer.forLog(service)));
        });
    }

    /**
     * Deletes a permission of the service. Bindings that referenced it stop granting.
     */
    @NonNull
    public Mono<Void> delete(@NonNull String serviceId, @NonNull String permissionId) {
        AdminOperation operation = AdminOperation.DELETE_PERMISSION;
        return Mono.defer(() -> {
            String service = Identifiers.require(operation, "service_id", serviceId);
            String permission = Identifiers.require(operation, "permission_id", permissionId);

            return rbacApiClient.listPermissions(operation, service)
                    .flatMap(existing -> existing.stream().anyMatch(p -> permission.equals(p.id()))
                            ? rbacApiClient.deletePermission(operation, permission)
                            : Mono.error(new ResourceNotFoundException(
                                    operation, "Permission", permission, "service " + service)))
                    .doOnSuccess(ignored -> log.info("Deleted permission {} from service {}",
                            StringSanitizer.forLog(permission), StringSanitizer.forLog(service)));
        });
    }

    private static boolean isGatewayConflict(Throwable error) {
        return error instanceof ConsoleException console
                && console.getCategory() == ErrorCategory.CONFLICT;
    }
}
