package com.example.console.rbac.controller;

import com.example.console.common.util.StringSanitizer;
import com.example.console.rbac.dto.CreateRoleRequest;
import com.example.console.rbac.dto.SetParentRequest;
import com.example.console.rbac.dto.UpdateRoleRequest;
import com.example.console.rbac.hierarchy.HierarchyAnomalies;
import com.example.console.rbac.model.BindingResult;
import com.example.console.rbac.model.EffectivePermissions;
import com.example.console.rbac.model.Permission;
import com.example.console.rbac.model.Role;
import com.example.console.rbac.service.RoleHierarchyService;
import com.example.console.rbac.service.RolePermissionBindingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/services/{serviceId}/roles")
@RequiredArgsConstructor
public class RoleController {

    private final RoleHierarchyService roleHierarchyService;
    private final RolePermissionBindingService bindingService;

    @GetMapping
    public Mono<List<Role>> listRoles(@PathVariable String serviceId) {
        log.debug("GET /roles - service: {}", StringSanitizer.forLog(serviceId));
        return roleHierarchyService.listRoles(serviceId);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<Role> createRole(@PathVariable String serviceId, @Valid @RequestBody CreateRoleRequest request) {
        log.debug("POST /roles - service: {}, name: {}",
                StringSanitizer.forLog(serviceId), StringSanitizer.forLog(request.name()));
        return roleHierarchyService.createRole(serviceId, request.name(), request.description(), request.parentRoleId());
    }

    @PutMapping("/{roleId}")
    public Mono<Role> updateRole(@PathVariable String serviceId, @PathVariable String roleId,
                                 @Valid @RequestBody UpdateRoleRequest request) {
        log.debug("PUT /roles/{} - service: {}", StringSanitizer.forLog(roleId), StringSanitizer.forLog(serviceId));
        return roleHierarchyService.updateRole(serviceId, roleId, request.name(), request.description());
    }

    @DeleteMapping("/{roleId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteRole(@PathVariable String serviceId, @PathVariable String roleId) {
        log.debug("DELETE /roles/{} - service: {}", StringSanitizer.forLog(roleId), StringSanitizer.forLog(serviceId));
        return roleHierarchyService.deleteRole(serviceId, roleId);
    }

    @PutMapping("/{roleId}/parent")
    public Mono<Role> setParent(@PathVariable String serviceId, @PathVariable String roleId,
                                @RequestBody SetParentRequest request) {
        log.debug("PUT /roles/{}/parent - service: {}, parent: {}", StringSanitizer.forLog(roleId),
                StringSanitizer.forLog(serviceId), StringSanitizer.forLog(request.parentRoleId()));
        return roleHierarchyService.setParent(serviceId, roleId, request.parentRoleId());
    }

    @GetMapping("/{roleId}/permissions")
    public Mono<List<Permission>> listRolePermissions(@PathVariable String serviceId, @PathVariable String roleId) {
        return bindingService.listForRole(serviceId, roleId);
    }

    @PutMapping("/{roleId}/permissions/{permissionId}")
    public Mono<BindingResult> bindPermission(@PathVariable String serviceId, @PathVariable String roleId,
                                              @PathVariable String permissionId) {
        log.debug("PUT /roles/{}/permissions/{} - service: {}", StringSanitizer.forLog(roleId),
                StringSanitizer.forLog(permissionId), StringSanitizer.forLog(serviceId));
        return bindingService.bind(serviceId, roleId, permissionId);
    }

    @DeleteMapping("/{roleId}/permissions/{permissionId}")
    public Mono<BindingResult> unbindPermission(@PathVariable String serviceId, @PathVariable String roleId,
                                                @PathVariable String permissionId) {
        log.debug("DELETE /roles/{}/permissions/{} - service: {}", StringSanitizer.forLog(roleId),
                StringSanitizer.forLog(permissionId), StringSanitizer.forLog(serviceId));
        return bindingService.unbind(serviceId, roleId, permissionId);
    }

    @GetMapping("/{roleId}/effective-permissions")
    public Mono<EffectivePermissions> effectivePermissions(@PathVariable String serviceId,
                                                           @PathVariable String roleId) {
        return roleHierarchyService.effectivePermissions(serviceId, roleId);
    }

    @GetMapping("/anomalies")
    public Mono<HierarchyAnomalies> anomalies(@PathVariable String serviceId) {
        return roleHierarchyService.detectAnomalies(serviceId);
    }
}
