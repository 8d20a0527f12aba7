package com.example.console.rbac.controller;

import com.example.console.common.util.StringSanitizer;
import com.example.console.rbac.dto.CreatePermissionRequest;
import com.example.console.rbac.model.Permission;
import com.example.console.rbac.service.PermissionRegistryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/services/{serviceId}/permissions")
@RequiredArgsConstructor
public class PermissionController {

    private final PermissionRegistryService permissionRegistryService;

    @GetMapping
    public Mono<List<Permission>> listPermissions(@PathVariable String serviceId) {
        return permissionRegistryService.list(serviceId);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<Permission> createPermission(@PathVariable String serviceId,
                                             @Valid @RequestBody CreatePermissionRequest request) {
        log.debug("POST /permissions - service: {}, code: {}",
                StringSanitizer.forLog(serviceId), StringSanitizer.forLog(request.code()));
        return permissionRegistryService.create(serviceId, request.code(), request.name(), request.description());
    }

    @DeleteMapping("/{permissionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deletePermission(@PathVariable String serviceId, @PathVariable String permissionId) {
        log.debug("DELETE /permissions/{} - service: {}",
                StringSanitizer.forLog(permissionId), StringSanitizer.forLog(serviceId));
        return permissionRegistryService.delete(serviceId, permissionId);
    }
}
