package com.civicdesk.backend.modules.permission.presentation;

import java.util.List;
import java.util.UUID;

import com.civicdesk.backend.global.security.SecurityUtils;
import com.civicdesk.backend.modules.authorization.domain.PermissionDefinition;
import com.civicdesk.backend.modules.permission.application.PermissionCatalogService;
import com.civicdesk.backend.modules.permission.presentation.dto.PermissionResponse;
import com.civicdesk.backend.modules.permission.presentation.dto.RegisterPermissionRequest;
import com.civicdesk.backend.modules.permission.presentation.dto.RolePermissionRequest;
import com.civicdesk.backend.modules.permission.presentation.dto.RolePermissionResponse;
import com.civicdesk.backend.modules.permission.presentation.dto.UpdatePermissionRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/rbac")
@Tag(name = "Permission Admin", description = "Permission catalog and role grants")
public class PermissionAdminController {

    private final PermissionCatalogService permissionCatalogService;

    public PermissionAdminController(PermissionCatalogService permissionCatalogService) {
        this.permissionCatalogService = permissionCatalogService;
    }

    @GetMapping("/permissions")
    @Operation(summary = "List registered permissions")
    @PreAuthorize("@permissionGuard.has('manage_permissions')")
    public ResponseEntity<List<PermissionResponse>> list(
            @RequestParam(name = "activeOnly", defaultValue = "false") boolean activeOnly
    ) {
        List<PermissionDefinition> definitions = activeOnly
                ? permissionCatalogService.listActive()
                : permissionCatalogService.list();
        return ResponseEntity.ok(definitions.stream().map(PermissionResponse::from).toList());
    }

    @PostMapping("/permissions")
    @Operation(summary = "Register a permission")
    @PreAuthorize("@permissionGuard.has('manage_permissions')")
    public ResponseEntity<PermissionResponse> register(@Valid @RequestBody RegisterPermissionRequest request) {
        UUID actorId = SecurityUtils.getCurrentUserId();
        PermissionDefinition created = permissionCatalogService.register(actorId, request.codename(),
                request.name(), request.description(), request.category());
        return ResponseEntity.status(HttpStatus.CREATED).body(PermissionResponse.from(created));
    }

    @PatchMapping("/permissions/{codename}")
    @Operation(summary = "Activate or deactivate a permission")
    @PreAuthorize("@permissionGuard.has('manage_permissions')")
    public ResponseEntity<PermissionResponse> update(@PathVariable("codename") String codename,
                                                     @Valid @RequestBody UpdatePermissionRequest request) {
        UUID actorId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(PermissionResponse.from(
                permissionCatalogService.setActive(actorId, codename, request.active())));
    }

    @PutMapping("/roles/{code}/permissions/{codename}")
    @Operation(summary = "Grant a permission to a role or update the grant")
    @PreAuthorize("@permissionGuard.has('manage_permissions')")
    public ResponseEntity<RolePermissionResponse> setRolePermission(@PathVariable("code") String roleCode,
                                                                    @PathVariable("codename") String codename,
                                                                    @RequestBody RolePermissionRequest request) {
        UUID actorId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(RolePermissionResponse.from(permissionCatalogService.setRolePermission(
                actorId, roleCode, codename, request.activeOrDefault(), request.canDelegateOrDefault())));
    }
}
