package com.civicdesk.backend.modules.role.presentation;

import java.util.List;
import java.util.UUID;

import com.civicdesk.backend.global.security.SecurityUtils;
import com.civicdesk.backend.modules.role.application.RoleGraphService;
import com.civicdesk.backend.modules.role.application.RoleView;
import com.civicdesk.backend.modules.role.presentation.dto.CreateRoleRequest;
import com.civicdesk.backend.modules.role.presentation.dto.RoleResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/rbac/roles")
@Tag(name = "Role Admin", description = "Role hierarchy management")
public class RoleAdminController {

    private final RoleGraphService roleGraphService;

    public RoleAdminController(RoleGraphService roleGraphService) {
        this.roleGraphService = roleGraphService;
    }

    @GetMapping
    @Operation(summary = "List roles by level, highest first")
    @PreAuthorize("@permissionGuard.has('manage_roles')")
    public ResponseEntity<List<RoleResponse>> listRoles() {
        return ResponseEntity.ok(roleGraphService.listRoles().stream().map(RoleResponse::from).toList());
    }

    @PostMapping
    @Operation(summary = "Create a role")
    @PreAuthorize("@permissionGuard.has('manage_roles')")
    public ResponseEntity<RoleResponse> createRole(@Valid @RequestBody CreateRoleRequest request) {
        UUID actorId = SecurityUtils.getCurrentUserId();
        RoleView created = roleGraphService.createRole(actorId, request.code(), request.name(),
                request.description(), request.level(), request.parents());
        return ResponseEntity.status(HttpStatus.CREATED).body(RoleResponse.from(created));
    }

    @PostMapping("/{code}/parents/{parent}")
    @Operation(summary = "Make a role inherit from another")
    @PreAuthorize("@permissionGuard.has('manage_roles')")
    public ResponseEntity<RoleResponse> addParent(@PathVariable("code") String code,
                                                  @PathVariable("parent") String parent) {
        UUID actorId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(RoleResponse.from(roleGraphService.addParent(actorId, code, parent)));
    }

    @DeleteMapping("/{code}/parents/{parent}")
    @Operation(summary = "Remove an inheritance edge")
    @PreAuthorize("@permissionGuard.has('manage_roles')")
    public ResponseEntity<RoleResponse> removeParent(@PathVariable("code") String code,
                                                     @PathVariable("parent") String parent) {
        UUID actorId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(RoleResponse.from(roleGraphService.removeParent(actorId, code, parent)));
    }
}
