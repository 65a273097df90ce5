package com.civicdesk.backend.modules.authorization.presentation;

import java.util.UUID;

import com.civicdesk.backend.global.security.SecurityUtils;
import com.civicdesk.backend.modules.authorization.application.AuthorizationService;
import com.civicdesk.backend.modules.authorization.presentation.dto.EffectivePermissionResponse;
import com.civicdesk.backend.modules.authorization.presentation.dto.EffectivePermissionsResponse;
import com.civicdesk.backend.modules.authorization.presentation.dto.PermissionCheckResponse;
import com.civicdesk.backend.modules.authorization.presentation.dto.RoleCheckResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Permission checks for the calling user. Downstream CivicDesk modules call these before acting.
 */
@RestController
@RequestMapping("/authz")
@Tag(name = "Authorization", description = "Permission checks for the caller")
public class AuthorizationController {

    private final AuthorizationService authorizationService;

    public AuthorizationController(AuthorizationService authorizationService) {
        this.authorizationService = authorizationService;
    }

    @GetMapping("/check")
    @Operation(summary = "Check a single permission for the caller")
    public ResponseEntity<PermissionCheckResponse> check(@RequestParam("permission") String permission) {
        UUID userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(new PermissionCheckResponse(permission,
                authorizationService.resolve(userId, permission)));
    }

    @GetMapping("/check-role")
    @Operation(summary = "Check whether the caller's role is at or above a role level")
    public ResponseEntity<RoleCheckResponse> checkRole(@RequestParam("role") String role) {
        UUID userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(new RoleCheckResponse(role, authorizationService.hasRoleAtLeast(userId, role)));
    }

    @GetMapping("/me/permissions")
    @Operation(summary = "List the caller's effective permissions")
    public ResponseEntity<EffectivePermissionsResponse> myPermissions() {
        UUID userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(new EffectivePermissionsResponse(userId,
                authorizationService.resolveAll(userId).stream().map(EffectivePermissionResponse::from).toList()));
    }
}
