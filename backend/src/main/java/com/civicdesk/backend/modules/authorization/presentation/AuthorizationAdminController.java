package com.civicdesk.backend.modules.authorization.presentation;

import java.util.UUID;

import com.civicdesk.backend.modules.authorization.application.AuthorizationService;
import com.civicdesk.backend.modules.authorization.presentation.dto.EffectivePermissionResponse;
import com.civicdesk.backend.modules.authorization.presentation.dto.EffectivePermissionsResponse;
import com.civicdesk.backend.modules.authorization.presentation.dto.PermissionExplanationResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/rbac/users/{userId}")
@Tag(name = "Authorization Admin", description = "Inspect effective permissions of any user")
@PreAuthorize("@permissionGuard.has('view_user_permissions')")
public class AuthorizationAdminController {

    private final AuthorizationService authorizationService;

    public AuthorizationAdminController(AuthorizationService authorizationService) {
        this.authorizationService = authorizationService;
    }

    @GetMapping("/permissions")
    @Operation(summary = "List a user's effective permissions")
    public ResponseEntity<EffectivePermissionsResponse> permissions(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(new EffectivePermissionsResponse(userId,
                authorizationService.resolveAll(userId).stream().map(EffectivePermissionResponse::from).toList()));
    }

    @GetMapping("/explain")
    @Operation(summary = "Explain which rule decides a permission for a user")
    public ResponseEntity<PermissionExplanationResponse> explain(@PathVariable("userId") UUID userId,
                                                                 @RequestParam("permission") String permission) {
        return ResponseEntity.ok(PermissionExplanationResponse.from(authorizationService.explain(userId, permission)));
    }
}
