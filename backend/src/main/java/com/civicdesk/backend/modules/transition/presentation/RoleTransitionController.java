package com.civicdesk.backend.modules.transition.presentation;

import java.util.UUID;

import com.civicdesk.backend.global.security.SecurityUtils;
import com.civicdesk.backend.modules.transition.application.RoleTransitionService;
import com.civicdesk.backend.modules.transition.presentation.dto.RoleTransitionRequest;
import com.civicdesk.backend.modules.transition.presentation.dto.RoleTransitionResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/rbac/users/{userId}/role")
@Tag(name = "Role Transition", description = "Assign a new role to a user")
public class RoleTransitionController {

    private static final String FORWARDED_FOR = "X-Forwarded-For";

    private final RoleTransitionService roleTransitionService;

    public RoleTransitionController(RoleTransitionService roleTransitionService) {
        this.roleTransitionService = roleTransitionService;
    }

    @PostMapping
    @Operation(summary = "Change the role of a user")
    @PreAuthorize("@permissionGuard.has('assign_roles')")
    public ResponseEntity<RoleTransitionResponse> transition(@PathVariable("userId") UUID userId,
                                                             @Valid @RequestBody RoleTransitionRequest request,
                                                             HttpServletRequest httpRequest) {
        UUID actorId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(RoleTransitionResponse.from(roleTransitionService.transition(
                actorId, userId, request.role(), request.reason(), clientIp(httpRequest))));
    }

    private static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (StringUtils.hasText(forwarded)) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
