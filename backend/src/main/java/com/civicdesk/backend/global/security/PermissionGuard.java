package com.civicdesk.backend.global.security;

import com.civicdesk.backend.modules.authorization.application.AuthorizationService;

import org.springframework.stereotype.Component;

/**
 * Exposes the authorization engine to {@code @PreAuthorize} expressions,
 * e.g. {@code @PreAuthorize("@permissionGuard.has('manage_roles')")}.
 */
@Component("permissionGuard")
public class PermissionGuard {

    private final AuthorizationService authorizationService;

    public PermissionGuard(AuthorizationService authorizationService) {
        this.authorizationService = authorizationService;
    }

    public boolean has(String codename) {
        return SecurityUtils.findCurrentActor()
                .map(actor -> authorizationService.resolve(actor.userId(), codename))
                .orElse(false);
    }
}
