package com.civicdesk.backend.global.config;

import java.util.Optional;
import java.util.UUID;

import com.civicdesk.backend.global.security.AuthenticatedActor;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Resolves the current auditor (portal user id) for JPA auditing.
 * Falls back to {@code Optional.empty()} for scheduled jobs and other system actions.
 */
public class CivicDeskAuditorAware implements AuditorAware<UUID> {

    @Override
    @NonNull
    public Optional<UUID> getCurrentAuditor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }

        if (authentication.getPrincipal() instanceof AuthenticatedActor actor) {
            return Optional.ofNullable(actor.userId());
        }

        return Optional.empty();
    }
}
