package com.civicdesk.backend.modules.authorization.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.civicdesk.backend.modules.authorization.domain.SubjectContext;
import com.civicdesk.backend.modules.override.domain.PermissionOverride;
import com.civicdesk.backend.modules.override.infrastructure.persistence.PermissionOverrideRepository;
import com.civicdesk.backend.modules.user.domain.PortalUser;
import com.civicdesk.backend.modules.user.infrastructure.persistence.PortalUserRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class SubjectLoader {

    private final PortalUserRepository portalUserRepository;
    private final PermissionOverrideRepository permissionOverrideRepository;

    public SubjectLoader(PortalUserRepository portalUserRepository,
                         PermissionOverrideRepository permissionOverrideRepository) {
        this.portalUserRepository = portalUserRepository;
        this.permissionOverrideRepository = permissionOverrideRepository;
    }

    @Transactional(readOnly = true)
    public Optional<SubjectContext> load(UUID userId) {
        return portalUserRepository.findById(userId)
                .map(user -> new SubjectContext(
                        user.getId(),
                        user.getRoleCode(),
                        user.isActive(),
                        permissionOverrideRepository.findByUserId(userId).stream()
                                .map(PermissionOverride::toEntry)
                                .toList()
                ));
    }

    /**
     * Subject view of a user without overrides, for authority checks on writes.
     */
    public static SubjectContext withoutOverrides(PortalUser user) {
        return new SubjectContext(user.getId(), user.getRoleCode(), user.isActive(), List.of());
    }
}
