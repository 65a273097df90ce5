package com.civicdesk.backend.modules.authorization.domain;

import java.util.List;
import java.util.UUID;

/**
 * What the resolver needs to know about a user: the role held, whether the account is active,
 * and the overrides on record (expired ones included; the resolver filters by time).
 */
public record SubjectContext(UUID userId, String roleCode, boolean active, List<OverrideEntry> overrides) {

    public SubjectContext {
        overrides = overrides == null ? List.of() : List.copyOf(overrides);
    }
}
