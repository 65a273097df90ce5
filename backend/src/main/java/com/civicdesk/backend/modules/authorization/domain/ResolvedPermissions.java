package com.civicdesk.backend.modules.authorization.domain;

import java.time.OffsetDateTime;
import java.util.Set;

/**
 * @param validUntil earliest instant at which an override of the subject lapses, or {@code null}
 */
public record ResolvedPermissions(Set<String> codenames, boolean topLevel, OffsetDateTime validUntil) {

    public ResolvedPermissions {
        codenames = Set.copyOf(codenames);
    }

    public static ResolvedPermissions none() {
        return new ResolvedPermissions(Set.of(), false, null);
    }
}
