package com.civicdesk.backend.modules.authorization.domain;

/**
 * The rule that settled a permission check, in evaluation order.
 */
public enum Decision {
    UNKNOWN_PERMISSION(false),
    UNKNOWN_SUBJECT(false),
    INACTIVE_SUBJECT(false),
    SUPERUSER_BYPASS(true),
    INACTIVE_PERMISSION(false),
    DENY_OVERRIDE(false),
    GRANT_OVERRIDE(true),
    ROLE_GRANT(true),
    DEFAULT_DENY(false);

    private final boolean allowed;

    Decision(boolean allowed) {
        this.allowed = allowed;
    }

    public boolean allowed() {
        return allowed;
    }
}
