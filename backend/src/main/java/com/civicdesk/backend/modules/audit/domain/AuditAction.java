package com.civicdesk.backend.modules.audit.domain;

public enum AuditAction {
    ROLE_CREATED,
    ROLE_EDGE_ADDED,
    ROLE_EDGE_REMOVED,
    ROLE_ASSIGNED,
    PERMISSION_REGISTERED,
    PERMISSION_ACTIVATION_CHANGED,
    ROLE_PERMISSION_CHANGED,
    OVERRIDE_CREATED,
    OVERRIDE_REPLACED,
    OVERRIDE_REMOVED,
    OVERRIDE_EXPIRED
}
