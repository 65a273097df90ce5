package com.civicdesk.backend.modules.audit.domain;

public enum AuditResourceType {
    ROLE,
    ROLE_EDGE,
    PERMISSION,
    ROLE_PERMISSION,
    USER,
    OVERRIDE
}
