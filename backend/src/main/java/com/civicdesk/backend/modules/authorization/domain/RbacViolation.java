package com.civicdesk.backend.modules.authorization.domain;

import org.springframework.http.HttpStatus;

public enum RbacViolation {
    UNKNOWN_ROLE(HttpStatus.NOT_FOUND, "rbac.unknown_role"),
    UNKNOWN_PERMISSION(HttpStatus.NOT_FOUND, "rbac.unknown_permission"),
    UNKNOWN_USER(HttpStatus.NOT_FOUND, "rbac.unknown_user"),
    CYCLE_DETECTED(HttpStatus.CONFLICT, "rbac.cycle_detected"),
    DUPLICATE_LEVEL(HttpStatus.CONFLICT, "rbac.duplicate_level"),
    DUPLICATE_ROLE(HttpStatus.CONFLICT, "rbac.duplicate_role"),
    DUPLICATE_CODENAME(HttpStatus.CONFLICT, "rbac.duplicate_codename"),
    INSUFFICIENT_AUTHORITY(HttpStatus.FORBIDDEN, "rbac.insufficient_authority"),
    SELF_ESCALATION(HttpStatus.FORBIDDEN, "rbac.self_escalation"),
    UNKNOWN_TARGET_ROLE(HttpStatus.UNPROCESSABLE_ENTITY, "rbac.unknown_target_role"),
    USER_INACTIVE(HttpStatus.CONFLICT, "rbac.user_inactive"),
    ROLE_UNCHANGED(HttpStatus.CONFLICT, "rbac.role_unchanged"),
    INVALID_OVERRIDE(HttpStatus.BAD_REQUEST, "rbac.invalid_override"),
    INVALID_PERMISSION(HttpStatus.BAD_REQUEST, "rbac.invalid_permission"),
    INVALID_ROLE(HttpStatus.BAD_REQUEST, "rbac.invalid_role"),
    OVERRIDE_NOT_FOUND(HttpStatus.NOT_FOUND, "rbac.override_not_found"),
    EDGE_NOT_FOUND(HttpStatus.NOT_FOUND, "rbac.edge_not_found");

    private final HttpStatus status;
    private final String code;

    RbacViolation(HttpStatus status, String code) {
        this.status = status;
        this.code = code;
    }

    public HttpStatus status() {
        return status;
    }

    public String code() {
        return code;
    }

    public RbacException exception(String detail) {
        return new RbacException(this, detail);
    }
}
