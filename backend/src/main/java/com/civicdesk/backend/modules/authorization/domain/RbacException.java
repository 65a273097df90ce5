package com.civicdesk.backend.modules.authorization.domain;

import com.civicdesk.backend.global.error.ProblemException;

public class RbacException extends ProblemException {

    private final RbacViolation violation;

    public RbacException(RbacViolation violation, String detail) {
        super(violation.status(), violation.code(), detail);
        this.violation = violation;
    }

    public RbacViolation getViolation() {
        return violation;
    }
}
