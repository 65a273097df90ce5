package com.civicdesk.backend.modules.authorization.domain;

public enum OverridePolarity {
    GRANT,
    DENY
}
