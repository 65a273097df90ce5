package com.civicdesk.backend.modules.user.domain;

public enum PortalUserStatus {
    ACTIVE,
    INACTIVE
}
