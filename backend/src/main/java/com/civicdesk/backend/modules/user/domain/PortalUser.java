package com.civicdesk.backend.modules.user.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.civicdesk.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Portal account as far as authorization is concerned: exactly one role, an activity flag and the
 * version that stamps the user's cached permissions.
 * Profile and credential data live with the upstream identity provider.
 */
@Entity
@Table(name = "portal_user")
public class PortalUser extends AbstractTimestampedEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "login_id", nullable = false, unique = true, length = 100)
    private String loginId;

    @Column(name = "full_name", nullable = false, length = 150)
    private String fullName;

    @Column(name = "role_code", nullable = false, length = 64)
    private String roleCode;

    @Column(name = "role_assigned_at")
    private OffsetDateTime roleAssignedAt;

    @Column(name = "role_assigned_by", columnDefinition = "uuid")
    private UUID roleAssignedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PortalUserStatus status = PortalUserStatus.ACTIVE;

    @Column(name = "permission_version", nullable = false)
    private long permissionVersion;

    protected PortalUser() {
    }

    public PortalUser(UUID id, String loginId, String fullName, String roleCode) {
        this.id = id;
        this.loginId = loginId;
        this.fullName = fullName;
        this.roleCode = roleCode;
    }

    public UUID getId() {
        return id;
    }

    public String getLoginId() {
        return loginId;
    }

    public String getFullName() {
        return fullName;
    }

    public String getRoleCode() {
        return roleCode;
    }

    public OffsetDateTime getRoleAssignedAt() {
        return roleAssignedAt;
    }

    public UUID getRoleAssignedBy() {
        return roleAssignedBy;
    }

    public void assignRole(String newRoleCode, UUID assignedBy, OffsetDateTime assignedAt) {
        this.roleCode = newRoleCode;
        this.roleAssignedBy = assignedBy;
        this.roleAssignedAt = assignedAt;
        bumpPermissionVersion();
    }

    /**
     * Marks every permission set cached for this user as stale once the surrounding transaction commits.
     */
    public void bumpPermissionVersion() {
        this.permissionVersion++;
    }

    public long getPermissionVersion() {
        return permissionVersion;
    }

    public PortalUserStatus getStatus() {
        return status;
    }

    public boolean isActive() {
        return status == PortalUserStatus.ACTIVE;
    }
}
