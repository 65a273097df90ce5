package com.civicdesk.backend.modules.override.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.civicdesk.backend.global.jpa.AbstractTimestampedEntity;
import com.civicdesk.backend.modules.authorization.domain.OverrideEntry;
import com.civicdesk.backend.modules.authorization.domain.OverridePolarity;
import com.civicdesk.backend.modules.permission.domain.Permission;
import com.civicdesk.backend.modules.user.domain.PortalUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * Per-user exception to the role-derived permission set. At most one per (user, permission).
 */
@Entity
@Table(name = "permission_override",
        uniqueConstraints = @UniqueConstraint(name = "uq_permission_override_user_permission",
                columnNames = {"user_id", "permission_codename"}))
public class PermissionOverride extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private PortalUser user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "permission_codename", nullable = false)
    private Permission permission;

    @Enumerated(EnumType.STRING)
    @Column(name = "polarity", nullable = false, length = 8)
    private OverridePolarity polarity;

    @Column(name = "reason", nullable = false, length = 500)
    private String reason;

    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    @Column(name = "created_by", columnDefinition = "uuid")
    private UUID createdBy;

    protected PermissionOverride() {
    }

    public PermissionOverride(PortalUser user, Permission permission) {
        this.user = user;
        this.permission = permission;
    }

    public UUID getId() {
        return id;
    }

    public PortalUser getUser() {
        return user;
    }

    public Permission getPermission() {
        return permission;
    }

    public OverridePolarity getPolarity() {
        return polarity;
    }

    public String getReason() {
        return reason;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public UUID getCreatedBy() {
        return createdBy;
    }

    public void apply(OverridePolarity polarity, String reason, OffsetDateTime expiresAt, UUID createdBy) {
        this.polarity = polarity;
        this.reason = reason;
        this.expiresAt = expiresAt;
        this.createdBy = createdBy;
    }

    public void expireAt(OffsetDateTime instant) {
        this.expiresAt = instant;
    }

    public boolean isEffectiveAt(OffsetDateTime now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }

    public OverrideEntry toEntry() {
        return new OverrideEntry(permission.getCodename(), polarity, expiresAt);
    }
}
