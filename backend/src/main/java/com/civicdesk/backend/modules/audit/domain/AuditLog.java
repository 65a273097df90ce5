package com.civicdesk.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.SequenceGenerator;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Append-only record of an authorization mutation. The table rejects UPDATE and DELETE.
 */
@Entity
@Immutable
@Table(name = "audit_log")
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "audit_log_seq")
    @SequenceGenerator(name = "audit_log_seq", sequenceName = "audit_log_seq", allocationSize = 1)
    @Column(name = "sequence_no", nullable = false, updatable = false)
    private Long sequenceNo;

    @Column(name = "actor_user_id", updatable = false, columnDefinition = "uuid")
    private UUID actorUserId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, updatable = false, length = 64)
    private AuditAction actionType;

    @Enumerated(EnumType.STRING)
    @Column(name = "resource_type", nullable = false, updatable = false, length = 64)
    private AuditResourceType resourceType;

    @Column(name = "resource_key", nullable = false, updatable = false, length = 255)
    private String resourceKey;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "before_state", updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> before;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "after_state", updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> after;

    @Column(name = "correlation_id", updatable = false, length = 64)
    private String correlationId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected AuditLog() {
    }

    public AuditLog(UUID actorUserId,
                    AuditAction actionType,
                    AuditResourceType resourceType,
                    String resourceKey,
                    Map<String, Object> before,
                    Map<String, Object> after,
                    String correlationId,
                    OffsetDateTime createdAt) {
        this.actorUserId = actorUserId;
        this.actionType = actionType;
        this.resourceType = resourceType;
        this.resourceKey = resourceKey;
        this.before = before;
        this.after = after;
        this.correlationId = correlationId;
        this.createdAt = createdAt;
    }

    public Long getSequenceNo() {
        return sequenceNo;
    }

    public UUID getActorUserId() {
        return actorUserId;
    }

    public AuditAction getActionType() {
        return actionType;
    }

    public AuditResourceType getResourceType() {
        return resourceType;
    }

    public String getResourceKey() {
        return resourceKey;
    }

    public Map<String, Object> getBefore() {
        return before;
    }

    public Map<String, Object> getAfter() {
        return after;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
