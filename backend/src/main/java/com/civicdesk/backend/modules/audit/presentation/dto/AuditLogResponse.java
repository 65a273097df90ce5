package com.civicdesk.backend.modules.audit.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.civicdesk.backend.modules.audit.domain.AuditLog;

public record AuditLogResponse(
        long sequenceNo,
        UUID actorUserId,
        String action,
        String resourceType,
        String resourceKey,
        Map<String, Object> before,
        Map<String, Object> after,
        String correlationId,
        OffsetDateTime createdAt
) {

    public static AuditLogResponse from(AuditLog log) {
        return new AuditLogResponse(
                log.getSequenceNo(),
                log.getActorUserId(),
                log.getActionType().name(),
                log.getResourceType().name(),
                log.getResourceKey(),
                log.getBefore(),
                log.getAfter(),
                log.getCorrelationId(),
                log.getCreatedAt()
        );
    }
}
