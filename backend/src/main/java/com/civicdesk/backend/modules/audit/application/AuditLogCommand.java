package com.civicdesk.backend.modules.audit.application;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.civicdesk.backend.modules.audit.domain.AuditAction;
import com.civicdesk.backend.modules.audit.domain.AuditResourceType;

public record AuditLogCommand(
        AuditAction action,
        AuditResourceType resourceType,
        String resourceKey,
        UUID actorUserId,
        Map<String, Object> before,
        Map<String, Object> after,
        String correlationId,
        OffsetDateTime occurredAt
) {

    public static AuditLogCommand of(AuditAction action,
                                     AuditResourceType resourceType,
                                     String resourceKey,
                                     UUID actorUserId,
                                     Map<String, Object> before,
                                     Map<String, Object> after) {
        return new AuditLogCommand(action, resourceType, resourceKey, actorUserId, before, after, null, null);
    }

    AuditLogCommand stamped(String requestId, OffsetDateTime now) {
        return new AuditLogCommand(action, resourceType, resourceKey, actorUserId, before, after,
                correlationId != null ? correlationId : requestId,
                occurredAt != null ? occurredAt : now);
    }
}
