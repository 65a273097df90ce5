package com.civicdesk.backend.modules.audit.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.civicdesk.backend.modules.audit.domain.AuditResourceType;

public record AuditLogSearchCondition(
        UUID actorUserId,
        AuditResourceType resourceType,
        String resourceKey,
        OffsetDateTime from,
        OffsetDateTime to
) {
}
