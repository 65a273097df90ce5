package com.civicdesk.backend.modules.audit.presentation;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.civicdesk.backend.modules.audit.application.AuditLogQueryService;
import com.civicdesk.backend.modules.audit.domain.AuditLog;
import com.civicdesk.backend.modules.audit.domain.AuditResourceType;
import com.civicdesk.backend.modules.audit.infrastructure.persistence.AuditLogSearchCondition;
import com.civicdesk.backend.modules.audit.presentation.dto.AuditLogPageResponse;
import com.civicdesk.backend.modules.audit.presentation.dto.AuditLogResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/audit-logs")
@Tag(name = "Audit Log", description = "Append-only trail of authorization changes")
public class AuditLogController {

    private final AuditLogQueryService auditLogQueryService;

    public AuditLogController(AuditLogQueryService auditLogQueryService) {
        this.auditLogQueryService = auditLogQueryService;
    }

    @GetMapping
    @Operation(summary = "Search audit entries ordered by sequence number")
    @PreAuthorize("@permissionGuard.has('view_audit_logs')")
    public ResponseEntity<AuditLogPageResponse> search(
            @RequestParam(name = "actorId", required = false) UUID actorId,
            @RequestParam(name = "resourceType", required = false) AuditResourceType resourceType,
            @RequestParam(name = "resourceKey", required = false) String resourceKey,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "50") int size
    ) {
        Page<AuditLog> result = auditLogQueryService.search(
                new AuditLogSearchCondition(actorId, resourceType, resourceKey, from, to), page, size);
        AuditLogPageResponse body = new AuditLogPageResponse(
                result.getContent().stream().map(AuditLogResponse::from).toList(),
                result.getNumber(),
                result.getSize(),
                result.getTotalElements(),
                result.getTotalPages()
        );
        return ResponseEntity.ok(body);
    }
}
