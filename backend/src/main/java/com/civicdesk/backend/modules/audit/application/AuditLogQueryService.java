package com.civicdesk.backend.modules.audit.application;

import com.civicdesk.backend.modules.audit.domain.AuditLog;
import com.civicdesk.backend.modules.audit.infrastructure.persistence.AuditLogRepository;
import com.civicdesk.backend.modules.audit.infrastructure.persistence.AuditLogSearchCondition;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogQueryService {

    private static final int MAX_PAGE_SIZE = 200;

    private final AuditLogRepository auditLogRepository;

    public AuditLogQueryService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    @Transactional(readOnly = true)
    public Page<AuditLog> search(AuditLogSearchCondition condition, int page, int size) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        return auditLogRepository.search(condition, PageRequest.of(safePage, safeSize));
    }
}
