package com.civicdesk.backend.modules.audit.infrastructure.persistence;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import com.civicdesk.backend.modules.audit.domain.AuditLog;

public interface AuditLogRepositoryCustom {

    Page<AuditLog> search(AuditLogSearchCondition condition, Pageable pageable);
}
