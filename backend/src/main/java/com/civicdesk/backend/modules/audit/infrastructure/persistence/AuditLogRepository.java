package com.civicdesk.backend.modules.audit.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.civicdesk.backend.modules.audit.domain.AuditLog;
import com.civicdesk.backend.modules.audit.domain.AuditResourceType;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long>, AuditLogRepositoryCustom {

    List<AuditLog> findByResourceTypeAndResourceKeyOrderBySequenceNoAsc(AuditResourceType resourceType,
                                                                       String resourceKey);
}
