package com.civicdesk.backend.modules.audit.application;

import java.util.LinkedHashMap;
import java.util.Map;

import com.civicdesk.backend.modules.audit.domain.AuditLog;
import com.civicdesk.backend.modules.audit.infrastructure.persistence.AuditLogRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Persists one audit entry in its own transaction, independent of any caller transaction.
 */
@Component
public class AuditLogWriter {

    private final AuditLogRepository auditLogRepository;
    private final TransactionTemplate transactionTemplate;

    public AuditLogWriter(AuditLogRepository auditLogRepository, PlatformTransactionManager transactionManager) {
        this.auditLogRepository = auditLogRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public AuditLog write(AuditLogCommand command) {
        AuditLog entry = new AuditLog(
                command.actorUserId(),
                command.action(),
                command.resourceType(),
                command.resourceKey(),
                copy(command.before()),
                copy(command.after()),
                command.correlationId(),
                command.occurredAt()
        );
        return transactionTemplate.execute(status -> auditLogRepository.saveAndFlush(entry));
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null || source.isEmpty() ? null : new LinkedHashMap<>(source);
    }
}
