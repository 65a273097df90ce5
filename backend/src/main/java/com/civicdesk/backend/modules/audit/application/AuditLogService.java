package com.civicdesk.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;

import com.civicdesk.backend.global.web.RequestIdFilter;
import com.civicdesk.backend.modules.audit.domain.AuditLog;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records authorization mutations. Called after the mutation has committed; a failed write is
 * queued for retry and never propagates to the caller.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private final AuditLogWriter writer;
    private final AuditRetryQueue retryQueue;
    private final Clock clock;
    private final Counter failureCounter;

    public AuditLogService(AuditLogWriter writer, AuditRetryQueue retryQueue, Clock clock, MeterRegistry meterRegistry) {
        this.writer = writer;
        this.retryQueue = retryQueue;
        this.clock = clock;
        this.failureCounter = Counter.builder("rbac.audit.write.failures")
                .description("Audit writes that failed on the first attempt")
                .register(meterRegistry);
    }

    public Optional<AuditLog> record(AuditLogCommand command) {
        Objects.requireNonNull(command.action(), "action is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLogCommand stamped = command.stamped(RequestIdFilter.currentRequestId(), OffsetDateTime.now(clock));
        try {
            return Optional.of(writer.write(stamped));
        } catch (RuntimeException ex) {
            failureCounter.increment();
            retryQueue.enqueue(stamped);
            log.warn("Audit write failed for {} {}:{}; queued for retry: {}", stamped.action(),
                    stamped.resourceType(), stamped.resourceKey(), ex.getMessage());
            return Optional.empty();
        }
    }
}
