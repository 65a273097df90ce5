package com.civicdesk.backend.modules.audit.application;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

import com.civicdesk.backend.global.config.RbacProperties;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Holds audit entries whose first write failed and retries them with a bounded number of attempts.
 * Entries are kept in memory only; a process restart loses what is still pending.
 */
@Component
public class AuditRetryQueue {

    private static final Logger log = LoggerFactory.getLogger(AuditRetryQueue.class);

    private final Queue<PendingAudit> pending = new ConcurrentLinkedQueue<>();
    private final AuditLogWriter writer;
    private final RbacProperties properties;
    private final Counter abandonedCounter;

    public AuditRetryQueue(AuditLogWriter writer, RbacProperties properties, MeterRegistry meterRegistry) {
        this.writer = writer;
        this.properties = properties;
        this.abandonedCounter = Counter.builder("rbac.audit.write.abandoned")
                .description("Audit entries dropped after exhausting retries")
                .register(meterRegistry);
        Gauge.builder("rbac.audit.retry.pending", pending, Queue::size)
                .description("Audit entries waiting for a retry")
                .register(meterRegistry);
    }

    public void enqueue(AuditLogCommand command) {
        pending.add(new PendingAudit(command, 1));
    }

    public int size() {
        return pending.size();
    }

    /**
     * Makes one pass over the entries pending at call time.
     *
     * @return number of entries written in this pass
     */
    @Scheduled(fixedDelayString = "${rbac.audit.retry-interval:PT30S}")
    public int retryPending() {
        int batch = pending.size();
        int written = 0;
        for (int i = 0; i < batch; i++) {
            PendingAudit next = pending.poll();
            if (next == null) {
                break;
            }
            try {
                writer.write(next.command());
                written++;
            } catch (RuntimeException ex) {
                int attempts = next.attempts() + 1;
                if (attempts >= properties.getAudit().getMaxAttempts()) {
                    abandonedCounter.increment();
                    log.error("Abandoning audit entry {} {}:{} after {} attempts",
                            next.command().action(), next.command().resourceType(),
                            next.command().resourceKey(), attempts, ex);
                } else {
                    pending.add(new PendingAudit(next.command(), attempts));
                    log.warn("Audit retry {} failed for {} {}:{}: {}", attempts, next.command().action(),
                            next.command().resourceType(), next.command().resourceKey(), ex.getMessage());
                }
            }
        }
        if (written > 0) {
            log.info("Flushed {} pending audit entries ({} still pending)", written, pending.size());
        }
        return written;
    }

    private record PendingAudit(AuditLogCommand command, int attempts) {
    }
}
