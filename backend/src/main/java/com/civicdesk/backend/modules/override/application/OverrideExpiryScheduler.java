package com.civicdesk.backend.modules.override.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class OverrideExpiryScheduler {

    private static final Logger log = LoggerFactory.getLogger(OverrideExpiryScheduler.class);

    private final OverrideService overrideService;

    public OverrideExpiryScheduler(OverrideService overrideService) {
        this.overrideService = overrideService;
    }

    @Scheduled(cron = "${rbac.overrides.purge-cron:0 15 3 * * *}")
    public void purgeExpiredOverrides() {
        try {
            int purged = overrideService.purgeExpired();
            if (purged > 0) {
                log.info("Purged {} long-expired permission overrides", purged);
            }
        } catch (RuntimeException ex) {
            log.error("Failed to purge expired permission overrides", ex);
        }
    }
}
