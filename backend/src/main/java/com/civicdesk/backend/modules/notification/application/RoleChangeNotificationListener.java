package com.civicdesk.backend.modules.notification.application;

import com.civicdesk.backend.modules.transition.application.RoleChangedEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Delivers role-change notices off the request thread. Delivery failures never affect the transition.
 */
@Component
public class RoleChangeNotificationListener {

    private static final Logger log = LoggerFactory.getLogger(RoleChangeNotificationListener.class);

    private final NotificationService notificationService;

    public RoleChangeNotificationListener(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @Async
    @EventListener
    public void onRoleChanged(RoleChangedEvent event) {
        try {
            notificationService.notifyRoleChanged(event);
        } catch (RuntimeException ex) {
            log.error("Failed to deliver role change notification to user {}", event.userId(), ex);
        }
    }
}
