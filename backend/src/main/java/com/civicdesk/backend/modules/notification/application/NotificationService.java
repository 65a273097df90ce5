package com.civicdesk.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.civicdesk.backend.modules.notification.domain.Notification;
import com.civicdesk.backend.modules.notification.domain.NotificationState;
import com.civicdesk.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.civicdesk.backend.modules.transition.application.RoleChangedEvent;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional
public class NotificationService {

    public static final String KIND_ROLE_CHANGED = "ROLE_CHANGED";

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    public NotificationService(NotificationRepository notificationRepository, Clock clock) {
        this.notificationRepository = notificationRepository;
        this.clock = clock;
    }

    public Notification notifyRoleChanged(RoleChangedEvent event) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("previousRole", event.previousRole());
        metadata.put("newRole", event.newRole());
        if (event.changedBy() != null) {
            metadata.put("changedBy", event.changedBy().toString());
        }
        String body = "Your role changed from " + event.previousRole() + " to " + event.newRole() + ".";
        if (event.reason() != null && !event.reason().isBlank()) {
            body = body + " Reason: " + event.reason();
        }
        Notification notification = new Notification(event.userId(), KIND_ROLE_CHANGED, "Role updated", body, metadata);
        return notificationRepository.save(notification);
    }

    @Transactional(readOnly = true)
    public NotificationPageResult getNotifications(UUID userId, Pageable pageable) {
        Page<Notification> page = notificationRepository.findByUserIdOrderByCreatedAtDesc(userId, pageable);
        long unreadCount = notificationRepository.countByUserIdAndState(userId, NotificationState.UNREAD);
        return new NotificationPageResult(page.getContent(), page.getNumber(), page.getSize(),
                page.getTotalElements(), unreadCount);
    }

    public void markNotificationRead(UUID userId, UUID notificationId) {
        Notification notification = notificationRepository.findByIdAndUserId(notificationId, userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "NOTIFICATION_NOT_FOUND"));
        if (notification.getState() == NotificationState.UNREAD) {
            notification.markRead(OffsetDateTime.now(clock));
            notificationRepository.save(notification);
        }
    }

    public record NotificationPageResult(
            List<Notification> notifications,
            int page,
            int size,
            long totalElements,
            long unreadCount
    ) {
    }
}
