package com.civicdesk.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.civicdesk.backend.modules.notification.domain.Notification;

public record NotificationItemResponse(
        UUID id,
        String kindCode,
        String title,
        String body,
        String state,
        Map<String, Object> metadata,
        OffsetDateTime createdAt,
        OffsetDateTime readAt
) {

    public static NotificationItemResponse from(Notification notification) {
        return new NotificationItemResponse(
                notification.getId(),
                notification.getKindCode(),
                notification.getTitle(),
                notification.getBody(),
                notification.getState().name(),
                notification.getMetadata(),
                notification.getCreatedAt(),
                notification.getReadAt()
        );
    }
}
