package com.civicdesk.backend.modules.notification.presentation;

import java.util.UUID;

import com.civicdesk.backend.global.security.SecurityUtils;
import com.civicdesk.backend.modules.notification.application.NotificationService;
import com.civicdesk.backend.modules.notification.application.NotificationService.NotificationPageResult;
import com.civicdesk.backend.modules.notification.presentation.dto.NotificationItemResponse;
import com.civicdesk.backend.modules.notification.presentation.dto.NotificationListResponse;

import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notifications")
public class NotificationController {

    private static final int MAX_PAGE_SIZE = 50;

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public ResponseEntity<NotificationListResponse> getNotifications(
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);

        UUID userId = SecurityUtils.getCurrentUserId();
        NotificationPageResult result = notificationService.getNotifications(userId, PageRequest.of(safePage, safeSize));

        NotificationListResponse response = new NotificationListResponse(
                result.notifications().stream().map(NotificationItemResponse::from).toList(),
                result.page(),
                result.size(),
                result.totalElements(),
                result.unreadCount()
        );
        return ResponseEntity.ok(response);
    }

    @PatchMapping("/{notificationId}/read")
    public ResponseEntity<Void> markRead(@PathVariable("notificationId") UUID notificationId) {
        UUID userId = SecurityUtils.getCurrentUserId();
        notificationService.markNotificationRead(userId, notificationId);
        return ResponseEntity.noContent().build();
    }
}
